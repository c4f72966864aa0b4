package com.storedsafe.client;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for StoredSafeResponse parsing.
 */
class StoredSafeResponseTest {

    @Test
    void fromJson_withNullBody_isNotJson() {
        StoredSafeResponse response = StoredSafeResponse.fromJson(200, null);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.isJson()).isFalse();
        assertThat(response.getCallInfoStatus()).isNull();
        assertThat(response.getObjects()).isEmpty();
        assertThat(response.getFileData()).isNull();
    }

    @Test
    void getCallInfoStatus_readsNestedMarker() {
        StoredSafeResponse response = StoredSafeResponse.fromJson(200,
                "{\"CALLINFO\":{\"status\":\"SUCCESS\",\"token\":\"abc\"}}");

        assertThat(response.isJson()).isTrue();
        assertThat(response.getCallInfoStatus()).isEqualTo(StoredSafeResponse.STATUS_SUCCESS);
    }

    @Test
    void getCallInfoStatus_withNonStringStatus_returnsNull() {
        StoredSafeResponse response = StoredSafeResponse.fromJson(200, "{\"CALLINFO\":{\"status\":1}}");

        assertThat(response.getCallInfoStatus()).isNull();
    }

    @Test
    void getObjects_skipsNonObjectEntries() {
        StoredSafeResponse response = StoredSafeResponse.fromJson(200,
                "{\"OBJECT\":[\"junk\",{\"id\":\"1\"},{\"id\":\"2\"}]}");

        assertThat(response.getObjects()).hasSize(2);
        assertThat(response.getObjects().get(0)).containsEntry("id", "1");
    }

    @Test
    void getObjects_whenObjectIsNotArray_returnsEmpty() {
        StoredSafeResponse response = StoredSafeResponse.fromJson(200, "{\"OBJECT\":{\"id\":\"1\"}}");

        assertThat(response.getObjects()).isEmpty();
    }

    @Test
    void getObjects_withOversizedNumericId_isStillJson() {
        StoredSafeResponse response = StoredSafeResponse.fromJson(200,
                "{\"OBJECT\":[{\"id\":99999999999999999999,\"crypted\":{\"password\":\"s3cret\"}}],"
                        + "\"CALLINFO\":{\"status\":\"SUCCESS\"}}");

        assertThat(response.isJson()).isTrue();
        assertThat(response.getObjects()).hasSize(1);
        assertThat(response.getCallInfoStatus()).isEqualTo(StoredSafeResponse.STATUS_SUCCESS);
    }

    @Test
    void getFileData_returnsBase64Blob() {
        StoredSafeResponse response = StoredSafeResponse.fromJson(200,
                "{\"OBJECT\":[{}],\"FILEDATA\":\"aGVsbG8=\"}");

        assertThat(response.getFileData()).isEqualTo("aGVsbG8=");
    }
}
