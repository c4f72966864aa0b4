package com.storedsafe.lookup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for RcFile.
 */
class RcFileTest {

    @TempDir
    Path tempDir;

    @Test
    void read_withServerAndToken_returnsBoth() throws Exception {
        Path rc = write("""
                username:alice
                mysite:safe.example.com
                token:Xk3r9VxzAb12
                apikey:ignored
                """);

        RcFile file = RcFile.read(rc);

        assertThat(file.getServer()).isEqualTo("safe.example.com");
        assertThat(file.getToken()).isEqualTo("Xk3r9VxzAb12");
    }

    @Test
    void read_trimsKeysAndValues() throws Exception {
        Path rc = write(" mysite : safe.example.com \ntoken:  abc  \n");

        RcFile file = RcFile.read(rc);

        assertThat(file.getServer()).isEqualTo("safe.example.com");
        assertThat(file.getToken()).isEqualTo("abc");
    }

    @Test
    void read_withTokenNone_yieldsNeitherServerNorToken() throws Exception {
        Path rc = write("mysite:safe.example.com\ntoken:none\n");

        RcFile file = RcFile.read(rc);

        assertThat(file.getServer()).isNull();
        assertThat(file.getToken()).isNull();
    }

    @Test
    void read_withServerNone_yieldsNeitherServerNorToken() throws Exception {
        Path rc = write("token:abc\nmysite:none\n");

        RcFile file = RcFile.read(rc);

        assertThat(file.getServer()).isNull();
        assertThat(file.getToken()).isNull();
    }

    @Test
    void read_withOnlyServer_returnsNullToken() throws Exception {
        Path rc = write("mysite:safe.example.com\ntoken:\nthis line has no separator\n");

        RcFile file = RcFile.read(rc);

        assertThat(file.getServer()).isEqualTo("safe.example.com");
        assertThat(file.getToken()).isNull();
    }

    @Test
    void read_withMissingFile_returnsEmpty() throws Exception {
        RcFile file = RcFile.read(tempDir.resolve("missing.rc"));

        assertThat(file.getServer()).isNull();
        assertThat(file.getToken()).isNull();
    }

    @Test
    void read_withDirectory_throwsConfigurationException() {
        assertThatThrownBy(() -> RcFile.read(tempDir))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Cannot read rc file");
    }

    @Test
    void defaultPath_isInUserHome() {
        assertThat(RcFile.defaultPath().getFileName().toString()).isEqualTo(".storedsafe-client.rc");
        assertThat(RcFile.defaultPath().getParent().toString()).isEqualTo(System.getProperty("user.home"));
    }

    private Path write(String content) throws Exception {
        Path rc = tempDir.resolve(".storedsafe-client.rc");
        Files.writeString(rc, content);
        return rc;
    }
}
