package com.storedsafe.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A parsed response from the StoredSafe REST API.
 *
 * <p>StoredSafe responses use upper-case top-level keys:
 * <pre>{@code
 * {
 *   "CALLINFO": { "status": "SUCCESS", ... },
 *   "OBJECT":   [ { "objectname": "...", "public": {...}, "crypted": {...} } ],
 *   "FILEDATA": "<base64>",
 *   "ERRORS":   [ "..." ]
 * }
 * }</pre>
 */
public class StoredSafeResponse {

    public static final String STATUS_SUCCESS = "SUCCESS";

    private final int status;
    private final Map<String, Object> root;

    private StoredSafeResponse(int status, Map<String, Object> root) {
        this.status = status;
        this.root = root;
    }

    /**
     * Parses a response body.
     *
     * @param status the HTTP status code
     * @param json   the response body, may be null
     * @return the response; {@link #isJson()} is false when the body is not a JSON object
     */
    public static StoredSafeResponse fromJson(int status, String json) {
        return new StoredSafeResponse(status, JsonUtil.parseObject(json));
    }

    public int getStatus() {
        return status;
    }

    /** True when the body was a well-formed JSON object. */
    public boolean isJson() {
        return root != null;
    }

    /** The {@code CALLINFO.status} marker, or null when absent or not a string. */
    public String getCallInfoStatus() {
        if (root == null) {
            return null;
        }
        Object value = JsonUtil.getPath(root, "CALLINFO", "status");
        return value instanceof String ? (String) value : null;
    }

    /**
     * Returns the entries of the {@code OBJECT} array that are JSON objects.
     *
     * @return the objects in response order, empty when none were returned
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> getObjects() {
        Object objects = root != null ? root.get("OBJECT") : null;
        if (!(objects instanceof List)) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object entry : (List<?>) objects) {
            if (entry instanceof Map) {
                result.add((Map<String, Object>) entry);
            }
        }
        return result;
    }

    /** The base64 {@code FILEDATA} blob, or null when absent. */
    public String getFileData() {
        Object value = root != null ? root.get("FILEDATA") : null;
        return value instanceof String ? (String) value : null;
    }
}
