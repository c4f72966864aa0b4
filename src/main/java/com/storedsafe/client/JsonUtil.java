package com.storedsafe.client;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal JSON utilities for the StoredSafe REST API.
 *
 * <p>The API only exchanges small documents: a flat request body for the auth
 * check, and responses made of objects, arrays, strings, numbers and booleans.
 * Parsing keeps key order so field maps are reported in the order the server sent
 * them.
 */
public final class JsonUtil {

    private JsonUtil() {
        // Utility class
    }

    /**
     * Serializes a flat map of string, number, boolean or null values.
     *
     * @param map the map to serialize, may be null
     * @return the JSON object text
     * @throws IllegalArgumentException for nested or unsupported value types
     */
    public static String toJson(Map<String, ?> map) {
        StringBuilder sb = new StringBuilder("{");
        if (map != null) {
            String separator = "";
            for (Map.Entry<String, ?> entry : map.entrySet()) {
                sb.append(separator);
                separator = ",";
                appendString(sb, entry.getKey());
                sb.append(':');
                Object value = entry.getValue();
                if (value == null || value instanceof Number || value instanceof Boolean) {
                    sb.append(value);
                } else if (value instanceof CharSequence) {
                    appendString(sb, value.toString());
                } else {
                    throw new IllegalArgumentException(
                            "Unsupported JSON value type for key '" + entry.getKey() + "': "
                                    + value.getClass().getName());
                }
            }
        }
        return sb.append('}').toString();
    }

    private static void appendString(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        sb.append('"');
    }

    /**
     * Parses a JSON document whose root is an object.
     *
     * @param json the JSON text
     * @return the parsed map, or null if the text is blank, malformed or not an object
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> parseObject(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            Reader reader = new Reader(json);
            Object root = reader.readValue();
            reader.requireEnd();
            return root instanceof Map ? (Map<String, Object>) root : null;
        } catch (IllegalStateException | NumberFormatException e) {
            return null;
        }
    }

    /**
     * Follows a chain of object keys from {@code root}.
     *
     * @return the value at the end of the path, or null if any step is missing or
     *         not an object
     */
    @SuppressWarnings("unchecked")
    public static Object getPath(Map<String, Object> root, String... keys) {
        Object current = root;
        for (String key : keys) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(key);
        }
        return current;
    }

    /**
     * Reads the {@code ERRORS} array StoredSafe puts in failed responses.
     *
     * @param json the response body
     * @return the error messages, empty when the body carries none
     */
    public static List<String> parseErrors(String json) {
        List<String> result = new ArrayList<>();
        Map<String, Object> root = parseObject(json);
        Object errors = root != null ? root.get("ERRORS") : null;
        if (errors instanceof List) {
            for (Object item : (List<?>) errors) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        }
        return result;
    }

    /** Recursive descent reader over a JSON string. */
    private static final class Reader {
        private final String text;
        private int pos;

        Reader(String text) {
            this.text = text;
        }

        Object readValue() {
            skipWhitespace();
            char c = peek();
            switch (c) {
                case '{':
                    return readObject();
                case '[':
                    return readArray();
                case '"':
                    return readString();
                case 't':
                    return readLiteral("true", Boolean.TRUE);
                case 'f':
                    return readLiteral("false", Boolean.FALSE);
                case 'n':
                    return readLiteral("null", null);
                default:
                    if (c == '-' || Character.isDigit(c)) {
                        return readNumber();
                    }
                    throw error("Unexpected character '" + c + "'");
            }
        }

        Map<String, Object> readObject() {
            Map<String, Object> map = new LinkedHashMap<>();
            pos++;
            skipWhitespace();
            if (tryConsume('}')) {
                return map;
            }
            do {
                skipWhitespace();
                String key = readString();
                skipWhitespace();
                consume(':');
                map.put(key, readValue());
                skipWhitespace();
            } while (tryConsume(','));
            consume('}');
            return map;
        }

        List<Object> readArray() {
            List<Object> list = new ArrayList<>();
            pos++;
            skipWhitespace();
            if (tryConsume(']')) {
                return list;
            }
            do {
                list.add(readValue());
                skipWhitespace();
            } while (tryConsume(','));
            consume(']');
            return list;
        }

        String readString() {
            consume('"');
            StringBuilder sb = new StringBuilder();
            while (pos < text.length()) {
                char c = text.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                }
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                char escaped = peek();
                pos++;
                switch (escaped) {
                    case 'b':
                        sb.append('\b');
                        break;
                    case 'f':
                        sb.append('\f');
                        break;
                    case 'n':
                        sb.append('\n');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 'u':
                        if (pos + 4 > text.length()) {
                            throw error("Truncated unicode escape");
                        }
                        sb.append((char) Integer.parseInt(text.substring(pos, pos + 4), 16));
                        pos += 4;
                        break;
                    default:
                        sb.append(escaped);
                }
            }
            throw error("Unterminated string");
        }

        Number readNumber() {
            int start = pos;
            boolean fractional = false;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '.' || c == 'e' || c == 'E') {
                    fractional = true;
                } else if (!(Character.isDigit(c) || c == '-' || c == '+')) {
                    break;
                }
                pos++;
            }
            String literal = text.substring(start, pos);
            if (fractional) {
                // Keeps the literal's scale, so 1.10 prints back as 1.10.
                return new BigDecimal(literal);
            }
            try {
                long value = Long.parseLong(literal);
                if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                    return (int) value;
                }
                return value;
            } catch (NumberFormatException e) {
                return new BigInteger(literal);
            }
        }

        Object readLiteral(String literal, Object value) {
            if (!text.startsWith(literal, pos)) {
                throw error("Expected " + literal);
            }
            pos += literal.length();
            return value;
        }

        void requireEnd() {
            skipWhitespace();
            if (pos != text.length()) {
                throw error("Trailing content");
            }
        }

        void skipWhitespace() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        char peek() {
            if (pos >= text.length()) {
                throw error("Unexpected end of JSON");
            }
            return text.charAt(pos);
        }

        void consume(char expected) {
            if (peek() != expected) {
                throw error("Expected '" + expected + "'");
            }
            pos++;
        }

        boolean tryConsume(char c) {
            if (pos < text.length() && text.charAt(pos) == c) {
                pos++;
                return true;
            }
            return false;
        }

        IllegalStateException error(String message) {
            return new IllegalStateException(message + " at position " + pos);
        }
    }
}
