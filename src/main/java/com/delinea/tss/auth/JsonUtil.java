package com.delinea.tss.auth;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal JSON support for the token, health, vault and resource endpoints.
 *
 * <p>Parses objects into {@code Map<String, Object>} with String, Number (Integer, Long or
 * Double), Boolean, null, nested Map and List values, and serializes maps back to JSON.
 * Field accessors are lenient: a missing field or one of the wrong type reads as absent.
 */
public final class JsonUtil {

    private JsonUtil() {
        // Utility class
    }

    /**
     * Parses a JSON object.
     *
     * @param json the JSON text
     * @return the parsed object, or null if the text is blank, malformed or not an object
     */
    public static Map<String, Object> parseObject(String json) {
        if (Preconditions.isBlank(json)) {
            return null;
        }
        try {
            Reader reader = new Reader(json);
            Object value = reader.readValue();
            reader.requireEnd();
            return value instanceof Map ? asMap(value) : null;
        } catch (IllegalStateException | NumberFormatException e) {
            return null;
        }
    }

    public static String getString(Map<String, Object> object, String field) {
        Object value = object != null ? object.get(field) : null;
        return value instanceof String ? (String) value : null;
    }

    /**
     * Reads a boolean field; absent or non-boolean values read as {@code false}.
     */
    public static boolean getBoolean(Map<String, Object> object, String field) {
        return object != null && Boolean.TRUE.equals(object.get(field));
    }

    public static long getLong(Map<String, Object> object, String field, long defaultValue) {
        Object value = object != null ? object.get(field) : null;
        return value instanceof Number ? ((Number) value).longValue() : defaultValue;
    }

    public static Map<String, Object> getObject(Map<String, Object> object, String field) {
        Object value = object != null ? object.get(field) : null;
        return value instanceof Map ? asMap(value) : null;
    }

    /**
     * Reads an array field whose elements are objects. Non-object elements are skipped.
     */
    public static List<Map<String, Object>> getObjectList(Map<String, Object> object, String field) {
        Object value = object != null ? object.get(field) : null;
        if (!(value instanceof List)) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item instanceof Map) {
                result.add(asMap(item));
            }
        }
        return result;
    }

    /**
     * Serializes a map to a JSON object.
     *
     * @param map the map to serialize; null serializes as {@code {}}
     * @return the JSON text
     */
    public static String toJson(Map<String, ?> map) {
        StringBuilder out = new StringBuilder();
        writeValue(out, map == null ? Collections.emptyMap() : map);
        return out.toString();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private static void writeValue(StringBuilder out, Object value) {
        if (value == null) {
            out.append("null");
        } else if (value instanceof Number || value instanceof Boolean) {
            out.append(value);
        } else if (value instanceof Map) {
            out.append('{');
            String separator = "";
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                out.append(separator);
                writeString(out, String.valueOf(entry.getKey()));
                out.append(':');
                writeValue(out, entry.getValue());
                separator = ",";
            }
            out.append('}');
        } else if (value instanceof Iterable) {
            out.append('[');
            String separator = "";
            for (Object item : (Iterable<?>) value) {
                out.append(separator);
                writeValue(out, item);
                separator = ",";
            }
            out.append(']');
        } else {
            writeString(out, value.toString());
        }
    }

    private static void writeString(StringBuilder out, String s) {
        out.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"' || c == '\\') {
                out.append('\\').append(c);
            } else if (c == '\n') {
                out.append("\\n");
            } else if (c == '\r') {
                out.append("\\r");
            } else if (c == '\t') {
                out.append("\\t");
            } else if (c < 0x20) {
                out.append(String.format("\\u%04x", (int) c));
            } else {
                out.append(c);
            }
        }
        out.append('"');
    }

    /**
     * Recursive descent reader over a JSON text.
     */
    private static final class Reader {
        private final String text;
        private int pos;

        Reader(String text) {
            this.text = text;
        }

        Object readValue() {
            skipWhitespace();
            char c = current();
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
                    if (c == '-' || (c >= '0' && c <= '9')) {
                        return readNumber();
                    }
                    throw new IllegalStateException("Unexpected '" + c + "' at " + pos);
            }
        }

        void requireEnd() {
            skipWhitespace();
            if (pos != text.length()) {
                throw new IllegalStateException("Trailing content at " + pos);
            }
        }

        private Map<String, Object> readObject() {
            pos++;
            Map<String, Object> object = new LinkedHashMap<>();
            skipWhitespace();
            if (current() == '}') {
                pos++;
                return object;
            }
            while (true) {
                skipWhitespace();
                if (current() != '"') {
                    throw new IllegalStateException("Expected field name at " + pos);
                }
                String name = readString();
                skipWhitespace();
                accept(':');
                object.put(name, readValue());
                skipWhitespace();
                if (current() == ',') {
                    pos++;
                } else {
                    accept('}');
                    return object;
                }
            }
        }

        private List<Object> readArray() {
            pos++;
            List<Object> array = new ArrayList<>();
            skipWhitespace();
            if (current() == ']') {
                pos++;
                return array;
            }
            while (true) {
                array.add(readValue());
                skipWhitespace();
                if (current() == ',') {
                    pos++;
                } else {
                    accept(']');
                    return array;
                }
            }
        }

        private String readString() {
            pos++;
            StringBuilder sb = new StringBuilder();
            while (true) {
                char c = current();
                pos++;
                if (c == '"') {
                    return sb.toString();
                }
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                char escape = current();
                pos++;
                switch (escape) {
                    case 'n':
                        sb.append('\n');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 'b':
                        sb.append('\b');
                        break;
                    case 'f':
                        sb.append('\f');
                        break;
                    case 'u':
                        if (pos + 4 > text.length()) {
                            throw new IllegalStateException("Truncated unicode escape");
                        }
                        sb.append((char) Integer.parseInt(text.substring(pos, pos + 4), 16));
                        pos += 4;
                        break;
                    default:
                        sb.append(escape);
                }
            }
        }

        private Number readNumber() {
            int start = pos;
            boolean fractional = false;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '.' || c == 'e' || c == 'E') {
                    fractional = true;
                } else if (!(c == '-' || c == '+' || (c >= '0' && c <= '9'))) {
                    break;
                }
                pos++;
            }
            String literal = text.substring(start, pos);
            if (fractional) {
                return Double.parseDouble(literal);
            }
            long value = Long.parseLong(literal);
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return (int) value;
            }
            return value;
        }

        private Object readLiteral(String literal, Object value) {
            if (!text.startsWith(literal, pos)) {
                throw new IllegalStateException("Expected " + literal + " at " + pos);
            }
            pos += literal.length();
            return value;
        }

        private void accept(char expected) {
            if (current() != expected) {
                throw new IllegalStateException("Expected '" + expected + "' at " + pos);
            }
            pos++;
        }

        private char current() {
            if (pos >= text.length()) {
                throw new IllegalStateException("Unexpected end of JSON");
            }
            return text.charAt(pos);
        }

        private void skipWhitespace() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }
    }
}
