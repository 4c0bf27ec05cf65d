package io.fanout.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lightweight JSON object encoder/decoder with no external dependencies.
 *
 * <p>This is the default {@link JsonCodec} implementation, accessible via
 * {@link JsonCodec#getDefault()}. Parsed maps preserve key order and are unmodifiable.
 */
public final class DefaultJsonCodec implements JsonCodec {
    static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

    private static final int MAX_DEPTH = 32;

    DefaultJsonCodec() {
    }

    @Override
    public String toJson(Map<String, ?> object) {
        StringBuilder sb = new StringBuilder();
        writeObject(sb, object == null ? Collections.emptyMap() : object, 0);
        return sb.toString();
    }

    private static void writeObject(StringBuilder sb, Map<?, ?> object, int depth) {
        if (depth > MAX_DEPTH) {
            throw new IllegalArgumentException("Object nesting exceeds " + MAX_DEPTH + " levels");
        }
        sb.append('{');
        boolean first = true;
        for (Map.Entry<?, ?> entry : object.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new IllegalArgumentException("JSON object keys must be non-null strings");
            }
            if (!first) {
                sb.append(',');
            }
            first = false;
            writeString(sb, key);
            sb.append(':');
            writeValue(sb, entry.getValue(), depth);
        }
        sb.append('}');
    }

    private static void writeValue(StringBuilder sb, Object value, int depth) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof String s) {
            writeString(sb, s);
        } else if (value instanceof Boolean b) {
            sb.append(b.booleanValue());
        } else if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
            throw new IllegalArgumentException("JSON cannot represent " + d);
        } else if (value instanceof Float f && (f.isNaN() || f.isInfinite())) {
            throw new IllegalArgumentException("JSON cannot represent " + f);
        } else if (value instanceof Number n) {
            sb.append(n);
        } else if (value instanceof Map<?, ?> nested) {
            writeObject(sb, nested, depth + 1);
        } else {
            throw new IllegalArgumentException("Unsupported JSON value type: " + value.getClass().getName());
        }
    }

    private static void writeString(StringBuilder sb, String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\b':
                    sb.append("\\b");
                    break;
                case '\f':
                    sb.append("\\f");
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

    @Override
    public Map<String, Object> parseObject(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Expected JSON object but input was empty");
        }
        Parser parser = new Parser(json);
        parser.skipWhitespace();
        Map<String, Object> result = parser.readObject(0);
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw new IllegalArgumentException("Unexpected trailing content at index " + parser.pos);
        }
        return result;
    }

    private static final class Parser {
        private final String input;
        private int pos;

        private Parser(String input) {
            this.input = input;
        }

        private boolean atEnd() {
            return pos >= input.length();
        }

        private char peek() {
            if (atEnd()) {
                throw new IllegalArgumentException("Unexpected end of JSON");
            }
            return input.charAt(pos);
        }

        private void expect(char expected) {
            if (peek() != expected) {
                throw new IllegalArgumentException("Expected '" + expected + "' at index " + pos);
            }
            pos++;
        }

        private void skipWhitespace() {
            while (!atEnd()) {
                char c = input.charAt(pos);
                if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
                    break;
                }
                pos++;
            }
        }

        private Map<String, Object> readObject(int depth) {
            if (depth > MAX_DEPTH) {
                throw new IllegalArgumentException("Object nesting exceeds " + MAX_DEPTH + " levels");
            }
            expect('{');
            Map<String, Object> result = new LinkedHashMap<>();
            skipWhitespace();
            if (peek() == '}') {
                pos++;
                return Collections.unmodifiableMap(result);
            }
            while (true) {
                skipWhitespace();
                if (peek() != '"') {
                    throw new IllegalArgumentException("Expected string key at index " + pos);
                }
                String key = readString();
                skipWhitespace();
                expect(':');
                skipWhitespace();
                result.put(key, readValue(depth));
                skipWhitespace();
                char next = peek();
                pos++;
                if (next == '}') {
                    return Collections.unmodifiableMap(result);
                }
                if (next != ',') {
                    throw new IllegalArgumentException("Expected ',' or '}' at index " + (pos - 1));
                }
            }
        }

        private Object readValue(int depth) {
            char c = peek();
            if (c == '"') {
                return readString();
            }
            if (c == '{') {
                return readObject(depth + 1);
            }
            if (c == '[') {
                throw new IllegalArgumentException("JSON arrays are not supported (index " + pos + ")");
            }
            if (input.startsWith("true", pos)) {
                pos += 4;
                return Boolean.TRUE;
            }
            if (input.startsWith("false", pos)) {
                pos += 5;
                return Boolean.FALSE;
            }
            if (input.startsWith("null", pos)) {
                pos += 4;
                return null;
            }
            if (c == '-' || (c >= '0' && c <= '9')) {
                return readNumber();
            }
            throw new IllegalArgumentException("Unexpected character '" + c + "' at index " + pos);
        }

        private Object readNumber() {
            int start = pos;
            boolean integral = true;
            while (!atEnd()) {
                char c = input.charAt(pos);
                if (c == '.' || c == 'e' || c == 'E') {
                    integral = false;
                } else if (c != '-' && c != '+' && (c < '0' || c > '9')) {
                    break;
                }
                pos++;
            }
            String literal = input.substring(start, pos);
            try {
                if (integral) {
                    return Long.parseLong(literal);
                }
                return Double.parseDouble(literal);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number '" + literal + "' at index " + start, e);
            }
        }

        private String readString() {
            expect('"');
            StringBuilder sb = new StringBuilder();
            while (!atEnd()) {
                char c = input.charAt(pos);
                if (c == '"') {
                    pos++;
                    return sb.toString();
                }
                if (c != '\\') {
                    sb.append(c);
                    pos++;
                    continue;
                }
                if (pos + 1 >= input.length()) {
                    throw new IllegalArgumentException("Invalid escape sequence");
                }
                char next = input.charAt(pos + 1);
                switch (next) {
                    case '"':
                    case '\\':
                    case '/':
                        sb.append(next);
                        break;
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
                        if (pos + 5 >= input.length()) {
                            throw new IllegalArgumentException("Invalid unicode escape");
                        }
                        String hex = input.substring(pos + 2, pos + 6);
                        try {
                            sb.append((char) Integer.parseInt(hex, 16));
                        } catch (NumberFormatException ex) {
                            throw new IllegalArgumentException("Invalid unicode escape", ex);
                        }
                        pos += 4;
                        break;
                    default:
                        throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
                }
                pos += 2;
            }
            throw new IllegalArgumentException("Unterminated string");
        }
    }
}
