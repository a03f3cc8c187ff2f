package mediaflow.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in {@link JsonCodec} that handles flat objects of string values only.
 */
public final class DefaultJsonCodec implements JsonCodec {
    static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

    private DefaultJsonCodec() {
    }

    @Override
    public String encode(Map<String, String> values) {
        StringBuilder out = new StringBuilder(64).append('{');
        String separator = "";
        for (Map.Entry<String, String> entry : values.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("map cannot contain null keys");
            }
            out.append(separator);
            writeString(out, entry.getKey());
            out.append(':');
            if (entry.getValue() == null) {
                out.append("null");
            } else {
                writeString(out, entry.getValue());
            }
            separator = ",";
        }
        return out.append('}').toString();
    }

    @Override
    public Map<String, String> decode(String json) {
        Map<String, String> values = new LinkedHashMap<>();
        if (json == null || json.isBlank()) {
            return values;
        }
        Cursor cursor = new Cursor(json);
        cursor.expect('{');
        if (cursor.consumeIf('}')) {
            cursor.expectEnd();
            return values;
        }
        do {
            String key = cursor.readString();
            cursor.expect(':');
            if (cursor.consumeLiteral("null")) {
                continue;
            }
            values.put(key, cursor.readString());
        } while (cursor.consumeIf(','));
        cursor.expect('}');
        cursor.expectEnd();
        return values;
    }

    private static void writeString(StringBuilder out, String value) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }

    private static final class Cursor {
        private final String text;
        private int pos;

        Cursor(String text) {
            this.text = text;
        }

        void expect(char expected) {
            skipBlanks();
            if (pos >= text.length() || text.charAt(pos) != expected) {
                throw error("expected '" + expected + "'");
            }
            pos++;
        }

        boolean consumeIf(char candidate) {
            skipBlanks();
            if (pos < text.length() && text.charAt(pos) == candidate) {
                pos++;
                return true;
            }
            return false;
        }

        boolean consumeLiteral(String literal) {
            skipBlanks();
            if (text.startsWith(literal, pos)) {
                pos += literal.length();
                return true;
            }
            return false;
        }

        void expectEnd() {
            skipBlanks();
            if (pos != text.length()) {
                throw error("trailing content");
            }
        }

        String readString() {
            expect('"');
            StringBuilder value = new StringBuilder();
            while (pos < text.length()) {
                char c = text.charAt(pos++);
                if (c == '"') {
                    return value.toString();
                }
                if (c != '\\') {
                    value.append(c);
                    continue;
                }
                if (pos >= text.length()) {
                    throw error("unterminated escape");
                }
                char escaped = text.charAt(pos++);
                switch (escaped) {
                    case '"', '\\', '/' -> value.append(escaped);
                    case 'n' -> value.append('\n');
                    case 'r' -> value.append('\r');
                    case 't' -> value.append('\t');
                    case 'b' -> value.append('\b');
                    case 'f' -> value.append('\f');
                    case 'u' -> {
                        if (pos + 4 > text.length()) {
                            throw error("truncated unicode escape");
                        }
                        try {
                            value.append((char) Integer.parseInt(text.substring(pos, pos + 4), 16));
                        } catch (NumberFormatException e) {
                            throw error("invalid unicode escape");
                        }
                        pos += 4;
                    }
                    default -> throw error("invalid escape '\\" + escaped + "'");
                }
            }
            throw error("unterminated string");
        }

        private void skipBlanks() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        private IllegalArgumentException error(String message) {
            return new IllegalArgumentException("Malformed JSON at offset " + pos + ": " + message);
        }
    }
}
