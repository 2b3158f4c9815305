package io.recallr.memory.codec;

import io.recallr.memory.ErrorCode;
import io.recallr.memory.MemoryException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed single-line JSON object with typed, defaulting accessors.
 *
 * <p>Only the subset the memory files use is supported: objects, arrays,
 * strings, numbers, booleans and null. Anything else raises
 * {@link ErrorCode#PARSE_ERROR}.</p>
 */
public final class JsonLine {

    private final Map<String, Object> fields;

    private JsonLine(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static JsonLine parse(String line) {
        if (line == null) {
            throw new MemoryException(ErrorCode.PARSE_ERROR, "line is null");
        }
        var parser = new Parser(line);
        parser.skipWhitespace();
        if (!parser.peek('{')) {
            throw parser.error("expected '{'");
        }
        Map<String, Object> object = parser.readObject();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw parser.error("trailing characters");
        }
        return new JsonLine(object);
    }

    public boolean has(String name) {
        return fields.get(name) != null;
    }

    public String string(String name) {
        Object value = fields.get(name);
        return value instanceof String s ? s : null;
    }

    public long longValue(String name, long defaultValue) {
        Object value = fields.get(name);
        if (!(value instanceof Number n)) return defaultValue;
        return n.longValue();
    }

    public int intValue(String name, int defaultValue) {
        return (int) longValue(name, defaultValue);
    }

    public double doubleValue(String name, double defaultValue) {
        Object value = fields.get(name);
        if (!(value instanceof Number n)) return defaultValue;
        return n.doubleValue();
    }

    public boolean bool(String name, boolean defaultValue) {
        Object value = fields.get(name);
        return value instanceof Boolean b ? b : defaultValue;
    }

    /** String elements of an array field; non-string elements are skipped. */
    public List<String> strings(String name) {
        Object value = fields.get(name);
        if (!(value instanceof List<?> list)) return List.of();
        List<String> result = new ArrayList<>(list.size());
        for (Object element : list) {
            if (element instanceof String s) result.add(s);
        }
        return Collections.unmodifiableList(result);
    }

    @SuppressWarnings("unchecked")
    public JsonLine object(String name) {
        Object value = fields.get(name);
        if (value instanceof Map<?, ?> map) {
            return new JsonLine((Map<String, Object>) map);
        }
        return new JsonLine(Map.of());
    }

    private static final class Parser {
        private final String text;
        private int pos;

        Parser(String text) {
            this.text = text;
        }

        Map<String, Object> readObject() {
            expect('{');
            Map<String, Object> object = new LinkedHashMap<>();
            skipWhitespace();
            if (peek('}')) {
                pos++;
                return object;
            }
            while (true) {
                skipWhitespace();
                String key = readString();
                skipWhitespace();
                expect(':');
                object.put(key, readValue());
                skipWhitespace();
                if (peek(',')) {
                    pos++;
                } else {
                    expect('}');
                    return object;
                }
            }
        }

        List<Object> readArray() {
            expect('[');
            List<Object> array = new ArrayList<>();
            skipWhitespace();
            if (peek(']')) {
                pos++;
                return array;
            }
            while (true) {
                array.add(readValue());
                skipWhitespace();
                if (peek(',')) {
                    pos++;
                } else {
                    expect(']');
                    return array;
                }
            }
        }

        Object readValue() {
            skipWhitespace();
            if (atEnd()) throw error("unexpected end of line");
            char c = text.charAt(pos);
            return switch (c) {
                case '"' -> readString();
                case '{' -> readObject();
                case '[' -> readArray();
                case 't' -> literal("true", Boolean.TRUE);
                case 'f' -> literal("false", Boolean.FALSE);
                case 'n' -> literal("null", null);
                default -> readNumber();
            };
        }

        String readString() {
            expect('"');
            int start = pos;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '\\') {
                    pos += 2;
                } else if (c == '"') {
                    String raw = text.substring(start, pos);
                    pos++;
                    return JsonLineWriter.unescape(raw);
                } else {
                    pos++;
                }
            }
            throw error("unterminated string");
        }

        Number readNumber() {
            int start = pos;
            while (pos < text.length() && "+-0123456789.eE".indexOf(text.charAt(pos)) >= 0) {
                pos++;
            }
            String token = text.substring(start, pos);
            if (token.isEmpty()) throw error("unexpected character");
            try {
                if (token.indexOf('.') >= 0 || token.indexOf('e') >= 0 || token.indexOf('E') >= 0) {
                    return Double.parseDouble(token);
                }
                return Long.parseLong(token);
            } catch (NumberFormatException e) {
                throw new MemoryException(ErrorCode.PARSE_ERROR, "bad number '" + token + "'", e);
            }
        }

        Object literal(String word, Object value) {
            if (!text.startsWith(word, pos)) throw error("unexpected token");
            pos += word.length();
            return value;
        }

        void expect(char c) {
            if (!peek(c)) throw error("expected '" + c + "'");
            pos++;
        }

        boolean peek(char c) {
            return pos < text.length() && text.charAt(pos) == c;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        void skipWhitespace() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        MemoryException error(String message) {
            return new MemoryException(ErrorCode.PARSE_ERROR, message + " at position " + pos);
        }
    }
}
