package io.recallr.memory.codec;

import java.util.List;
import java.util.Locale;

/**
 * Builds a single-line JSON object field by field, in call order.
 *
 * <p>Null strings and null lists are omitted rather than written as {@code null}.
 * Strings go through {@link #escape(String)}, so the output never contains a raw
 * newline.</p>
 */
public final class JsonLineWriter {

    private final StringBuilder out = new StringBuilder("{");
    private boolean first = true;

    public JsonLineWriter string(String name, String value) {
        if (value == null) return this;
        name(name).append('"').append(escape(value)).append('"');
        return this;
    }

    public JsonLineWriter number(String name, long value) {
        name(name).append(value);
        return this;
    }

    /** Writes a decimal with two fractional digits, e.g. {@code 0.50}. */
    public JsonLineWriter decimal(String name, double value) {
        name(name).append(String.format(Locale.ROOT, "%.2f", value));
        return this;
    }

    /** Writes a decimal at full precision, e.g. {@code 0.699}. */
    public JsonLineWriter real(String name, double value) {
        name(name).append(Double.isFinite(value) ? Double.toString(value) : "0.0");
        return this;
    }

    public JsonLineWriter bool(String name, boolean value) {
        name(name).append(value);
        return this;
    }

    public JsonLineWriter array(String name, List<String> values) {
        if (values == null) return this;
        var sb = name(name).append('[');
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append('"').append(escape(values.get(i))).append('"');
        }
        sb.append(']');
        return this;
    }

    public JsonLineWriter object(String name, JsonLineWriter nested) {
        name(name).append(nested.toLine());
        return this;
    }

    public String toLine() {
        return out + "}";
    }

    private StringBuilder name(String name) {
        if (!first) out.append(',');
        first = false;
        return out.append('"').append(name).append("\":");
    }

    /**
     * Escapes quote, backslash, newline, carriage return and tab. Every other
     * character is written as-is.
     */
    public static String escape(String value) {
        if (value == null) return "";
        var sb = new StringBuilder(value.length() + 16);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Reverses {@link #escape(String)}. An unknown escape {@code \x} yields {@code x}.
     */
    public static String unescape(String value) {
        if (value == null || value.indexOf('\\') < 0) return value;
        var sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '\\' || i + 1 >= value.length()) {
                sb.append(c);
                continue;
            }
            char next = value.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                default -> sb.append(next);
            }
        }
        return sb.toString();
    }
}
