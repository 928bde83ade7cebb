package com.purchasingpower.plangraph.util;

import java.math.BigDecimal;

/**
 * Renders Java values as Python literal source text.
 */
public final class PythonLiterals {

    private PythonLiterals() {
    }

    /**
     * Python literal for a JSON-ish value: {@code None}, {@code True}/{@code False}, a bare
     * number or a double-quoted string.
     */
    public static String literal(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Boolean bool) {
            return bool ? "True" : "False";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Number number) {
            return number.toString();
        }
        return quote(value.toString());
    }

    /** Double-quoted single-line string literal. */
    public static String quote(String text) {
        StringBuilder out = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        out.append(String.format("\\x%02x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.append('"').toString();
    }

    /**
     * Triple-double-quoted literal that keeps newlines as written. Backslashes are escaped and
     * quotes are escaped only where they would close the literal early.
     */
    public static String tripleQuote(String text) {
        StringBuilder out = new StringBuilder(text.length() + 6).append("\"\"\"");
        int quoteRun = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                if (quoteRun == 2) {
                    out.append("\\\"");
                    quoteRun = 0;
                } else {
                    out.append(c);
                    quoteRun++;
                }
                continue;
            }
            quoteRun = 0;
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '\r' -> out.append("\\r");
                default -> out.append(c);
            }
        }
        if (quoteRun > 0) {
            out.setLength(out.length() - 1);
            out.append("\\\"");
        }
        return out.append("\"\"\"").toString();
    }
}
