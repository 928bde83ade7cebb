package com.purchasingpower.plangraph.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Text helpers for Python source fragments.
 *
 * <p>{@link #dedent(String)} follows {@code textwrap.dedent}. The {@code *Code} variants are
 * string-literal aware: lines that start inside a multi-line string literal are neither
 * measured nor shifted, so prompt text embedded in triple quotes survives re-indentation.
 */
public final class PythonText {

    private PythonText() {
    }

    /** Drops a leading byte-order mark and converts CRLF / CR line endings to LF. */
    public static String normalize(String source) {
        if (source == null) {
            return "";
        }
        String text = source.startsWith("\uFEFF") ? source.substring(1) : source;
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    public static List<String> lines(String text) {
        return Arrays.asList(text.split("\n", -1));
    }

    /**
     * {@code textwrap.dedent}: whitespace-only lines become empty, then the longest common
     * leading whitespace of the remaining lines is removed.
     */
    public static String dedent(String text) {
        List<String> lines = lines(text);
        String margin = null;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            margin = commonMargin(margin, leadingWhitespace(line));
        }
        List<String> out = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (isSpaceOrTabOnly(line)) {
                out.add("");
            } else if (margin != null && line.startsWith(margin)) {
                out.add(line.substring(margin.length()));
            } else {
                out.add(line);
            }
        }
        return String.join("\n", out);
    }

    /** Dedent that leaves lines starting inside a string literal untouched. */
    public static String dedentCode(String text) {
        List<String> lines = lines(text);
        boolean[] insideString = stringContinuationLines(text);
        String margin = null;
        for (int i = 0; i < lines.size(); i++) {
            if (!insideString[i] && !lines.get(i).isBlank()) {
                margin = commonMargin(margin, leadingWhitespace(lines.get(i)));
            }
        }
        List<String> out = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (insideString[i]) {
                out.add(line);
            } else if (line.isBlank()) {
                out.add("");
            } else if (margin != null && line.startsWith(margin)) {
                out.add(line.substring(margin.length()));
            } else {
                out.add(line);
            }
        }
        return String.join("\n", out);
    }

    /** Prefixes every non-blank line that does not start inside a string literal. */
    public static String indentCode(String text, String prefix) {
        List<String> lines = lines(text);
        boolean[] insideString = stringContinuationLines(text);
        List<String> out = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            out.add(insideString[i] || line.isBlank() ? line : prefix + line);
        }
        return String.join("\n", out);
    }

    /**
     * Marks the lines (0-based) that begin inside a string literal opened on an earlier line:
     * the body lines of triple-quoted strings and lines after a backslash-newline in a string.
     */
    public static boolean[] stringContinuationLines(String text) {
        boolean[] inside = new boolean[lines(text).size()];
        int line = 0;
        int i = 0;
        int len = text.length();
        while (i < len) {
            char c = text.charAt(i);
            if (c == '#') {
                while (i < len && text.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }
            if (c == '\n') {
                line++;
                i++;
                continue;
            }
            if (c != '"' && c != '\'') {
                i++;
                continue;
            }
            String triple = String.valueOf(c).repeat(3);
            boolean isTriple = text.startsWith(triple, i);
            i += isTriple ? 3 : 1;
            while (i < len) {
                char s = text.charAt(i);
                if (s == '\\' && i + 1 < len) {
                    if (text.charAt(i + 1) == '\n') {
                        line++;
                        inside[line] = true;
                    }
                    i += 2;
                    continue;
                }
                if (isTriple ? text.startsWith(triple, i) : s == c) {
                    i += isTriple ? 3 : 1;
                    break;
                }
                if (s == '\n') {
                    line++;
                    if (!isTriple) {
                        // unterminated single-quoted literal: resume normal scanning
                        i++;
                        break;
                    }
                    inside[line] = true;
                }
                i++;
            }
        }
        return inside;
    }

    /** Lines {@code [startLine, endLine]}, 1-based and inclusive. */
    public static String sliceLines(List<String> lines, int startLine, int endLine) {
        return String.join("\n", lines.subList(Math.max(0, startLine - 1), Math.min(lines.size(), endLine)));
    }

    private static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }

    private static boolean isSpaceOrTabOnly(String line) {
        return !line.isEmpty() && leadingWhitespace(line).length() == line.length();
    }

    private static String commonMargin(String margin, String indent) {
        if (margin == null || indent.startsWith(margin)) {
            return margin == null ? indent : margin;
        }
        if (margin.startsWith(indent)) {
            return indent;
        }
        int i = 0;
        while (i < margin.length() && i < indent.length() && margin.charAt(i) == indent.charAt(i)) {
            i++;
        }
        return margin.substring(0, i);
    }
}
