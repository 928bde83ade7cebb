package com.purchasingpower.plangraph.parser;

import org.treesitter.TSNode;

import java.math.BigInteger;
import java.util.List;

/**
 * Value of a constant expression. {@code value} is a {@code String} for strings and bytes, a
 * {@code Long} or {@code BigInteger} for integers, a {@code Double} for floats, a
 * {@code Boolean} for True/False, the raw text for complex numbers and null for None and
 * Ellipsis.
 *
 * <p>A sign in front of a number folds into the number, so {@code -1} reads as the integer -1.
 */
public record PythonLiteral(LiteralKind kind, Object value) {

    public enum LiteralKind {
        STRING,
        BYTES,
        INTEGER,
        FLOAT,
        COMPLEX,
        TRUE,
        FALSE,
        NONE,
        ELLIPSIS
    }

    /** Literal for a node, null when the node is not a constant (f-strings included). */
    public static PythonLiteral of(PythonSyntaxTree tree, TSNode node) {
        TSNode expression = SyntaxNodes.unwrap(node);
        if (!SyntaxNodes.isPresent(expression)) {
            return null;
        }
        return switch (expression.getType()) {
            case "string" -> strings(tree, List.of(expression));
            case "concatenated_string" -> strings(tree, SyntaxNodes.namedChildren(expression));
            case "integer", "float" -> number(tree.text(expression));
            case "true" -> new PythonLiteral(LiteralKind.TRUE, Boolean.TRUE);
            case "false" -> new PythonLiteral(LiteralKind.FALSE, Boolean.FALSE);
            case "none" -> new PythonLiteral(LiteralKind.NONE, null);
            case "ellipsis" -> new PythonLiteral(LiteralKind.ELLIPSIS, null);
            case SyntaxNodes.UNARY_OPERATOR -> signedNumber(tree, expression);
            default -> null;
        };
    }

    public boolean isString() {
        return kind == LiteralKind.STRING;
    }

    public String stringValue() {
        return isString() ? (String) value : null;
    }

    public boolean isNumber() {
        return kind == LiteralKind.INTEGER || kind == LiteralKind.FLOAT;
    }

    /**
     * Text the way Python's {@code str()} prints it: strings unquoted, {@code True}/{@code False}/
     * {@code None}, numbers as written.
     */
    public String display() {
        return switch (kind) {
            case STRING, BYTES, COMPLEX -> String.valueOf(value);
            case TRUE -> "True";
            case FALSE -> "False";
            case NONE -> "None";
            case ELLIPSIS -> "Ellipsis";
            case INTEGER, FLOAT -> value.toString();
        };
    }

    private static PythonLiteral signedNumber(PythonSyntaxTree tree, TSNode unary) {
        TSNode operator = SyntaxNodes.field(unary, "operator");
        PythonLiteral operand = of(tree, SyntaxNodes.field(unary, "argument"));
        if (operator == null || operand == null || !operand.isNumber()) {
            return null;
        }
        String sign = tree.text(operator);
        if (sign.equals("+")) {
            return operand;
        }
        if (!sign.equals("-")) {
            return null;
        }
        Object negated;
        if (operand.value() instanceof Long number) {
            negated = number == Long.MIN_VALUE ? BigInteger.valueOf(number).negate() : -number;
        } else if (operand.value() instanceof BigInteger number) {
            negated = integerValue(number.negate());
        } else {
            negated = -((Double) operand.value());
        }
        return new PythonLiteral(operand.kind(), negated);
    }

    private static PythonLiteral number(String written) {
        String text = written.replace("_", "");
        char suffix = Character.toLowerCase(text.charAt(text.length() - 1));
        if (suffix == 'j') {
            return new PythonLiteral(LiteralKind.COMPLEX, written);
        }
        if (text.length() > 1 && text.charAt(0) == '0' && "xXoObB".indexOf(text.charAt(1)) >= 0) {
            int radix = switch (Character.toLowerCase(text.charAt(1))) {
                case 'x' -> 16;
                case 'o' -> 8;
                default -> 2;
            };
            return new PythonLiteral(LiteralKind.INTEGER, integerValue(new BigInteger(text.substring(2), radix)));
        }
        if (text.contains(".") || text.contains("e") || text.contains("E")) {
            return new PythonLiteral(LiteralKind.FLOAT, Double.parseDouble(text));
        }
        return new PythonLiteral(LiteralKind.INTEGER, integerValue(new BigInteger(text)));
    }

    private static Object integerValue(BigInteger value) {
        return value.bitLength() < 64 ? (Object) value.longValue() : value;
    }

    /** Implicitly concatenated string pieces; any formatted piece makes the whole non-constant. */
    private static PythonLiteral strings(PythonSyntaxTree tree, List<TSNode> pieces) {
        StringBuilder value = new StringBuilder();
        boolean bytes = false;
        for (TSNode piece : pieces) {
            if (!SyntaxNodes.is(piece, "string")) {
                return null;
            }
            String text = tree.text(piece);
            int prefixEnd = 0;
            while (prefixEnd < text.length() && Character.isLetter(text.charAt(prefixEnd))) {
                prefixEnd++;
            }
            String prefix = text.substring(0, prefixEnd).toLowerCase();
            if (prefix.contains("f") || prefix.contains("t")) {
                return null;
            }
            bytes |= prefix.contains("b");
            String quoted = text.substring(prefixEnd);
            int quote = quoted.startsWith("\"\"\"") || quoted.startsWith("'''") ? 3 : 1;
            if (quoted.length() < quote * 2) {
                return null;
            }
            String body = quoted.substring(quote, quoted.length() - quote);
            value.append(prefix.contains("r") ? body : decodeEscapes(body, prefix.contains("b")));
        }
        return new PythonLiteral(bytes ? LiteralKind.BYTES : LiteralKind.STRING, value.toString());
    }

    static String decodeEscapes(String body, boolean bytes) {
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder out = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                i++;
                continue;
            }
            char n = body.charAt(i + 1);
            i += 2;
            switch (n) {
                case '\n' -> { }
                case '\\' -> out.append('\\');
                case '\'' -> out.append('\'');
                case '"' -> out.append('"');
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'v' -> out.append('\u000b');
                case 'x' -> i = appendCodePoint(out, body, i, 2, "\\x");
                case 'u' -> i = bytes ? appendRaw(out, "\\u", i) : appendCodePoint(out, body, i, 4, "\\u");
                case 'U' -> i = bytes ? appendRaw(out, "\\U", i) : appendCodePoint(out, body, i, 8, "\\U");
                default -> {
                    if (n >= '0' && n <= '7') {
                        int end = i;
                        while (end < body.length() && end < i + 2 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
                            end++;
                        }
                        out.append((char) Integer.parseInt(body.substring(i - 1, end), 8));
                        i = end;
                    } else {
                        out.append('\\').append(n);
                    }
                }
            }
        }
        return out.toString();
    }

    private static int appendRaw(StringBuilder out, String text, int index) {
        out.append(text);
        return index;
    }

    private static int appendCodePoint(StringBuilder out, String body, int index, int digits, String escape) {
        if (index + digits > body.length()) {
            out.append(escape);
            return index;
        }
        try {
            int codePoint = Integer.parseInt(body.substring(index, index + digits), 16);
            out.appendCodePoint(codePoint);
            return index + digits;
        } catch (IllegalArgumentException e) {
            out.append(escape);
            return index;
        }
    }
}
