package com.purchasingpower.plangraph.parser;

import com.purchasingpower.plangraph.exception.SourceSyntaxException;
import com.purchasingpower.plangraph.util.PythonText;
import lombok.extern.slf4j.Slf4j;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A Python source file parsed by tree-sitter, plus the text-level queries the analyzer needs.
 *
 * <p>Node byte ranges count UTF-8 bytes; every slice goes through {@link #offset(int)} so that
 * non-ASCII source maps back onto the Java string. Nodes stay valid while this object is
 * reachable, since it owns the native tree.
 *
 * <p>Usage:
 * <pre>
 * PythonSyntaxTree tree = PythonSyntaxTree.parse(source, "pipeline.py");
 * for (TSNode statement : SyntaxNodes.statements(tree.root())) { ... }
 * </pre>
 */
@Slf4j
public final class PythonSyntaxTree {

    private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
        TSParser parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterPython())) {
            log.error("Failed to set the Python language on TSParser");
        }
        return parser;
    });

    private final String source;
    private final TSTree tree;
    private final int[] charOffsets;

    private PythonSyntaxTree(String source, TSTree tree) {
        this.source = source;
        this.tree = tree;
        this.charOffsets = charOffsets(source);
    }

    /**
     * Parses a whole source file. Line endings are normalized and a leading BOM is dropped
     * first; node ranges refer to that normalized text.
     *
     * @throws SourceSyntaxException when tree-sitter reports an error or missing node
     */
    public static PythonSyntaxTree parse(String source, String sourceName) {
        String normalized = PythonText.normalize(source);
        TSTree parsed = PARSER.get().parseString(null, normalized);
        PythonSyntaxTree syntaxTree = new PythonSyntaxTree(normalized, parsed);
        TSNode root = parsed.getRootNode();
        if (root == null || root.isNull()) {
            throw new SourceSyntaxException("source could not be parsed", sourceName, 1, 1);
        }
        if (root.hasError()) {
            TSNode error = firstError(root);
            TSNode at = error == null ? root : error;
            String message = error != null && error.isMissing() ? "missing " + error.getType() : "invalid syntax";
            throw new SourceSyntaxException(message, sourceName,
                    at.getStartPoint().getRow() + 1, at.getStartPoint().getColumn() + 1);
        }
        return syntaxTree;
    }

    /** The normalized text the tree was parsed from. */
    public String source() {
        return source;
    }

    public TSNode root() {
        return tree.getRootNode();
    }

    /** Character index of a byte offset. */
    public int offset(int byteOffset) {
        return charOffsets[Math.max(0, Math.min(byteOffset, charOffsets.length - 1))];
    }

    /** Exact source text of a node. */
    public String text(TSNode node) {
        return source.substring(offset(node.getStartByte()), offset(node.getEndByte()));
    }

    /** Text between two byte offsets. */
    public String text(int startByte, int endByte) {
        return source.substring(offset(startByte), offset(endByte));
    }

    /** 1-based line a node starts on. */
    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /** 1-based last line a node covers; a node ending right after a newline ends on the line before. */
    public static int endLine(TSNode node) {
        int row = node.getEndPoint().getRow();
        if (node.getEndPoint().getColumn() == 0 && row > node.getStartPoint().getRow()) {
            return row;
        }
        return row + 1;
    }

    /** Lines {@code [startLine, endLine]} (1-based, inclusive) joined with newlines. */
    public String lines(int startLine, int endLine) {
        return PythonText.sliceLines(PythonText.lines(source), startLine, endLine);
    }

    /** Whole lines covered by a node. */
    public String lines(TSNode node) {
        return lines(startLine(node), endLine(node));
    }

    /** Id of a plain name, parentheses ignored; null for anything else. */
    public String name(TSNode node) {
        TSNode expression = SyntaxNodes.unwrap(node);
        return SyntaxNodes.is(expression, SyntaxNodes.IDENTIFIER) ? text(expression) : null;
    }

    /** Attribute name of {@code a.b}: {@code b}. */
    public String attributeName(TSNode attribute) {
        TSNode name = SyntaxNodes.field(attribute, "attribute");
        return name == null ? null : text(name);
    }

    /** Name of a class or function definition. */
    public String definitionName(TSNode definition) {
        TSNode name = SyntaxNodes.field(SyntaxNodes.definition(definition), "name");
        return name == null ? null : text(name);
    }

    /**
     * Simple name of a callee: the id of a bare name, the last attribute of a dotted callee,
     * null otherwise.
     */
    public String calleeName(TSNode call) {
        TSNode function = SyntaxNodes.unwrap(SyntaxNodes.field(call, "function"));
        if (SyntaxNodes.is(function, SyntaxNodes.IDENTIFIER)) {
            return text(function);
        }
        if (SyntaxNodes.is(function, SyntaxNodes.ATTRIBUTE)) {
            return attributeName(function);
        }
        return null;
    }

    /** Keyword arguments of a call by keyword, in source order. */
    public Map<String, TSNode> keywords(TSNode call) {
        Map<String, TSNode> keywords = new LinkedHashMap<>();
        for (TSNode argument : SyntaxNodes.arguments(call)) {
            if (SyntaxNodes.is(argument, SyntaxNodes.KEYWORD_ARGUMENT)) {
                TSNode name = SyntaxNodes.field(argument, "name");
                TSNode value = SyntaxNodes.field(argument, "value");
                if (name != null && value != null) {
                    keywords.putIfAbsent(text(name), SyntaxNodes.unwrap(value));
                }
            }
        }
        return keywords;
    }

    public Optional<TSNode> keyword(TSNode call, String name) {
        return Optional.ofNullable(keywords(call).get(name));
    }

    /**
     * Name of the class a generic annotation applies to: {@code Optional} for
     * {@code Optional[int]}, whether tree-sitter read it as a subscript or a generic type.
     */
    public String genericName(TSNode node) {
        TSNode expression = SyntaxNodes.unwrap(node);
        if (SyntaxNodes.is(expression, SyntaxNodes.SUBSCRIPT)) {
            return name(SyntaxNodes.field(expression, "value"));
        }
        if (SyntaxNodes.is(expression, SyntaxNodes.GENERIC_TYPE)) {
            TSNode base = SyntaxNodes.firstNamedChild(expression);
            return base != null && SyntaxNodes.is(base, SyntaxNodes.IDENTIFIER) ? text(base) : null;
        }
        return null;
    }

    /** Literal value of a constant expression, null when the node is not one. */
    public PythonLiteral literal(TSNode node) {
        return PythonLiteral.of(this, node);
    }

    /** Value of a plain (non-formatted) string literal. */
    public Optional<String> stringValue(TSNode node) {
        PythonLiteral literal = literal(node);
        return literal != null && literal.isString() ? Optional.of(literal.stringValue()) : Optional.empty();
    }

    /** Names of the parameters that can be passed positionally, in declaration order. */
    public List<String> positionalParameterNames(TSNode function) {
        List<String> names = new ArrayList<>();
        for (TSNode parameter : SyntaxNodes.positionalParameters(function)) {
            TSNode name = SyntaxNodes.parameterName(parameter);
            if (name != null) {
                names.add(text(name));
            }
        }
        return names;
    }

    private static TSNode firstError(TSNode node) {
        if (SyntaxNodes.ERROR.equals(node.getType()) || node.isMissing()) {
            return node;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child.isNull() || !(child.hasError() || child.isMissing())) {
                continue;
            }
            TSNode found = firstError(child);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static int[] charOffsets(String text) {
        int[] offsets = new int[text.getBytes(StandardCharsets.UTF_8).length + 1];
        int bytes = 0;
        int i = 0;
        while (i < text.length()) {
            int codePoint = text.codePointAt(i);
            int chars = Character.charCount(codePoint);
            int width;
            if (chars == 1 && Character.isSurrogate(text.charAt(i))) {
                // unpaired surrogates encode as a single replacement byte
                width = 1;
            } else if (codePoint < 0x80) {
                width = 1;
            } else if (codePoint < 0x800) {
                width = 2;
            } else if (codePoint < 0x10000) {
                width = 3;
            } else {
                width = 4;
            }
            for (int k = 0; k < width; k++) {
                offsets[bytes + k] = i;
            }
            bytes += width;
            i += chars;
        }
        offsets[bytes] = i;
        return offsets;
    }
}
