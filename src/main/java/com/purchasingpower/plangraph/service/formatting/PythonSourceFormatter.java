package com.purchasingpower.plangraph.service.formatting;

import com.purchasingpower.plangraph.exception.FormatException;
import com.purchasingpower.plangraph.exception.SourceSyntaxException;
import com.purchasingpower.plangraph.parser.PythonSyntaxTree;
import com.purchasingpower.plangraph.parser.SyntaxNodes;
import com.purchasingpower.plangraph.util.PythonText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Brings generated Python source into one canonical layout.
 *
 * <p>Rules, applied outside string literals only:
 * <ul>
 *   <li>trailing whitespace is removed;</li>
 *   <li>two blank lines before a top-level {@code def}/{@code class}/decorator group (comments
 *       directly above it belong to the group) and after a top-level definition block;</li>
 *   <li>no blank line after a block opener or a decorator;</li>
 *   <li>otherwise at most two blank lines at top level and one inside blocks;</li>
 *   <li>no leading blank lines and exactly one final newline.</li>
 * </ul>
 * Formatting is idempotent. Text that does not parse is rejected with {@link FormatException}.
 */
@Slf4j
@Component
public class PythonSourceFormatter {

    private static final String SOURCE_NAME = "<generated>";

    public String format(String source) {
        PythonSyntaxTree tree;
        try {
            tree = PythonSyntaxTree.parse(source, SOURCE_NAME);
        } catch (SourceSyntaxException e) {
            log.warn("Generated source does not parse: {}", e.getMessage());
            throw new FormatException("Cannot format generated source: " + e.getMessage(), source, e);
        }

        String text = tree.source();
        List<String> lines = PythonText.lines(text);
        LineInfo[] info = classify(lines, tree, PythonText.stringContinuationLines(text));
        return layout(lines, info);
    }

    private enum Kind { BLANK, COMMENT, START, CONTINUATION }

    private static final class LineInfo {
        Kind kind;
        int indent;
        boolean definition;
        boolean decorator;
        boolean opener;
        boolean keepTrailing;
    }

    private static LineInfo[] classify(List<String> lines, PythonSyntaxTree tree, boolean[] insideString) {
        LineInfo[] info = new LineInfo[lines.size()];
        for (int i = 0; i < lines.size(); i++) {
            LineInfo line = new LineInfo();
            String text = lines.get(i);
            line.indent = indentOf(text);
            if (text.isBlank()) {
                line.kind = Kind.BLANK;
            } else if (text.strip().startsWith("#")) {
                line.kind = Kind.COMMENT;
            } else {
                line.kind = Kind.CONTINUATION;
            }
            line.keepTrailing = i + 1 < insideString.length && insideString[i + 1];
            info[i] = line;
        }
        markStatements(info, tree.root());
        return info;
    }

    private static void markStatements(LineInfo[] info, TSNode container) {
        for (TSNode statement : SyntaxNodes.statements(container)) {
            markStatement(info, statement);
        }
    }

    /**
     * Marks the logical lines of one statement. A compound statement claims only its header
     * (through the closing colon) and then recurses into its block and clauses; a one-line
     * body stays on the header's logical line.
     */
    private static void markStatement(LineInfo[] info, TSNode statement) {
        if (SyntaxNodes.is(statement, SyntaxNodes.DECORATED_DEFINITION)) {
            for (TSNode child : SyntaxNodes.namedChildren(statement)) {
                if (SyntaxNodes.is(child, SyntaxNodes.DECORATOR)) {
                    LineInfo line = claim(info, child, PythonSyntaxTree.endLine(child));
                    if (line != null) {
                        line.decorator = true;
                        line.definition = true;
                    }
                }
            }
            markStatement(info, SyntaxNodes.definition(statement));
            return;
        }

        TSNode colon = SyntaxNodes.headerColon(statement);
        if (colon == null) {
            claim(info, statement, PythonSyntaxTree.endLine(statement));
            return;
        }

        TSNode block = null;
        for (TSNode child : SyntaxNodes.namedChildren(statement)) {
            if (child.getStartByte() >= colon.getEndByte() && SyntaxNodes.is(child, SyntaxNodes.BLOCK)) {
                block = child;
                break;
            }
        }
        int colonLine = PythonSyntaxTree.endLine(colon);
        // a trailing comment after the colon may open the block node, so look at its first statement
        TSNode firstStatement = SyntaxNodes.firstNamedChild(block);
        boolean opener = firstStatement != null && PythonSyntaxTree.startLine(firstStatement) > colonLine;
        int headerEnd = opener || block == null ? colonLine : PythonSyntaxTree.endLine(block);
        LineInfo header = claim(info, statement, headerEnd);
        if (header != null) {
            header.opener = opener;
            header.definition = SyntaxNodes.is(statement, SyntaxNodes.FUNCTION_DEFINITION)
                    || SyntaxNodes.is(statement, SyntaxNodes.CLASS_DEFINITION);
        }

        for (TSNode child : SyntaxNodes.namedChildren(statement)) {
            if (child.getStartByte() < colon.getEndByte()) {
                continue;
            }
            if (SyntaxNodes.is(child, SyntaxNodes.BLOCK)) {
                if (opener) {
                    markStatements(info, child);
                }
            } else if (SyntaxNodes.headerColon(child) != null) {
                // elif/else/except/finally/case clauses
                markStatement(info, child);
            }
        }
    }

    /** Marks a start line and its continuation lines; null when another statement already owns the line. */
    private static LineInfo claim(LineInfo[] info, TSNode node, int endLine) {
        int startLine = PythonSyntaxTree.startLine(node);
        if (startLine > info.length || info[startLine - 1].kind == Kind.START) {
            return null;
        }
        LineInfo start = info[startLine - 1];
        start.kind = Kind.START;
        for (int line = startLine + 1; line <= endLine && line <= info.length; line++) {
            if (info[line - 1].kind != Kind.START) {
                info[line - 1].kind = Kind.CONTINUATION;
            }
        }
        return start;
    }

    private static String layout(List<String> lines, LineInfo[] info) {
        List<String> out = new ArrayList<>();
        int pendingBlanks = 0;
        LineInfo previous = null;
        boolean lastTopLevelIsDefinition = false;
        boolean previousLineIsTopComment = false;

        for (int i = 0; i < lines.size(); i++) {
            LineInfo line = info[i];
            String text = line.keepTrailing ? lines.get(i) : lines.get(i).stripTrailing();

            if (line.kind == Kind.BLANK) {
                pendingBlanks++;
                previousLineIsTopComment = false;
                continue;
            }
            if (line.kind == Kind.CONTINUATION) {
                pendingBlanks = 0;
                out.add(text);
                continue;
            }

            if (previous != null) {
                int blanks = blankLinesBefore(line, previous, pendingBlanks, lastTopLevelIsDefinition,
                        previousLineIsTopComment, isAttachedComment(lines, info, i));
                for (int b = 0; b < blanks; b++) {
                    out.add("");
                }
            }
            out.add(text);
            pendingBlanks = 0;

            if (line.kind == Kind.START && line.indent == 0) {
                lastTopLevelIsDefinition = line.definition;
            }
            previousLineIsTopComment = line.kind == Kind.COMMENT && line.indent == 0;
            previous = line;
        }

        while (!out.isEmpty() && out.get(out.size() - 1).isEmpty()) {
            out.remove(out.size() - 1);
        }
        return out.isEmpty() ? "" : String.join("\n", out) + "\n";
    }

    private static int blankLinesBefore(LineInfo line, LineInfo previous, int pendingBlanks,
                                        boolean lastTopLevelIsDefinition, boolean previousLineIsTopComment,
                                        boolean attachedComment) {
        if (previous.kind == Kind.START && (previous.decorator || previous.opener)) {
            return 0;
        }
        boolean topLevel = line.indent == 0;
        boolean startsDefinitionGroup = topLevel
                && ((line.kind == Kind.START && line.definition) || attachedComment);
        if (startsDefinitionGroup) {
            return previousLineIsTopComment ? 0 : 2;
        }
        if (topLevel && previous.indent > 0 && lastTopLevelIsDefinition) {
            return 2;
        }
        return Math.min(pendingBlanks, topLevel ? 2 : 1);
    }

    /** A top-level comment line with only top-level comments between it and a top-level definition. */
    private static boolean isAttachedComment(List<String> lines, LineInfo[] info, int index) {
        if (info[index].kind != Kind.COMMENT || info[index].indent != 0) {
            return false;
        }
        for (int i = index + 1; i < lines.size(); i++) {
            LineInfo next = info[i];
            if (next.kind == Kind.COMMENT && next.indent == 0) {
                continue;
            }
            return next.kind == Kind.START && next.indent == 0 && next.definition;
        }
        return false;
    }

    private static int indentOf(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }
}
