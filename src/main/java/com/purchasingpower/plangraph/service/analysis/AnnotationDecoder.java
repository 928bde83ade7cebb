package com.purchasingpower.plangraph.service.analysis;

import com.purchasingpower.plangraph.model.ir.FieldDefinition;
import com.purchasingpower.plangraph.parser.PythonLiteral;
import com.purchasingpower.plangraph.parser.PythonSyntaxTree;
import com.purchasingpower.plangraph.parser.SyntaxNodes;
import org.springframework.stereotype.Component;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reduces a type annotation to {@link DecodedAnnotation}.
 *
 * <p>Recognized shapes, outermost first: {@code Optional[X]}, {@code Literal[...]},
 * {@code List[X]} / {@code list[X]}, a bare name, a string annotation. Anything else keeps
 * its source text as the type name. Bare names map through the primitive table unless they
 * name a known task. Generic forms are recognized whether tree-sitter reads them as a
 * subscript or as a generic type.
 */
@Component
public class AnnotationDecoder {

    private static final Pattern QUOTED_VALUE = Pattern.compile("\"([^\"]*)\"");
    private static final Pattern NUMERIC_VALUE = Pattern.compile("(?<![\\w.])(-?\\d+(?:\\.\\d+)?)(?![\\w.])");

    public DecodedAnnotation decode(TSNode annotation, PythonSyntaxTree tree, Set<String> knownTasks) {
        boolean optional = false;
        TSNode current = SyntaxNodes.unwrap(annotation);
        if (isGeneric(current, "Optional", tree)) {
            optional = true;
            current = onlyArgument(current);
        }

        if (isGeneric(current, "Literal", tree)) {
            List<String> values = literalValues(current, tree);
            return new DecodedAnnotation(FieldDefinition.LITERAL_TYPE, false, values, optional);
        }

        if (isGeneric(current, "List", tree) || isGeneric(current, "list", tree)) {
            TSNode inner = onlyArgument(current);
            if (isGeneric(inner, "Optional", tree)) {
                optional = true;
                inner = onlyArgument(inner);
            }
            if (isGeneric(inner, "Literal", tree)) {
                List<String> values = literalValues(inner, tree);
                return new DecodedAnnotation(FieldDefinition.LITERAL_TYPE, true, values, optional);
            }
            return new DecodedAnnotation(resolve(elementName(inner, tree), knownTasks), true, null, optional);
        }

        return new DecodedAnnotation(resolve(elementName(current, tree), knownTasks), false, null, optional);
    }

    /** Decodes with no known tasks, as input-type inference does. */
    public DecodedAnnotation decode(TSNode annotation, PythonSyntaxTree tree) {
        return decode(annotation, tree, Set.of());
    }

    private static String elementName(TSNode expression, PythonSyntaxTree tree) {
        if (SyntaxNodes.is(expression, SyntaxNodes.IDENTIFIER)) {
            return tree.text(expression);
        }
        PythonLiteral literal = tree.literal(expression);
        if (literal != null) {
            return literal.display();
        }
        // nested generics and dotted names stay as written
        return tree.text(expression);
    }

    private static String resolve(String typeName, Set<String> knownTasks) {
        if (knownTasks.contains(typeName)) {
            return typeName;
        }
        return FrameworkVocabulary.PRIMITIVE_TAGS.getOrDefault(typeName, typeName);
    }

    /**
     * Values of {@code Literal[...]}: each constant argument, or the constants of a single
     * tuple or list argument. When none decode, double-quoted tokens are scraped from the
     * bracket text, then bare numbers.
     */
    static List<String> literalValues(TSNode literal, PythonSyntaxTree tree) {
        List<TSNode> arguments = SyntaxNodes.genericArguments(literal);
        List<String> values = new ArrayList<>();
        if (arguments.size() == 1 && (SyntaxNodes.is(arguments.get(0), SyntaxNodes.TUPLE)
                || SyntaxNodes.is(arguments.get(0), SyntaxNodes.LIST))) {
            collectConstants(SyntaxNodes.elements(arguments.get(0)), tree, values);
        } else {
            collectConstants(arguments, tree, values);
        }
        if (values.isEmpty() && !arguments.isEmpty()) {
            String text = tree.text(arguments.get(0).getStartByte(), arguments.get(arguments.size() - 1).getEndByte());
            values.addAll(scrapeValues(text));
        }
        return values;
    }

    /** Double-quoted tokens of {@code text}, or its bare (possibly negative or decimal) numbers when it has none. */
    static List<String> scrapeValues(String text) {
        List<String> values = new ArrayList<>();
        Matcher quoted = QUOTED_VALUE.matcher(text);
        while (quoted.find()) {
            values.add(quoted.group(1));
        }
        if (values.isEmpty()) {
            Matcher numeric = NUMERIC_VALUE.matcher(text);
            while (numeric.find()) {
                values.add(numeric.group(1));
            }
        }
        return values;
    }

    private static void collectConstants(List<TSNode> elements, PythonSyntaxTree tree, List<String> values) {
        for (TSNode element : elements) {
            PythonLiteral literal = tree.literal(element);
            if (literal != null) {
                values.add(literal.display());
            }
        }
    }

    private static TSNode onlyArgument(TSNode generic) {
        List<TSNode> arguments = SyntaxNodes.genericArguments(generic);
        return arguments.isEmpty() ? generic : arguments.get(0);
    }

    static boolean isGeneric(TSNode expression, String name, PythonSyntaxTree tree) {
        return name.equals(tree.genericName(expression));
    }
}
