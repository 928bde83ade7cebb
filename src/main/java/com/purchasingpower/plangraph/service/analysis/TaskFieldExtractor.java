package com.purchasingpower.plangraph.service.analysis;

import com.purchasingpower.plangraph.exception.InvalidIdentifierException;
import com.purchasingpower.plangraph.model.ir.FieldDefinition;
import com.purchasingpower.plangraph.model.ir.TaskDefinition;
import com.purchasingpower.plangraph.parser.PythonLiteral;
import com.purchasingpower.plangraph.parser.PythonSyntaxTree;
import com.purchasingpower.plangraph.parser.SyntaxNodes;
import com.purchasingpower.plangraph.util.IdentifierValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts the annotated fields of a Task class.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskFieldExtractor {

    private final AnnotationDecoder annotationDecoder;

    /**
     * @param classDef the task's {@code class_definition} node
     * @param warnings receives one message per skipped field
     */
    public TaskDefinition extract(TSNode classDef, PythonSyntaxTree tree, Set<String> knownTasks, List<String> warnings) {
        String className = tree.definitionName(classDef);
        List<FieldDefinition> fields = new ArrayList<>();
        for (TSNode statement : SyntaxNodes.body(classDef)) {
            TSNode assignment = SyntaxNodes.assignment(statement);
            TSNode annotation = SyntaxNodes.field(assignment, "type");
            String target = annotation == null ? null : tree.name(SyntaxNodes.singleTarget(assignment));
            if (target == null) {
                continue;
            }
            try {
                IdentifierValidator.requireValid(target, "field", className);
                fields.add(toField(target, annotation, SyntaxNodes.assignedValue(assignment), tree, knownTasks));
            } catch (InvalidIdentifierException e) {
                warnings.add(e.getMessage() + " in task " + className + "; field skipped");
            }
        }
        log.debug("Task {} has {} field(s)", className, fields.size());
        return TaskDefinition.builder()
                .className(className)
                .fields(fields)
                .build();
    }

    private FieldDefinition toField(String name, TSNode annotation, TSNode value, PythonSyntaxTree tree,
                                    Set<String> knownTasks) {
        DecodedAnnotation decoded = annotationDecoder.decode(annotation, tree, knownTasks);
        Optional<TSNode> fieldCall = fieldCall(value, tree);

        boolean defaultsToNone = fieldCall
                .map(SyntaxNodes::positionalArguments)
                .map(positional -> !positional.isEmpty() && isNone(positional.get(0), tree))
                .orElse(false);
        String description = fieldCall
                .flatMap(call -> tree.keyword(call, "description"))
                .flatMap(tree::stringValue)
                .orElse(null);
        List<String> literalValues = decoded.isLiteral() && !decoded.literalValues().isEmpty()
                ? decoded.literalValues()
                : null;

        return FieldDefinition.builder()
                .name(name)
                .type(decoded.typeName())
                .list(decoded.list())
                .required(!(decoded.optional() || defaultsToNone))
                .description(description)
                .literalValues(literalValues)
                .build();
    }

    private static Optional<TSNode> fieldCall(TSNode value, PythonSyntaxTree tree) {
        if (SyntaxNodes.is(value, SyntaxNodes.CALL) && "Field".equals(tree.calleeName(value))) {
            return Optional.of(value);
        }
        return Optional.empty();
    }

    private static boolean isNone(TSNode expression, PythonSyntaxTree tree) {
        PythonLiteral literal = tree.literal(expression);
        return literal != null && literal.kind() == PythonLiteral.LiteralKind.NONE;
    }
}
