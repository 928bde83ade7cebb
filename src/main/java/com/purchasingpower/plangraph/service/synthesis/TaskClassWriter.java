package com.purchasingpower.plangraph.service.synthesis;

import com.purchasingpower.plangraph.exception.SourceSyntaxException;
import com.purchasingpower.plangraph.exception.UnresolvedTypeReferenceException;
import com.purchasingpower.plangraph.model.ir.FieldDefinition;
import com.purchasingpower.plangraph.model.ir.TaskDefinition;
import com.purchasingpower.plangraph.parser.PythonSyntaxTree;
import com.purchasingpower.plangraph.parser.SyntaxNodes;
import com.purchasingpower.plangraph.service.analysis.FrameworkVocabulary;
import com.purchasingpower.plangraph.util.PythonLiterals;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Writes {@code class Name(Task):} with one {@code Field(...)} declaration per field.
 */
@Slf4j
@Component
public class TaskClassWriter {

    private static final Pattern NUMERIC = Pattern.compile("^-?\\d+(\\.\\d+)?$");

    public String write(TaskDefinition task, List<String> warnings) {
        List<String> lines = new ArrayList<>();
        lines.add("class " + task.getClassName() + "(Task):");
        for (FieldDefinition field : task.getFields()) {
            try {
                lines.add("    " + fieldDeclaration(field, task.getClassName()));
            } catch (UnresolvedTypeReferenceException e) {
                warnings.add(e.getMessage() + " on field " + task.getClassName() + "." + field.getName()
                        + "; field omitted");
            }
        }
        if (lines.size() == 1) {
            lines.add("    pass");
        }
        return String.join("\n", lines);
    }

    String fieldDeclaration(FieldDefinition field, String taskName) {
        String type = pythonType(field, taskName);
        if (field.isList()) {
            type = "List[" + type + "]";
        }
        String defaultValue = "...";
        if (!field.isRequired()) {
            type = "Optional[" + type + "]";
            defaultValue = "None";
        }
        StringBuilder declaration = new StringBuilder()
                .append(field.getName()).append(": ").append(type)
                .append(" = Field(").append(defaultValue);
        if (field.getDescription() != null && !field.getDescription().isEmpty()) {
            declaration.append(", description=").append(PythonLiterals.quote(field.getDescription()));
        }
        return declaration.append(")").toString();
    }

    private static String pythonType(FieldDefinition field, String taskName) {
        String type = field.getType();
        if (FieldDefinition.LITERAL_TYPE.equals(type)) {
            if (field.getLiteralValues() == null || field.getLiteralValues().isEmpty()) {
                throw new UnresolvedTypeReferenceException("Literal[]", taskName);
            }
            List<String> items = new ArrayList<>();
            for (String value : field.getLiteralValues()) {
                items.add(NUMERIC.matcher(value).matches() ? value : PythonLiterals.quote(value));
            }
            return "Literal[" + String.join(", ", items) + "]";
        }
        String primitive = type == null ? null : FrameworkVocabulary.PRIMITIVE_TAGS.inverse().get(type);
        if (primitive != null) {
            return primitive;
        }
        if (type == null || !isTypeExpression(type)) {
            throw new UnresolvedTypeReferenceException(String.valueOf(type), taskName);
        }
        return type;
    }

    /** True when {@code text} parses as a single-line annotation. */
    static boolean isTypeExpression(String text) {
        if (text.isBlank() || text.contains("\n")) {
            return false;
        }
        try {
            PythonSyntaxTree tree = PythonSyntaxTree.parse("_: " + text + "\n", "<type>");
            List<TSNode> statements = SyntaxNodes.statements(tree.root());
            TSNode assignment = statements.size() == 1 ? SyntaxNodes.assignment(statements.get(0)) : null;
            return SyntaxNodes.field(assignment, "type") != null && SyntaxNodes.field(assignment, "right") == null;
        } catch (SourceSyntaxException e) {
            log.debug("Not a type expression: {}", text);
            return false;
        }
    }
}
