package com.purchasingpower.plangraph.service.synthesis;

import com.purchasingpower.plangraph.model.ir.FieldDefinition;
import com.purchasingpower.plangraph.model.ir.TaskDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Task Class Writer Tests")
class TaskClassWriterTest {

    private final TaskClassWriter writer = new TaskClassWriter();

    private static FieldDefinition field(String name, String type) {
        return FieldDefinition.builder().name(name).type(type).build();
    }

    @Test
    @DisplayName("Should write primitives, lists, optionals and descriptions")
    void testFieldDeclarations() {
        // Given
        FieldDefinition text = field("text", "string");
        text.setDescription("Say \"hi\"");
        FieldDefinition scores = field("scores", "float");
        scores.setList(true);
        FieldDefinition parent = field("parent", "Query");
        parent.setRequired(false);
        TaskDefinition task = TaskDefinition.builder()
                .className("Query")
                .fields(List.of(text, scores, parent))
                .build();
        List<String> warnings = new ArrayList<>();

        // When
        String source = writer.write(task, warnings);

        // Then
        assertThat(source).isEqualTo("""
                class Query(Task):
                    text: str = Field(..., description="Say \\"hi\\"")
                    scores: List[float] = Field(...)
                    parent: Optional[Query] = Field(None)""");
        assertThat(warnings).isEmpty();
    }

    @Test
    @DisplayName("Should quote literal strings and leave numeric literals bare")
    void testLiteralField() {
        // Given
        FieldDefinition level = field("level", FieldDefinition.LITERAL_TYPE);
        level.setLiteralValues(List.of("a", "b", "3", "-1.5", "1e3"));

        // When
        String declaration = writer.fieldDeclaration(level, "T");

        // Then
        assertThat(declaration).isEqualTo("level: Literal[\"a\", \"b\", 3, -1.5, \"1e3\"] = Field(...)");
    }

    @Test
    @DisplayName("Should omit a field whose type is not a Python type expression")
    void testUnresolvedFieldOmitted() {
        // Given
        TaskDefinition task = TaskDefinition.builder()
                .className("Broken")
                .fields(List.of(field("bad", "not a type"), field("empty", FieldDefinition.LITERAL_TYPE)))
                .build();
        List<String> warnings = new ArrayList<>();

        // When
        String source = writer.write(task, warnings);

        // Then
        assertThat(source).isEqualTo("class Broken(Task):\n    pass");
        assertThat(warnings).hasSize(2).allMatch(w -> w.contains("field omitted"));
    }

    @Test
    @DisplayName("Should accept dotted and generic type text")
    void testTypeExpressions() {
        assertThat(TaskClassWriter.isTypeExpression("models.Result")).isTrue();
        assertThat(TaskClassWriter.isTypeExpression("Dict[str, List[int]]")).isTrue();
        assertThat(TaskClassWriter.isTypeExpression("x = 1")).isFalse();
        assertThat(TaskClassWriter.isTypeExpression("A\nB")).isFalse();
    }
}
