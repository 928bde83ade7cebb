package com.purchasingpower.plangraph.parser;

import com.purchasingpower.plangraph.exception.SourceSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.treesitter.TSNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Python Syntax Tree Tests")
class PythonSyntaxTreeTest {

    @Test
    @DisplayName("Should expose class bases, annotated fields, keywords and method parameters")
    void testClassDefinition() {
        // Given
        String source = """
                class Query(Task):
                    text: str = Field(..., description="q")
                    tags: List[str]

                    def consume_work(self, task: Query):
                        return task
                """;

        // When
        PythonSyntaxTree tree = PythonSyntaxTree.parse(source, "t.py");
        TSNode query = SyntaxNodes.statements(tree.root()).get(0);
        List<TSNode> body = SyntaxNodes.body(query);

        // Then
        assertThat(tree.definitionName(query)).isEqualTo("Query");
        assertThat(SyntaxNodes.arguments(query)).extracting(tree::text).containsExactly("Task");

        TSNode text = SyntaxNodes.assignment(body.get(0));
        assertThat(tree.name(SyntaxNodes.singleTarget(text))).isEqualTo("text");
        TSNode field = SyntaxNodes.assignedValue(text);
        assertThat(tree.calleeName(field)).isEqualTo("Field");
        assertThat(tree.keyword(field, "description").flatMap(tree::stringValue)).contains("q");

        TSNode tags = SyntaxNodes.assignment(body.get(1));
        assertThat(SyntaxNodes.assignedValue(tags)).isNull();
        assertThat(tree.genericName(SyntaxNodes.field(tags, "type"))).isEqualTo("List");

        TSNode method = SyntaxNodes.definition(body.get(2));
        assertThat(tree.positionalParameterNames(method)).containsExactly("self", "task");
        TSNode annotation = SyntaxNodes.parameterAnnotation(SyntaxNodes.positionalParameters(method).get(1));
        assertThat(tree.text(annotation)).isEqualTo("Query");
    }

    @Test
    @DisplayName("Should slice whole lines of a decorated definition and its header colon")
    void testDecoratedDefinition() {
        // Given
        String source = """
                @cached
                def format_prompt(
                    self,
                    task: Query,
                ) -> str:
                    return "x"
                """;

        // When
        PythonSyntaxTree tree = PythonSyntaxTree.parse(source, "t.py");
        TSNode statement = SyntaxNodes.statements(tree.root()).get(0);
        TSNode function = SyntaxNodes.definition(statement);
        TSNode colon = SyntaxNodes.headerColon(function);

        // Then
        assertThat(tree.lines(statement)).startsWith("@cached").endsWith("return \"x\"");
        assertThat(PythonSyntaxTree.startLine(statement)).isEqualTo(1);
        assertThat(PythonSyntaxTree.endLine(statement)).isEqualTo(6);
        assertThat(tree.text(function.getStartByte(), colon.getEndByte()))
                .startsWith("def format_prompt(")
                .endsWith(") -> str:");
    }

    @Test
    @DisplayName("Should map byte ranges back onto text with non-ASCII characters")
    void testNonAsciiOffsets() {
        // Given
        String source = "greeting = \"héllo wörld 🚀\"\nx = 1\n";

        // When
        PythonSyntaxTree tree = PythonSyntaxTree.parse(source, "t.py");
        List<TSNode> statements = SyntaxNodes.statements(tree.root());

        // Then
        assertThat(tree.text(statements.get(1))).isEqualTo("x = 1");
        assertThat(tree.stringValue(SyntaxNodes.assignedValue(SyntaxNodes.assignment(statements.get(0)))))
                .contains("héllo wörld 🚀");
    }

    @Test
    @DisplayName("Should accept match statements, type aliases and generic function syntax")
    void testModernSyntax() {
        // Given
        String source = """
                type Alias = int

                def first[T](items: list[T]) -> T:
                    return items[0]

                def route(task):
                    match task.kind:
                        case "a":
                            return 1
                        case _:
                            return 2
                """;

        // When / Then
        assertThatCode(() -> PythonSyntaxTree.parse(source, "t.py")).doesNotThrowAnyException();
        PythonSyntaxTree tree = PythonSyntaxTree.parse(source, "t.py");
        List<TSNode> statements = SyntaxNodes.statements(tree.root());
        assertThat(statements).hasSize(3);
        assertThat(tree.definitionName(statements.get(1))).isEqualTo("first");
        assertThat(tree.positionalParameterNames(SyntaxNodes.definition(statements.get(1)))).containsExactly("items");
    }

    @Test
    @DisplayName("Should accept the wider statement grammar")
    void testWiderGrammar() {
        // Given
        String source = """
                import json, sys
                async def main(*args, key=None, **kwargs):
                    async with lock as held:
                        await run([x ** 2 for x in range(10) if x % 2], {k: v for k, v in kwargs.items()})
                    while True:
                        break
                    return lambda y: (y, *args)
                x = {"a": 1, **other}
                y = a if b else c
                del x[0]
                assert y, "message"
                """;

        // When
        PythonSyntaxTree tree = PythonSyntaxTree.parse(source, "t.py");
        List<TSNode> statements = SyntaxNodes.statements(tree.root());

        // Then
        assertThat(statements).hasSize(6);
        assertThat(SyntaxNodes.isAsync(SyntaxNodes.definition(statements.get(1)))).isTrue();
        assertThat(SyntaxNodes.positionalParameters(SyntaxNodes.definition(statements.get(1)))).isEmpty();
    }

    @Test
    @DisplayName("Should read relative and parenthesized from-imports")
    void testImportFrom() {
        // Given
        String source = "from planai.patterns import (\n    PlanRequest as Request,\n    FinalPlan,\n)\nfrom . import local\n";

        // When
        PythonSyntaxTree tree = PythonSyntaxTree.parse(source, "t.py");
        List<TSNode> statements = SyntaxNodes.statements(tree.root());

        // Then
        assertThat(statements).allMatch(statement -> SyntaxNodes.is(statement, SyntaxNodes.IMPORT_FROM_STATEMENT));
        assertThat(tree.text(SyntaxNodes.field(statements.get(0), "module_name"))).isEqualTo("planai.patterns");
        assertThat(SyntaxNodes.findAllDescendants(statements.get(0), SyntaxNodes.ALIASED_IMPORT)).hasSize(1);
        assertThat(SyntaxNodes.field(statements.get(1), "module_name").getType()).isEqualTo(SyntaxNodes.RELATIVE_IMPORT);
    }

    @Test
    @DisplayName("Should report the line of a syntax error")
    void testSyntaxError() {
        assertThatThrownBy(() -> PythonSyntaxTree.parse("x = 1\nclass :\n", "broken.py"))
                .isInstanceOfSatisfying(SourceSyntaxException.class, e -> {
                    assertThat(e.getLine()).isEqualTo(2);
                    assertThat(e.getSourceName()).isEqualTo("broken.py");
                });
    }
}
