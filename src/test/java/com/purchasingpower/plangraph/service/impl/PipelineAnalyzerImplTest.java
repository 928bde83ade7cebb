package com.purchasingpower.plangraph.service.impl;

import com.purchasingpower.plangraph.PipelineComponents;
import com.purchasingpower.plangraph.model.ir.EntryEdge;
import com.purchasingpower.plangraph.model.ir.ImportedTaskRef;
import com.purchasingpower.plangraph.model.ir.PipelineDefinition;
import com.purchasingpower.plangraph.model.ir.TaskDefinition;
import com.purchasingpower.plangraph.model.ir.WorkerDefinition;
import com.purchasingpower.plangraph.model.ir.WorkerEdge;
import com.purchasingpower.plangraph.model.ir.WorkerVariant;
import com.purchasingpower.plangraph.model.result.AnalysisResult;
import com.purchasingpower.plangraph.model.result.ErrorKind;
import com.purchasingpower.plangraph.service.PipelineAnalyzer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("Pipeline Analyzer Tests")
class PipelineAnalyzerImplTest {

    private PipelineAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = PipelineComponents.analyzer();
    }

    @Test
    @DisplayName("Should recover tasks, workers and one typed edge from a small module")
    void testSmallModule() {
        // Given
        String source = """
                from planai import Graph, Task, TaskWorker

                class Q(Task):
                    text: str

                class W(TaskWorker):
                    output_types = [Q]

                    def consume_work(self, task: Q2):
                        pass

                class W2(TaskWorker):
                    def consume_work(self, task: Q2):
                        pass

                def create_graph():
                    graph = Graph(name="G")
                    w = W()
                    w2 = W2()
                    graph.add_workers(w, w2)
                    graph.set_dependency(w, w2)
                    return graph
                """;

        // When
        AnalysisResult result = analyzer.analyzeSource(source, "small.py");

        // Then
        assertThat(result.isSuccess()).isTrue();
        PipelineDefinition definition = result.getDefinition();
        assertThat(definition.getTasks()).extracting(TaskDefinition::getClassName).containsExactly("Q");
        assertThat(definition.getWorkers()).extracting(WorkerDefinition::getClassName).containsExactly("W", "W2");
        assertThat(definition.getEdges())
                .extracting(WorkerEdge::getSource, WorkerEdge::getTarget, WorkerEdge::getTargetInputType)
                .containsExactly(tuple("W", "W2", "Q2"));
    }

    @Test
    @DisplayName("Should analyze workers written with match statements and newer syntax")
    void testModernSyntax() {
        // Given
        String source = """
                from planai import Graph, Task, TaskWorker

                type Label = str

                class Q(Task):
                    text: str

                class Routed(Task):
                    label: str

                def first[T](items: list[T]) -> T:
                    return items[0]

                class Router(TaskWorker):
                    output_types = [Routed]

                    def consume_work(self, task: Q):
                        match task.text:
                            case "a":
                                self.publish_work(Routed(label="a"), input_task=task)
                            case _:
                                pass

                class Sink(TaskWorker):
                    def consume_work(self, task: Routed):
                        pass

                def create_graph():
                    graph = Graph(name="G")
                    router = Router()
                    sink = Sink()
                    graph.add_workers(router, sink)
                    graph.set_dependency(router, sink)
                    graph.set_entry(router)
                    return graph
                """;

        // When
        AnalysisResult result = analyzer.analyzeSource(source, "modern.py");

        // Then
        assertThat(result.isSuccess()).isTrue();
        PipelineDefinition definition = result.getDefinition();
        assertThat(definition.getTasks()).extracting(TaskDefinition::getClassName).containsExactly("Q", "Routed");
        assertThat(definition.getWorkers()).extracting(WorkerDefinition::getClassName).containsExactly("Router", "Sink");
        assertThat(definition.findWorker("Router").orElseThrow().getMethods().get("consume_work"))
                .contains("match task.text:");
        assertThat(definition.getEdges())
                .extracting(WorkerEdge::getSource, WorkerEdge::getTarget, WorkerEdge::getTargetInputType)
                .containsExactly(tuple("Router", "Sink", "Routed"));
        assertThat(definition.getEntryEdges()).extracting(EntryEdge::getSourceTask, EntryEdge::getTargetWorker)
                .containsExactly(tuple("Q", "Router"));
    }

    @Test
    @DisplayName("Should analyze the research pipeline fixture end to end")
    void testResearchPipeline() {
        // Given
        String source = PipelineComponents.resource("pipelines/research_pipeline.py");

        // When
        AnalysisResult result = analyzer.analyzeSource(source, "research_pipeline.py");

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getWarnings()).isEmpty();
        PipelineDefinition definition = result.getDefinition();

        assertThat(definition.getTasks()).extracting(TaskDefinition::getClassName)
                .containsExactly("Query", "Answer", "Summary");
        assertThat(definition.getWorkers())
                .extracting(WorkerDefinition::getClassName, WorkerDefinition::getVariantKind)
                .containsExactly(
                        tuple("QueryExpander", WorkerVariant.TASK_WORKER),
                        tuple("Answerer", WorkerVariant.CACHED_LLM_TASK_WORKER),
                        tuple("Collector", WorkerVariant.JOINED_TASK_WORKER),
                        tuple("ResearchPlanner", WorkerVariant.SUBGRAPH_WORKER));

        WorkerDefinition answerer = definition.findWorker("Answerer").orElseThrow();
        assertThat(answerer.getInputTypes()).containsExactly("Query");
        assertThat(answerer.getLlmConfigVar()).isEqualTo("llm");
        assertThat(answerer.getLlmConfigFromCode()).containsOnlyKeys("provider", "model_name", "max_tokens");
        assertThat(answerer.getClassVars().getPrompt()).contains("Answer the question in the task.");

        WorkerDefinition planner = definition.findWorker("ResearchPlanner").orElseThrow();
        assertThat(planner.getFactoryInvocation()).isEqualTo("llm=llm, name=\"ResearchPlanner\"");
        assertThat(planner.getLlmConfigVar()).isEqualTo("llm");

        assertThat(definition.getEdges()).extracting(WorkerEdge::getSource, WorkerEdge::getTarget)
                .containsExactly(
                        tuple("QueryExpander", "Answerer"),
                        tuple("Answerer", "Collector"),
                        tuple("QueryExpander", "ResearchPlanner"));
        assertThat(definition.getEntryEdges()).extracting(EntryEdge::getSourceTask, EntryEdge::getTargetWorker)
                .containsExactly(tuple("Query", "QueryExpander"));
        assertThat(definition.findWorker("QueryExpander").orElseThrow().isEntryPoint()).isTrue();

        assertThat(definition.getImportedTasks())
                .extracting(ImportedTaskRef::getModulePath, ImportedTaskRef::getClassName, ImportedTaskRef::isImplicit)
                .containsExactly(
                        tuple("planai.patterns", "PlanRequest", false),
                        tuple("planai.patterns", "FinalPlan", true));
    }

    @Test
    @DisplayName("Should return a syntax error descriptor with an empty definition")
    void testSyntaxError() {
        // When
        AnalysisResult result = analyzer.analyzeSource("class Broken(:\n    pass\n", "broken.py");

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().kind()).isEqualTo(ErrorKind.SYNTAX_ERROR);
        assertThat(result.getError().getError().getFullTraceback()).isNotBlank();
        assertThat(result.getDefinition().getTasks()).isEmpty();
    }

    @Test
    @DisplayName("Should keep a worker that depends on itself")
    void testSelfLoop() {
        // Given
        String source = """
                class A(TaskWorker):
                    pass

                def create_graph():
                    graph = Graph(name="G")
                    a = A()
                    graph.set_dependency(a, a)
                """;

        // When
        AnalysisResult result = analyzer.analyzeSource(source, "self_loop.py");

        // Then
        assertThat(result.getDefinition().getEdges()).hasSize(1);
    }

    @Test
    @DisplayName("Should return an empty topology when there is no graph builder")
    void testNoGraphBuilder() {
        // When
        AnalysisResult result = analyzer.analyzeSource("class T(Task):\n    x: int\n", "tasks_only.py");

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getDefinition().getTasks()).hasSize(1);
        assertThat(result.getDefinition().getWorkers()).isEmpty();
        assertThat(result.getDefinition().getEdges()).isEmpty();
    }

    @Test
    @DisplayName("Should report an unreadable file as an IO error")
    void testMissingFile(@TempDir Path dir) {
        // When
        AnalysisResult result = analyzer.analyzeFile(dir.resolve("absent.py"));

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().kind()).isEqualTo(ErrorKind.IO_ERROR);
    }
}
