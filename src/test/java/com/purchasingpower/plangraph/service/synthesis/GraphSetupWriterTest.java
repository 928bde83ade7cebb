package com.purchasingpower.plangraph.service.synthesis;

import com.purchasingpower.plangraph.PipelineComponents;
import com.purchasingpower.plangraph.model.ir.LlmConfigValue;
import com.purchasingpower.plangraph.model.ir.WorkerDefinition;
import com.purchasingpower.plangraph.model.ir.WorkerEdge;
import com.purchasingpower.plangraph.model.ir.WorkerVariant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Graph Setup Writer Tests")
class GraphSetupWriterTest {

    private GraphSetupWriter writer;
    private List<String> warnings;

    @BeforeEach
    void setUp() {
        writer = new GraphSetupWriter(PipelineComponents.snippetLibrary(), PipelineComponents.vocabulary());
        warnings = new ArrayList<>();
    }

    @Test
    @DisplayName("Should guard each instantiation with a structured error block")
    void testInstantiationBlock() {
        // Given
        SynthesisPlan plan = plan(List.of(worker("Router", WorkerVariant.TASK_WORKER)), List.of(), Set.of());

        // When
        GraphSetupWriter.GraphSetup setup = writer.write(plan, warnings);

        // Then
        assertThat(setup.workerInstantiation())
                .startsWith("    try:\n        router_worker = Router()\n    except Exception as e:")
                .contains("\"message\": \"Failed to instantiate Router\" + \": \" + repr(str(e)),")
                .contains("\"nodeName\": \"Router\",")
                .contains("print(\"##ERROR_JSON_START##\", flush=True)")
                .endsWith("        sys.exit(1)");
        assertThat(warnings).isEmpty();
    }

    @Test
    @DisplayName("Should declare a shared LLM variable once, in the first worker that uses it")
    void testSharedLlmVariable() {
        // Given
        WorkerDefinition first = worker("Answerer", WorkerVariant.LLM_TASK_WORKER);
        first.setLlmConfigVar("llm");
        first.setLlmConfigFromCode(config());
        WorkerDefinition second = worker("Critic", WorkerVariant.CHAT_TASK_WORKER);
        second.setLlmConfigVar("llm");
        second.setLlmConfigFromCode(config());
        SynthesisPlan plan = plan(List.of(first, second), List.of(), Set.of());

        // When
        String instantiation = writer.write(plan, warnings).workerInstantiation();

        // Then
        assertThat(instantiation).contains("        llm = llm_from_config(provider=\"openai\", max_tokens=-1, "
                + "temperature=settings.temperature)\n        answerer_worker = Answerer(llm=llm)");
        assertThat(instantiation).contains("        critic_worker = Critic(llm=llm)");
        assertThat(instantiation.split("llm = llm_from_config", -1)).hasSize(2);
    }

    @Test
    @DisplayName("Should inline the configuration call or pass None when no configuration is known")
    void testInlineAndMissingConfiguration() {
        // Given
        WorkerDefinition inline = worker("Inline", WorkerVariant.LLM_TASK_WORKER);
        inline.setLlmConfigFromCode(config());
        WorkerDefinition unbound = worker("Unbound", WorkerVariant.TASK_WORKER);
        unbound.setLlmConfigVar("model");
        WorkerDefinition bare = worker("Bare", WorkerVariant.CHAT_TASK_WORKER);
        SynthesisPlan plan = plan(List.of(inline, unbound, bare), List.of(), Set.of());

        // When
        String instantiation = writer.write(plan, warnings).workerInstantiation();

        // Then
        assertThat(instantiation)
                .contains("inline_worker = Inline(llm=llm_from_config(provider=\"openai\", max_tokens=-1, "
                        + "temperature=settings.temperature))")
                .contains("unbound_worker = Unbound(llm=None)")
                .contains("bare_worker = Bare(llm=None)");
        assertThat(warnings).containsExactly("LLM variable model of worker Unbound has no configuration; passing llm=None");
    }

    @Test
    @DisplayName("Should call factory functions and add a name argument for renamed instances")
    void testFactoryWorkers() {
        // Given
        WorkerDefinition stock = factoryWorker("PlanningWorkerSubgraph", "create_planning_worker", "llm=llm");
        WorkerDefinition renamed = factoryWorker("ResearchPlanner", "create_planning_worker", "llm=llm");
        WorkerDefinition named = factoryWorker("Fetcher", "create_search_fetch_worker", "llm=llm, name = \"Fetch\"");
        WorkerDefinition unknown = factoryWorker("Custom", "create_custom_worker", "");
        SynthesisPlan plan = plan(List.of(stock, renamed, named, unknown), List.of(), Set.of());

        // When
        String instantiation = writer.write(plan, warnings).workerInstantiation();

        // Then
        assertThat(instantiation)
                .contains("planningworkersubgraph_worker = create_planning_worker(llm=llm)\n")
                .contains("researchplanner_worker = create_planning_worker(llm=llm, name=\"ResearchPlanner\")")
                .contains("fetcher_worker = create_search_fetch_worker(llm=llm, name = \"Fetch\")")
                .contains("custom_worker = create_custom_worker(name=\"Custom\")");
        assertThat(warnings).containsExactly("Factory function create_custom_worker of worker Custom is not registered");
    }

    @Test
    @DisplayName("Should wire workers, dependencies and entry points in worker order")
    void testWiring() {
        // Given
        List<WorkerDefinition> workers = List.of(
                worker("Expander", WorkerVariant.TASK_WORKER),
                worker("Answerer", WorkerVariant.TASK_WORKER),
                worker("Collector", WorkerVariant.JOINED_TASK_WORKER));
        List<WorkerEdge> edges = List.of(edge("Expander", "Answerer"), edge("Answerer", "Collector"));
        Set<String> entries = new LinkedHashSet<>(List.of("Answerer", "Expander"));

        // When
        String wiring = writer.write(plan(workers, edges, entries), warnings).dependencySetup();

        // Then
        assertThat(wiring).isEqualTo(
                "    graph.add_workers(expander_worker, answerer_worker, collector_worker)\n"
                        + "    graph.set_dependency(expander_worker, answerer_worker)\n"
                        + "    graph.set_dependency(answerer_worker, collector_worker)\n"
                        + "    graph.set_entry(expander_worker)\n"
                        + "    graph.set_entry(answerer_worker)");
    }

    @Test
    @DisplayName("Should give workers whose names differ only in case distinct instance names")
    void testCaseCollidingInstanceNames() {
        // Given
        List<WorkerDefinition> workers = List.of(
                worker("AbWorker", WorkerVariant.TASK_WORKER),
                worker("ABWorker", WorkerVariant.TASK_WORKER),
                worker("Sink", WorkerVariant.TASK_WORKER));
        List<WorkerEdge> edges = List.of(edge("AbWorker", "Sink"), edge("ABWorker", "Sink"));

        // When
        GraphSetupWriter.GraphSetup setup = writer.write(plan(workers, edges, Set.of("AbWorker")), warnings);

        // Then
        assertThat(setup.workerInstantiation())
                .contains("abworker_worker = AbWorker()")
                .contains("abworker_2_worker = ABWorker()")
                .contains("sink_worker = Sink()");
        assertThat(setup.dependencySetup()).isEqualTo(
                "    graph.add_workers(abworker_worker, abworker_2_worker, sink_worker)\n"
                        + "    graph.set_dependency(abworker_worker, sink_worker)\n"
                        + "    graph.set_dependency(abworker_2_worker, sink_worker)\n"
                        + "    graph.set_entry(abworker_worker)");
    }

    @Test
    @DisplayName("Should not reuse a class or LLM variable name as an instance name")
    void testInstanceNamesAvoidOtherNames() {
        // Given
        WorkerDefinition shadowed = worker("Cache", WorkerVariant.TASK_WORKER);
        WorkerDefinition lowerCase = worker("cache_worker", WorkerVariant.TASK_WORKER);

        // When
        Map<String, String> names = GraphSetupWriter.instanceNames(List.of(shadowed, lowerCase));

        // Then
        assertThat(names).containsEntry("Cache", "cache_2_worker")
                .containsEntry("cache_worker", "cache_worker_worker");
    }

    @Test
    @DisplayName("Should write no wiring for an empty graph")
    void testEmptyGraph() {
        // When
        GraphSetupWriter.GraphSetup setup = writer.write(plan(List.of(), List.of(), Set.of()), warnings);

        // Then
        assertThat(setup.workerInstantiation()).isEmpty();
        assertThat(setup.dependencySetup()).isEmpty();
    }

    @Test
    @DisplayName("Should render literal arguments as Python literals and expressions verbatim")
    void testConfigCall() {
        // Given
        Map<String, LlmConfigValue> config = new LinkedHashMap<>();
        config.put("streaming", LlmConfigValue.literal(true));
        config.put("host", LlmConfigValue.literal(null));
        config.put("model_name", LlmConfigValue.expression("os.environ[\"MODEL\"]"));

        // When / Then
        assertThat(GraphSetupWriter.configCall(config))
                .isEqualTo("llm_from_config(streaming=True, host=None, model_name=os.environ[\"MODEL\"])");
        assertThat(GraphSetupWriter.instanceName("QueryExpander")).isEqualTo("queryexpander_worker");
    }

    private static Map<String, LlmConfigValue> config() {
        Map<String, LlmConfigValue> config = new LinkedHashMap<>();
        config.put("provider", LlmConfigValue.literal("openai"));
        config.put("max_tokens", LlmConfigValue.literal(-1L));
        config.put("temperature", LlmConfigValue.expression("settings.temperature"));
        return config;
    }

    private static WorkerDefinition worker(String className, WorkerVariant variant) {
        return WorkerDefinition.builder().className(className).variantKind(variant).build();
    }

    private static WorkerDefinition factoryWorker(String className, String factory, String invocation) {
        return WorkerDefinition.builder()
                .className(className)
                .variantKind(WorkerVariant.SUBGRAPH_WORKER)
                .factoryFunction(factory)
                .factoryInvocation(invocation)
                .build();
    }

    private static WorkerEdge edge(String source, String target) {
        return WorkerEdge.builder().source(source).target(target).build();
    }

    private static SynthesisPlan plan(List<WorkerDefinition> workers, List<WorkerEdge> edges, Set<String> entries) {
        return new SynthesisPlan(List.of(), List.of(), workers, edges, entries);
    }
}
