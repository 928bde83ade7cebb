package com.purchasingpower.plangraph.service.validation;

import com.purchasingpower.plangraph.PipelineComponents;
import com.purchasingpower.plangraph.model.result.EquivalenceReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Round Trip Verifier Tests")
class RoundTripVerifierTest {

    private final RoundTripVerifier verifier = PipelineComponents.roundTripVerifier();

    @Test
    @DisplayName("Should keep the research pipeline equivalent through synthesis")
    void testResearchPipeline() {
        // Given
        String source = PipelineComponents.resource("pipelines/research_pipeline.py");

        // When
        EquivalenceReport report = verifier.verify(source, "research_pipeline.py");

        // Then
        assertTrue(report.isEquivalent(), report.getSummary());
    }

    @Test
    @DisplayName("Should keep literal fields, optional fields and inline LLM configuration")
    void testLiteralsAndInlineConfiguration() {
        // Given
        String source = """
                from typing import List, Literal, Optional, Type

                from planai import ChatTaskWorker, Graph, Task, TaskWorker, llm_from_config
                from pydantic import Field


                class Ticket(Task):
                    level: Literal["low", "high", 3] = Field(..., description="Severity")
                    labels: Optional[List[str]] = None


                class Triage(TaskWorker):
                    output_types: List[Type[Task]] = [Ticket]
                    debug_mode: bool = False

                    def consume_work(self, ticket: Ticket):
                        self.publish_work(ticket.model_copy(), input_task=ticket)


                class Helper(ChatTaskWorker):
                    pass


                def main():
                    graph = Graph(name="Support")
                    triage = Triage()
                    helper = Helper(llm=llm_from_config(provider="ollama", model_name="llama3", temperature=0.2))
                    graph.add_workers(triage, helper)
                    graph.set_dependency(triage, helper)
                    graph.set_entry(triage)
                """;

        // When
        EquivalenceReport report = verifier.verify(source);

        // Then
        assertTrue(report.isEquivalent(), report.getSummary());
    }

    @Test
    @DisplayName("Should keep the wiring of workers whose names differ only in case")
    void testCaseCollidingWorkerNames() {
        // Given
        String source = """
                from planai import Graph, Task, TaskWorker


                class Item(Task):
                    text: str


                class AbWorker(TaskWorker):
                    output_types = [Item]

                    def consume_work(self, task: Item):
                        self.publish_work(task.model_copy(), input_task=task)


                class ABWorker(TaskWorker):
                    output_types = [Item]

                    def consume_work(self, task: Item):
                        self.publish_work(task.model_copy(), input_task=task)


                class Sink(TaskWorker):
                    def consume_work(self, task: Item):
                        pass


                def create_graph():
                    graph = Graph(name="Collide")
                    a = AbWorker()
                    b = ABWorker()
                    s = Sink()
                    graph.add_workers(a, b, s)
                    graph.set_dependency(a, s)
                    graph.set_entry(a)
                    return graph
                """;

        // When
        EquivalenceReport report = verifier.verify(source, "collide.py");

        // Then
        assertTrue(report.isEquivalent(), report.getSummary());
    }

    @Test
    @DisplayName("Should report the stage that failed")
    void testFailedStage() {
        // When
        EquivalenceReport report = verifier.verify("class Broken(Task:\n    pass\n", "broken.py");

        // Then
        assertFalse(report.isEquivalent());
        assertThat(report.getDifferences()).singleElement().asString()
                .startsWith("analysis of broken.py failed: ");
    }
}
