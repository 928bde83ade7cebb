package com.purchasingpower.plangraph.service.synthesis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.plangraph.PipelineComponents;
import com.purchasingpower.plangraph.exception.InvalidIdentifierException;
import com.purchasingpower.plangraph.exception.MultipleInputTypesException;
import com.purchasingpower.plangraph.exception.PipelineTransformException;
import com.purchasingpower.plangraph.model.ir.WorkerVariant;
import com.purchasingpower.plangraph.model.payload.GraphPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("Graph Payload Reader Tests")
class GraphPayloadReaderTest {

    private final ObjectMapper objectMapper = PipelineComponents.objectMapper();
    private GraphPayloadReader reader;
    private List<String> warnings;

    @BeforeEach
    void setUp() {
        reader = new GraphPayloadReader(objectMapper);
        warnings = new ArrayList<>();
    }

    @Test
    @DisplayName("Should read tasks, workers and edges from the editor payload")
    void testMinimalPayload() throws Exception {
        // Given
        GraphPayload payload = objectMapper.readValue(
                PipelineComponents.resource("payloads/minimal_payload.json"), GraphPayload.class);

        // When
        SynthesisPlan plan = reader.read(payload, warnings);

        // Then
        assertThat(plan.tasks()).singleElement().satisfies(task -> {
            assertThat(task.getClassName()).isEqualTo("Question");
            assertThat(task.getFields()).extracting("name", "required")
                    .containsExactly(tuple("text", true), tuple("level", false));
        });
        assertThat(plan.workers()).extracting("className", "variantKind")
                .containsExactly(tuple("Router", WorkerVariant.TASK_WORKER),
                        tuple("Responder", WorkerVariant.CHAT_TASK_WORKER));
        assertThat(plan.dependencies()).extracting("source", "target")
                .containsExactly(tuple("Router", "Responder"));
        assertThat(plan.entryWorkers()).containsExactly("Router");
        assertThat(warnings).isEmpty();
    }

    @Test
    @DisplayName("Should resolve edge endpoints by class name and skip duplicates and unknown endpoints")
    void testEdgeResolution() throws Exception {
        // Given
        GraphPayload payload = payload("""
                {"nodes": [
                  {"id": "a", "type": "taskworker", "data": {"className": "First"}},
                  {"id": "b", "type": "taskworker", "data": {"className": "Second", "entryPoint": true}},
                  {"id": "n", "type": "note", "data": {"className": "Sticky"}}
                ],
                "edges": [
                  {"source": "First", "target": "b"},
                  {"source": "a", "target": "Second"},
                  {"source": "a", "target": "missing"}
                ]}
                """);

        // When
        SynthesisPlan plan = reader.read(payload, warnings);

        // Then
        assertThat(plan.dependencies()).extracting("source", "target")
                .containsExactly(tuple("First", "Second"));
        assertThat(plan.entryWorkers()).containsExactly("Second");
        assertThat(warnings).containsExactly(
                "Node n has unknown type 'note'; skipped",
                "Edge a -> missing does not connect known nodes; skipped");
    }

    @Test
    @DisplayName("Should skip imported tasks without a module path")
    void testImportWithoutModule() throws Exception {
        // Given
        GraphPayload payload = payload("""
                {"nodes": [
                  {"id": "i1", "type": "taskimport", "data": {"className": "SearchQuery", "modulePath": "planai.patterns"}},
                  {"id": "i2", "type": "task-import", "data": {"className": "FinalPlan"}}
                ]}
                """);

        // When
        SynthesisPlan plan = reader.read(payload, warnings);

        // Then
        assertThat(plan.importedTasks()).extracting("className").containsExactly("SearchQuery");
        assertThat(warnings).containsExactly("Imported task FinalPlan has no module path; skipped");
    }

    @Test
    @DisplayName("Should reject invalid class and field names")
    void testInvalidIdentifiers() throws Exception {
        // Given
        GraphPayload badClass = payload("""
                {"nodes": [{"id": "t", "type": "task", "data": {"className": "2fast"}}]}
                """);
        GraphPayload badField = payload("""
                {"nodes": [{"id": "t", "type": "task", "data": {"className": "Query",
                  "fields": [{"name": "class", "type": "string"}]}}]}
                """);

        // When / Then
        assertThatThrownBy(() -> reader.read(badClass, warnings))
                .isInstanceOf(InvalidIdentifierException.class)
                .hasMessage("Invalid class name: '2fast'");
        assertThatThrownBy(() -> reader.read(badField, warnings))
                .isInstanceOf(InvalidIdentifierException.class)
                .hasMessage("Invalid field name: 'class'")
                .extracting("nodeName").isEqualTo("Query");
    }

    @Test
    @DisplayName("Should reject several input types on a non-join worker and keep the first on a join worker")
    void testMultipleInputTypes() throws Exception {
        // Given
        GraphPayload plain = payload("""
                {"nodes": [{"id": "w", "type": "taskworker",
                  "data": {"className": "Mixer", "inputTypes": ["A", "B"]}}]}
                """);
        GraphPayload joined = payload("""
                {"nodes": [{"id": "w", "type": "joinedtaskworker",
                  "data": {"className": "Gather", "inputTypes": ["A", "B"]}}]}
                """);

        // When / Then
        assertThatThrownBy(() -> reader.read(plain, warnings))
                .isInstanceOf(MultipleInputTypesException.class)
                .extracting("nodeName").isEqualTo("Mixer");

        SynthesisPlan plan = reader.read(joined, warnings);
        assertThat(plan.workers().get(0).getInputTypes()).containsExactly("A");
        assertThat(warnings).containsExactly("Join worker Gather declares input types [A, B]; using A");
    }

    @Test
    @DisplayName("Should reject duplicate class names and nodes without a class name")
    void testDuplicateAndMissingClassName() throws Exception {
        // Given
        GraphPayload duplicate = payload("""
                {"nodes": [
                  {"id": "t", "type": "task", "data": {"className": "Query"}},
                  {"id": "w", "type": "taskworker", "data": {"className": "Query"}}
                ]}
                """);
        GraphPayload unnamed = payload("""
                {"nodes": [{"id": "t", "type": "task", "data": {"fields": []}}]}
                """);

        // When / Then
        assertThatThrownBy(() -> reader.read(duplicate, warnings))
                .isInstanceOf(PipelineTransformException.class)
                .hasMessage("Duplicate class name: Query");
        assertThatThrownBy(() -> reader.read(unnamed, warnings))
                .isInstanceOf(PipelineTransformException.class)
                .hasMessage("Node t has no className");
        assertThatThrownBy(() -> reader.read(null, warnings))
                .isInstanceOf(PipelineTransformException.class)
                .hasMessage("Payload is empty");
    }

    @Test
    @DisplayName("Should not modify the caller's payload")
    void testPayloadUntouched() throws Exception {
        // Given
        GraphPayload payload = payload("""
                {"nodes": [{"id": "w", "type": "joinedtaskworker",
                  "data": {"className": "Gather", "inputTypes": ["A", "B"]}}]}
                """);
        String before = objectMapper.writeValueAsString(payload);

        // When
        reader.read(payload, warnings);

        // Then
        assertThat(objectMapper.writeValueAsString(payload)).isEqualTo(before);
    }

    private GraphPayload payload(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, GraphPayload.class);
    }
}
