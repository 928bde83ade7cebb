package com.purchasingpower.plangraph.service.validation;

import com.purchasingpower.plangraph.PipelineComponents;
import com.purchasingpower.plangraph.model.result.ExecutionOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Runtime Marker Parser Tests")
class RuntimeMarkerParserTest {

    private final RuntimeMarkerParser parser = new RuntimeMarkerParser(PipelineComponents.objectMapper());

    @Test
    @DisplayName("Should read an error block between interleaved user output")
    void testErrorBlock() {
        // Given
        String stdout = """
                loading model...
                ##ERROR_JSON_START##
                {"success": false, "error": {"message": "Failed to instantiate Answerer: 'boom'", "nodeName": "Answerer", "fullTraceback": "Traceback..."}}
                ##ERROR_JSON_END##
                bye
                """;

        // When
        ExecutionOutcome outcome = parser.parse(stdout, 1);

        // Then
        assertFalse(outcome.isSuccess());
        assertTrue(outcome.isMarkerFound());
        assertEquals("Failed to instantiate Answerer: 'boom'", outcome.getMessage());
        assertEquals("Answerer", outcome.getNodeName());
        assertEquals("Traceback...", outcome.getFullTraceback());
        assertEquals(1, outcome.getExitCode());
    }

    @Test
    @DisplayName("Should let the last complete block win")
    void testLastBlockWins() {
        // Given
        String stdout = "##ERROR_JSON_START##\r\n"
                + "{\"success\": false, \"error\": {\"message\": \"early\", \"nodeName\": null}}\r\n"
                + "##ERROR_JSON_END##\r\n"
                + "  ##SUCCESS_JSON_START##  \r\n"
                + "{\"success\": true, \"message\": \"Graph setup successful.\"}\r\n"
                + "##SUCCESS_JSON_END##\r\n"
                + "##ERROR_JSON_START##\r\n"
                + "{\"success\": false";

        // When
        ExecutionOutcome outcome = parser.parse(stdout, 0);

        // Then
        assertTrue(outcome.isSuccess());
        assertTrue(outcome.isMarkerFound());
        assertEquals("Graph setup successful.", outcome.getMessage());
        assertThat(outcome.getNodeName()).isNull();
    }

    @Test
    @DisplayName("Should skip blocks with invalid JSON and lines that only mention a marker")
    void testInvalidBlocks() {
        // Given
        String stdout = """
                ##SUCCESS_JSON_START##
                {"success": true, "message": "first"}
                ##SUCCESS_JSON_END##
                echo ##ERROR_JSON_START## from user code
                ##ERROR_JSON_START##
                not json
                ##ERROR_JSON_END##
                """;

        // When
        ExecutionOutcome outcome = parser.parse(stdout, 0);

        // Then
        assertTrue(outcome.isSuccess());
        assertEquals("first", outcome.getMessage());
    }

    @Test
    @DisplayName("Should fall back to the exit code without a marker block")
    void testExitCodeFallback() {
        // When
        ExecutionOutcome clean = parser.parse("hello\n", 0);
        ExecutionOutcome crashed = parser.parse("##ERROR_JSON_START##\n{\"success\": false}\n", 2);

        // Then
        assertTrue(clean.isSuccess());
        assertFalse(clean.isMarkerFound());
        assertEquals("Process exited normally", clean.getMessage());
        assertFalse(crashed.isSuccess());
        assertFalse(crashed.isMarkerFound());
        assertEquals("Process exited with code 2", crashed.getMessage());
    }
}
