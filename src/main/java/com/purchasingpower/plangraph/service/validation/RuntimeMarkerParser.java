package com.purchasingpower.plangraph.service.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.plangraph.model.result.ExecutionOutcome;
import com.purchasingpower.plangraph.util.PythonText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reads the outcome a generated module printed between its marker lines.
 *
 * <p>Only lines equal to a marker (surrounding whitespace ignored) count, so user output that
 * merely mentions a marker is skipped. The last complete block wins. Without one, the exit
 * code decides.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuntimeMarkerParser {

    public static final String ERROR_START = "##ERROR_JSON_START##";
    public static final String ERROR_END = "##ERROR_JSON_END##";
    public static final String SUCCESS_START = "##SUCCESS_JSON_START##";
    public static final String SUCCESS_END = "##SUCCESS_JSON_END##";

    private final ObjectMapper objectMapper;

    public ExecutionOutcome parse(String stdout, int exitCode) {
        List<String> lines = PythonText.lines(PythonText.normalize(stdout));

        for (int end = lines.size() - 1; end >= 0; end--) {
            String line = lines.get(end).strip();
            String start;
            if (line.equals(ERROR_END)) {
                start = ERROR_START;
            } else if (line.equals(SUCCESS_END)) {
                start = SUCCESS_START;
            } else {
                continue;
            }
            int begin = findStart(lines, start, end);
            if (begin < 0) {
                continue;
            }
            String json = String.join("\n", lines.subList(begin + 1, end)).strip();
            ExecutionOutcome outcome = decode(json, exitCode);
            if (outcome != null) {
                return outcome;
            }
        }

        log.debug("No marker block in output, falling back to exit code {}", exitCode);
        return ExecutionOutcome.builder()
                .success(exitCode == 0)
                .message(exitCode == 0 ? "Process exited normally" : "Process exited with code " + exitCode)
                .markerFound(false)
                .exitCode(exitCode)
                .build();
    }

    private static int findStart(List<String> lines, String marker, int end) {
        for (int i = end - 1; i >= 0; i--) {
            String line = lines.get(i).strip();
            if (line.equals(marker)) {
                return i;
            }
            if (line.equals(ERROR_END) || line.equals(SUCCESS_END)) {
                return -1;
            }
        }
        return -1;
    }

    private ExecutionOutcome decode(String json, int exitCode) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Marker block does not hold valid JSON: {}", e.getOriginalMessage());
            return null;
        }
        if (root == null || !root.isObject()) {
            log.warn("Marker block does not hold a JSON object");
            return null;
        }
        JsonNode error = root.path("error");
        String message = error.isObject() ? text(error.path("message")) : text(root.path("message"));
        return ExecutionOutcome.builder()
                .success(root.path("success").asBoolean(false))
                .message(message)
                .nodeName(text(error.path("nodeName")))
                .fullTraceback(text(error.path("fullTraceback")))
                .markerFound(true)
                .exitCode(exitCode)
                .build();
    }

    private static String text(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
