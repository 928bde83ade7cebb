package com.purchasingpower.plangraph.service.validation;

import com.purchasingpower.plangraph.model.payload.GraphPayload;
import com.purchasingpower.plangraph.model.result.AnalysisResult;
import com.purchasingpower.plangraph.model.result.EquivalenceReport;
import com.purchasingpower.plangraph.model.result.SynthesisResult;
import com.purchasingpower.plangraph.service.PipelineAnalyzer;
import com.purchasingpower.plangraph.service.PipelineSynthesizer;
import com.purchasingpower.plangraph.service.payload.GraphPayloadAssembler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Checks that a module survives analyze, assemble, synthesize, analyze unchanged.
 *
 * <p>A failure at any stage is reported as a single difference naming the stage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoundTripVerifier {

    private final PipelineAnalyzer analyzer;
    private final GraphPayloadAssembler assembler;
    private final PipelineSynthesizer synthesizer;
    private final PipelineEquivalenceChecker checker;

    public EquivalenceReport verify(String source) {
        return verify(source, "<source>");
    }

    public EquivalenceReport verify(String source, String sourceName) {
        AnalysisResult original = analyzer.analyzeSource(source, sourceName);
        if (!original.isSuccess()) {
            return failed("analysis of " + sourceName, original.getError().getError().getMessage());
        }

        GraphPayload payload = assembler.toPayload(original.getDefinition());
        SynthesisResult synthesized = synthesizer.synthesize(payload);
        if (!synthesized.isSuccess()) {
            return failed("synthesis", synthesized.getError().getError().getMessage());
        }

        AnalysisResult reanalyzed = analyzer.analyzeSource(synthesized.getSourceText(), synthesized.getModuleName() + ".py");
        if (!reanalyzed.isSuccess()) {
            return failed("analysis of synthesized source", reanalyzed.getError().getError().getMessage());
        }

        EquivalenceReport report = checker.compare(original.getDefinition(), reanalyzed.getDefinition());
        log.info("Round trip of {}: {}", sourceName, report.isEquivalent() ? "equivalent" : report.getSummary());
        return report;
    }

    private static EquivalenceReport failed(String stage, String message) {
        log.warn("Round trip stopped at {}: {}", stage, message);
        return EquivalenceReport.of(List.of(stage + " failed: " + message));
    }
}
