package com.purchasingpower.plangraph.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.plangraph.model.payload.GraphPayload;
import com.purchasingpower.plangraph.model.result.AnalysisResult;
import com.purchasingpower.plangraph.model.result.EquivalenceReport;
import com.purchasingpower.plangraph.model.result.SynthesisResult;
import com.purchasingpower.plangraph.service.PipelineAnalyzer;
import com.purchasingpower.plangraph.service.PipelineSynthesizer;
import com.purchasingpower.plangraph.service.validation.RoundTripVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry points:
 * <pre>
 *   --analyze=pipeline.py      print the recovered definition as JSON
 *   --synthesize=payload.json  print the generated module
 *   --verify=pipeline.py       print the round-trip equivalence report
 * </pre>
 * Without any of these options the runner does nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransducerCommandRunner implements ApplicationRunner {

    static final String ANALYZE = "analyze";
    static final String SYNTHESIZE = "synthesize";
    static final String VERIFY = "verify";

    private final PipelineAnalyzer analyzer;
    private final PipelineSynthesizer synthesizer;
    private final RoundTripVerifier verifier;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        execute(args, System.out);
    }

    /**
     * @return true when every requested command succeeded
     */
    boolean execute(ApplicationArguments args, PrintStream out) throws IOException {
        boolean ok = true;
        for (String file : values(args, ANALYZE)) {
            AnalysisResult result = analyzer.analyzeFile(Path.of(file));
            out.println(objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(result.isSuccess() ? result.getDefinition() : result.getError()));
            ok &= result.isSuccess();
        }
        for (String file : values(args, SYNTHESIZE)) {
            GraphPayload payload = objectMapper.readValue(Files.readString(Path.of(file), StandardCharsets.UTF_8),
                    GraphPayload.class);
            SynthesisResult result = synthesizer.synthesize(payload);
            if (result.isSuccess()) {
                out.print(result.getSourceText());
            } else {
                out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result.getError()));
            }
            ok &= result.isSuccess();
        }
        for (String file : values(args, VERIFY)) {
            EquivalenceReport report = verifier.verify(Files.readString(Path.of(file), StandardCharsets.UTF_8),
                    Path.of(file).getFileName().toString());
            out.println(report.getSummary());
            ok &= report.isEquivalent();
        }
        if (!ok) {
            log.warn("One or more commands reported a failure");
        }
        return ok;
    }

    private static List<String> values(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        return values == null ? List.of() : values;
    }
}
