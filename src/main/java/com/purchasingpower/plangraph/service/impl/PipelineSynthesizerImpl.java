package com.purchasingpower.plangraph.service.impl;

import com.purchasingpower.plangraph.exception.PipelineTransformException;
import com.purchasingpower.plangraph.model.ir.ImportedTaskRef;
import com.purchasingpower.plangraph.model.ir.TaskDefinition;
import com.purchasingpower.plangraph.model.ir.WorkerDefinition;
import com.purchasingpower.plangraph.model.payload.GraphPayload;
import com.purchasingpower.plangraph.model.result.ErrorDescriptor;
import com.purchasingpower.plangraph.model.result.ErrorKind;
import com.purchasingpower.plangraph.model.result.SynthesisResult;
import com.purchasingpower.plangraph.service.PipelineSynthesizer;
import com.purchasingpower.plangraph.service.analysis.FactorySpec;
import com.purchasingpower.plangraph.service.analysis.FrameworkVocabulary;
import com.purchasingpower.plangraph.service.formatting.PythonSourceFormatter;
import com.purchasingpower.plangraph.service.synthesis.CodeSnippetLibrary;
import com.purchasingpower.plangraph.service.synthesis.GraphPayloadReader;
import com.purchasingpower.plangraph.service.synthesis.GraphSetupWriter;
import com.purchasingpower.plangraph.service.synthesis.SynthesisPlan;
import com.purchasingpower.plangraph.service.synthesis.TaskClassWriter;
import com.purchasingpower.plangraph.service.synthesis.WorkerClassWriter;
import com.purchasingpower.plangraph.util.PythonLiterals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineSynthesizerImpl implements PipelineSynthesizer {

    static final String MODULE_SNIPPET = "module";
    static final String TOOL_IMPORT = "from llm_interface import Tool, tool  # noqa: F401";

    private final GraphPayloadReader payloadReader;
    private final TaskClassWriter taskClassWriter;
    private final WorkerClassWriter workerClassWriter;
    private final GraphSetupWriter graphSetupWriter;
    private final CodeSnippetLibrary snippetLibrary;
    private final PythonSourceFormatter formatter;
    private final FrameworkVocabulary vocabulary;

    @Override
    public SynthesisResult synthesize(GraphPayload payload) {
        log.info("Synthesizing module {} from {} node(s)", vocabulary.moduleName(),
                payload == null || payload.getNodes() == null ? 0 : payload.getNodes().size());
        try {
            List<String> warnings = new ArrayList<>();
            SynthesisPlan plan = payloadReader.read(payload, warnings);
            String raw = render(plan, warnings);
            String source = formatter.format(raw);
            warnings.forEach(warning -> log.warn("Synthesis: {}", warning));
            log.info("Synthesized {}: {} task(s), {} worker(s), {} line(s)", vocabulary.moduleName(),
                    plan.tasks().size(), plan.workers().size(), source.lines().count());
            return SynthesisResult.success(source, vocabulary.moduleName(), warnings);
        } catch (PipelineTransformException e) {
            log.warn("Synthesis rejected: {}", e.getMessage());
            return SynthesisResult.failure(ErrorDescriptor.from(e));
        } catch (RuntimeException e) {
            log.error("Unexpected failure during synthesis", e);
            return SynthesisResult.failure(
                    ErrorDescriptor.of(ErrorKind.INTERNAL_ERROR, "Synthesis failed: " + e.getMessage(), null, e));
        }
    }

    String render(SynthesisPlan plan, List<String> warnings) {
        List<String> taskClasses = new ArrayList<>();
        for (TaskDefinition task : plan.tasks()) {
            taskClasses.add(taskClassWriter.write(task, warnings));
        }
        List<String> workerClasses = new ArrayList<>();
        for (WorkerDefinition worker : plan.workers()) {
            String text = workerClassWriter.write(worker);
            if (text != null) {
                workerClasses.add(text);
            }
        }
        GraphSetupWriter.GraphSetup setup = graphSetupWriter.write(plan, warnings);

        Map<String, Object> variables = new HashMap<>();
        variables.put("extraImports", extraImports(plan));
        variables.put("taskDefinitions", String.join("\n\n\n", taskClasses));
        variables.put("workerDefinitions", String.join("\n\n\n", workerClasses));
        variables.put("graphName", PythonLiterals.quote(vocabulary.graphName()));
        variables.put("workerInstantiation", setup.workerInstantiation());
        variables.put("dependencySetup", setup.dependencySetup());
        return snippetLibrary.render(MODULE_SNIPPET, variables);
    }

    /**
     * {@code from M import A, B} per module, modules and names sorted, for imported tasks and
     * factory functions; then the tool import when a worker declares tools.
     */
    String extraImports(SynthesisPlan plan) {
        Map<String, SortedSet<String>> byModule = new TreeMap<>();
        for (ImportedTaskRef imported : plan.importedTasks()) {
            byModule.computeIfAbsent(imported.getModulePath(), key -> new TreeSet<>()).add(imported.getClassName());
        }
        for (WorkerDefinition worker : plan.workers()) {
            if (worker.getFactoryFunction() == null) {
                continue;
            }
            Optional<FactorySpec> factory = vocabulary.factory(worker.getFactoryFunction());
            factory.ifPresent(spec -> byModule.computeIfAbsent(spec.module(), key -> new TreeSet<>()).add(spec.name()));
        }

        List<String> lines = byModule.entrySet().stream()
                .map(entry -> "from " + entry.getKey() + " import " + String.join(", ", entry.getValue()))
                .collect(Collectors.toCollection(ArrayList::new));
        boolean usesTools = plan.workers().stream()
                .anyMatch(worker -> worker.getClassVars() != null && worker.getClassVars().getTools() != null);
        if (usesTools) {
            lines.add(TOOL_IMPORT);
        }
        return String.join("\n", lines);
    }
}
