package com.purchasingpower.plangraph.service.impl;

import com.purchasingpower.plangraph.exception.InvalidIdentifierException;
import com.purchasingpower.plangraph.exception.SourceSyntaxException;
import com.purchasingpower.plangraph.model.ir.EntryEdge;
import com.purchasingpower.plangraph.model.ir.ImportedTaskRef;
import com.purchasingpower.plangraph.model.ir.PipelineDefinition;
import com.purchasingpower.plangraph.model.ir.TaskDefinition;
import com.purchasingpower.plangraph.model.ir.WorkerDefinition;
import com.purchasingpower.plangraph.model.ir.WorkerEdge;
import com.purchasingpower.plangraph.model.result.AnalysisResult;
import com.purchasingpower.plangraph.model.result.ErrorDescriptor;
import com.purchasingpower.plangraph.model.result.ErrorKind;
import com.purchasingpower.plangraph.parser.PythonSyntaxTree;
import com.purchasingpower.plangraph.service.PipelineAnalyzer;
import com.purchasingpower.plangraph.service.analysis.ClassClassifier;
import com.purchasingpower.plangraph.service.analysis.ClassInventory;
import com.purchasingpower.plangraph.service.analysis.LlmBindingParser;
import com.purchasingpower.plangraph.service.analysis.PipelineTopology;
import com.purchasingpower.plangraph.service.analysis.TaskFieldExtractor;
import com.purchasingpower.plangraph.service.analysis.TopologyExtractor;
import com.purchasingpower.plangraph.service.analysis.WorkerDetailExtractor;
import com.purchasingpower.plangraph.util.IdentifierValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.treesitter.TSNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineAnalyzerImpl implements PipelineAnalyzer {

    private final ClassClassifier classClassifier;
    private final TaskFieldExtractor taskFieldExtractor;
    private final WorkerDetailExtractor workerDetailExtractor;
    private final TopologyExtractor topologyExtractor;
    private final LlmBindingParser llmBindingParser;

    @Override
    public AnalysisResult analyzeFile(Path file) {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return AnalysisResult.failure(
                    ErrorDescriptor.of(ErrorKind.IO_ERROR, "Could not read " + file + ": " + e.getMessage(), null, e));
        }
        return analyzeSource(source, file.getFileName().toString());
    }

    @Override
    public AnalysisResult analyzeSource(String source, String sourceName) {
        log.info("Analyzing {} ({} chars)", sourceName, source == null ? 0 : source.length());
        try {
            PythonSyntaxTree tree = PythonSyntaxTree.parse(source, sourceName);
            List<String> warnings = new ArrayList<>();
            PipelineDefinition definition = analyze(tree, warnings);
            warnings.forEach(warning -> log.warn("{}: {}", sourceName, warning));
            log.info("Analyzed {}: {} task(s), {} worker(s), {} edge(s), {} entry edge(s), {} import(s)",
                    sourceName, definition.getTasks().size(), definition.getWorkers().size(),
                    definition.getEdges().size(), definition.getEntryEdges().size(),
                    definition.getImportedTasks().size());
            return AnalysisResult.success(definition, warnings);
        } catch (SourceSyntaxException e) {
            log.warn("Syntax error in {}: {}", sourceName, e.getMessage());
            return AnalysisResult.failure(ErrorDescriptor.from(e));
        } catch (RuntimeException e) {
            log.error("Unexpected failure analyzing {}", sourceName, e);
            return AnalysisResult.failure(
                    ErrorDescriptor.of(ErrorKind.INTERNAL_ERROR, "Analysis failed: " + e.getMessage(), null, e));
        }
    }

    private PipelineDefinition analyze(PythonSyntaxTree tree, List<String> warnings) {
        ClassInventory inventory = classClassifier.classify(tree);
        Set<String> importedNames = topologyExtractor.importedTaskNames(tree);

        Set<String> knownTasks = new LinkedHashSet<>(inventory.tasks().keySet());
        knownTasks.addAll(importedNames);

        List<TaskDefinition> tasks = new ArrayList<>();
        for (Map.Entry<String, TSNode> task : inventory.tasks().entrySet()) {
            if (isValidClassName(task.getKey(), warnings)) {
                tasks.add(taskFieldExtractor.extract(task.getValue(), tree, knownTasks, warnings));
            }
        }

        Map<String, WorkerDefinition> localWorkers = new LinkedHashMap<>();
        for (Map.Entry<String, TSNode> worker : inventory.workers().entrySet()) {
            if (isValidClassName(worker.getKey(), warnings)) {
                localWorkers.put(worker.getKey(),
                        workerDetailExtractor.extract(worker.getValue(), inventory.variantOf(worker.getKey()), tree));
            }
        }

        PipelineTopology topology = topologyExtractor.extract(tree, localWorkers, warnings);

        Map<String, WorkerDefinition> allWorkers = new LinkedHashMap<>(localWorkers);
        topology.factoryWorkers().forEach(worker -> allWorkers.put(worker.getClassName(), worker));
        llmBindingParser.bind(tree, topology, allWorkers);

        List<WorkerDefinition> workers = new ArrayList<>(allWorkers.values());
        List<ImportedTaskRef> importedTasks = topologyExtractor.importedTasks(tree, workers, inventory.tasks().keySet());

        Set<String> declaredTasks = new LinkedHashSet<>(inventory.tasks().keySet());
        importedTasks.forEach(ref -> declaredTasks.add(ref.getClassName()));

        return PipelineDefinition.builder()
                .tasks(tasks)
                .workers(workers)
                .edges(resolvedEdges(topology.edges(), allWorkers.keySet(), warnings))
                .entryEdges(resolvedEntryEdges(topology.entryEdges(), declaredTasks, allWorkers.keySet(), warnings))
                .importedTasks(importedTasks)
                .build();
    }

    private static boolean isValidClassName(String className, List<String> warnings) {
        try {
            IdentifierValidator.requireValid(className, "class", className);
            return true;
        } catch (InvalidIdentifierException e) {
            warnings.add(e.getMessage() + "; class skipped");
            return false;
        }
    }

    private static List<WorkerEdge> resolvedEdges(List<WorkerEdge> edges, Set<String> workers, List<String> warnings) {
        List<WorkerEdge> resolved = new ArrayList<>();
        for (WorkerEdge edge : edges) {
            if (workers.contains(edge.getSource()) && workers.contains(edge.getTarget())) {
                resolved.add(edge);
            } else {
                warnings.add("Edge " + edge.getSource() + " -> " + edge.getTarget()
                        + " references an undeclared worker; dropped");
            }
        }
        return resolved;
    }

    private static List<EntryEdge> resolvedEntryEdges(List<EntryEdge> entries, Set<String> tasks, Set<String> workers,
                                                      List<String> warnings) {
        List<EntryEdge> resolved = new ArrayList<>();
        for (EntryEdge entry : entries) {
            if (tasks.contains(entry.getSourceTask()) && workers.contains(entry.getTargetWorker())) {
                resolved.add(entry);
            } else {
                warnings.add("Entry edge " + entry.getSourceTask() + " -> " + entry.getTargetWorker()
                        + " references an undeclared task or worker; dropped");
            }
        }
        return resolved;
    }
}
