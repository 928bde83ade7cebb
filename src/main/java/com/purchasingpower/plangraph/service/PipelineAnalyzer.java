package com.purchasingpower.plangraph.service;

import com.purchasingpower.plangraph.model.result.AnalysisResult;

import java.nio.file.Path;

/**
 * Reads pipeline source text and recovers its tasks, workers and wiring.
 *
 * <p>Never throws for bad input: syntax errors, unreadable files and unexpected failures are
 * reported through {@link AnalysisResult#getError()} together with an empty definition.
 */
public interface PipelineAnalyzer {

    /**
     * Analyzes one module given as text.
     *
     * @param source     Python source of the module
     * @param sourceName name used in error messages (usually the file name)
     * @return the recovered definition plus one warning per skipped unit
     */
    AnalysisResult analyzeSource(String source, String sourceName);

    /**
     * Reads a module from disk (UTF-8) and analyzes it.
     *
     * @param file path of the {@code .py} file
     */
    AnalysisResult analyzeFile(Path file);
}
