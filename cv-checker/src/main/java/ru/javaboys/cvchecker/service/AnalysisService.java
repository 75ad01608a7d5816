package ru.javaboys.cvchecker.service;

import reactor.core.publisher.Flux;
import ru.javaboys.cvchecker.model.AnalysisResult;
import ru.javaboys.cvchecker.model.AnalysisStreamItem;

/**
 * Résumé-to-job match analysis.
 */
public interface AnalysisService {

    /**
     * Runs all four stages and returns the result.
     *
     * @throws ru.javaboys.cvchecker.exception.ValidationException on empty input, before any LLM call
     * @throws ru.javaboys.cvchecker.exception.AnalysisException   the first stage failure
     */
    AnalysisResult analyze(String cvText, String jobText);

    /**
     * Same pipeline as {@link #analyze}, reported step by step: an in-progress and a completed
     * {@link ru.javaboys.cvchecker.model.ProgressEvent} per stage, then one
     * {@link ru.javaboys.cvchecker.model.AnalysisResultItem}. A stage failure emits a single
     * failed event and completes the flux. Cancelling the subscription stops the pipeline
     * before its next stage.
     *
     * @throws ru.javaboys.cvchecker.exception.ValidationException on empty input, at call time
     */
    Flux<AnalysisStreamItem> analyzeStream(String cvText, String jobText);
}
