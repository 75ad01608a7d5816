package ru.javaboys.cvchecker.model;

/**
 * One element of a streamed analysis: a progress event or the final result.
 */
public interface AnalysisStreamItem {

    String getType();
}
