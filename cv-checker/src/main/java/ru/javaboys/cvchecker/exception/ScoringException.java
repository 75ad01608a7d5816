package ru.javaboys.cvchecker.exception;

import ru.javaboys.cvchecker.model.AnalysisStageEnum;

public class ScoringException extends AnalysisException {

    public ScoringException(String message) {
        this(message, null);
    }

    public ScoringException(String message, Throwable cause) {
        super(AnalysisStageEnum.ANALYZING, AnalysisStageEnum.ANALYZING.getUserMessage(), message, cause);
    }
}
