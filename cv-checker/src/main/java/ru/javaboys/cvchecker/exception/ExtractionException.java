package ru.javaboys.cvchecker.exception;

import ru.javaboys.cvchecker.model.AnalysisStageEnum;

public class ExtractionException extends AnalysisException {

    public ExtractionException(AnalysisStageEnum stage, String message) {
        this(stage, message, null);
    }

    public ExtractionException(AnalysisStageEnum stage, String message, Throwable cause) {
        super(stage, stage.getUserMessage(), message, cause);
    }
}
