package ru.javaboys.cvchecker.exception;

import ru.javaboys.cvchecker.model.AnalysisStageEnum;

public class ReportGenerationException extends AnalysisException {

    public ReportGenerationException(String message, Throwable cause) {
        super(AnalysisStageEnum.REPORT_GENERATION, AnalysisStageEnum.REPORT_GENERATION.getUserMessage(), message, cause);
    }
}
