package ru.javaboys.cvchecker.exception;

import org.springframework.lang.Nullable;
import ru.javaboys.cvchecker.model.AnalysisStageEnum;

/**
 * Base of every error the analysis pipeline reports to its callers.
 * Carries the failed stage and a message that can be shown to an end user as is.
 */
public abstract class AnalysisException extends RuntimeException {

    @Nullable
    private final AnalysisStageEnum stage;
    private final String userMessage;

    protected AnalysisException(@Nullable AnalysisStageEnum stage, String userMessage, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.userMessage = userMessage;
    }

    /**
     * @return failed stage, or {@code null} when the request was rejected before the pipeline started
     */
    @Nullable
    public AnalysisStageEnum getStage() {
        return stage;
    }

    public String getStageId() {
        return stage == null ? "validation" : stage.getId();
    }

    public String getUserMessage() {
        return userMessage;
    }
}
