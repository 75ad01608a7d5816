package ru.javaboys.cvchecker.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "step", "total_steps", "message", "status", "stage", "error"})
public class ProgressEvent implements AnalysisStreamItem {

    public static final String TYPE = "progress";

    int step;
    int totalSteps;
    String message;
    ProgressStatusEnum status;
    AnalysisStageEnum stage; // only on FAILED
    String error;            // only on FAILED

    @Override
    public String getType() {
        return TYPE;
    }

    public static ProgressEvent started(AnalysisStageEnum stage) {
        return ProgressEvent.builder()
                .step(stage.getStep())
                .totalSteps(AnalysisStageEnum.TOTAL_STEPS)
                .message(stage.getStartMessage())
                .status(ProgressStatusEnum.IN_PROGRESS)
                .build();
    }

    public static ProgressEvent completed(AnalysisStageEnum stage) {
        return ProgressEvent.builder()
                .step(stage.getStep())
                .totalSteps(AnalysisStageEnum.TOTAL_STEPS)
                .message(stage.getCompletedMessage())
                .status(ProgressStatusEnum.COMPLETED)
                .build();
    }

    public static ProgressEvent failed(AnalysisStageEnum stage, String message, String error) {
        return ProgressEvent.builder()
                .step(stage.getStep())
                .totalSteps(AnalysisStageEnum.TOTAL_STEPS)
                .message(message)
                .status(ProgressStatusEnum.FAILED)
                .stage(stage)
                .error(error)
                .build();
    }
}
