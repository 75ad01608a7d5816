package ru.javaboys.cvchecker.model;

import org.springframework.lang.Nullable;

public enum PipelineStateEnum {

    IDLE(null),
    PARSING_JOB(AnalysisStageEnum.JOB_PARSING),
    PARSING_CV(AnalysisStageEnum.CV_PARSING),
    ANALYZING(AnalysisStageEnum.ANALYZING),
    GENERATING_REPORT(AnalysisStageEnum.REPORT_GENERATION),
    COMPLETE(null),
    FAILED(null);

    @Nullable
    private final AnalysisStageEnum stage;

    PipelineStateEnum(@Nullable AnalysisStageEnum stage) {
        this.stage = stage;
    }

    @Nullable
    public AnalysisStageEnum getStage() {
        return stage;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    public static PipelineStateEnum of(AnalysisStageEnum stage) {
        for (PipelineStateEnum state : values()) {
            if (state.stage == stage) {
                return state;
            }
        }
        throw new IllegalArgumentException("No state for stage " + stage);
    }
}
