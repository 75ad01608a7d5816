package ru.javaboys.cvchecker.service.impl;

import lombok.extern.slf4j.Slf4j;
import ru.javaboys.cvchecker.model.AnalysisStageEnum;
import ru.javaboys.cvchecker.model.PipelineStateEnum;

import java.util.UUID;

/**
 * State of one analysis request. Stages may only be entered in order, each one after
 * its predecessor has finished.
 */
@Slf4j
class PipelineRun {

    private final String runId = UUID.randomUUID().toString().substring(0, 8);
    private PipelineStateEnum state = PipelineStateEnum.IDLE;
    private PipelineStateEnum failedIn;

    String getRunId() {
        return runId;
    }

    PipelineStateEnum getState() {
        return state;
    }

    /**
     * State the run was in when it failed, {@code null} otherwise.
     */
    PipelineStateEnum getFailedIn() {
        return failedIn;
    }

    void enter(AnalysisStageEnum stage) {
        int expectedStep = state == PipelineStateEnum.IDLE ? 1
                : state.getStage() == null ? -1 : state.getStage().getStep() + 1;
        if (state.isTerminal() || stage.getStep() != expectedStep) {
            throw new IllegalStateException("Run " + runId + ": cannot enter " + stage + " from " + state);
        }
        state = PipelineStateEnum.of(stage);
        log.debug("Run {}: {}", runId, state);
    }

    void complete() {
        if (state != PipelineStateEnum.GENERATING_REPORT) {
            throw new IllegalStateException("Run " + runId + ": cannot complete from " + state);
        }
        state = PipelineStateEnum.COMPLETE;
    }

    void fail() {
        if (state.isTerminal()) {
            throw new IllegalStateException("Run " + runId + ": already " + state);
        }
        failedIn = state;
        state = PipelineStateEnum.FAILED;
    }
}
