package ru.javaboys.cvchecker.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import ru.javaboys.cvchecker.exception.AnalysisException;
import ru.javaboys.cvchecker.exception.ExtractionException;
import ru.javaboys.cvchecker.exception.ReportGenerationException;
import ru.javaboys.cvchecker.exception.ScoringException;
import ru.javaboys.cvchecker.exception.ValidationException;
import ru.javaboys.cvchecker.model.AnalysisResult;
import ru.javaboys.cvchecker.model.AnalysisResultItem;
import ru.javaboys.cvchecker.model.AnalysisStageEnum;
import ru.javaboys.cvchecker.model.AnalysisStreamItem;
import ru.javaboys.cvchecker.model.CandidateProfile;
import ru.javaboys.cvchecker.model.DeterministicScore;
import ru.javaboys.cvchecker.model.ExperienceMatch;
import ru.javaboys.cvchecker.model.HybridScore;
import ru.javaboys.cvchecker.model.JobRequirements;
import ru.javaboys.cvchecker.model.MatchReport;
import ru.javaboys.cvchecker.model.ProgressEvent;
import ru.javaboys.cvchecker.service.AnalysisService;

import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs job parsing, CV parsing, hybrid scoring and report generation strictly in that order.
 * Nothing is retried and no partial result is returned: the first failure ends the request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisOrchestrator implements AnalysisService {

    static final double EXPERIENCE_MATCH_THRESHOLD = 70.0;

    private final JobRequirementExtractor jobRequirementExtractor;
    private final CandidateProfileExtractor candidateProfileExtractor;
    private final HybridScorer hybridScorer;
    private final RecommendationGenerator recommendationGenerator;
    private final Scheduler analysisScheduler;

    @Override
    public AnalysisResult analyze(String cvText, String jobText) {
        validate(cvText, jobText);
        return run(cvText, jobText, event -> { }, () -> false);
    }

    @Override
    public Flux<AnalysisStreamItem> analyzeStream(String cvText, String jobText) {
        validate(cvText, jobText);
        return Flux.<AnalysisStreamItem>create(sink -> {
            try {
                AnalysisResult result = run(cvText, jobText, sink::next, sink::isCancelled);
                sink.next(new AnalysisResultItem(result));
                sink.complete();
            } catch (PipelineCancelledException e) {
                log.info("Run {}: subscriber cancelled, stopped before {}", e.runId, e.nextStage);
            } catch (AnalysisException e) {
                sink.next(ProgressEvent.failed(e.getStage(), e.getUserMessage(), e.getMessage()));
                sink.complete();
            } catch (RuntimeException e) {
                sink.error(e);
            }
        }).subscribeOn(analysisScheduler);
    }

    private AnalysisResult run(String cvText, String jobText,
                               Consumer<ProgressEvent> progress, BooleanSupplier cancelled) {
        PipelineRun run = new PipelineRun();
        log.info("Run {}: starting CV analysis workflow", run.getRunId());
        try {
            JobRequirements job = stage(run, AnalysisStageEnum.JOB_PARSING, progress, cancelled,
                    () -> jobRequirementExtractor.extract(jobText));

            CandidateProfile profile = stage(run, AnalysisStageEnum.CV_PARSING, progress, cancelled,
                    () -> candidateProfileExtractor.extract(cvText));

            HybridScore score = stage(run, AnalysisStageEnum.ANALYZING, progress, cancelled,
                    () -> hybridScorer.analyze(jobText, cvText, job, profile));

            MatchReport report = stage(run, AnalysisStageEnum.REPORT_GENERATION, progress, cancelled,
                    () -> recommendationGenerator.generate(score, job, profile));

            run.complete();
            AnalysisResult result = buildResult(job, profile, score, report);
            log.info("Run {}: workflow complete - final score {}/100 ({})",
                    run.getRunId(), result.getOverallScore(), result.getLetterGrade().getLabel());
            return result;
        } catch (AnalysisException e) {
            run.fail();
            log.error("Run {}: workflow failed at stage {}: {}", run.getRunId(), e.getStageId(), e.getMessage(), e);
            throw e;
        }
    }

    private <T> T stage(PipelineRun run, AnalysisStageEnum stage, Consumer<ProgressEvent> progress,
                        BooleanSupplier cancelled, Supplier<T> work) {
        checkCancelled(run, stage, cancelled);
        run.enter(stage);
        log.info("Run {}: step {}/{} - {}", run.getRunId(), stage.getStep(), AnalysisStageEnum.TOTAL_STEPS, stage.getStartMessage());
        progress.accept(ProgressEvent.started(stage));
        checkCancelled(run, stage, cancelled);

        T out;
        try {
            out = work.get();
        } catch (AnalysisException e) {
            throw e;
        } catch (RuntimeException e) {
            throw wrap(stage, e);
        }

        progress.accept(ProgressEvent.completed(stage));
        return out;
    }

    private static void checkCancelled(PipelineRun run, AnalysisStageEnum next, BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) {
            throw new PipelineCancelledException(run.getRunId(), next);
        }
    }

    private static AnalysisException wrap(AnalysisStageEnum stage, RuntimeException e) {
        String message = "Unexpected failure in " + stage.getId() + ": " + e.getMessage();
        switch (stage) {
            case JOB_PARSING:
            case CV_PARSING:
                return new ExtractionException(stage, message, e);
            case ANALYZING:
                return new ScoringException(message, e);
            default:
                return new ReportGenerationException(message, e);
        }
    }

    static void validate(String cvText, String jobText) {
        if (jobText == null || jobText.isBlank()) {
            throw new ValidationException("Job description must not be empty");
        }
        if (cvText == null || cvText.isBlank()) {
            throw new ValidationException("CV text must not be empty");
        }
    }

    private static AnalysisResult buildResult(JobRequirements job, CandidateProfile profile,
                                              HybridScore score, MatchReport report) {
        DeterministicScore det = score.getDeterministic();
        ExperienceMatch experience = ExperienceMatch.builder()
                .requiredYears(job.getMinYearsExperience())
                .candidateYears(profile.getTotalYearsExperience())
                .alignmentScore(det.getExperienceAlignmentScore())
                .match(det.getExperienceAlignmentScore() >= EXPERIENCE_MATCH_THRESHOLD)
                .build();

        return AnalysisResult.builder()
                .overallScore(score.getBreakdown().getOverallScore())
                .letterGrade(score.getBreakdown().getLetterGrade())
                .scoreBreakdown(score.getBreakdown())
                .skillMatches(det.getSkillMatches())
                .strengths(report.getStrengths())
                .gaps(report.getGaps())
                .recommendations(report.getRecommendations())
                .summary(report.getSummary())
                .jobTitle(job.getTitle())
                .seniorityLevel(job.getSeniorityLevel())
                .candidateName(profile.getName())
                .experienceMatch(experience)
                .transferableSkills(score.getSemantic().getTransferableSkills())
                .semanticReasoning(score.getSemantic().getReasoning())
                .build();
    }

    private static final class PipelineCancelledException extends RuntimeException {
        private final String runId;
        private final AnalysisStageEnum nextStage;

        PipelineCancelledException(String runId, AnalysisStageEnum nextStage) {
            super("Analysis " + runId + " cancelled before " + nextStage.getId(), null, false, false);
            this.runId = runId;
            this.nextStage = nextStage;
        }
    }
}
