package ru.javaboys.cvchecker.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.javaboys.cvchecker.model.CandidateProfile;
import ru.javaboys.cvchecker.model.DeterministicScore;
import ru.javaboys.cvchecker.model.HybridScore;
import ru.javaboys.cvchecker.model.JobRequirements;
import ru.javaboys.cvchecker.model.LetterGradeEnum;
import ru.javaboys.cvchecker.model.ScoreBreakdown;
import ru.javaboys.cvchecker.model.SemanticAssessment;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static ru.javaboys.cvchecker.service.impl.TextUtils.clamp;
import static ru.javaboys.cvchecker.service.impl.TextUtils.notBlank;
import static ru.javaboys.cvchecker.service.impl.TextUtils.round2;

/**
 * Combines the deterministic comparison with the semantic judgment.
 * Weights are whole percents: skills 40, experience 20, semantic 25, soft skills 15.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridScorer {

    public static final int WEIGHT_SKILL = 40;
    public static final int WEIGHT_EXPERIENCE = 20;
    public static final int WEIGHT_SEMANTIC = 25;
    public static final int WEIGHT_SOFT_SKILLS = 15;

    private static final int MAX_LISTED_SKILLS = 5;
    private static final int MAX_NOTE_CHARS = 200;

    private final DeterministicScorer deterministicScorer;
    private final SemanticValidator semanticValidator;

    public HybridScore analyze(String jobText, String cvText, JobRequirements job, CandidateProfile profile) {
        log.info("Starting hybrid scoring analysis");

        // 1) deterministic part, no I/O
        DeterministicScore det = deterministicScorer.score(job, profile);

        // 2) one LLM call
        SemanticAssessment sem = semanticValidator.validate(jobText, cvText, job, profile, det);

        // 3) weighted combination
        ScoreBreakdown breakdown = combine(
                det.getSkillMatchScore(), det.getExperienceAlignmentScore(),
                sem.getSemanticMatchScore(), sem.getSoftSkillsScore());

        log.info("Hybrid scoring complete - overall: {} ({})",
                breakdown.getOverallScore(), breakdown.getLetterGrade().getLabel());

        return HybridScore.builder()
                .breakdown(breakdown)
                .deterministic(det)
                .semantic(sem)
                .strengths(compileStrengths(det, sem))
                .gaps(compileGaps(det, sem))
                .build();
    }

    public ScoreBreakdown combine(double skill, double experience, double semantic, double softSkills) {
        double s = clamp(skill);
        double e = clamp(experience);
        double m = clamp(semantic);
        double k = clamp(softSkills);
        double overall = round2((WEIGHT_SKILL * s + WEIGHT_EXPERIENCE * e
                + WEIGHT_SEMANTIC * m + WEIGHT_SOFT_SKILLS * k) / 100.0);

        return ScoreBreakdown.builder()
                .skillMatchScore(s)
                .experienceAlignmentScore(e)
                .semanticMatchScore(m)
                .softSkillsScore(k)
                .overallScore(overall)
                // grade of the rounded, reported score
                .letterGrade(LetterGradeEnum.fromScore(overall))
                .build();
    }

    List<String> compileStrengths(DeterministicScore det, SemanticAssessment sem) {
        Set<String> strengths = new LinkedHashSet<>();
        if (!det.getMatchedSkills().isEmpty()) {
            strengths.add(String.format(Locale.US, "Strong match on %d required skills: %s",
                    det.getMatchedSkills().size(), firstN(det.getMatchedSkills())));
        }
        if (det.getExperienceAlignmentScore() >= 90) {
            strengths.add("Excellent experience level alignment");
        }
        if (!sem.getTransferableSkills().isEmpty()) {
            strengths.add("Transferable skills identified: " + String.join(", ",
                    sem.getTransferableSkills().subList(0, Math.min(3, sem.getTransferableSkills().size()))));
        }
        strengths.addAll(sem.getStrengths());
        if (strengths.size() < 3 && notBlank(sem.getReasoning())) {
            strengths.add(cut(sem.getReasoning()));
        }
        return List.copyOf(strengths);
    }

    List<String> compileGaps(DeterministicScore det, SemanticAssessment sem) {
        Set<String> gaps = new LinkedHashSet<>();
        if (!det.getMissingSkills().isEmpty()) {
            gaps.add(String.format(Locale.US, "Missing %d required skills: %s",
                    det.getMissingSkills().size(), firstN(det.getMissingSkills())));
        }
        if (det.getExperienceGap() != null) {
            gaps.add(det.getExperienceGap());
        }
        if (notBlank(sem.getCulturalFitNotes())
                && sem.getCulturalFitNotes().toLowerCase(Locale.ROOT).contains("concern")) {
            gaps.add(cut(sem.getCulturalFitNotes()));
        }
        gaps.addAll(sem.getGaps());
        return List.copyOf(gaps);
    }

    private static String firstN(List<String> items) {
        List<String> head = new ArrayList<>(items.subList(0, Math.min(MAX_LISTED_SKILLS, items.size())));
        return String.join(", ", head);
    }

    private static String cut(String s) {
        String t = s.trim();
        return t.length() <= MAX_NOTE_CHARS ? t : t.substring(0, MAX_NOTE_CHARS);
    }
}
