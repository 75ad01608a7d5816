package ru.javaboys.cvchecker.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import ru.javaboys.cvchecker.model.CandidateProfile;
import ru.javaboys.cvchecker.model.DeterministicScore;
import ru.javaboys.cvchecker.model.JobRequirements;
import ru.javaboys.cvchecker.model.SkillMatch;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static ru.javaboys.cvchecker.service.impl.TextUtils.clamp;
import static ru.javaboys.cvchecker.service.impl.TextUtils.round2;

/**
 * Keyword and experience-years comparison of two extracted records. No I/O.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeterministicScorer {

    static final double OVERQUALIFICATION_FACTOR = 2.0;
    static final double OVERQUALIFICATION_FLOOR = 80.0;

    private final SkillNormalizer skillNormalizer;

    @Value
    public static class SkillMatchResult {
        double score; // 0..100
        List<SkillMatch> matches;
        List<String> matchedSkills;
        List<String> missingSkills;
    }

    public DeterministicScore score(JobRequirements job, CandidateProfile profile) {
        SkillMatchResult skills = skillMatch(job, profile);
        double experience = round2(experienceAlignment(job, profile));

        log.info("Deterministic score - skills: {}% ({} of {} required), experience: {}%",
                skills.getScore(), skills.getMatchedSkills().size(), job.getRequiredSkills().size(), experience);

        return DeterministicScore.builder()
                .skillMatchScore(skills.getScore())
                .experienceAlignmentScore(experience)
                .skillMatches(skills.getMatches())
                .matchedSkills(skills.getMatchedSkills())
                .missingSkills(skills.getMissingSkills())
                .experienceGap(experienceGap(job, profile))
                .build();
    }

    /**
     * Exact match on normalized names. Preferred skills are listed but do not count.
     */
    public SkillMatchResult skillMatch(JobRequirements job, CandidateProfile profile) {
        Set<String> got = new HashSet<>();
        for (String s : profile.getSkills()) {
            got.add(key(s));
        }

        List<SkillMatch> matches = new ArrayList<>();
        List<String> matched = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String skill : job.getRequiredSkills()) {
            boolean has = got.contains(key(skill));
            matches.add(toMatch(skill, true, has));
            if (has) matched.add(skill); else missing.add(skill);
        }
        Set<String> requiredKeys = new HashSet<>();
        for (String skill : job.getRequiredSkills()) requiredKeys.add(key(skill));
        for (String skill : job.getPreferredSkills()) {
            if (requiredKeys.contains(key(skill))) continue;
            matches.add(toMatch(skill, false, got.contains(key(skill))));
        }

        int totalRequired = job.getRequiredSkills().size();
        double score = totalRequired == 0 ? 100.0 : round2(100.0 * matched.size() / totalRequired);
        return new SkillMatchResult(score, List.copyOf(matches), List.copyOf(matched), List.copyOf(missing));
    }

    /**
     * 100 when the requirement is met; linear down to 0 when under-qualified;
     * proportional penalty (floor 80) beyond twice the requirement.
     */
    public double experienceAlignment(JobRequirements job, CandidateProfile profile) {
        double required = Math.max(0.0, job.getMinYearsExperience());
        double has = Math.max(0.0, profile.getTotalYearsExperience());

        if (required == 0.0) return 100.0;
        if (has >= required) {
            double limit = required * OVERQUALIFICATION_FACTOR;
            if (has <= limit) return 100.0;
            return Math.max(OVERQUALIFICATION_FLOOR, 100.0 * limit / has);
        }
        return clamp(100.0 * has / required);
    }

    @Nullable
    String experienceGap(JobRequirements job, CandidateProfile profile) {
        double required = Math.max(0.0, job.getMinYearsExperience());
        double has = Math.max(0.0, profile.getTotalYearsExperience());
        if (has < required) {
            return String.format(Locale.US, "Missing %.1f years of experience", required - has);
        }
        if (required > 0 && has > required * OVERQUALIFICATION_FACTOR) {
            return String.format(Locale.US, "Candidate has %.1f years beyond requirement", has - required);
        }
        return null;
    }

    private SkillMatch toMatch(String skill, boolean required, boolean has) {
        return SkillMatch.builder()
                .skillName(skill)
                .required(required)
                .candidateHas(has)
                .proficiencyLevel(has ? "present" : null)
                .matchScore(has ? 1.0 : 0.0)
                .build();
    }

    private String key(String skill) {
        return skillNormalizer.matchKey(skill);
    }
}
