package ru.javaboys.cvchecker.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.javaboys.cvchecker.ai.LlmException;
import ru.javaboys.cvchecker.ai.LlmJsonReader;
import ru.javaboys.cvchecker.ai.LlmResponseFormatException;
import ru.javaboys.cvchecker.ai.LlmService;
import ru.javaboys.cvchecker.ai.dto.SemanticInfo;
import ru.javaboys.cvchecker.config.CvCheckerProperties;
import ru.javaboys.cvchecker.exception.ScoringException;
import ru.javaboys.cvchecker.model.CandidateProfile;
import ru.javaboys.cvchecker.model.DeterministicScore;
import ru.javaboys.cvchecker.model.JobRequirements;
import ru.javaboys.cvchecker.model.SemanticAssessment;

import static ru.javaboys.cvchecker.service.impl.TextUtils.clamp;
import static ru.javaboys.cvchecker.service.impl.TextUtils.cleanList;
import static ru.javaboys.cvchecker.service.impl.TextUtils.joinOrNone;
import static ru.javaboys.cvchecker.service.impl.TextUtils.nullIfBlank;
import static ru.javaboys.cvchecker.service.impl.TextUtils.round2;
import static ru.javaboys.cvchecker.service.impl.TextUtils.safeTrim;

/**
 * LLM judgment of what keyword matching cannot see: transferable skills and soft skills.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SemanticValidator {

    static final String SYSTEM_PROMPT = """
            You are an expert technical recruiter with a deep understanding of skill transferability and cultural fit.
            Analyze the candidate's CV against the job requirements considering:
            1. Semantic skill matching that keyword matching misses: synonyms, related technologies,
               transferable skills (e.g. Java -> C#, AWS -> Azure), depth of experience shown by projects.
            2. Soft skills and cultural fit: leadership and collaboration, communication quality of the CV,
               problem solving shown by achievements, growth mindset.
            Return EXACTLY ONE JSON object (no extra text):
            {
              "semanticMatchScore": 0..100,
              "softSkillsScore": 0..100,
              "reasoning": "brief explanation",
              "transferableSkills": ["string", ...],
              "culturalFitNotes": "observations",
              "strengths": ["string", ...],
              "gaps": ["string", ...]
            }
            Be objective but considerate.
            """;

    private final LlmService llmService;
    private final LlmJsonReader jsonReader;
    private final CvCheckerProperties properties;

    public SemanticAssessment validate(String jobText, String cvText,
                                       JobRequirements job, CandidateProfile profile,
                                       DeterministicScore baseline) {
        log.info("Starting semantic validation");
        int max = properties.getAnalysis().getMaxInputChars();

        String user = """
                DETERMINISTIC BASELINE:
                - Skill match: %s%%
                - Matched skills: %s
                - Missing skills: %s
                - Experience alignment: %s%%

                JOB REQUIREMENTS (extracted):
                - Title: %s (%s)
                - Required skills: %s
                - Preferred skills: %s
                - Minimum experience: %s years

                CANDIDATE PROFILE (extracted):
                - Name: %s
                - Skills: %s
                - Total experience: %s years

                JOB DESCRIPTION:
                ----------------
                %s

                CANDIDATE CV:
                ----------------
                %s

                Analyze and return JSON only.
                """.formatted(
                baseline.getSkillMatchScore(),
                joinOrNone(baseline.getMatchedSkills()),
                joinOrNone(baseline.getMissingSkills()),
                baseline.getExperienceAlignmentScore(),
                job.getTitle(), job.getSeniorityLevel().getId(),
                joinOrNone(job.getRequiredSkills()),
                joinOrNone(job.getPreferredSkills()),
                job.getMinYearsExperience(),
                profile.getName(),
                joinOrNone(profile.getSkills()),
                profile.getTotalYearsExperience(),
                safeTrim(jobText, max),
                safeTrim(cvText, max));

        SemanticInfo dto;
        try {
            dto = jsonReader.read(llmService.complete(SYSTEM_PROMPT, user), SemanticInfo.class);
        } catch (LlmException e) {
            throw new ScoringException("Semantic validation call failed: " + e.getMessage(), e);
        } catch (LlmResponseFormatException e) {
            throw new ScoringException("Invalid JSON from semantic validator: " + e.getMessage(), e);
        }

        if (!isScore(dto.getSemanticMatchScore()) || !isScore(dto.getSoftSkillsScore())) {
            throw new ScoringException("Semantic validator response has no usable semanticMatchScore/softSkillsScore");
        }

        SemanticAssessment assessment = SemanticAssessment.builder()
                .semanticMatchScore(round2(clamp(dto.getSemanticMatchScore())))
                .softSkillsScore(round2(clamp(dto.getSoftSkillsScore())))
                .reasoning(nullIfBlank(dto.getReasoning(), ""))
                .transferableSkills(cleanList(dto.getTransferableSkills()))
                .culturalFitNotes(nullIfBlank(dto.getCulturalFitNotes(), ""))
                .strengths(cleanList(dto.getStrengths()))
                .gaps(cleanList(dto.getGaps()))
                .build();

        log.info("Semantic validation complete - semantic: {}%, soft skills: {}%",
                assessment.getSemanticMatchScore(), assessment.getSoftSkillsScore());
        return assessment;
    }

    private static boolean isScore(Double v) {
        return v != null && !v.isNaN() && !v.isInfinite();
    }
}
