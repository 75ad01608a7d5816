package ru.javaboys.cvchecker.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.javaboys.cvchecker.ai.LlmException;
import ru.javaboys.cvchecker.ai.LlmJsonReader;
import ru.javaboys.cvchecker.ai.LlmResponseFormatException;
import ru.javaboys.cvchecker.ai.LlmService;
import ru.javaboys.cvchecker.ai.dto.JobInfo;
import ru.javaboys.cvchecker.config.CvCheckerProperties;
import ru.javaboys.cvchecker.exception.ExtractionException;
import ru.javaboys.cvchecker.model.AnalysisStageEnum;
import ru.javaboys.cvchecker.model.JobRequirements;
import ru.javaboys.cvchecker.model.SeniorityLevelEnum;

import java.util.Locale;

import static ru.javaboys.cvchecker.service.impl.TextUtils.cleanList;
import static ru.javaboys.cvchecker.service.impl.TextUtils.nullIfBlank;
import static ru.javaboys.cvchecker.service.impl.TextUtils.safeTrim;

@Service
@RequiredArgsConstructor
@Slf4j
public class JobRequirementExtractor {

    static final String SYSTEM_PROMPT = """
            You are an expert job description parser. Extract structured information from the job posting.
            Return EXACTLY ONE JSON object (no extra text) with this schema:
            {
              "title": "string",
              "company": "string" | null,
              "location": "string" | null,
              "requiredSkills": ["string", ...],
              "preferredSkills": ["string", ...],
              "minYearsExperience": number | null,
              "educationRequirements": ["string", ...],
              "responsibilities": ["string", ...],
              "seniorityLevel": "entry" | "mid" | "senior" | "lead" | "principal"
            }
            Rules:
            - requiredSkills: required technical and soft skills; preferredSkills: nice-to-have ones.
            - Normalize skill names (e.g. "React.js" -> "React", "K8s" -> "Kubernetes").
            - minYearsExperience: the minimum number of years asked for, null if not stated.
            - If information is missing use null or [] as appropriate.
            """;

    private final LlmService llmService;
    private final LlmJsonReader jsonReader;
    private final SkillNormalizer skillNormalizer;
    private final CvCheckerProperties properties;

    public JobRequirements extract(String jobText) {
        if (jobText == null || jobText.isBlank()) {
            throw new IllegalArgumentException("jobText must not be empty");
        }
        log.info("Parsing job description (length: {})", jobText.length());

        String user = """
                Parse this job description:
                ----------------
                %s
                """.formatted(safeTrim(jobText, properties.getAnalysis().getMaxInputChars()));

        JobInfo dto;
        try {
            dto = jsonReader.read(llmService.complete(SYSTEM_PROMPT, user), JobInfo.class);
        } catch (LlmException e) {
            throw new ExtractionException(AnalysisStageEnum.JOB_PARSING, "Job description extraction failed: " + e.getMessage(), e);
        } catch (LlmResponseFormatException e) {
            throw new ExtractionException(AnalysisStageEnum.JOB_PARSING, "Invalid JSON from job parser: " + e.getMessage(), e);
        }

        if (dto.getRequiredSkills() == null) {
            throw new ExtractionException(AnalysisStageEnum.JOB_PARSING, "Job parser response has no requiredSkills");
        }

        JobRequirements job = JobRequirements.builder()
                .title(nullIfBlank(dto.getTitle(), "Untitled position"))
                .company(nullIfBlank(dto.getCompany(), null))
                .location(nullIfBlank(dto.getLocation(), null))
                .requiredSkills(skillNormalizer.normalizeAll(dto.getRequiredSkills()))
                .preferredSkills(skillNormalizer.normalizeAll(dto.getPreferredSkills()))
                .minYearsExperience(nonNegative(dto.getMinYearsExperience()))
                .educationRequirements(cleanList(dto.getEducationRequirements()))
                .responsibilities(cleanList(dto.getResponsibilities()))
                .seniorityLevel(parseSeniority(dto.getSeniorityLevel()))
                .build();

        log.info("Job parsing complete - Title: {}, required skills: {}, min years: {}",
                job.getTitle(), job.getRequiredSkills().size(), job.getMinYearsExperience());
        return job;
    }

    static SeniorityLevelEnum parseSeniority(String s) {
        if (s == null || s.isBlank()) return SeniorityLevelEnum.MID;
        String t = s.trim().toLowerCase(Locale.ROOT);
        SeniorityLevelEnum exact = SeniorityLevelEnum.fromId(t);
        if (exact != null) return exact;
        if (t.contains("principal") || t.contains("staff") || t.contains("architect")) return SeniorityLevelEnum.PRINCIPAL;
        if (t.contains("lead") || t.contains("head")) return SeniorityLevelEnum.LEAD;
        if (t.contains("senior") || t.contains("sr")) return SeniorityLevelEnum.SENIOR;
        if (t.contains("junior") || t.contains("entry") || t.contains("intern") || t.contains("graduate")) return SeniorityLevelEnum.ENTRY;
        return SeniorityLevelEnum.MID;
    }

    private static double nonNegative(Double v) {
        return v == null || v.isNaN() || v < 0 ? 0.0 : v;
    }
}
