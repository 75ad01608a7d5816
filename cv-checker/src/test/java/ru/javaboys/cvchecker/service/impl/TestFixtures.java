package ru.javaboys.cvchecker.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import ru.javaboys.cvchecker.ai.LlmJsonReader;
import ru.javaboys.cvchecker.ai.LlmService;
import ru.javaboys.cvchecker.config.CvCheckerProperties;
import ru.javaboys.cvchecker.model.CandidateProfile;
import ru.javaboys.cvchecker.model.JobRequirements;
import ru.javaboys.cvchecker.model.SeniorityLevelEnum;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

final class TestFixtures {

    static final Clock CLOCK = Clock.fixed(
            LocalDate.of(2025, 6, 1).atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

    static final String JOB_TEXT = """
            Senior Python Developer at Contoso (Remote)
            Requirements: 5+ years of experience, Python, FastAPI, Azure.
            Nice to have: Docker, Terraform.
            """;

    static final String CV_TEXT = """
            # Jane Doe
            ## Experience
            - Backend Engineer, Fabrikam (2019-06 - Present): Python, FastAPI, Azure, Docker
            """;

    static final String JOB_JSON = """
            {
              "title": "Senior Python Developer",
              "company": "Contoso",
              "location": "Remote",
              "requiredSkills": ["Python", "FastAPI", "Azure"],
              "preferredSkills": ["Docker", "Terraform"],
              "minYearsExperience": 5,
              "educationRequirements": ["Bachelor's in Computer Science"],
              "responsibilities": ["Build APIs"],
              "seniorityLevel": "senior"
            }
            """;

    static final String CV_JSON = """
            {
              "name": "Jane Doe",
              "email": "jane@example.com",
              "skills": ["python", "FastAPI", "Microsoft Azure", "docker"],
              "totalYearsExperience": 6,
              "workHistory": [
                {"company": "Fabrikam", "title": "Backend Engineer", "startDate": "2019-06", "endDate": "Present",
                 "durationYears": 6, "responsibilities": ["Built APIs"]}
              ],
              "education": [{"degree": "BSc Computer Science", "institution": "MIT", "graduationYear": "2019"}],
              "certifications": ["AZ-204"],
              "projects": ["Open-source FastAPI plugin"]
            }
            """;

    static final String SEMANTIC_JSON = """
            {
              "semanticMatchScore": 85,
              "softSkillsScore": 80,
              "reasoning": "Strong backend profile.",
              "transferableSkills": ["AWS -> Azure"],
              "culturalFitNotes": "Collaborative.",
              "strengths": ["Clear API ownership"],
              "gaps": ["No Terraform"]
            }
            """;

    static final String REPORT_JSON = """
            {
              "executiveSummary": "Jane is a strong match.",
              "recommendations": [
                {"priority": "LOW", "category": "RESTRUCTURE", "title": "Add a summary", "rationale": "Framing"},
                {"priority": "HIGH", "category": "ADD_SKILL", "title": "Mention Terraform", "rationale": "Preferred skill"},
                {"priority": "MEDIUM", "category": "EMPHASIZE_EXPERIENCE", "title": "Highlight Azure work", "rationale": "Core skill"},
                {"priority": "HIGH", "category": "MODIFY_CONTENT", "title": "Quantify API impact", "rationale": "Evidence", "example": "Cut latency by 30%"},
                {"priority": "MEDIUM", "category": "REMOVE_CONTENT", "title": "Drop hobby section", "rationale": "Noise"}
              ],
              "quickWins": ["Add GitHub link"]
            }
            """;

    private TestFixtures() {
    }

    static CvCheckerProperties properties() {
        return new CvCheckerProperties();
    }

    static LlmJsonReader jsonReader() {
        return new LlmJsonReader(new ObjectMapper());
    }

    static JobRequirementExtractor jobExtractor(LlmService llm) {
        return new JobRequirementExtractor(llm, jsonReader(), new SkillNormalizer(), properties());
    }

    static CandidateProfileExtractor cvExtractor(LlmService llm) {
        return new CandidateProfileExtractor(llm, jsonReader(), new SkillNormalizer(), properties(), CLOCK);
    }

    static HybridScorer hybridScorer(LlmService llm) {
        return new HybridScorer(new DeterministicScorer(new SkillNormalizer()),
                new SemanticValidator(llm, jsonReader(), properties()));
    }

    static RecommendationGenerator recommendationGenerator(LlmService llm) {
        return new RecommendationGenerator(llm, jsonReader());
    }

    static JobRequirements job(List<String> required, double minYears) {
        return JobRequirements.builder()
                .title("Backend Developer")
                .requiredSkills(required)
                .preferredSkills(List.of())
                .minYearsExperience(minYears)
                .educationRequirements(List.of())
                .responsibilities(List.of())
                .seniorityLevel(SeniorityLevelEnum.MID)
                .build();
    }

    static CandidateProfile profile(List<String> skills, double years) {
        return CandidateProfile.builder()
                .name("Jane Doe")
                .skills(skills)
                .totalYearsExperience(years)
                .workHistory(List.of())
                .education(List.of())
                .certifications(List.of())
                .projects(List.of())
                .build();
    }
}
