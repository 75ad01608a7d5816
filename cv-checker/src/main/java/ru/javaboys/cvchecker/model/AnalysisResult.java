package ru.javaboys.cvchecker.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Final outcome of one analysis. Carries no storage identifier; persisting it is up to the caller.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisResult {
    double overallScore;
    LetterGradeEnum letterGrade;
    ScoreBreakdown scoreBreakdown;
    List<SkillMatch> skillMatches;
    List<String> strengths;
    List<String> gaps;
    List<Recommendation> recommendations;
    String summary;

    String jobTitle;
    SeniorityLevelEnum seniorityLevel;
    String candidateName;
    ExperienceMatch experienceMatch;
    List<String> transferableSkills;
    String semanticReasoning;
}
