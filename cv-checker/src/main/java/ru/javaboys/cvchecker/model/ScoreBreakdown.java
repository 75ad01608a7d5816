package ru.javaboys.cvchecker.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ScoreBreakdown {
    double skillMatchScore;          // 0..100
    double experienceAlignmentScore; // 0..100
    double semanticMatchScore;       // 0..100
    double softSkillsScore;          // 0..100
    double overallScore;             // 0..100
    LetterGradeEnum letterGrade;
}
