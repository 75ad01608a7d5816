package ru.javaboys.cvchecker.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SkillMatch {
    String skillName;
    boolean required;
    boolean candidateHas;
    String proficiencyLevel; // optional
    Double yearsExperience;  // optional
    double matchScore;       // 0.0 or 1.0
}
