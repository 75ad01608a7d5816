package ru.javaboys.cvchecker.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Structured requirements extracted from a job description. Skill names are normalized.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobRequirements {
    String title;
    String company;   // optional
    String location;  // optional
    List<String> requiredSkills;
    List<String> preferredSkills;
    double minYearsExperience;
    List<String> educationRequirements;
    List<String> responsibilities;
    SeniorityLevelEnum seniorityLevel;
}
