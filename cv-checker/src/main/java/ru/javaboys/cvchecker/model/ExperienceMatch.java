package ru.javaboys.cvchecker.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExperienceMatch {
    double requiredYears;
    double candidateYears;
    double alignmentScore;
    boolean match;
}
