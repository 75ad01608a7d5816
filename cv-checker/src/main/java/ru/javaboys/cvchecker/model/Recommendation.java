package ru.javaboys.cvchecker.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Recommendation {
    RecommendationCategoryEnum category;
    RecommendationPriorityEnum priority;
    String title;
    String rationale;
    String example; // optional
}
