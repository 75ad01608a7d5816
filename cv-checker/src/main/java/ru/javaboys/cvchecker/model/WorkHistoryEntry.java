package ru.javaboys.cvchecker.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkHistoryEntry {
    String company;
    String title;
    String startDate; // "yyyy-MM" | "yyyy" | ""
    String endDate;   // "yyyy-MM" | "yyyy" | "Present" | ""
    double durationYears;
    List<String> responsibilities;
}
