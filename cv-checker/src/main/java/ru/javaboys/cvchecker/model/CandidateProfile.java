package ru.javaboys.cvchecker.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Structured profile extracted from a résumé. Skill names are normalized the same way as
 * {@link JobRequirements} skills so that matching can compare them directly.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CandidateProfile {
    String name;
    String email;    // optional
    String phone;    // optional
    String location; // optional
    List<String> skills;
    /**
     * Sum of {@link WorkHistoryEntry#getDurationYears()}; overlapping ranges are counted twice.
     */
    double totalYearsExperience;
    List<WorkHistoryEntry> workHistory;
    List<String> education;
    List<String> certifications;
    List<String> projects;
}
