package ru.javaboys.cvchecker.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DeterministicScore {
    double skillMatchScore;
    double experienceAlignmentScore;
    List<SkillMatch> skillMatches;
    List<String> matchedSkills;
    List<String> missingSkills;
    String experienceGap; // null when experience is within range
}
