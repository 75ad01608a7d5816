package ru.javaboys.cvchecker.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SemanticAssessment {
    double semanticMatchScore;
    double softSkillsScore;
    String reasoning;
    List<String> transferableSkills;
    String culturalFitNotes;
    List<String> strengths;
    List<String> gaps;
}
