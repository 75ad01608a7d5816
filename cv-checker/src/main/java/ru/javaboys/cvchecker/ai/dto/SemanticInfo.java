package ru.javaboys.cvchecker.ai.dto;

import lombok.Data;

import java.util.List;

@Data
public class SemanticInfo {
    private Double semanticMatchScore;   // 0..100
    private Double softSkillsScore;      // 0..100
    private String reasoning;
    private List<String> transferableSkills;
    private String culturalFitNotes;
    private List<String> strengths;
    private List<String> gaps;
}
