package ru.javaboys.cvchecker.ai.dto;

import lombok.Data;

import java.util.List;

@Data
public class ReportInfo {
    private String executiveSummary;
    private List<RecommendationItem> recommendations;
    private List<String> quickWins;

    @Data
    public static class RecommendationItem {
        private String priority; // HIGH|MEDIUM|LOW
        private String category; // ADD_SKILL|MODIFY_CONTENT|EMPHASIZE_EXPERIENCE|REMOVE_CONTENT|RESTRUCTURE
        private String title;
        private String rationale;
        private String example;
    }
}
