package ru.javaboys.cvchecker.ai.dto;

import lombok.Data;

import java.util.List;

@Data
public class ResumeInfo {
    private String name;
    private String email;
    private String phone;
    private String location;
    private List<String> skills;
    private Double totalYearsExperience; // model's own estimate
    private List<ExperienceItem> workHistory;
    private List<EducationItem> education;
    private List<String> certifications;
    private List<String> projects;

    @Data
    public static class ExperienceItem {
        private String company;
        private String title;
        private String startDate; // "yyyy-MM" | "yyyy"
        private String endDate;   // "yyyy-MM" | "yyyy" | "Present" | ""
        private Double durationYears;
        private List<String> responsibilities;
    }

    @Data
    public static class EducationItem {
        private String degree;
        private String institution;
        private String graduationYear;
    }
}
