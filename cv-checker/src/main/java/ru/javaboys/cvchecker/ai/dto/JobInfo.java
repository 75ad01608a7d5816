package ru.javaboys.cvchecker.ai.dto;

import lombok.Data;

import java.util.List;

@Data
public class JobInfo {
    private String title;
    private String company;
    private String location;
    private List<String> requiredSkills;  // null means the model skipped the field
    private List<String> preferredSkills;
    private Double minYearsExperience;
    private List<String> educationRequirements;
    private List<String> responsibilities;
    private String seniorityLevel; // entry|mid|senior|lead|principal
}
