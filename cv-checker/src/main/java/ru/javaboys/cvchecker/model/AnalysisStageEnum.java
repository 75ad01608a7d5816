package ru.javaboys.cvchecker.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The four pipeline stages in execution order.
 */
public enum AnalysisStageEnum {

    JOB_PARSING(1, "job_parsing",
            "Parsing job description...",
            "Job description parsed",
            "We couldn't understand the job description. Please try rephrasing it."),
    CV_PARSING(2, "cv_parsing",
            "Parsing CV...",
            "CV parsed",
            "We couldn't read the structure of your CV. Please check its formatting and try again."),
    ANALYZING(3, "analyzing",
            "Analyzing compatibility...",
            "Compatibility analysis completed",
            "We couldn't complete the compatibility analysis. Please try again in a moment."),
    REPORT_GENERATION(4, "report_generation",
            "Generating recommendations...",
            "Recommendations generated",
            "We couldn't generate recommendations for this match. Please try again in a moment.");

    public static final int TOTAL_STEPS = 4;

    private final int step;
    private final String id;
    private final String startMessage;
    private final String completedMessage;
    private final String userMessage;

    AnalysisStageEnum(int step, String id, String startMessage, String completedMessage, String userMessage) {
        this.step = step;
        this.id = id;
        this.startMessage = startMessage;
        this.completedMessage = completedMessage;
        this.userMessage = userMessage;
    }

    public int getStep() {
        return step;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getStartMessage() {
        return startMessage;
    }

    public String getCompletedMessage() {
        return completedMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
