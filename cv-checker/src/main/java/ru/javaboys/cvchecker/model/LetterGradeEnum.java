package ru.javaboys.cvchecker.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Grade bands of the overall score. Each band includes its lower bound.
 */
public enum LetterGradeEnum {

    A_PLUS("A+", 95),
    A("A", 90),
    B_PLUS("B+", 85),
    B("B", 80),
    C_PLUS("C+", 75),
    C("C", 70),
    D("D", 60),
    F("F", 0);

    private final String label;
    private final double lowerBound;

    LetterGradeEnum(String label, double lowerBound) {
        this.label = label;
        this.lowerBound = lowerBound;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public static LetterGradeEnum fromScore(double score) {
        for (LetterGradeEnum grade : values()) {
            if (score >= grade.lowerBound) {
                return grade;
            }
        }
        return F;
    }
}
