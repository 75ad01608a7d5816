package ru.javaboys.cvchecker.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Output of the analysis stage: the combined breakdown plus both of its sources.
 */
@Value
@Builder
public class HybridScore {
    ScoreBreakdown breakdown;
    DeterministicScore deterministic;
    SemanticAssessment semantic;
    List<String> strengths;
    List<String> gaps;
}
