package ru.javaboys.cvchecker.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Output of the report stage. All three lists hold at least five entries.
 */
@Value
@Builder
public class MatchReport {
    String summary;
    List<Recommendation> recommendations;
    List<String> strengths;
    List<String> gaps;
}
