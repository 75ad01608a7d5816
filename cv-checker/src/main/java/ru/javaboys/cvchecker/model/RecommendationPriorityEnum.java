package ru.javaboys.cvchecker.model;

import org.springframework.lang.Nullable;

/**
 * Declaration order is the presentation order of recommendations.
 */
public enum RecommendationPriorityEnum {

    HIGH,
    MEDIUM,
    LOW;

    @Nullable
    public static RecommendationPriorityEnum fromId(String id) {
        for (RecommendationPriorityEnum at : RecommendationPriorityEnum.values()) {
            if (at.name().equals(id)) {
                return at;
            }
        }
        return null;
    }
}
