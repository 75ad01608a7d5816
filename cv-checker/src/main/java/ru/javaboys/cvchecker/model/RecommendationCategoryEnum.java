package ru.javaboys.cvchecker.model;

import org.springframework.lang.Nullable;

public enum RecommendationCategoryEnum {

    ADD_SKILL,
    MODIFY_CONTENT,
    EMPHASIZE_EXPERIENCE,
    REMOVE_CONTENT,
    RESTRUCTURE;

    @Nullable
    public static RecommendationCategoryEnum fromId(String id) {
        for (RecommendationCategoryEnum at : RecommendationCategoryEnum.values()) {
            if (at.name().equals(id)) {
                return at;
            }
        }
        return null;
    }
}
