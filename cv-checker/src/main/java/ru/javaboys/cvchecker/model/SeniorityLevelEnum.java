package ru.javaboys.cvchecker.model;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

public enum SeniorityLevelEnum {

    ENTRY("entry"),
    MID("mid"),
    SENIOR("senior"),
    LEAD("lead"),
    PRINCIPAL("principal");

    private final String id;

    SeniorityLevelEnum(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @Nullable
    public static SeniorityLevelEnum fromId(String id) {
        for (SeniorityLevelEnum at : SeniorityLevelEnum.values()) {
            if (at.getId().equals(id)) {
                return at;
            }
        }
        return null;
    }
}
