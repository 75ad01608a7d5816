package ru.javaboys.cvchecker.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProgressStatusEnum {

    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String id;

    ProgressStatusEnum(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }
}
