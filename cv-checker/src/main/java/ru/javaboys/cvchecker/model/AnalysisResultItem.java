package ru.javaboys.cvchecker.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

@Value
@JsonPropertyOrder({"type", "data"})
public class AnalysisResultItem implements AnalysisStreamItem {

    public static final String TYPE = "result";

    AnalysisResult data;

    @Override
    public String getType() {
        return TYPE;
    }
}
