package ru.javaboys.cvchecker.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "cvchecker")
public class CvCheckerProperties {

    @Valid
    private Analysis analysis = new Analysis();
    private Skills skills = new Skills();

    @Getter
    @Setter
    public static class Analysis {
        /** Longer CV / job texts are cut before they go into a prompt. */
        @Min(1000)
        private int maxInputChars = 18000;
    }

    @Getter
    @Setter
    public static class Skills {
        /** alias -> canonical name, added on top of the built-in table. */
        private Map<String, String> aliases = new LinkedHashMap<>();
    }
}
