package ru.javaboys.cvchecker.ai;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps the JSON object a model was asked to return onto a DTO, the same way
 * {@code ChatClient...call().entity(type)} does. Markdown code fences are tolerated;
 * anything else that is not the object is a {@link LlmResponseFormatException}.
 */
@Component
@Slf4j
public class LlmJsonReader {

    private final ObjectMapper objectMapper;
    private final Map<Class<?>, BeanOutputConverter<?>> converters = new ConcurrentHashMap<>();

    public LlmJsonReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
    }

    public <T> T read(String raw, Class<T> type) {
        if (raw == null || raw.isBlank()) {
            throw new LlmResponseFormatException("Model returned an empty response");
        }
        T value;
        try {
            value = converterFor(type).convert(raw);
        } catch (RuntimeException e) {
            log.debug("Unparseable model response: {}", raw);
            Throwable root = NestedExceptionUtils.getMostSpecificCause(e);
            throw new LlmResponseFormatException("Model response is not valid JSON: " + root.getMessage(), e);
        }
        if (value == null) {
            throw new LlmResponseFormatException("Model returned JSON null instead of an object");
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private <T> BeanOutputConverter<T> converterFor(Class<T> type) {
        return (BeanOutputConverter<T>) converters.computeIfAbsent(type,
                t -> new BeanOutputConverter<>(type, objectMapper));
    }
}
