package ru.javaboys.cvchecker.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import ru.javaboys.cvchecker.model.AnalysisStreamItem;

/**
 * Renders streamed analysis items in the wire format clients consume:
 * one JSON object per line, snake_case fields,
 * {@code {"type":"progress",...}} events and a final {@code {"type":"result","data":{...}}}.
 */
@Component
public class AnalysisStreamEncoder {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .disable(SerializationFeature.INDENT_OUTPUT);

    public String encode(AnalysisStreamItem item) {
        try {
            return objectMapper.writeValueAsString(item);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize stream item of type " + item.getType(), e);
        }
    }

    /**
     * NDJSON lines, each terminated by {@code \n}.
     */
    public Flux<String> encodeLines(Flux<AnalysisStreamItem> items) {
        return items.map(item -> encode(item) + "\n");
    }
}
