package ru.javaboys.cvchecker.ai;

/**
 * Text completion capability every pipeline stage depends on.
 * Implementations must be safe for concurrent use.
 */
public interface LlmService {

    /**
     * @throws LlmException when the model could not be reached or returned nothing
     */
    String complete(String systemInstructions, String userPrompt);
}
