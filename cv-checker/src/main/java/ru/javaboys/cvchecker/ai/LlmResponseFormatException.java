package ru.javaboys.cvchecker.ai;

/**
 * Model answered, but not with the JSON we asked for.
 */
public class LlmResponseFormatException extends RuntimeException {

    public LlmResponseFormatException(String message) {
        super(message);
    }

    public LlmResponseFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
