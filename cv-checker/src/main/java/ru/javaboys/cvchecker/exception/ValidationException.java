package ru.javaboys.cvchecker.exception;

/**
 * Caller supplied unusable input. Raised before any LLM call.
 */
public class ValidationException extends AnalysisException {

    public ValidationException(String message) {
        super(null, message, message, null);
    }
}
