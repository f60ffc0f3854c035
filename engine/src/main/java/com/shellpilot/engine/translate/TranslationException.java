package com.shellpilot.engine.translate;

/**
 * Thrown when a natural-language request could not be translated.
 * The loop reports it and waits for the next input.
 */
public class TranslationException extends RuntimeException {

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
