package com.tubearchive.archiver.engine;

/**
 * A single extraction attempt failed. Retried by the fallback engine.
 */
public class ExtractionException extends Exception {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
