package com.storycast.processing;

/**
 * A single extraction call failed or returned output with no usable character data.
 * The orchestrator skips the batch and carries on with the next one.
 */
public class ExtractionEngineException extends Exception {

    public ExtractionEngineException(String message) {
        super(message);
    }

    public ExtractionEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
