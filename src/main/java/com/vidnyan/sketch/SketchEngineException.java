package com.vidnyan.sketch;

/**
 * Infrastructure failure inside the engine (unreadable profile store, sketch folder, ...).
 * Malformed sketches never raise it.
 */
public class SketchEngineException extends RuntimeException {

    public SketchEngineException(String message) {
        super(message);
    }

    public SketchEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
