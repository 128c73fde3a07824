package com.glengine.common.exception;

/**
 * Base exception for infrastructure failures raised by the engine.
 *
 * Expected business-rule failures are reported through result objects,
 * never through this hierarchy.
 */
public class GlEngineException extends RuntimeException {

    public GlEngineException(String message) {
        super(message);
    }

    public GlEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
