package com.gnovoa.swiss.exception;

/**
 * Base of every failure the engine reports to its caller. None of them is retried inside
 * the engine.
 */
public abstract class PairingEngineException extends RuntimeException {

    protected PairingEngineException(String message) {
        super(message);
    }

    protected PairingEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
