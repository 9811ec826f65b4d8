package com.amqp.receiver.engine;

/**
 * Signals that the protocol engine did not carry out a requested action.
 */
public class EngineException extends Exception {

    private static final long serialVersionUID = 1L;

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
