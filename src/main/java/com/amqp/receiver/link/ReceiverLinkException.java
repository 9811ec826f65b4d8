package com.amqp.receiver.link;

/**
 * Base class for failures of a {@link ReceiverLink} operation.
 */
public class ReceiverLinkException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String operation;

    public ReceiverLinkException(String operation, String message) {
        super(operation + " failed: " + message);
        this.operation = operation;
    }

    public ReceiverLinkException(String operation, String message, Throwable cause) {
        super(operation + " failed: " + message, cause);
        this.operation = operation;
    }

    /**
     * Name of the receiver link operation that failed.
     */
    public String getOperation() {
        return operation;
    }
}
