package com.amqp.receiver.link;

/**
 * The receiver resource could not be allocated, is not held, or could not
 * be accessed in time.
 */
public class ResourceException extends ReceiverLinkException {

    private static final long serialVersionUID = 1L;

    public ResourceException(String operation, String message) {
        super(operation, message);
    }

    public ResourceException(String operation, String message, Throwable cause) {
        super(operation, message, cause);
    }
}
