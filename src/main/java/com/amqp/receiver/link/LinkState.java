package com.amqp.receiver.link;

/**
 * Lifecycle states of a {@link ReceiverLink}.
 */
public enum LinkState {
    /**
     * No receiver resource has been created yet.
     */
    UNCREATED,

    /**
     * Resource allocated and bound to a link, not receiving.
     */
    CREATED,

    /**
     * Receiving; the message handler is invoked for each arrival.
     */
    OPENED,

    /**
     * No longer receiving; the resource is still held.
     */
    CLOSED,

    /**
     * Resource released. Only a new create is valid.
     */
    DESTROYED
}
