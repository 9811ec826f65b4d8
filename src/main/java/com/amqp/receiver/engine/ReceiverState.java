package com.amqp.receiver.engine;

/**
 * Receiver states reported by the protocol engine.
 */
public enum ReceiverState {
    /**
     * Receiver created but not yet opened.
     */
    IDLE,

    /**
     * Open requested, waiting for the link to become active.
     */
    OPENING,

    /**
     * Receiver is active and messages may arrive.
     */
    OPEN,

    /**
     * Close requested, waiting for the link to wind down.
     */
    CLOSING,

    /**
     * Receiver failed, either locally or because the peer reported an error.
     */
    ERROR
}
