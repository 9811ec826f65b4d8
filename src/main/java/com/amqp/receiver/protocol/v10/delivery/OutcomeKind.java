package com.amqp.receiver.protocol.v10.delivery;

import com.amqp.receiver.protocol.v10.types.Descriptors;

/**
 * The four terminal outcomes a receiver can report for a delivery.
 */
public enum OutcomeKind {

    ACCEPTED(Descriptors.ACCEPTED, "settleAccepted"),

    RELEASED(Descriptors.RELEASED, "settleReleased"),

    REJECTED(Descriptors.REJECTED, "settleRejected"),

    MODIFIED(Descriptors.MODIFIED, "settleModified");

    private final long descriptor;
    private final String operation;

    OutcomeKind(long descriptor, String operation) {
        this.descriptor = descriptor;
        this.operation = operation;
    }

    /**
     * Descriptor code of the outcome's described type.
     */
    public long descriptor() {
        return descriptor;
    }

    /**
     * Name of the receiver link operation that sends this outcome.
     */
    public String operation() {
        return operation;
    }
}
