package com.amqp.receiver.protocol.v10.delivery;

import com.amqp.receiver.protocol.v10.transport.ErrorCondition;
import com.amqp.receiver.protocol.v10.types.DescribedType;

import java.util.Collections;

/**
 * The receiver refused the message as invalid; it is not redelivered.
 * The optional error tells the sender why.
 */
public final class Rejected implements DeliveryState {

    private final ErrorCondition error;

    public Rejected() {
        this(null);
    }

    public Rejected(ErrorCondition error) {
        this.error = error;
    }

    @Override
    public OutcomeKind getKind() {
        return OutcomeKind.REJECTED;
    }

    @Override
    public DescribedType toDescribed() {
        return new DescribedType.Default(getDescriptor(),
                Collections.<Object>singletonList(error == null ? null : error.toDescribed()));
    }

    /**
     * Reason for the rejection, or null if none was given.
     */
    public ErrorCondition getError() {
        return error;
    }

    @Override
    public String toString() {
        return error == null ? "Rejected" : "Rejected{" + error + "}";
    }
}
