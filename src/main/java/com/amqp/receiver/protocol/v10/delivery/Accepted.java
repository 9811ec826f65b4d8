package com.amqp.receiver.protocol.v10.delivery;

import com.amqp.receiver.protocol.v10.types.DescribedType;

import java.util.Collections;

/**
 * The receiver processed the message. Carries no fields.
 */
public final class Accepted implements DeliveryState {

    public static final Accepted INSTANCE = new Accepted();

    private Accepted() {
    }

    @Override
    public OutcomeKind getKind() {
        return OutcomeKind.ACCEPTED;
    }

    @Override
    public DescribedType toDescribed() {
        return new DescribedType.Default(getDescriptor(), Collections.emptyList());
    }

    @Override
    public String toString() {
        return "Accepted";
    }
}
