package com.amqp.receiver.protocol.v10.delivery;

import com.amqp.receiver.protocol.v10.types.DescribedType;

import java.util.Collections;

/**
 * The receiver gave the message back unprocessed; the sender may deliver it
 * again, to this or another link. Carries no fields.
 */
public final class Released implements DeliveryState {

    public static final Released INSTANCE = new Released();

    private Released() {
    }

    @Override
    public OutcomeKind getKind() {
        return OutcomeKind.RELEASED;
    }

    @Override
    public DescribedType toDescribed() {
        return new DescribedType.Default(getDescriptor(), Collections.emptyList());
    }

    @Override
    public String toString() {
        return "Released";
    }
}
