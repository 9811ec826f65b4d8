package com.amqp.receiver.protocol.v10.delivery;

import com.amqp.receiver.protocol.v10.types.DescribedType;

/**
 * Outcome a receiver reports when it settles a delivery.
 *
 * Implementations are immutable, so one instance can be settled on any
 * number of deliveries.
 */
public interface DeliveryState {

    OutcomeKind getKind();

    /**
     * Fields of the outcome in wire order, for the engine's encoder.
     */
    DescribedType toDescribed();

    default long getDescriptor() {
        return getKind().descriptor();
    }
}
