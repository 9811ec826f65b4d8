package com.amqp.receiver.protocol.v10.delivery;

import com.amqp.receiver.protocol.v10.types.DescribedType;
import com.amqp.receiver.protocol.v10.types.Symbol;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The receiver did not process the message and asks the sender to alter it
 * before any redelivery.
 *
 * {@code deliveryFailed} counts the attempt as a failed delivery,
 * {@code undeliverableHere} keeps the message away from this link, and the
 * annotations are merged into the message's annotations.
 */
public final class Modified implements DeliveryState {

    private final boolean deliveryFailed;
    private final boolean undeliverableHere;
    private final Map<Symbol, Object> messageAnnotations;

    public Modified(boolean deliveryFailed, boolean undeliverableHere) {
        this(deliveryFailed, undeliverableHere, null);
    }

    public Modified(boolean deliveryFailed, boolean undeliverableHere, Map<Symbol, Object> messageAnnotations) {
        this.deliveryFailed = deliveryFailed;
        this.undeliverableHere = undeliverableHere;
        this.messageAnnotations = messageAnnotations == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(messageAnnotations));
    }

    @Override
    public OutcomeKind getKind() {
        return OutcomeKind.MODIFIED;
    }

    @Override
    public DescribedType toDescribed() {
        return new DescribedType.Default(getDescriptor(),
                Arrays.<Object>asList(deliveryFailed, undeliverableHere, messageAnnotations));
    }

    public boolean isDeliveryFailed() {
        return deliveryFailed;
    }

    public boolean isUndeliverableHere() {
        return undeliverableHere;
    }

    /**
     * Unmodifiable snapshot of the annotations, or null if none were given.
     */
    public Map<Symbol, Object> getMessageAnnotations() {
        return messageAnnotations;
    }

    @Override
    public String toString() {
        return String.format("Modified{deliveryFailed=%s, undeliverableHere=%s, annotations=%s}",
                deliveryFailed, undeliverableHere, messageAnnotations);
    }
}
