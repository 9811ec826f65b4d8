package com.amqp.receiver.link;

import com.amqp.receiver.protocol.v10.delivery.OutcomeKind;

/**
 * The protocol engine rejected a requested action.
 *
 * Settlement failures also carry the delivery number and the outcome that
 * could not be sent.
 */
public class ProtocolException extends ReceiverLinkException {

    private static final long serialVersionUID = 1L;

    private final Long deliveryNumber;
    private final OutcomeKind outcome;

    public ProtocolException(String operation, String message) {
        super(operation, message);
        this.deliveryNumber = null;
        this.outcome = null;
    }

    public ProtocolException(String operation, String message, Throwable cause) {
        super(operation, message, cause);
        this.deliveryNumber = null;
        this.outcome = null;
    }

    public ProtocolException(OutcomeKind outcome, long deliveryNumber, String message, Throwable cause) {
        super(outcome.operation(), message + " (delivery " + deliveryNumber + ", outcome " + outcome + ")", cause);
        this.deliveryNumber = deliveryNumber;
        this.outcome = outcome;
    }

    /**
     * Delivery number of the failed settlement, or null for non-settlement operations.
     */
    public Long getDeliveryNumber() {
        return deliveryNumber;
    }

    /**
     * Outcome of the failed settlement, or null for non-settlement operations.
     */
    public OutcomeKind getOutcome() {
        return outcome;
    }
}
