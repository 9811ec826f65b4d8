package com.amqp.receiver.link;

import com.amqp.receiver.protocol.v10.messaging.AmqpMessage;

import java.util.function.Consumer;

/**
 * The callbacks an owner object provides, resolved once at registration.
 *
 * An owner may implement {@link StateChangeHandler}, {@link MessageHandler},
 * both, or neither. An owner without a message handler that is a
 * {@link Consumer} receives messages through {@link Consumer#accept}.
 */
public final class ReceiverCallbacks {

    static final ReceiverCallbacks NONE = new ReceiverCallbacks(null, null);

    private final StateChangeHandler stateHandler;
    private final MessageHandler messageHandler;

    private ReceiverCallbacks(StateChangeHandler stateHandler, MessageHandler messageHandler) {
        this.stateHandler = stateHandler;
        this.messageHandler = messageHandler;
    }

    @SuppressWarnings("unchecked")
    public static ReceiverCallbacks resolve(Object owner) {
        if (owner == null) {
            return NONE;
        }
        if (owner instanceof ReceiverCallbacks) {
            return (ReceiverCallbacks) owner;
        }
        StateChangeHandler stateHandler = owner instanceof StateChangeHandler
                ? (StateChangeHandler) owner
                : null;
        MessageHandler messageHandler;
        if (owner instanceof MessageHandler) {
            messageHandler = (MessageHandler) owner;
        } else if (owner instanceof Consumer) {
            Consumer<AmqpMessage> consumer = (Consumer<AmqpMessage>) owner;
            messageHandler = consumer::accept;
        } else {
            messageHandler = null;
        }
        return new ReceiverCallbacks(stateHandler, messageHandler);
    }

    static ReceiverCallbacks of(StateChangeHandler stateHandler) {
        return new ReceiverCallbacks(stateHandler, null);
    }

    public StateChangeHandler getStateHandler() {
        return stateHandler;
    }

    public MessageHandler getMessageHandler() {
        return messageHandler;
    }

    public boolean hasMessageHandler() {
        return messageHandler != null;
    }
}
