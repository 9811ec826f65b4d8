package com.amqp.receiver.link;

import com.amqp.receiver.protocol.v10.messaging.AmqpMessage;

/**
 * Application hook invoked once per received message.
 *
 * Called on the engine's processing thread; must return quickly. The message
 * is a copy owned by the handler, which is responsible for releasing it.
 * Returning does not settle the delivery.
 */
@FunctionalInterface
public interface MessageHandler {

    void onMessage(AmqpMessage message);
}
