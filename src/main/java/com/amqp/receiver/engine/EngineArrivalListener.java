package com.amqp.receiver.engine;

import com.amqp.receiver.protocol.v10.messaging.AmqpMessage;

/**
 * Hook the engine calls from its processing loop once per arriving message.
 */
@FunctionalInterface
public interface EngineArrivalListener {

    /**
     * @param transientMessage the engine's message; valid only until this call returns
     */
    void onMessage(AmqpMessage transientMessage);
}
