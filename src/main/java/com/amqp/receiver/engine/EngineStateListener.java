package com.amqp.receiver.engine;

/**
 * Hook the engine calls from its processing loop on every receiver state transition.
 */
@FunctionalInterface
public interface EngineStateListener {

    void onStateChanged(ReceiverState previous, ReceiverState current);
}
