package com.amqp.receiver.link;

import com.amqp.receiver.engine.ReceiverState;

/**
 * Application hook notified of every receiver state transition the engine reports.
 *
 * Called on the engine's processing thread; must return quickly.
 */
@FunctionalInterface
public interface StateChangeHandler {

    void onStateChanged(ReceiverState previous, ReceiverState current);
}
