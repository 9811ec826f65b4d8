package com.amqp.receiver.engine;

import com.amqp.receiver.protocol.v10.delivery.DeliveryState;

/**
 * Engine-owned disposition value built for one settlement.
 *
 * Must be closed exactly once after it has been sent, whether or not the
 * send succeeded.
 */
public interface DispositionValue extends AutoCloseable {

    /**
     * The outcome this value carries.
     */
    DeliveryState getState();

    @Override
    void close();
}
