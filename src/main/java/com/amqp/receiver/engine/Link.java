package com.amqp.receiver.engine;

/**
 * An AMQP link already attached at the session layer.
 *
 * Owned by the session that created it; a receiver link only reads it when
 * the engine receiver resource is created.
 */
public interface Link {
}
