package com.amqp.receiver.engine;

/**
 * Opaque handle to a receiver resource allocated by a {@link ReceiverEngine}.
 */
public interface ReceiverHandle {
}
