package com.amqp.receiver.protocol.v10.messaging;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A received AMQP 1.0 message, held as its encoded sections.
 *
 * The receiver never parses the payload. The protocol engine hands out
 * transient instances that are released as soon as the arrival callback
 * returns; {@link #copy()} produces an independently owned message that
 * stays readable after that.
 */
public class AmqpMessage {

    private final ByteBuf payload;

    public AmqpMessage(ByteBuf payload) {
        this.payload = Objects.requireNonNull(payload, "payload is required");
    }

    public static AmqpMessage wrap(byte[] encoded) {
        return new AmqpMessage(Unpooled.wrappedBuffer(encoded));
    }

    public static AmqpMessage wrap(String text) {
        return wrap(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Create an independently owned copy of this message.
     *
     * @throws IllegalStateException if this message has already been released
     */
    public AmqpMessage copy() {
        ensureAccessible();
        return new AmqpMessage(Unpooled.copiedBuffer(payload));
    }

    public byte[] getBytes() {
        ensureAccessible();
        return ByteBufUtil.getBytes(payload);
    }

    public int getSize() {
        ensureAccessible();
        return payload.readableBytes();
    }

    /**
     * Release the underlying buffer. Releasing an already released
     * message has no effect.
     *
     * @return true if this call released the buffer
     */
    public boolean release() {
        if (payload.refCnt() == 0) {
            return false;
        }
        return payload.release();
    }

    public boolean isReleased() {
        return payload.refCnt() == 0;
    }

    private void ensureAccessible() {
        if (payload.refCnt() == 0) {
            throw new IllegalStateException("Message has already been released");
        }
    }

    @Override
    public String toString() {
        if (isReleased()) {
            return "AmqpMessage{released}";
        }
        return "AmqpMessage{size=" + payload.readableBytes() + "}";
    }
}
