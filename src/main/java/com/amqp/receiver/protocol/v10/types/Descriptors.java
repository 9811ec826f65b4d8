package com.amqp.receiver.protocol.v10.types;

/**
 * Descriptor codes for the AMQP 1.0 described types a receiver produces
 * when settling deliveries.
 */
public final class Descriptors {

    // Error (0x00000000:0x0000001D)
    public static final long ERROR = 0x000000000000001DL;

    // Delivery states (0x00000000:0x00000024 - 0x00000000:0x00000027)
    public static final long ACCEPTED = 0x0000000000000024L;
    public static final long REJECTED = 0x0000000000000025L;
    public static final long RELEASED = 0x0000000000000026L;
    public static final long MODIFIED = 0x0000000000000027L;

    private Descriptors() {
    }
}
