package com.amqp.receiver.protocol.v10.types;

/**
 * AMQP 1.0 uint, the wire type of delivery numbers.
 *
 * Java has no unsigned int, so the value is carried in a long and checked
 * against 0-4294967295 on construction.
 */
public final class UInt implements Comparable<UInt> {

    public static final long MAX_VALUE = 0xFFFFFFFFL;

    private final long value;

    private UInt(long value) {
        this.value = value;
    }

    /**
     * @throws IllegalArgumentException if the value does not fit in 32 unsigned bits
     */
    public static UInt valueOf(long value) {
        if (!isValid(value)) {
            throw new IllegalArgumentException("UInt value must be 0-4294967295, got: " + value);
        }
        return new UInt(value);
    }

    public static boolean isValid(long value) {
        return value >= 0 && value <= MAX_VALUE;
    }

    public long longValue() {
        return value;
    }

    @Override
    public int compareTo(UInt other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UInt)) return false;
        return value == ((UInt) obj).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
