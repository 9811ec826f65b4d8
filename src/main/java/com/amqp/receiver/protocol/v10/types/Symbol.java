package com.amqp.receiver.protocol.v10.types;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * AMQP 1.0 symbol: an ASCII string naming an error condition or an
 * annotation key.
 *
 * Instances are interned, so equal symbols are also identical.
 */
public final class Symbol implements Comparable<Symbol> {

    private static final ConcurrentMap<String, Symbol> INTERNED = new ConcurrentHashMap<>();

    private final String value;

    private Symbol(String value) {
        this.value = value;
    }

    /**
     * @return the symbol, or null for null text
     * @throws IllegalArgumentException if the text is not ASCII
     */
    public static Symbol valueOf(String value) {
        if (value == null) {
            return null;
        }
        Symbol symbol = INTERNED.get(value);
        if (symbol != null) {
            return symbol;
        }
        if (!StandardCharsets.US_ASCII.newEncoder().canEncode(value)) {
            throw new IllegalArgumentException("Symbol must be ASCII: " + value);
        }
        return INTERNED.computeIfAbsent(value, Symbol::new);
    }

    @Override
    public int compareTo(Symbol other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        return obj instanceof Symbol && value.equals(((Symbol) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
