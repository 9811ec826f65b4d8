package com.amqp.receiver.protocol.v10.transport;

import com.amqp.receiver.protocol.v10.types.DescribedType;
import com.amqp.receiver.protocol.v10.types.Descriptors;
import com.amqp.receiver.protocol.v10.types.Symbol;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * AMQP 1.0 error, as carried by a {@code Rejected} outcome.
 *
 * The condition is a symbolic name such as {@code amqp:decode-error}; the
 * description and info map are optional.
 */
public final class ErrorCondition {

    public static final long DESCRIPTOR = Descriptors.ERROR;

    // Conditions a receiver typically rejects with
    public static final Symbol DECODE_ERROR = Symbol.valueOf("amqp:decode-error");
    public static final Symbol INVALID_FIELD = Symbol.valueOf("amqp:invalid-field");
    public static final Symbol PRECONDITION_FAILED = Symbol.valueOf("amqp:precondition-failed");
    public static final Symbol NOT_ALLOWED = Symbol.valueOf("amqp:not-allowed");
    public static final Symbol NOT_FOUND = Symbol.valueOf("amqp:not-found");
    public static final Symbol UNAUTHORIZED_ACCESS = Symbol.valueOf("amqp:unauthorized-access");
    public static final Symbol RESOURCE_LIMIT_EXCEEDED = Symbol.valueOf("amqp:resource-limit-exceeded");
    public static final Symbol MESSAGE_SIZE_EXCEEDED = Symbol.valueOf("amqp:link:message-size-exceeded");
    public static final Symbol NOT_IMPLEMENTED = Symbol.valueOf("amqp:not-implemented");
    public static final Symbol INTERNAL_ERROR = Symbol.valueOf("amqp:internal-error");

    private final Symbol condition;
    private final String description;
    private final Map<Symbol, Object> info;

    public ErrorCondition(Symbol condition) {
        this(condition, null, null);
    }

    public ErrorCondition(Symbol condition, String description) {
        this(condition, description, null);
    }

    public ErrorCondition(Symbol condition, String description, Map<Symbol, Object> info) {
        this.condition = Objects.requireNonNull(condition, "condition is required");
        this.description = description;
        this.info = info == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(info));
    }

    /**
     * Build an error from the textual condition name.
     */
    public static ErrorCondition of(String condition, String description) {
        return new ErrorCondition(Symbol.valueOf(Objects.requireNonNull(condition, "condition is required")),
                description);
    }

    public Symbol getCondition() {
        return condition;
    }

    public String getDescription() {
        return description;
    }

    public Map<Symbol, Object> getInfo() {
        return info;
    }

    public DescribedType toDescribed() {
        return new DescribedType.Default(DESCRIPTOR, Arrays.<Object>asList(condition, description, info));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ErrorCondition)) return false;
        ErrorCondition other = (ErrorCondition) obj;
        return condition.equals(other.condition)
                && Objects.equals(description, other.description)
                && Objects.equals(info, other.info);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, description, info);
    }

    @Override
    public String toString() {
        return description == null
                ? condition.toString()
                : condition + " (" + description + ")";
    }
}
