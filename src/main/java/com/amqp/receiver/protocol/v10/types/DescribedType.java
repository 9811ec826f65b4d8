package com.amqp.receiver.protocol.v10.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AMQP 1.0 Described Type.
 * A described type wraps a list of fields with a descriptor that identifies the semantics.
 */
public interface DescribedType {

    /**
     * Get the descriptor code that identifies this type.
     */
    long getDescriptor();

    /**
     * Get the described fields, trailing nulls removed.
     */
    List<Object> getDescribed();

    /**
     * Simple implementation of DescribedType.
     */
    class Default implements DescribedType {
        private final long descriptor;
        private final List<Object> described;

        public Default(long descriptor, List<Object> fields) {
            int end = fields.size();
            while (end > 0 && fields.get(end - 1) == null) {
                end--;
            }
            this.descriptor = descriptor;
            this.described = Collections.unmodifiableList(new ArrayList<>(fields.subList(0, end)));
        }

        @Override
        public long getDescriptor() {
            return descriptor;
        }

        @Override
        public List<Object> getDescribed() {
            return described;
        }

        @Override
        public String toString() {
            return "Described{descriptor=0x" + Long.toHexString(descriptor) + ", described=" + described + "}";
        }
    }
}
