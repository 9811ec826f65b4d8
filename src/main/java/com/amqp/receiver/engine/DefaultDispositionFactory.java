package com.amqp.receiver.engine;

import com.amqp.receiver.protocol.v10.delivery.Accepted;
import com.amqp.receiver.protocol.v10.delivery.DeliveryState;
import com.amqp.receiver.protocol.v10.delivery.Modified;
import com.amqp.receiver.protocol.v10.delivery.Rejected;
import com.amqp.receiver.protocol.v10.delivery.Released;
import com.amqp.receiver.protocol.v10.transport.ErrorCondition;
import com.amqp.receiver.protocol.v10.types.Symbol;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Disposition factory for engines that encode the outcome themselves and
 * hold no native resources for a disposition value.
 */
public class DefaultDispositionFactory implements DispositionFactory {

    @Override
    public DispositionValue accepted() {
        return new StateValue(Accepted.INSTANCE);
    }

    @Override
    public DispositionValue released() {
        return new StateValue(Released.INSTANCE);
    }

    @Override
    public DispositionValue rejected(Symbol condition, String description) {
        if (condition == null) {
            return new StateValue(new Rejected());
        }
        return new StateValue(new Rejected(new ErrorCondition(condition, description)));
    }

    @Override
    public DispositionValue modified(boolean deliveryFailed, boolean undeliverableHere,
                                     Map<Symbol, Object> annotations) {
        return new StateValue(new Modified(deliveryFailed, undeliverableHere, annotations));
    }

    /**
     * Disposition value backed by a plain delivery state.
     */
    public static class StateValue implements DispositionValue {

        private final DeliveryState state;
        private final AtomicBoolean closed = new AtomicBoolean();

        public StateValue(DeliveryState state) {
            this.state = Objects.requireNonNull(state, "state is required");
        }

        @Override
        public DeliveryState getState() {
            return state;
        }

        public boolean isClosed() {
            return closed.get();
        }

        @Override
        public void close() {
            closed.set(true);
        }

        @Override
        public String toString() {
            return "DispositionValue{" + state + (isClosed() ? ", closed" : "") + "}";
        }
    }
}
