package com.amqp.receiver.link;

import com.amqp.receiver.config.ReceiverLinkConfig;
import com.amqp.receiver.engine.DispositionFactory;
import com.amqp.receiver.engine.DispositionValue;
import com.amqp.receiver.engine.EngineArrivalListener;
import com.amqp.receiver.engine.EngineException;
import com.amqp.receiver.engine.EngineStateListener;
import com.amqp.receiver.engine.Link;
import com.amqp.receiver.engine.ReceiverEngine;
import com.amqp.receiver.engine.ReceiverHandle;
import com.amqp.receiver.engine.ReceiverState;
import com.amqp.receiver.protocol.v10.delivery.Accepted;
import com.amqp.receiver.protocol.v10.delivery.DeliveryState;
import com.amqp.receiver.protocol.v10.delivery.Modified;
import com.amqp.receiver.protocol.v10.delivery.OutcomeKind;
import com.amqp.receiver.protocol.v10.delivery.Rejected;
import com.amqp.receiver.protocol.v10.delivery.Released;
import com.amqp.receiver.protocol.v10.messaging.AmqpMessage;
import com.amqp.receiver.protocol.v10.transport.ErrorCondition;
import com.amqp.receiver.protocol.v10.types.Symbol;
import com.amqp.receiver.protocol.v10.types.UInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * AMQP 1.0 Receiver Link.
 *
 * Owns one engine receiver resource and drives it through create, open,
 * close and destroy. Messages arriving while the link is open are copied and
 * handed to the registered {@link MessageHandler}; the application settles
 * each delivery explicitly by delivery number.
 *
 * All engine interaction is serialized by one reentrant lock. Engine
 * callbacks run while holding it, so a handler may settle from inside its
 * callback, and close and destroy wait for a callback in progress.
 */
public class ReceiverLink {

    private static final Logger log = LoggerFactory.getLogger(ReceiverLink.class);

    private final ReceiverEngine engine;
    private final ReceiverLinkConfig config;
    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private ReceiverHandle handle;
    private Binding binding;
    private MessageHandler messageHandler;

    private volatile String linkName;
    private volatile LinkState state = LinkState.UNCREATED;
    private volatile ReceiverState receiverState;

    public ReceiverLink(ReceiverEngine engine) {
        this(engine, new ReceiverLinkConfig());
    }

    public ReceiverLink(ReceiverEngine engine, ReceiverLinkConfig config) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.config = Objects.requireNonNull(config, "config is required");
    }

    // Lifecycle

    /**
     * Create the receiver resource on an attached link. A resource this link
     * already holds is destroyed first.
     *
     * @param stateHandler notified of engine state transitions, may be null
     * @throws ResourceException if the engine cannot allocate the receiver
     * @throws ProtocolException if the link name cannot be retrieved
     */
    public void create(Link link, StateChangeHandler stateHandler) {
        bind(link, ReceiverCallbacks.of(stateHandler));
    }

    /**
     * Create the receiver resource, taking the state handler from an owner
     * object (see {@link ReceiverCallbacks#resolve(Object)}).
     */
    public void create(Link link, Object owner) {
        bind(link, ReceiverCallbacks.resolve(owner));
    }

    private void bind(Link link, ReceiverCallbacks callbacks) {
        Objects.requireNonNull(link, "link is required");
        acquire("create");
        try {
            if (handle != null) {
                log.debug("Receiver link '{}' re-created, destroying previous resource", linkName);
                releaseResource();
            }

            Binding created = new Binding(callbacks.getStateHandler());
            binding = created;
            receiverState = null;
            ReceiverHandle allocated;
            try {
                allocated = engine.createReceiver(link, created);
            } catch (EngineException e) {
                binding = null;
                throw new ResourceException("create", "could not allocate receiver resource", e);
            }
            if (allocated == null) {
                binding = null;
                throw new ResourceException("create", "engine returned no receiver resource");
            }

            String name;
            try {
                name = engine.linkName(allocated);
            } catch (EngineException e) {
                binding = null;
                destroyQuietly(allocated);
                throw new ProtocolException("create", "could not retrieve link name", e);
            }
            if (name == null) {
                binding = null;
                destroyQuietly(allocated);
                throw new ProtocolException("create", "engine reported no link name");
            }

            handle = allocated;
            linkName = name;
            messageHandler = null;
            state = LinkState.CREATED;
            log.debug("Receiver link '{}' created", name);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Start receiving. Each arriving message is copied and passed to the handler.
     *
     * @throws ResourceException if no receiver resource is held
     * @throws ProtocolException if the link is already open or the engine rejects the open
     */
    public void open(MessageHandler handler) {
        Objects.requireNonNull(handler, "handler is required");
        acquire("open");
        try {
            ReceiverHandle current = requireHandle("open");
            if (state == LinkState.OPENED) {
                throw new ProtocolException("open", "receiver link '" + linkName + "' is already open");
            }

            messageHandler = handler;
            try {
                engine.open(current, binding);
            } catch (EngineException e) {
                messageHandler = null;
                throw new ProtocolException("open", "engine rejected open of receiver link '" + linkName + "'", e);
            }
            state = LinkState.OPENED;
            log.debug("Receiver link '{}' opened", linkName);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Start receiving, taking the message handler from an owner object.
     *
     * @throws IllegalArgumentException if the owner provides no message handler
     */
    public void open(Object owner) {
        ReceiverCallbacks callbacks = ReceiverCallbacks.resolve(owner);
        if (!callbacks.hasMessageHandler()) {
            throw new IllegalArgumentException("Owner provides no message handler: " + owner);
        }
        open(callbacks.getMessageHandler());
    }

    /**
     * Stop receiving. No message handler call happens after this returns.
     * The resource stays allocated and the link may be opened again.
     *
     * @throws ResourceException if no receiver resource is held
     * @throws ProtocolException if the engine cannot close the receiver
     */
    public void close() {
        acquire("close");
        try {
            ReceiverHandle current = requireHandle("close");
            try {
                engine.close(current);
            } catch (EngineException e) {
                throw new ProtocolException("close", "engine could not close receiver link '" + linkName + "'", e);
            }
            messageHandler = null;
            state = LinkState.CLOSED;
            log.debug("Receiver link '{}' closed", linkName);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release the receiver resource. Does nothing if none is held and never
     * throws. Waits for any engine interaction in progress.
     */
    public void destroy() {
        lock.lock();
        try {
            releaseResource();
        } finally {
            lock.unlock();
        }
    }

    private void releaseResource() {
        if (handle == null) {
            return;
        }
        ReceiverHandle released = handle;
        String name = linkName;

        handle = null;
        messageHandler = null;
        state = LinkState.DESTROYED;

        // Binding stays current until the engine returns: teardown transitions are reported
        destroyQuietly(released);
        binding = null;
        linkName = null;
        receiverState = null;
        log.debug("Receiver link '{}' destroyed", name);
    }

    private void destroyQuietly(ReceiverHandle released) {
        try {
            engine.destroy(released);
        } catch (EngineException | RuntimeException e) {
            log.warn("Error destroying receiver resource", e);
        }
    }

    // Delivery tracking

    /**
     * Delivery number of the most recently received message, or empty if
     * nothing has been received yet.
     *
     * @throws ResourceException if no receiver resource is held
     * @throws ProtocolException if the engine cannot report it
     */
    public OptionalLong lastReceivedDeliveryNumber() {
        String operation = "lastReceivedDeliveryNumber";
        acquire(operation);
        try {
            ReceiverHandle current = requireHandle(operation);
            OptionalLong number;
            try {
                number = engine.lastDeliveryNumber(current);
            } catch (EngineException e) {
                throw new ProtocolException(operation,
                        "engine could not report last delivery number of receiver link '" + linkName + "'", e);
            }
            if (number == null) {
                throw new ProtocolException(operation, "engine reported no delivery number state");
            }
            return number;
        } finally {
            lock.unlock();
        }
    }

    // Settlement

    /**
     * Settle a delivery as accepted.
     */
    public void settleAccepted(long deliveryNumber) {
        settle(deliveryNumber, OutcomeKind.ACCEPTED, DispositionFactory::accepted);
    }

    /**
     * Settle a delivery as released for redelivery.
     */
    public void settleReleased(long deliveryNumber) {
        settle(deliveryNumber, OutcomeKind.RELEASED, DispositionFactory::released);
    }

    /**
     * Settle a delivery as rejected.
     *
     * @param errorCondition symbolic AMQP error condition, e.g. {@code amqp:decode-error}
     * @param errorDescription human readable description, may be null
     */
    public void settleRejected(long deliveryNumber, String errorCondition, String errorDescription) {
        settleRejected(deliveryNumber, ErrorCondition.of(errorCondition, errorDescription));
    }

    public void settleRejected(long deliveryNumber, ErrorCondition error) {
        Objects.requireNonNull(error, "error is required");
        settleRejected(deliveryNumber, error.getCondition(), error.getDescription());
    }

    private void settleRejected(long deliveryNumber, Symbol condition, String description) {
        settle(deliveryNumber, OutcomeKind.REJECTED, factory -> factory.rejected(condition, description));
    }

    /**
     * Settle a delivery as modified.
     *
     * @param annotations message annotations for the redelivery, may be null
     */
    public void settleModified(long deliveryNumber, boolean deliveryFailed, boolean undeliverableHere,
                               Map<Symbol, Object> annotations) {
        settle(deliveryNumber, OutcomeKind.MODIFIED,
                factory -> factory.modified(deliveryFailed, undeliverableHere, annotations));
    }

    /**
     * Settle a delivery with a prebuilt outcome.
     *
     * @throws IllegalArgumentException if the state is not one of the four outcomes
     */
    public void settle(long deliveryNumber, DeliveryState outcome) {
        Objects.requireNonNull(outcome, "outcome is required");
        if (outcome instanceof Accepted) {
            settleAccepted(deliveryNumber);
        } else if (outcome instanceof Released) {
            settleReleased(deliveryNumber);
        } else if (outcome instanceof Rejected) {
            ErrorCondition error = ((Rejected) outcome).getError();
            settleRejected(deliveryNumber,
                    error != null ? error.getCondition() : null,
                    error != null ? error.getDescription() : null);
        } else if (outcome instanceof Modified) {
            Modified modified = (Modified) outcome;
            settleModified(deliveryNumber, modified.isDeliveryFailed(), modified.isUndeliverableHere(),
                    modified.getMessageAnnotations());
        } else {
            throw new IllegalArgumentException("Not a settlement outcome: " + outcome);
        }
    }

    private void settle(long deliveryNumber, OutcomeKind outcome, DispositionConstructor constructor) {
        long number = UInt.valueOf(deliveryNumber).longValue();
        String operation = outcome.operation();
        acquire(operation);
        try {
            ReceiverHandle current = requireHandle(operation);

            DispositionValue disposition;
            try {
                disposition = constructor.construct(engine.dispositions());
            } catch (EngineException | RuntimeException e) {
                throw new ProtocolException(outcome, number, "engine could not construct disposition", e);
            }
            if (disposition == null) {
                throw new ProtocolException(outcome, number, "engine constructed no disposition", null);
            }

            try (DispositionValue value = disposition) {
                engine.sendDisposition(current, linkName, number, value);
            } catch (EngineException | RuntimeException e) {
                throw new ProtocolException(outcome, number,
                        "engine could not send disposition on receiver link '" + linkName + "'", e);
            }

            if (config.isTrace()) {
                log.info("Receiver link '{}' settled delivery {} as {}", linkName, number, outcome);
            } else {
                log.debug("Receiver link '{}' settled delivery {} as {}", linkName, number, outcome);
            }
        } finally {
            lock.unlock();
        }
    }

    // Engine callbacks

    private void onEngineStateChanged(Binding source, ReceiverState previous, ReceiverState current) {
        lock.lock();
        try {
            if (source != binding) {
                log.debug("Ignoring state change {} -> {} from a released receiver resource", previous, current);
                return;
            }
            receiverState = current;
            log.info("Receiver link '{}' state changed: {} -> {}", linkName, previous, current);

            if (source.stateHandler == null) {
                return;
            }
            try {
                source.stateHandler.onStateChanged(previous, current);
            } catch (Exception e) {
                log.error("Error in state change handler of receiver link '{}'", linkName, e);
            }
        } finally {
            lock.unlock();
        }
    }

    private void onEngineMessage(Binding source, AmqpMessage transientMessage) {
        lock.lock();
        try {
            MessageHandler handler = messageHandler;
            if (source != binding || handler == null) {
                log.debug("Dropping message arriving on receiver link '{}' in state {}", linkName, state);
                return;
            }

            AmqpMessage message;
            try {
                message = transientMessage.copy();
            } catch (RuntimeException e) {
                log.error("Could not copy message arriving on receiver link '{}'", linkName, e);
                return;
            }

            if (config.isTrace()) {
                log.info("Receiver link '{}' received message of {} bytes", linkName, message.getSize());
            }
            try {
                handler.onMessage(message);
            } catch (Exception e) {
                log.error("Error in message handler of receiver link '{}'", linkName, e);
            }
        } finally {
            lock.unlock();
        }
    }

    // Helpers

    private void acquire(String operation) {
        long timeoutMs = config.getLockTimeoutMs();
        try {
            if (!lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new ResourceException(operation,
                        "timed out after " + timeoutMs + "ms waiting for receiver link lock");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResourceException(operation, "interrupted waiting for receiver link lock", e);
        }
    }

    private ReceiverHandle requireHandle(String operation) {
        if (handle == null) {
            throw new ResourceException(operation, "receiver link holds no receiver resource (state " + state + ")");
        }
        return handle;
    }

    // Getters

    /**
     * Name of the bound link, or null when no resource is held.
     */
    public String getLinkName() {
        return linkName;
    }

    public LinkState getState() {
        return state;
    }

    /**
     * Last receiver state the engine reported, or null if none was reported
     * for the current resource.
     */
    public ReceiverState getReceiverState() {
        return receiverState;
    }

    public boolean isOpen() {
        return state == LinkState.OPENED;
    }

    @Override
    public String toString() {
        return String.format("ReceiverLink{name='%s', state=%s, receiverState=%s}",
                linkName, state, receiverState);
    }

    @FunctionalInterface
    private interface DispositionConstructor {
        DispositionValue construct(DispositionFactory factory) throws EngineException;
    }

    /**
     * Engine hooks for one receiver resource. Callbacks from a binding that
     * is no longer current are ignored.
     */
    private final class Binding implements EngineStateListener, EngineArrivalListener {

        private final StateChangeHandler stateHandler;

        Binding(StateChangeHandler stateHandler) {
            this.stateHandler = stateHandler;
        }

        @Override
        public void onStateChanged(ReceiverState previous, ReceiverState current) {
            onEngineStateChanged(this, previous, current);
        }

        @Override
        public void onMessage(AmqpMessage transientMessage) {
            onEngineMessage(this, transientMessage);
        }
    }
}
