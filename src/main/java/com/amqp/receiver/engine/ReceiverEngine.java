package com.amqp.receiver.engine;

import java.util.OptionalLong;

/**
 * Protocol engine operations on a receiver resource.
 *
 * Implementations run their own single-threaded processing loop and call the
 * registered listeners from it. A {@code ReceiverLink} calls into the engine
 * only while holding its link lock, so calls for one handle never overlap.
 * Every failure is reported as an {@link EngineException}.
 */
public interface ReceiverEngine {

    /**
     * Allocate a receiver resource bound to an attached link.
     *
     * @param stateListener the single state-change hook for this receiver
     */
    ReceiverHandle createReceiver(Link link, EngineStateListener stateListener) throws EngineException;

    /**
     * Name of the link the receiver is bound to.
     */
    String linkName(ReceiverHandle handle) throws EngineException;

    /**
     * Start receiving.
     *
     * @param arrivalListener the single message-arrival hook for this receiver
     */
    void open(ReceiverHandle handle, EngineArrivalListener arrivalListener) throws EngineException;

    /**
     * Stop receiving. The resource stays allocated.
     */
    void close(ReceiverHandle handle) throws EngineException;

    /**
     * Release the receiver resource. The handle is invalid afterwards.
     */
    void destroy(ReceiverHandle handle) throws EngineException;

    /**
     * Delivery number of the most recently received message, or empty if
     * nothing has been received on this receiver yet.
     */
    OptionalLong lastDeliveryNumber(ReceiverHandle handle) throws EngineException;

    /**
     * Factory for the disposition values {@link #sendDisposition} accepts.
     */
    DispositionFactory dispositions();

    /**
     * Hand a settled disposition for one delivery to the engine for transmission.
     * Does not wait for the peer.
     */
    void sendDisposition(ReceiverHandle handle, String linkName, long deliveryNumber,
                         DispositionValue disposition) throws EngineException;
}
