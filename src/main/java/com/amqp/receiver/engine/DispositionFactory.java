package com.amqp.receiver.engine;

import com.amqp.receiver.protocol.v10.types.Symbol;

import java.util.Map;

/**
 * Builds the engine's disposition values, one constructor per outcome.
 */
public interface DispositionFactory {

    DispositionValue accepted() throws EngineException;

    DispositionValue released() throws EngineException;

    DispositionValue rejected(Symbol condition, String description) throws EngineException;

    /**
     * @param annotations message annotations for the redelivery, may be null
     */
    DispositionValue modified(boolean deliveryFailed, boolean undeliverableHere,
                              Map<Symbol, Object> annotations) throws EngineException;
}
