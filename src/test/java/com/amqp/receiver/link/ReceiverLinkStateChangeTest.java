package com.amqp.receiver.link;

import com.amqp.receiver.config.ReceiverLinkConfig;
import com.amqp.receiver.engine.FakeReceiverEngine;
import com.amqp.receiver.engine.ReceiverHandle;
import com.amqp.receiver.engine.ReceiverState;
import com.amqp.receiver.protocol.v10.messaging.AmqpMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Receiver Link State Change Tests")
class ReceiverLinkStateChangeTest {

    @Mock
    private StateChangeHandler stateHandler;

    private FakeReceiverEngine engine;
    private ReceiverLink receiver;

    @BeforeEach
    void setUp() {
        engine = new FakeReceiverEngine();
        receiver = new ReceiverLink(engine, new ReceiverLinkConfig(Collections.emptyMap()));
    }

    @Test
    @DisplayName("Transitions are reported in engine order with previous and new state")
    void testOrderedTransitions() {
        receiver.create(FakeReceiverEngine.link("events"), stateHandler);
        receiver.open(AmqpMessage::release);
        receiver.close();

        InOrder inOrder = inOrder(stateHandler);
        inOrder.verify(stateHandler).onStateChanged(ReceiverState.IDLE, ReceiverState.OPENING);
        inOrder.verify(stateHandler).onStateChanged(ReceiverState.OPENING, ReceiverState.OPEN);
        inOrder.verify(stateHandler).onStateChanged(ReceiverState.OPEN, ReceiverState.CLOSING);
        inOrder.verify(stateHandler).onStateChanged(ReceiverState.CLOSING, ReceiverState.IDLE);
        inOrder.verifyNoMoreInteractions();
    }

    @Test
    @DisplayName("Engine initiated error while open is reported")
    void testEngineInitiatedError() {
        receiver.create(FakeReceiverEngine.link("events"), stateHandler);
        receiver.open(AmqpMessage::release);

        engine.pushState(ReceiverState.ERROR);

        verify(stateHandler).onStateChanged(ReceiverState.OPEN, ReceiverState.ERROR);
        assertThat(receiver.getReceiverState()).isEqualTo(ReceiverState.ERROR);
        assertThat(receiver.getState()).isEqualTo(LinkState.OPENED);
    }

    @Test
    @DisplayName("Transitions are reported without ever opening")
    void testNotificationWithoutOpen() {
        receiver.create(FakeReceiverEngine.link("events"), stateHandler);

        engine.pushState(ReceiverState.ERROR);

        verify(stateHandler).onStateChanged(ReceiverState.IDLE, ReceiverState.ERROR);
    }

    @Test
    @DisplayName("Handler exception is contained at the callback boundary")
    void testHandlerExceptionContained() {
        doThrow(new IllegalStateException("application bug"))
                .when(stateHandler).onStateChanged(any(), any());
        receiver.create(FakeReceiverEngine.link("events"), stateHandler);

        assertThatCode(() -> engine.pushState(ReceiverState.ERROR)).doesNotThrowAnyException();
        assertThat(receiver.getReceiverState()).isEqualTo(ReceiverState.ERROR);
    }

    @Test
    @DisplayName("Transitions of a destroyed resource are not reported")
    void testNoNotificationAfterDestroy() {
        receiver.create(FakeReceiverEngine.link("events"), stateHandler);
        ReceiverHandle handle = engine.current();
        receiver.destroy();

        engine.pushState(handle, ReceiverState.ERROR);

        verifyNoInteractions(stateHandler);
    }

    @Test
    @DisplayName("Transitions reported while the engine destroys the resource are delivered")
    void testTransitionsDuringDestroy() {
        engine.closeOnDestroy = true;
        receiver.create(FakeReceiverEngine.link("events"), stateHandler);
        receiver.open(AmqpMessage::release);
        ReceiverHandle handle = engine.current();

        receiver.destroy();
        engine.pushState(handle, ReceiverState.ERROR);

        InOrder inOrder = inOrder(stateHandler);
        inOrder.verify(stateHandler).onStateChanged(ReceiverState.IDLE, ReceiverState.OPENING);
        inOrder.verify(stateHandler).onStateChanged(ReceiverState.OPENING, ReceiverState.OPEN);
        inOrder.verify(stateHandler).onStateChanged(ReceiverState.OPEN, ReceiverState.CLOSING);
        inOrder.verify(stateHandler).onStateChanged(ReceiverState.CLOSING, ReceiverState.IDLE);
        inOrder.verifyNoMoreInteractions();
        assertThat(receiver.getState()).isEqualTo(LinkState.DESTROYED);
        assertThat(receiver.getReceiverState()).isNull();
    }

    @Test
    @DisplayName("Owner implementing both handlers receives both kinds of callbacks")
    void testOwnerWithBothCapabilities() {
        RecordingOwner owner = new RecordingOwner();
        receiver.create(FakeReceiverEngine.link("events"), (Object) owner);
        receiver.open((Object) owner);

        engine.deliver(1, "a");

        assertThat(owner.transitions).containsExactly("IDLE->OPENING", "OPENING->OPEN");
        assertThat(owner.messages).isEqualTo(1);
    }

    @Test
    @DisplayName("Link without a state handler still tracks the receiver state")
    void testNoStateHandler() {
        receiver.create(FakeReceiverEngine.link("events"), (StateChangeHandler) null);
        receiver.open(AmqpMessage::release);

        assertThat(receiver.getReceiverState()).isEqualTo(ReceiverState.OPEN);
    }

    private static class RecordingOwner implements StateChangeHandler, MessageHandler {
        private final java.util.List<String> transitions = new java.util.ArrayList<>();
        private int messages;

        @Override
        public void onStateChanged(ReceiverState previous, ReceiverState current) {
            transitions.add(previous + "->" + current);
        }

        @Override
        public void onMessage(AmqpMessage message) {
            messages++;
            message.release();
        }
    }
}
