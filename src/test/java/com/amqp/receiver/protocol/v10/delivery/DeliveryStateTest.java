package com.amqp.receiver.protocol.v10.delivery;

import com.amqp.receiver.protocol.v10.transport.ErrorCondition;
import com.amqp.receiver.protocol.v10.types.DescribedType;
import com.amqp.receiver.protocol.v10.types.Symbol;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AMQP 1.0 Delivery State Tests")
class DeliveryStateTest {

    @Nested
    @DisplayName("Accepted and Released")
    class NoFieldTests {

        @Test
        @DisplayName("Accepted has descriptor 0x24 and no fields")
        void testAccepted() {
            DescribedType described = Accepted.INSTANCE.toDescribed();

            assertThat(Accepted.INSTANCE.getDescriptor()).isEqualTo(0x24L);
            assertThat(described.getDescriptor()).isEqualTo(0x24L);
            assertThat(described.getDescribed()).isEmpty();
            assertThat(Accepted.INSTANCE.getKind()).isEqualTo(OutcomeKind.ACCEPTED);
        }

        @Test
        @DisplayName("Released has descriptor 0x26 and no fields")
        void testReleased() {
            assertThat(Released.INSTANCE.getDescriptor()).isEqualTo(0x26L);
            assertThat(Released.INSTANCE.toDescribed().getDescribed()).isEmpty();
            assertThat(Released.INSTANCE.getKind()).isEqualTo(OutcomeKind.RELEASED);
        }
    }

    @Nested
    @DisplayName("Rejected")
    class RejectedTests {

        @Test
        @DisplayName("Rejected encodes its error as a described error")
        void testRejectedWithError() {
            Rejected rejected = new Rejected(new ErrorCondition(ErrorCondition.DECODE_ERROR, "bad body"));

            DescribedType described = rejected.toDescribed();

            assertThat(described.getDescriptor()).isEqualTo(0x25L);
            assertThat(described.getDescribed()).hasSize(1);
            DescribedType error = (DescribedType) described.getDescribed().get(0);
            assertThat(error.getDescriptor()).isEqualTo(ErrorCondition.DESCRIPTOR);
            assertThat(error.getDescribed()).containsExactly(ErrorCondition.DECODE_ERROR, "bad body");
        }

        @Test
        @DisplayName("Rejected without error has no fields")
        void testRejectedWithoutError() {
            Rejected rejected = new Rejected();

            assertThat(rejected.getError()).isNull();
            assertThat(rejected.toDescribed().getDescribed()).isEmpty();
            assertThat(rejected.getKind()).isEqualTo(OutcomeKind.REJECTED);
        }
    }

    @Nested
    @DisplayName("Modified")
    class ModifiedTests {

        @Test
        @DisplayName("Modified encodes flags and drops absent annotations")
        void testModifiedFields() {
            Modified modified = new Modified(true, false);

            assertThat(modified.getDescriptor()).isEqualTo(0x27L);
            assertThat(modified.toDescribed().getDescribed()).containsExactly(true, false);
            assertThat(modified.getKind()).isEqualTo(OutcomeKind.MODIFIED);
        }

        @Test
        @DisplayName("Modified keeps a snapshot of the annotations")
        void testModifiedAnnotationsSnapshot() {
            Map<Symbol, Object> annotations = new HashMap<>();
            annotations.put(Symbol.valueOf("x-opt-attempt"), 2);
            Modified modified = new Modified(false, true, annotations);

            annotations.put(Symbol.valueOf("x-opt-late"), true);

            assertThat(modified.getMessageAnnotations()).containsOnlyKeys(Symbol.valueOf("x-opt-attempt"));
            assertThatThrownBy(() -> modified.getMessageAnnotations().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThat(modified.toDescribed().getDescribed()).hasSize(3);
        }
    }

    @Test
    @DisplayName("Each outcome names the operation that sends it")
    void testOutcomeOperations() {
        assertThat(OutcomeKind.ACCEPTED.operation()).isEqualTo("settleAccepted");
        assertThat(OutcomeKind.RELEASED.operation()).isEqualTo("settleReleased");
        assertThat(OutcomeKind.REJECTED.operation()).isEqualTo("settleRejected");
        assertThat(OutcomeKind.MODIFIED.operation()).isEqualTo("settleModified");
    }
}
