package org.stackvm.runtime.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stackvm.runtime.VmLimits;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class VmStateTest {

    private VmState state;

    @BeforeEach
    void setUp() {
        state = new VmState(BytecodeProgram.of(new byte[]{0, 0, 0}), new VmLimits(4, 2, 16, 256, 64, 8));
        state.start();
    }

    @Test
    void pushFailsAtCapacityWithoutRecordingTheValue() {
        for (int i = 0; i < 4; i++) {
            assertThat(state.push(i)).isTrue();
        }
        assertThat(state.push(99)).isFalse();
        assertThat(state.getFault().kind()).isEqualTo(FaultKind.STACK_OVERFLOW);
        assertThat(state.getStack().toArray()).containsExactly(0, 1, 2, 3);
    }

    @Test
    void framesRecordReturnAddressAndStackBase() {
        state.push(5);
        assertThat(state.pushFrame(3)).isTrue();
        CallFrame frame = state.currentFrame();
        assertThat(frame.getReturnAddress()).isEqualTo(3);
        assertThat(frame.getStackBase()).isEqualTo(1);
        assertThat(frame.getLocal(15)).isZero();
        assertThat(state.getFramePointer()).isZero();

        assertThat(state.popFrame()).isSameAs(frame);
        assertThat(state.hasActiveFrame()).isFalse();
    }

    @Test
    void callStackIsBounded() {
        assertThat(state.pushFrame(0)).isTrue();
        assertThat(state.pushFrame(0)).isTrue();
        assertThat(state.pushFrame(0)).isFalse();
        assertThat(state.getFault().kind()).isEqualTo(FaultKind.CALL_STACK_OVERFLOW);
        assertThat(state.getCallDepth()).isEqualTo(2);
    }

    @Test
    void popFrameWithoutFrameFaults() {
        assertThat(state.popFrame()).isNull();
        assertThat(state.getFault().kind()).isEqualTo(FaultKind.CALL_STACK_UNDERFLOW);
    }

    @Test
    void jumpAcceptsEndOfCodeButNotBeyond() {
        assertThat(state.jumpTo(3)).isTrue();
        assertThat(state.getPc()).isEqualTo(3);
        assertThat(state.jumpTo(4)).isFalse();
        assertThat(state.getFault().kind()).isEqualTo(FaultKind.INVALID_ADDRESS);
    }

    @Test
    void haltDoesNotClearAFault() {
        state.pop();
        state.halt();
        assertThat(state.getStatus()).isEqualTo(VmStatus.FAULTED);
    }
}
