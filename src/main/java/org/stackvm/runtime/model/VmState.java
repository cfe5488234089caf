package org.stackvm.runtime.model;

import org.stackvm.runtime.VmLimits;

import java.util.Arrays;
import java.util.Objects;

/**
 * The complete mutable state of one virtual machine run.
 * <p>
 * Every accessor that can go out of range checks its bounds and records a {@link VmFault}
 * instead of throwing. After a fault the status is {@link VmStatus#FAULTED}; callers check
 * {@link #isFaulted()} after each accessor and return early, the same way instruction
 * implementations stop after a failed pop.
 * Only the first fault of a run is kept.
 */
public class VmState {

    private final BytecodeProgram program;
    private final VmLimits limits;
    private final OperandStack stack;
    private final CallFrame[] frames;
    private final int[] globals;

    private int fp = -1;
    private int pc;
    private int instructionAddress;
    private long instructionCount;
    private VmStatus status = VmStatus.IDLE;
    private VmFault fault;

    /**
     * Creates a fresh state for the given program.
     * @param program The program to execute.
     * @param limits  The capacities of the machine.
     */
    public VmState(BytecodeProgram program, VmLimits limits) {
        this.program = Objects.requireNonNull(program, "program");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.stack = new OperandStack(limits.stackCapacity());
        this.frames = new CallFrame[limits.callStackCapacity()];
        this.globals = new int[limits.globals()];
    }

    // --- Faults ---

    /**
     * Records a fault and stops the machine. Later faults of the same run are ignored.
     * @param kind   The fault category.
     * @param detail An optional detail message.
     */
    public void fault(FaultKind kind, String detail) {
        if (fault == null) {
            fault = new VmFault(kind, instructionAddress, pc, stack.size(), fp, detail);
        }
        status = VmStatus.FAULTED;
    }

    public boolean isFaulted() {
        return status == VmStatus.FAULTED;
    }

    public VmFault getFault() {
        return fault;
    }

    // --- Operand stack ---

    /**
     * Pushes a value, faulting with {@link FaultKind#STACK_OVERFLOW} when the stack is full.
     * @param value The value to push.
     * @return true if the value was pushed.
     */
    public boolean push(int value) {
        if (stack.isFull()) {
            fault(FaultKind.STACK_OVERFLOW, null);
            return false;
        }
        stack.push(value);
        return true;
    }

    /**
     * Pops a value, faulting with {@link FaultKind#STACK_UNDERFLOW} when the stack is empty.
     * @return The popped value, or 0 after a fault.
     */
    public int pop() {
        if (stack.isEmpty()) {
            fault(FaultKind.STACK_UNDERFLOW, null);
            return 0;
        }
        return stack.pop();
    }

    /**
     * Reads a value below the top of stack without removing it.
     * @param depth 0 for the top of stack.
     * @return The value, or 0 after a {@link FaultKind#STACK_UNDERFLOW} fault.
     */
    public int peek(int depth) {
        if (depth < 0 || depth >= stack.size()) {
            fault(FaultKind.STACK_UNDERFLOW, null);
            return 0;
        }
        return stack.peek(depth);
    }

    public OperandStack getStack() {
        return stack;
    }

    public int getStackPointer() {
        return stack.size();
    }

    // --- Call frames ---

    /**
     * Pushes a call frame, faulting with {@link FaultKind#CALL_STACK_OVERFLOW} when the call stack is full.
     * @param returnAddress The address to return to.
     * @return true if the frame was pushed.
     */
    public boolean pushFrame(int returnAddress) {
        if (fp >= frames.length - 1) {
            fault(FaultKind.CALL_STACK_OVERFLOW, "depth " + frames.length);
            return false;
        }
        frames[++fp] = new CallFrame(returnAddress, limits.localsPerFrame(), stack.size());
        return true;
    }

    /**
     * Pops the active call frame, faulting with {@link FaultKind#CALL_STACK_UNDERFLOW} when there is none.
     * @return The popped frame, or null after a fault.
     */
    public CallFrame popFrame() {
        if (fp < 0) {
            fault(FaultKind.CALL_STACK_UNDERFLOW, null);
            return null;
        }
        CallFrame frame = frames[fp];
        frames[fp--] = null;
        return frame;
    }

    public boolean hasActiveFrame() {
        return fp >= 0;
    }

    /**
     * @return The active frame, or null at top level.
     */
    public CallFrame currentFrame() {
        return fp >= 0 ? frames[fp] : null;
    }

    /**
     * @return The index of the active frame, -1 at top level.
     */
    public int getFramePointer() {
        return fp;
    }

    public int getCallDepth() {
        return fp + 1;
    }

    // --- Variables ---

    /**
     * Reads a local variable of the active frame. At top level the global with the same
     * index is read instead.
     * @param index The slot.
     * @return The value, or 0 after an {@link FaultKind#OUT_OF_BOUNDS} fault.
     */
    public int loadLocal(int index) {
        if (index < 0 || index >= limits.localsPerFrame()) {
            fault(FaultKind.OUT_OF_BOUNDS, "local index " + index);
            return 0;
        }
        CallFrame frame = currentFrame();
        return frame != null ? frame.getLocal(index) : loadGlobal(index);
    }

    /**
     * Writes a local variable of the active frame. At top level the global with the same
     * index is written instead.
     * @param index The slot.
     * @param value The value.
     * @return true if the value was stored.
     */
    public boolean storeLocal(int index, int value) {
        if (index < 0 || index >= limits.localsPerFrame()) {
            fault(FaultKind.OUT_OF_BOUNDS, "local index " + index);
            return false;
        }
        CallFrame frame = currentFrame();
        if (frame != null) {
            frame.setLocal(index, value);
            return true;
        }
        return storeGlobal(index, value);
    }

    /**
     * @param index The global slot.
     * @return The value, or 0 after an {@link FaultKind#OUT_OF_BOUNDS} fault.
     */
    public int loadGlobal(long index) {
        if (index < 0 || index >= globals.length) {
            fault(FaultKind.OUT_OF_BOUNDS, "global index " + index);
            return 0;
        }
        return globals[(int) index];
    }

    /**
     * @param index The global slot.
     * @param value The value.
     * @return true if the value was stored.
     */
    public boolean storeGlobal(long index, int value) {
        if (index < 0 || index >= globals.length) {
            fault(FaultKind.OUT_OF_BOUNDS, "global index " + index);
            return false;
        }
        globals[(int) index] = value;
        return true;
    }

    /**
     * @return A copy of the global variables.
     */
    public int[] getGlobals() {
        return Arrays.copyOf(globals, globals.length);
    }

    // --- Program counter and code ---

    public BytecodeProgram getProgram() {
        return program;
    }

    public int getPc() {
        return pc;
    }

    /**
     * Sets the program counter to a jump target. A target past the end of the
     * code faults with {@link FaultKind#INVALID_ADDRESS}; the end of the code itself is
     * a legal target and ends the run.
     * @param target The unsigned 32-bit target address.
     * @return true if the jump was taken.
     */
    public boolean jumpTo(long target) {
        if (target < 0 || target > program.length()) {
            fault(FaultKind.INVALID_ADDRESS, "jump target " + target);
            return false;
        }
        pc = (int) target;
        return true;
    }

    /**
     * Moves the program counter without validation. Used by the fetch loop.
     * @param pc The new program counter.
     */
    public void setPc(int pc) {
        this.pc = pc;
    }

    /**
     * Reads the next code byte and advances the program counter.
     * @return The unsigned byte, or 0 after an {@link FaultKind#INVALID_ADDRESS} fault.
     */
    public int readByte() {
        if (!program.hasBytes(pc, 1)) {
            fault(FaultKind.INVALID_ADDRESS, "read past end of code");
            return 0;
        }
        return program.byteAt(pc++);
    }

    /**
     * Reads the next little-endian 32-bit operand and advances the program counter.
     * @return The signed value, or 0 after an {@link FaultKind#INVALID_ADDRESS} fault.
     */
    public int readInt32() {
        if (!program.hasBytes(pc, 4)) {
            fault(FaultKind.INVALID_ADDRESS, "read past end of code");
            return 0;
        }
        int value = program.readInt32(pc);
        pc += 4;
        return value;
    }

    public int getInstructionAddress() {
        return instructionAddress;
    }

    public void setInstructionAddress(int instructionAddress) {
        this.instructionAddress = instructionAddress;
    }

    // --- Lifecycle ---

    public VmStatus getStatus() {
        return status;
    }

    public boolean isRunning() {
        return status == VmStatus.RUNNING;
    }

    /**
     * Enters the running state. Has no effect once the run has ended.
     */
    public void start() {
        if (status == VmStatus.IDLE) {
            status = VmStatus.RUNNING;
        }
    }

    /**
     * Stops the machine normally. A faulted run stays faulted.
     */
    public void halt() {
        if (status != VmStatus.FAULTED) {
            status = VmStatus.HALTED;
        }
    }

    public long getInstructionCount() {
        return instructionCount;
    }

    public void countInstruction() {
        instructionCount++;
    }

    public VmLimits getLimits() {
        return limits;
    }
}
