package org.stackvm.runtime.model;

/**
 * Per-invocation state, pushed by CALL and popped by RET.
 */
public final class CallFrame {

    private final int returnAddress;
    private final int[] locals;
    private final int stackBase;

    /**
     * Creates a frame with zero-initialized locals.
     * @param returnAddress The program counter to continue at after RET.
     * @param localCount    The number of local slots.
     * @param stackBase     The operand stack pointer at the time of the call.
     */
    public CallFrame(int returnAddress, int localCount, int stackBase) {
        this.returnAddress = returnAddress;
        this.locals = new int[localCount];
        this.stackBase = stackBase;
    }

    public int getReturnAddress() {
        return returnAddress;
    }

    public int getStackBase() {
        return stackBase;
    }

    public int getLocalCount() {
        return locals.length;
    }

    /**
     * @param index The slot, which the caller has range-checked.
     * @return The value of the local.
     */
    public int getLocal(int index) {
        return locals[index];
    }

    /**
     * @param index The slot, which the caller has range-checked.
     * @param value The new value.
     */
    public void setLocal(int index, int value) {
        locals[index] = value;
    }
}
