package org.stackvm.runtime.model;

import java.util.Arrays;

/**
 * A fixed-capacity LIFO stack of 32-bit values.
 * <p>
 * The stack never grows beyond its capacity. Callers check {@link #isFull()} and
 * {@link #size()} first; {@link VmState} wraps this class with fault-reporting accessors.
 */
public final class OperandStack {

    private final int[] values;
    private int sp;

    public OperandStack(int capacity) {
        this.values = new int[capacity];
    }

    public int capacity() {
        return values.length;
    }

    /**
     * @return The stack pointer, i.e. the index of the next free slot and the current depth.
     */
    public int size() {
        return sp;
    }

    public boolean isEmpty() {
        return sp == 0;
    }

    public boolean isFull() {
        return sp == values.length;
    }

    void push(int value) {
        if (isFull()) {
            throw new IllegalStateException("Operand stack is full");
        }
        values[sp++] = value;
    }

    int pop() {
        if (isEmpty()) {
            throw new IllegalStateException("Operand stack is empty");
        }
        return values[--sp];
    }

    /**
     * Returns a value below the top without removing it.
     * @param depth 0 for the top of stack, 1 for the entry below it, and so on.
     * @return The value.
     */
    public int peek(int depth) {
        int index = sp - 1 - depth;
        if (index < 0 || index >= sp) {
            throw new IllegalStateException("No stack entry at depth " + depth);
        }
        return values[index];
    }

    /**
     * Returns the value at an absolute index, 0 being the bottom of the stack.
     * @param index The index in {@code [0, size())}.
     * @return The value.
     */
    public int get(int index) {
        if (index < 0 || index >= sp) {
            throw new IndexOutOfBoundsException("Stack index " + index + " outside [0, " + sp + ")");
        }
        return values[index];
    }

    /**
     * @return The live entries, bottom first.
     */
    public int[] toArray() {
        return Arrays.copyOf(values, sp);
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray());
    }
}
