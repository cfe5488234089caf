package org.stackvm.runtime.model;

/**
 * The run-time error conditions that stop the virtual machine.
 */
public enum FaultKind {
    STACK_OVERFLOW("Stack overflow"),
    STACK_UNDERFLOW("Stack underflow"),
    CALL_STACK_OVERFLOW("Call stack overflow"),
    CALL_STACK_UNDERFLOW("Call stack underflow"),
    INVALID_OPCODE("Invalid opcode"),
    DIVISION_BY_ZERO("Division by zero"),
    OUT_OF_BOUNDS("Array index out of bounds"),
    INVALID_ADDRESS("Invalid memory address");

    private final String description;

    FaultKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
