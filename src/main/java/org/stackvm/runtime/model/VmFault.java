package org.stackvm.runtime.model;

/**
 * Describes the fault that stopped a virtual machine.
 *
 * @param kind               The fault category.
 * @param instructionAddress The address of the instruction that faulted.
 * @param pc                 The program counter at the time of the fault.
 * @param sp                 The operand stack pointer at the time of the fault.
 * @param fp                 The frame pointer (index of the active frame, -1 if none).
 * @param detail             A human-readable detail, e.g. the offending index.
 */
public record VmFault(
        FaultKind kind,
        int instructionAddress,
        int pc,
        int sp,
        int fp,
        String detail
) {

    @Override
    public String toString() {
        return String.format("VM Error at PC=%d: %s%s (SP=%d, FP=%d)",
                pc, kind.description(), detail == null || detail.isEmpty() ? "" : " - " + detail, sp, fp);
    }
}
