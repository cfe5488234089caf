package org.stackvm.runtime.model;

/**
 * The lifecycle of one virtual machine run.
 */
public enum VmStatus {
    /** Created, not yet started. */
    IDLE,
    /** Inside the fetch-decode-execute loop. */
    RUNNING,
    /** Stopped normally (HALT, RET from the outermost routine, or end of code). */
    HALTED,
    /** Stopped by a fault; see {@link VmState#getFault()}. */
    FAULTED
}
