package org.stackvm.runtime;

/**
 * Provides the default capacities of the virtual machine and the assembler.
 * This final class contains static constants only. It is not meant to be instantiated.
 * Runtime overrides are read from HOCON configuration by {@link VmLimits}.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * The maximum depth of the operand stack.
     */
    public static final int STACK_CAPACITY = 256;

    /**
     * The maximum depth of the call stack, preventing unbounded recursion.
     */
    public static final int CALL_STACK_CAPACITY = 64;

    /**
     * The number of local variable slots in each call frame.
     */
    public static final int LOCALS_PER_FRAME = 16;

    /**
     * The number of global variable slots.
     */
    public static final int GLOBALS_SIZE = 256;

    /**
     * The maximum size of a bytecode program in bytes.
     */
    public static final int CODE_CAPACITY = 4096;

    /**
     * The maximum number of labels a single assembly source may define.
     */
    public static final int MAX_LABELS = 256;

    /**
     * The maximum number of stack entries shown by a stack dump.
     */
    public static final int STACK_DUMP_LIMIT = 10;
}
