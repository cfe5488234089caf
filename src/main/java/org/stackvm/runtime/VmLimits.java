package org.stackvm.runtime;

/**
 * The capacities a virtual machine and its assembler operate with.
 *
 * @param stackCapacity     maximum operand stack depth
 * @param callStackCapacity maximum number of active call frames
 * @param localsPerFrame    local variable slots per frame (at most 256, they are addressed by one byte)
 * @param globals           number of global variable slots
 * @param codeCapacity      maximum program size in bytes
 * @param maxLabels         maximum number of labels per assembly source
 */
public record VmLimits(
        int stackCapacity,
        int callStackCapacity,
        int localsPerFrame,
        int globals,
        int codeCapacity,
        int maxLabels
) {

    /** The limits of the reference machine. */
    public static final VmLimits DEFAULTS = new VmLimits(
            Config.STACK_CAPACITY,
            Config.CALL_STACK_CAPACITY,
            Config.LOCALS_PER_FRAME,
            Config.GLOBALS_SIZE,
            Config.CODE_CAPACITY,
            Config.MAX_LABELS);

    private static final String VM_PATH = "stackvm.vm";
    private static final String ASSEMBLER_PATH = "stackvm.assembler";

    public VmLimits {
        requirePositive("stack-capacity", stackCapacity);
        requirePositive("call-stack-capacity", callStackCapacity);
        requirePositive("locals-per-frame", localsPerFrame);
        requirePositive("globals", globals);
        requirePositive("code-capacity", codeCapacity);
        requirePositive("max-labels", maxLabels);
        if (localsPerFrame > 256) {
            throw new IllegalArgumentException("locals-per-frame must not exceed 256, got " + localsPerFrame);
        }
    }

    /**
     * Reads the limits from a HOCON configuration. Missing keys fall back to {@link #DEFAULTS}.
     * <pre>
     * stackvm {
     *   vm { stack-capacity = 256, call-stack-capacity = 64, locals-per-frame = 16,
     *        globals = 256, code-capacity = 4096 }
     *   assembler { max-labels = 256 }
     * }
     * </pre>
     *
     * @param config The application configuration.
     * @return The resolved limits.
     * @throws IllegalArgumentException if a configured capacity is not positive.
     */
    public static VmLimits fromConfig(com.typesafe.config.Config config) {
        com.typesafe.config.Config vm = config.hasPath(VM_PATH)
                ? config.getConfig(VM_PATH)
                : com.typesafe.config.ConfigFactory.empty();
        com.typesafe.config.Config asm = config.hasPath(ASSEMBLER_PATH)
                ? config.getConfig(ASSEMBLER_PATH)
                : com.typesafe.config.ConfigFactory.empty();
        return new VmLimits(
                intOrDefault(vm, "stack-capacity", DEFAULTS.stackCapacity),
                intOrDefault(vm, "call-stack-capacity", DEFAULTS.callStackCapacity),
                intOrDefault(vm, "locals-per-frame", DEFAULTS.localsPerFrame),
                intOrDefault(vm, "globals", DEFAULTS.globals),
                intOrDefault(vm, "code-capacity", DEFAULTS.codeCapacity),
                intOrDefault(asm, "max-labels", DEFAULTS.maxLabels));
    }

    private static int intOrDefault(com.typesafe.config.Config config, String key, int fallback) {
        return config.hasPath(key) ? config.getInt(key) : fallback;
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }
}
