package org.stackvm.runtime.spi;

import java.util.OptionalInt;

/**
 * Supplies integers to the READ instruction.
 */
public interface InputSource {

    /**
     * Reads the next integer. May block until input is available.
     * @return The integer, or empty if no valid integer could be read.
     */
    OptionalInt readInt();

    /**
     * An input source that never yields a value.
     */
    InputSource EMPTY = OptionalInt::empty;
}
