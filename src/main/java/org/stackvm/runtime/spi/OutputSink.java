package org.stackvm.runtime.spi;

/**
 * Receives the text a program prints, as well as debug and trace output.
 */
public interface OutputSink {

    /**
     * Writes text without a trailing line break.
     * @param text The text to write.
     */
    void write(String text);

    /**
     * Writes a single character.
     * @param c The character.
     */
    default void write(char c) {
        write(String.valueOf(c));
    }

    /**
     * Flushes buffered output, if any.
     */
    default void flush() {
    }
}
