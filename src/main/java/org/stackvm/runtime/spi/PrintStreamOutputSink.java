package org.stackvm.runtime.spi;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Writer;

/**
 * An {@link OutputSink} backed by a {@link PrintWriter}, e.g. {@code System.out}
 * or the writer picocli hands to a command.
 */
public class PrintStreamOutputSink implements OutputSink {

    private final PrintWriter out;

    public PrintStreamOutputSink(PrintStream stream) {
        this(new PrintWriter(stream, true));
    }

    public PrintStreamOutputSink(Writer writer) {
        this.out = writer instanceof PrintWriter pw ? pw : new PrintWriter(writer, true);
    }

    @Override
    public void write(String text) {
        out.print(text);
    }

    @Override
    public void write(char c) {
        out.print(c);
    }

    @Override
    public void flush() {
        out.flush();
    }
}
