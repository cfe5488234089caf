package org.stackvm.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The demonstration programs bundled as classpath resources under {@code programs/}, declared in listing order.
 */
public enum SampleProgram {
    FACTORIAL("factorial", "Recursive Factorial", "Recursive factorial (10!)"),
    FIBONACCI("fibonacci", "Fibonacci Sequence", "Fibonacci sequence (first 15 numbers)"),
    NESTED("nested", "Nested Function Calls", "Nested function call demo"),
    ARITHMETIC("arithmetic", "Arithmetic Demo", "Arithmetic operations demo");

    private static final List<SampleProgram> DEMO_ORDER = List.of(ARITHMETIC, FACTORIAL, FIBONACCI, NESTED);

    private final String id;
    private final String title;
    private final String description;

    SampleProgram(String id, String title, String description) {
        this.id = id;
        this.title = title;
        this.description = description;
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public String resourcePath() {
        return "programs/" + id + ".asm";
    }

    /**
     * Loads the assembly source of this program.
     * @return The source text.
     * @throws UncheckedIOException if the resource is missing or unreadable.
     */
    public String source() {
        try (InputStream in = SampleProgram.class.getClassLoader().getResourceAsStream(resourcePath())) {
            if (in == null) {
                throw new UncheckedIOException(new IOException("Missing program resource: " + resourcePath()));
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read program resource: " + resourcePath(), e);
        }
    }

    /**
     * @param id The program name as typed on the command line, case-insensitive.
     * @return The program, if one has that name.
     */
    public static Optional<SampleProgram> byId(String id) {
        return Arrays.stream(values()).filter(p -> p.id.equalsIgnoreCase(id)).findFirst();
    }

    /**
     * @return Every program in the order {@code run all} executes them, the arithmetic demo first.
     */
    public static List<SampleProgram> demoOrder() {
        return DEMO_ORDER;
    }
}
