package org.stackvm.runtime.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.NoSuchElementException;
import java.util.OptionalInt;
import java.util.Scanner;

/**
 * Reads whitespace-separated integers from a stream, typically {@code System.in}.
 * A token that is not an integer is consumed and reported as empty, so a READ
 * instruction pushes its default value instead of blocking on the same token forever.
 */
public class ScannerInputSource implements InputSource {

    private static final Logger LOG = LoggerFactory.getLogger(ScannerInputSource.class);

    private final Scanner scanner;

    public ScannerInputSource(InputStream in) {
        this.scanner = new Scanner(in, StandardCharsets.UTF_8);
    }

    @Override
    public OptionalInt readInt() {
        try {
            if (scanner.hasNextInt()) {
                return OptionalInt.of(scanner.nextInt());
            }
            if (scanner.hasNext()) {
                String skipped = scanner.next();
                LOG.debug("Ignoring non-integer input token '{}'", skipped);
            }
        } catch (NoSuchElementException | IllegalStateException e) {
            LOG.debug("Input exhausted: {}", e.getMessage());
        }
        return OptionalInt.empty();
    }
}
