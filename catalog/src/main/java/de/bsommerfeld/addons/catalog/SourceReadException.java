package de.bsommerfeld.addons.catalog;

import java.nio.file.Path;

/**
 * Thrown when a definition, repository or bundled file cannot be read or is
 * not valid JSON.
 */
public class SourceReadException extends Exception {

    private final Path source;

    public SourceReadException(Path source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /** The offending file, {@code null} for classpath resources. */
    public Path getSource() {
        return source;
    }
}
