package de.bsommerfeld.addons.catalog;

import java.nio.file.Path;

/**
 * A file or repository that a scan had to skip.
 *
 * @param source  the definition file or repository directory
 * @param message why it was skipped
 */
public record ScanWarning(Path source, String message) {
}
