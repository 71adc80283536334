package de.bsommerfeld.addons.catalog;

/**
 * Thrown when a parsed definition or repository file violates its schema.
 */
public class SchemaValidationException extends Exception {

    private final String field;

    /**
     * @param field path of the offending field, e.g. {@code ports.80/tcp}
     */
    public SchemaValidationException(String field, String message) {
        super("'" + field + "': " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
