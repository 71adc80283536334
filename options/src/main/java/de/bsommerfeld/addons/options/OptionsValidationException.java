package de.bsommerfeld.addons.options;

/**
 * Thrown when user options do not satisfy an addon's option schema, or when
 * the schema itself cannot be compiled.
 */
public class OptionsValidationException extends Exception {

    private final String path;
    private final String expected;

    /**
     * @param path     dotted/indexed location of the offending value, e.g.
     *                 {@code users[2].name}
     * @param expected the type that was expected there, {@code null} if the
     *                 key itself is the problem
     * @param message  what went wrong
     */
    public OptionsValidationException(String path, String expected, String message) {
        super(format(path, expected, message));
        this.path = path;
        this.expected = expected;
    }

    public String getPath() {
        return path;
    }

    public String getExpected() {
        return expected;
    }

    private static String format(String path, String expected, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append("Option '").append(path).append("': ").append(message);
        if (expected != null) {
            sb.append(" (expected ").append(expected).append(')');
        }
        return sb.toString();
    }
}
