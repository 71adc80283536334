package de.bsommerfeld.addons.core.domain;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A host folder an addon wants mounted, with its access mode.
 *
 * @param path the folder as written in the definition
 * @param mode {@link #READ_ONLY} or {@link #READ_WRITE}
 */
public record VolumeMapping(String path, String mode) {

    public static final String READ_ONLY = "ro";
    public static final String READ_WRITE = "rw";

    /**
     * Grammar of a {@code map} directive: {@code path[:mode]}. Definition
     * validation uses the same pattern, so {@link #parse} only ever sees
     * directives that match.
     */
    public static final Pattern DIRECTIVE = Pattern.compile("^([^:]+)(?::(rw|ro))?$");

    /**
     * Parses a single directive. A missing mode means read-only.
     *
     * @throws IllegalArgumentException if the directive does not match {@link #DIRECTIVE}
     */
    public static VolumeMapping parse(String directive) {
        Matcher matcher = DIRECTIVE.matcher(directive);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Malformed volume directive: '" + directive + "'");
        }
        String mode = matcher.group(2);
        return new VolumeMapping(matcher.group(1), mode != null ? mode : READ_ONLY);
    }

    public boolean isWritable() {
        return READ_WRITE.equals(mode);
    }
}
