package de.bsommerfeld.addons.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether an installed addon is started automatically with the system or
 * only on explicit request.
 */
public enum BootPolicy {

    AUTO("auto"),
    MANUAL("manual");

    private final String value;

    BootPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolves the wire value used in definition and state documents.
     *
     * @throws IllegalArgumentException if the value is not a known policy
     */
    @JsonCreator
    public static BootPolicy fromValue(String value) {
        for (BootPolicy policy : values()) {
            if (policy.value.equals(value)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown boot policy: " + value);
    }
}
