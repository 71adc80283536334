package de.bsommerfeld.addons.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The boot phase an addon belongs to. The container layer starts all
 * {@link BootPolicy#AUTO auto} addons of one class together.
 */
public enum StartupClass {

    /** Started before the main application comes up. */
    BEFORE("before"),
    /** Started once the main application is running. */
    AFTER("after"),
    /** Run-to-completion addons that are never kept alive. */
    ONCE("once");

    private final String value;

    StartupClass(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * @throws IllegalArgumentException if the value is not a known startup class
     */
    @JsonCreator
    public static StartupClass fromValue(String value) {
        for (StartupClass startup : values()) {
            if (startup.value.equals(value)) {
                return startup;
            }
        }
        throw new IllegalArgumentException("Unknown startup class: " + value);
    }
}
