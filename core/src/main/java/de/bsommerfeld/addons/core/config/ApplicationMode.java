package de.bsommerfeld.addons.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running mode of the store. In {@link #TEST} mode all roots default to a
 * throwaway directory so nothing touches the real installed state.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    public static final String PROPERTY = "addons.mode";
    public static final String ENV = "ADDONS_MODE";

    /** Reads {@code addons.mode}, then {@code ADDONS_MODE}. */
    public static ApplicationMode get() {
        return resolve(System.getProperty(PROPERTY), System.getenv(ENV));
    }

    /**
     * The system property wins over the environment when both are set. Blank
     * or unknown values resolve to PROD.
     */
    static ApplicationMode resolve(String property, String environment) {
        String value = isBlank(property) ? environment : property;
        if (isBlank(value)) {
            return PROD;
        }
        for (ApplicationMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        LOG.warn("Unknown store mode '{}', using PROD", value);
        return PROD;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public boolean isTest() {
        return this == TEST;
    }
}
