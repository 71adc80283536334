package de.bsommerfeld.addons.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import de.bsommerfeld.addons.core.domain.BootPolicy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The user-controlled part of an installed addon.
 *
 * @param options option overrides, merged over the definition's defaults
 * @param version the installed version
 * @param boot    boot policy override, {@code null} to follow the definition
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserHalf(Map<String, Object> options, String version, BootPolicy boot) {

    public UserHalf {
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    /** State right after an install: no overrides. */
    public static UserHalf fresh(String version) {
        return new UserHalf(Map.of(), version, null);
    }

    public UserHalf withOptions(Map<String, Object> options) {
        return new UserHalf(options, version, boot);
    }

    public UserHalf withVersion(String version) {
        return new UserHalf(options, version, boot);
    }

    public UserHalf withBoot(BootPolicy boot) {
        return new UserHalf(options, version, boot);
    }
}
