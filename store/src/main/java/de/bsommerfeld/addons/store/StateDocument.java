package de.bsommerfeld.addons.store;

import de.bsommerfeld.addons.core.domain.AddonDefinition;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * On-disk shape of the installed state. Both maps are keyed by the
 * {@code <repository>_<slug>} form.
 *
 * <pre>
 * {
 *   "user":   { "core_ssh": { "options": {...}, "version": "1.2", "boot": "manual" } },
 *   "system": { "core_ssh": { ...definition... } }
 * }
 * </pre>
 */
public record StateDocument(Map<String, UserHalf> user, Map<String, AddonDefinition> system) {

    public StateDocument {
        user = user == null ? new LinkedHashMap<>() : new LinkedHashMap<>(user);
        system = system == null ? new LinkedHashMap<>() : new LinkedHashMap<>(system);
    }

    public static StateDocument empty() {
        return new StateDocument(null, null);
    }
}
