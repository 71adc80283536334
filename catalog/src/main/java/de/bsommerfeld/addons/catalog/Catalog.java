package de.bsommerfeld.addons.catalog;

import de.bsommerfeld.addons.core.domain.AddonDefinition;
import de.bsommerfeld.addons.core.domain.QualifiedSlug;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The addons currently available from all repositories, as found by one
 * scan. Immutable. A new scan builds a new catalog and replaces the old one
 * as a whole; nothing is merged incrementally.
 */
public final class Catalog {

    private static final Catalog EMPTY = new Catalog(Map.of());

    private final Map<QualifiedSlug, AddonDefinition> addons;

    public Catalog(Map<QualifiedSlug, AddonDefinition> addons) {
        this.addons = Collections.unmodifiableMap(new LinkedHashMap<>(addons));
    }

    public static Catalog empty() {
        return EMPTY;
    }

    /** Returns the definition for {@code slug}, or {@code null} if the catalog has none. */
    public AddonDefinition get(QualifiedSlug slug) {
        return addons.get(slug);
    }

    public boolean contains(QualifiedSlug slug) {
        return addons.containsKey(slug);
    }

    /** True if at least one addon comes from the given repository. */
    public boolean hasRepository(String repository) {
        return addons.keySet().stream().anyMatch(slug -> slug.repository().equals(repository));
    }

    public Set<QualifiedSlug> slugs() {
        return addons.keySet();
    }

    public Collection<AddonDefinition> definitions() {
        return addons.values();
    }

    public int size() {
        return addons.size();
    }
}
