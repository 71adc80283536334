package de.bsommerfeld.addons.catalog;

import de.bsommerfeld.addons.core.domain.RepositoryRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Repositories that contributed to one catalog. Read-only once built.
 *
 * <p>
 * External repositories are listed when their {@code repository.json} was
 * accepted, even if they ship no valid addon. The built-in {@code core} and
 * {@code local} tags are listed only when the catalog holds at least one
 * addon from them, so an empty built-in repository is never advertised.
 */
public final class RepositoryRegistry {

    private static final RepositoryRegistry EMPTY = new RepositoryRegistry(Map.of());

    private final Map<String, RepositoryRecord> records;

    private RepositoryRegistry(Map<String, RepositoryRecord> records) {
        this.records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
    }

    public static RepositoryRegistry empty() {
        return EMPTY;
    }

    /**
     * @param external accepted external repositories keyed by tag
     * @param catalog  the catalog built in the same scan
     * @param builtin  bundled records for the built-in tags, empty if the
     *                 bundled table was unavailable
     */
    public static RepositoryRegistry build(Map<String, RepositoryRecord> external, Catalog catalog,
            Map<String, RepositoryRecord> builtin) {
        Map<String, RepositoryRecord> records = new LinkedHashMap<>();
        for (String tag : List.of(BuiltinRepositories.CORE, BuiltinRepositories.LOCAL)) {
            RepositoryRecord record = builtin.get(tag);
            if (record != null && catalog.hasRepository(tag)) {
                records.put(tag, record);
            }
        }
        records.putAll(external);
        return new RepositoryRegistry(records);
    }

    public List<RepositoryRecord> list() {
        return new ArrayList<>(records.values());
    }

    /** Returns the record for {@code slug}, or {@code null} if no such repository contributed. */
    public RepositoryRecord get(String slug) {
        return records.get(slug);
    }

    public boolean contains(String slug) {
        return records.containsKey(slug);
    }

    public int size() {
        return records.size();
    }
}
