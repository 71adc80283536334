package de.bsommerfeld.addons.catalog;

import java.util.List;

/**
 * Everything one scan produced.
 *
 * @param catalog      the addons found
 * @param repositories repositories that contributed to {@code catalog}
 * @param warnings     files and repositories that were skipped, in scan order
 */
public record ScanResult(Catalog catalog, RepositoryRegistry repositories, List<ScanWarning> warnings) {

    public ScanResult {
        warnings = List.copyOf(warnings);
    }

    public static ScanResult empty() {
        return new ScanResult(Catalog.empty(), RepositoryRegistry.empty(), List.of());
    }
}
