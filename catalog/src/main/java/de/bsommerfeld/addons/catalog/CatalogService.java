package de.bsommerfeld.addons.catalog;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.addons.core.event.AddonEventBus;
import de.bsommerfeld.addons.core.event.AddonEvents;

import java.util.List;

/**
 * Holds the catalog and repository registry of the most recent scan. Until
 * the first {@link #rescan()} both are empty.
 */
@Singleton
public class CatalogService {

    private final CatalogScanner scanner;
    private final AddonEventBus eventBus;

    private ScanResult current = ScanResult.empty();

    @Inject
    public CatalogService(CatalogScanner scanner, AddonEventBus eventBus) {
        this.scanner = scanner;
        this.eventBus = eventBus;
    }

    /**
     * Scans all addon folders and replaces the current catalog and registry
     * with the result.
     */
    public ScanResult rescan() {
        ScanResult result = scanner.scan();
        current = result;
        eventBus.post(new AddonEvents.CatalogRefreshedEvent(
                result.catalog().size(), result.repositories().size(), result.warnings().size()));
        return result;
    }

    public Catalog catalog() {
        return current.catalog();
    }

    public RepositoryRegistry repositories() {
        return current.repositories();
    }

    public List<ScanWarning> lastWarnings() {
        return current.warnings();
    }
}
