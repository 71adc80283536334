package de.bsommerfeld.addons.catalog;

import de.bsommerfeld.addons.core.domain.AddonDefinition;
import de.bsommerfeld.addons.core.domain.BootPolicy;
import de.bsommerfeld.addons.core.domain.QualifiedSlug;
import de.bsommerfeld.addons.core.domain.RepositoryRecord;
import de.bsommerfeld.addons.core.domain.StartupClass;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RepositoryRegistryTest {

    private static final Map<String, RepositoryRecord> BUILTIN = Map.of(
            "core", new RepositoryRecord("core", "Built-in Addons", null, null),
            "local", new RepositoryRecord("local", "Local Addons", null, null));

    private static Catalog catalogWith(String repository, String slug) {
        AddonDefinition def = new AddonDefinition(slug, slug, "d", "1", StartupClass.AFTER, BootPolicy.AUTO,
                null, null, null, null, null, null, null, null, null, repository, "/x");
        return new Catalog(Map.of(new QualifiedSlug(repository, slug), def));
    }

    @Test
    void build_shouldAddBuiltinOnlyForContributingTags() {
        RepositoryRegistry registry = RepositoryRegistry.build(Map.of(), catalogWith("local", "web"), BUILTIN);

        assertEquals(1, registry.size());
        assertEquals("Local Addons", registry.get("local").name());
        assertNull(registry.get("core"));
    }

    @Test
    void build_shouldKeepExternalRepositoriesWithoutAddons() {
        RepositoryRecord external = new RepositoryRecord("5c53de3b", "Community", "https://example.org", "Jane");
        RepositoryRegistry registry = RepositoryRegistry.build(Map.of("5c53de3b", external), Catalog.empty(), BUILTIN);

        assertEquals(1, registry.list().size());
        assertTrue(registry.contains("5c53de3b"));
    }

    @Test
    void build_shouldSurviveMissingBuiltinTable() {
        RepositoryRegistry registry = RepositoryRegistry.build(Map.of(), catalogWith("core", "ssh"), Map.of());
        assertEquals(0, registry.size());
    }

    @Test
    void list_shouldNotExposeInternalState() {
        RepositoryRegistry registry = RepositoryRegistry.build(Map.of(), catalogWith("core", "ssh"), BUILTIN);

        registry.list().clear();
        assertEquals(1, registry.size());
    }
}
