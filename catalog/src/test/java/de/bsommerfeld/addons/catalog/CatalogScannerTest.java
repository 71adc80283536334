package de.bsommerfeld.addons.catalog;

import de.bsommerfeld.addons.core.config.AddonPaths;
import de.bsommerfeld.addons.core.domain.AddonDefinition;
import de.bsommerfeld.addons.core.domain.QualifiedSlug;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Scans real folder layouts: built-in folders, external repositories with and
 * without a repository file, broken definitions and duplicate slugs.
 */
class CatalogScannerTest {

    @TempDir
    Path root;

    private AddonPaths paths;
    private CatalogScanner scanner;

    @BeforeEach
    void setUp() {
        paths = new AddonPaths(root.resolve("core"), root.resolve("local"), root.resolve("git"),
                root.resolve("data"), root.resolve("data"), root.resolve("addons.json"));
        scanner = new CatalogScanner(paths, new HashedRepositorySlugResolver(), new BuiltinRepositories());
    }

    static void writeAddon(Path dir, String slug, String version) throws IOException {
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(CatalogScanner.DEFINITION_FILE), """
                {
                  "name": "%s addon",
                  "version": "%s",
                  "slug": "%s",
                  "description": "test addon",
                  "startup": "after",
                  "boot": "auto",
                  "options": {},
                  "schema": {}
                }
                """.formatted(slug, version, slug));
    }

    static void writeRepository(Path dir, String name) throws IOException {
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(CatalogScanner.REPOSITORY_FILE), "{\"name\": \"" + name + "\"}");
    }

    @Test
    void scan_shouldReturnEmptyCatalogWhenRootsAreMissing() {
        ScanResult result = scanner.scan();

        assertEquals(0, result.catalog().size());
        assertEquals(0, result.repositories().size());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void scan_shouldTagBuiltinFolders() throws IOException {
        writeAddon(paths.coreAddons().resolve("ssh"), "ssh", "1.0");
        writeAddon(paths.localAddons().resolve("web"), "web", "0.1");

        ScanResult result = scanner.scan();

        AddonDefinition ssh = result.catalog().get(new QualifiedSlug("core", "ssh"));
        assertNotNull(ssh);
        assertEquals("core", ssh.repository());
        assertEquals(paths.coreAddons().resolve("ssh").toString(), ssh.location());
        assertTrue(result.catalog().contains(new QualifiedSlug("local", "web")));
    }

    @Test
    void scan_shouldFindDefinitionsAtAnyDepth() throws IOException {
        writeAddon(paths.localAddons().resolve("group/nested/deep"), "deep", "1.0");

        ScanResult result = scanner.scan();
        assertTrue(result.catalog().contains(new QualifiedSlug("local", "deep")));
    }

    @Test
    void scan_shouldCountOnlyValidDefinitions() throws IOException {
        writeAddon(paths.coreAddons().resolve("a"), "a", "1");
        writeAddon(paths.coreAddons().resolve("b"), "b", "1");
        Path broken = paths.coreAddons().resolve("broken");
        Files.createDirectories(broken);
        Files.writeString(broken.resolve(CatalogScanner.DEFINITION_FILE), "{ \"name\": ");
        Path invalid = paths.coreAddons().resolve("invalid");
        Files.createDirectories(invalid);
        Files.writeString(invalid.resolve(CatalogScanner.DEFINITION_FILE), "{\"name\": \"x\"}");

        ScanResult result = scanner.scan();

        assertEquals(2, result.catalog().size());
        assertEquals(2, result.warnings().size());
        assertEquals(broken.resolve(CatalogScanner.DEFINITION_FILE), result.warnings().get(0).source());
    }

    @Test
    void scan_shouldSkipUnwalkableEntryAndKeepSiblings() throws IOException {
        writeAddon(paths.coreAddons().resolve("ssh"), "ssh", "1.0");
        Path cycle = paths.coreAddons().resolve("zz-cycle");
        Files.createSymbolicLink(cycle, paths.coreAddons());
        writeAddon(paths.localAddons().resolve("web"), "web", "0.1");

        ScanResult result = scanner.scan();

        assertTrue(result.catalog().contains(new QualifiedSlug("core", "ssh")));
        assertTrue(result.catalog().contains(new QualifiedSlug("local", "web")));
        assertEquals(2, result.catalog().size());
        assertEquals(1, result.warnings().size());
        assertEquals(cycle, result.warnings().get(0).source());
    }

    @Test
    void scan_shouldLetLaterDuplicateWin() throws IOException {
        writeAddon(paths.localAddons().resolve("a-first"), "dup", "1.0");
        writeAddon(paths.localAddons().resolve("b-second"), "dup", "2.0");

        ScanResult result = scanner.scan();

        assertEquals(1, result.catalog().size());
        assertEquals("2.0", result.catalog().get(new QualifiedSlug("local", "dup")).version());
    }

    @Test
    void scan_shouldKeepSameSlugFromDifferentRepositoriesApart() throws IOException {
        writeAddon(paths.coreAddons().resolve("ssh"), "ssh", "1.0");
        writeAddon(paths.localAddons().resolve("ssh"), "ssh", "9.0");

        ScanResult result = scanner.scan();
        assertEquals(2, result.catalog().size());
    }

    @Test
    void scan_shouldReadExternalRepository() throws IOException {
        Path repo = paths.repositories().resolve("5c53de3b");
        writeRepository(repo, "Community");
        writeAddon(repo.resolve("mqtt"), "mqtt", "3.1");

        ScanResult result = scanner.scan();

        assertTrue(result.catalog().contains(new QualifiedSlug("5c53de3b", "mqtt")));
        assertEquals("Community", result.repositories().get("5c53de3b").name());
    }

    @Test
    void scan_shouldSkipRepositoryWithoutRepositoryFile() throws IOException {
        Path repo = paths.repositories().resolve("deadbeef");
        writeAddon(repo.resolve("mqtt"), "mqtt", "3.1");

        ScanResult result = scanner.scan();

        assertEquals(0, result.catalog().size());
        assertNull(result.repositories().get("deadbeef"));
        assertEquals(1, result.warnings().size());
        assertEquals(repo, result.warnings().get(0).source());
    }

    @Test
    void scan_shouldSkipRepositoryWithInvalidRepositoryFile() throws IOException {
        Path repo = paths.repositories().resolve("deadbeef");
        Files.createDirectories(repo);
        Files.writeString(repo.resolve(CatalogScanner.REPOSITORY_FILE), "{\"url\": \"x\"}");
        writeAddon(repo.resolve("mqtt"), "mqtt", "3.1");

        ScanResult result = scanner.scan();

        assertEquals(0, result.catalog().size());
        assertEquals(1, result.warnings().size());
    }

    @Test
    void scan_shouldListBuiltinRepositoriesOnlyWhenTheyContributeAddons() throws IOException {
        writeAddon(paths.coreAddons().resolve("ssh"), "ssh", "1.0");
        Files.createDirectories(paths.localAddons());

        ScanResult result = scanner.scan();

        assertNotNull(result.repositories().get("core"));
        assertNull(result.repositories().get("local"));
    }

    @Test
    void scan_shouldSkipRepositoryWithInvalidTag() throws IOException {
        scanner = new CatalogScanner(paths, dir -> "bad_tag", new BuiltinRepositories());
        Path repo = paths.repositories().resolve("whatever");
        writeRepository(repo, "Community");
        writeAddon(repo.resolve("mqtt"), "mqtt", "3.1");

        ScanResult result = scanner.scan();

        assertEquals(0, result.catalog().size());
        assertEquals(1, result.warnings().size());
    }

    @Test
    void scan_shouldBuildNewCatalogEachTime() throws IOException {
        writeAddon(paths.coreAddons().resolve("ssh"), "ssh", "1.0");
        Catalog first = scanner.scan().catalog();

        Files.delete(paths.coreAddons().resolve("ssh").resolve(CatalogScanner.DEFINITION_FILE));
        Catalog second = scanner.scan().catalog();

        assertEquals(1, first.size());
        assertEquals(0, second.size());
    }
}
