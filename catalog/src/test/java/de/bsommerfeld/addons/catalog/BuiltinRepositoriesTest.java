package de.bsommerfeld.addons.catalog;

import de.bsommerfeld.addons.core.domain.RepositoryRecord;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinRepositoriesTest {

    @Test
    void load_shouldReadBundledTable() throws SourceReadException {
        Map<String, RepositoryRecord> records = new BuiltinRepositories().load();

        assertEquals("Built-in Addons", records.get(BuiltinRepositories.CORE).name());
        assertEquals("Local Addons", records.get(BuiltinRepositories.LOCAL).name());
        assertEquals(BuiltinRepositories.CORE, records.get(BuiltinRepositories.CORE).slug());
    }

    @Test
    void load_shouldCacheResult() throws SourceReadException {
        BuiltinRepositories builtins = new BuiltinRepositories();
        assertSame(builtins.load(), builtins.load());
    }

    @Test
    void load_shouldFailForMissingResource() {
        BuiltinRepositories builtins = new BuiltinRepositories("does-not-exist.json");
        assertThrows(SourceReadException.class, builtins::load);
    }

    @Test
    void load_shouldFailForInvalidRecord() {
        BuiltinRepositories builtins = new BuiltinRepositories("builtin-invalid.json");

        SourceReadException e = assertThrows(SourceReadException.class, builtins::load);
        assertTrue(e.getMessage().contains("core"));
    }
}
