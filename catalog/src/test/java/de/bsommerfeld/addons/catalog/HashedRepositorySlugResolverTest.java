package de.bsommerfeld.addons.catalog;

import de.bsommerfeld.addons.core.util.HashUtil;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class HashedRepositorySlugResolverTest {

    private final HashedRepositorySlugResolver resolver = new HashedRepositorySlugResolver();

    @Test
    void resolve_shouldKeepHashNamedDirectory() {
        assertEquals("5c53de3b", resolver.resolve(Path.of("/addons/git/5c53de3b")));
    }

    @Test
    void resolve_shouldHashOtherNames() {
        String tag = resolver.resolve(Path.of("/addons/git/Community-Addons"));

        assertEquals(HashUtil.sha1("community-addons").substring(0, 8), tag);
        assertFalse(tag.contains("_"));
    }

    @Test
    void hash_shouldIgnoreCase() {
        assertEquals(HashedRepositorySlugResolver.hash("https://Example.org/Repo"),
                HashedRepositorySlugResolver.hash("https://example.org/repo"));
    }
}
