package de.bsommerfeld.addons.catalog;

import de.bsommerfeld.addons.core.util.HashUtil;

import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Default tag rule: checkouts live in directories named after the first
 * eight hex characters of the SHA-1 of the repository URL. A directory that
 * already has such a name is used as-is; any other name is hashed the same
 * way.
 */
public class HashedRepositorySlugResolver implements RepositorySlugResolver {

    private static final Pattern HASH = Pattern.compile("^[0-9a-f]{8}$");
    private static final int LENGTH = 8;

    @Override
    public String resolve(Path repositoryDir) {
        String name = repositoryDir.getFileName().toString();
        if (HASH.matcher(name).matches()) {
            return name;
        }
        return hash(name);
    }

    /** Hashes a repository URL or name into its tag. */
    public static String hash(String repository) {
        return HashUtil.sha1(repository.toLowerCase(Locale.ENGLISH)).substring(0, LENGTH);
    }
}
