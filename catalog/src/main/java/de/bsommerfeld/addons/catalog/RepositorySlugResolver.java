package de.bsommerfeld.addons.catalog;

import java.nio.file.Path;

/**
 * Derives the repository tag of an external repository from the directory
 * it was checked out into. The tag must not contain an underscore.
 */
@FunctionalInterface
public interface RepositorySlugResolver {

    String resolve(Path repositoryDir);
}
