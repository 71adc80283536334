package de.bsommerfeld.addons.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Inject;
import de.bsommerfeld.addons.core.config.AddonPaths;
import de.bsommerfeld.addons.core.domain.AddonDefinition;
import de.bsommerfeld.addons.core.domain.QualifiedSlug;
import de.bsommerfeld.addons.core.domain.RepositoryRecord;
import de.bsommerfeld.addons.core.util.JsonFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a fresh {@link Catalog} from the addon folders on disk.
 *
 * <h3>Scan order</h3>
 * <ol>
 * <li>the core addons folder, tagged {@code core}</li>
 * <li>the local addons folder, tagged {@code local}</li>
 * <li>every subdirectory of the repositories root, tagged by the
 * {@link RepositorySlugResolver}</li>
 * </ol>
 * Within a folder, {@code config.json} files are collected at any depth and
 * visited in sorted path order. A definition whose qualified slug was already
 * seen replaces the earlier one.
 *
 * <h3>Failure handling</h3>
 * A definition that cannot be read or fails validation is skipped and
 * reported as a {@link ScanWarning}; the rest of the scan continues. An
 * external repository without a valid {@code repository.json} is skipped as
 * a whole. A directory that cannot be listed, or a link cycle, is reported
 * and skipped without affecting its siblings. Missing roots contribute
 * nothing.
 */
public class CatalogScanner {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogScanner.class);

    static final String DEFINITION_FILE = "config.json";
    static final String REPOSITORY_FILE = "repository.json";

    private final AddonPaths paths;
    private final RepositorySlugResolver slugResolver;
    private final BuiltinRepositories builtinRepositories;

    @Inject
    public CatalogScanner(AddonPaths paths, RepositorySlugResolver slugResolver,
            BuiltinRepositories builtinRepositories) {
        this.paths = paths;
        this.slugResolver = slugResolver;
        this.builtinRepositories = builtinRepositories;
    }

    public ScanResult scan() {
        Map<QualifiedSlug, AddonDefinition> addons = new LinkedHashMap<>();
        Map<String, RepositoryRecord> external = new LinkedHashMap<>();
        List<ScanWarning> warnings = new ArrayList<>();

        scanFolder(paths.coreAddons(), BuiltinRepositories.CORE, addons, warnings);
        scanFolder(paths.localAddons(), BuiltinRepositories.LOCAL, addons, warnings);

        for (Path repositoryDir : listRepositories(warnings)) {
            RepositoryRecord record = readRepository(repositoryDir, warnings);
            if (record != null) {
                external.put(record.slug(), record);
                scanFolder(repositoryDir, record.slug(), addons, warnings);
            }
        }

        Catalog catalog = new Catalog(addons);
        RepositoryRegistry registry = RepositoryRegistry.build(external, catalog, loadBuiltins());
        LOG.info("Scan finished: {} addons from {} repositories, {} warnings",
                catalog.size(), registry.size(), warnings.size());
        return new ScanResult(catalog, registry, warnings);
    }

    private void scanFolder(Path root, String repository, Map<QualifiedSlug, AddonDefinition> addons,
            List<ScanWarning> warnings) {
        if (!Files.isDirectory(root)) {
            LOG.debug("Addon folder {} does not exist, skipping", root);
            return;
        }

        List<Path> files = collectDefinitionFiles(root, warnings);
        if (files == null) {
            return;
        }

        for (Path file : files) {
            AddonDefinition definition;
            try {
                definition = readDefinition(file);
            } catch (SourceReadException e) {
                warn(warnings, file, e.getMessage());
                continue;
            } catch (SchemaValidationException e) {
                warn(warnings, file, "Invalid addon definition: " + e.getMessage());
                continue;
            }

            AddonDefinition located = definition.withSource(repository, file.getParent().toString());
            AddonDefinition previous = addons.put(located.qualifiedSlug(), located);
            if (previous != null) {
                LOG.debug("Addon {} from {} replaces the one from {}",
                        located.qualifiedSlug(), located.location(), previous.location());
            }
        }
    }

    private List<Path> listRepositories(List<ScanWarning> warnings) {
        Path root = paths.repositories();
        if (!Files.isDirectory(root)) {
            LOG.debug("Repositories folder {} does not exist, skipping", root);
            return List.of();
        }
        List<Path> directories = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root, Files::isDirectory)) {
            entries.forEach(directories::add);
        } catch (IOException | DirectoryIteratorException e) {
            warn(warnings, root, "Failed to list repositories: " + e.getMessage());
            return List.of();
        }
        Collections.sort(directories);
        return directories;
    }

    /**
     * Walks {@code root} following links. Entries that cannot be visited,
     * such as unreadable directories or link cycles, are reported and skipped.
     *
     * @return the sorted definition files, or {@code null} if the root itself
     *         could not be walked
     */
    private List<Path> collectDefinitionFiles(Path root, List<ScanWarning> warnings) {
        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE,
                    new SimpleFileVisitor<>() {
                        @Override
                        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                            if (attrs.isRegularFile() && DEFINITION_FILE.equals(file.getFileName().toString())) {
                                files.add(file);
                            }
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFileFailed(Path file, IOException e) {
                            warn(warnings, file, "Failed to visit: " + e);
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult postVisitDirectory(Path dir, IOException e) {
                            if (e != null) {
                                warn(warnings, dir, "Failed to list directory: " + e);
                            }
                            return FileVisitResult.CONTINUE;
                        }
                    });
        } catch (IOException e) {
            warn(warnings, root, "Failed to list addon folder: " + e.getMessage());
            return null;
        }
        Collections.sort(files);
        return files;
    }

    private RepositoryRecord readRepository(Path repositoryDir, List<ScanWarning> warnings) {
        String tag = slugResolver.resolve(repositoryDir);
        if (tag == null || tag.isEmpty() || tag.indexOf('_') >= 0) {
            warn(warnings, repositoryDir, "Invalid repository tag '" + tag + "'");
            return null;
        }

        Path file = repositoryDir.resolve(REPOSITORY_FILE);
        if (!Files.isRegularFile(file)) {
            warn(warnings, repositoryDir, "Repository skipped: no " + REPOSITORY_FILE);
            return null;
        }
        try {
            return RepositoryConfigSchema.parse(JsonFiles.readTree(file), tag);
        } catch (IOException e) {
            warn(warnings, repositoryDir, "Repository skipped: failed to read " + REPOSITORY_FILE + ": " + e.getMessage());
        } catch (SchemaValidationException e) {
            warn(warnings, repositoryDir, "Repository skipped: invalid " + REPOSITORY_FILE + ": " + e.getMessage());
        }
        return null;
    }

    private AddonDefinition readDefinition(Path file) throws SourceReadException, SchemaValidationException {
        JsonNode node;
        try {
            node = JsonFiles.readTree(file);
        } catch (IOException e) {
            throw new SourceReadException(file, "Failed to read addon definition: " + e.getMessage(), e);
        }
        return AddonDefinitionSchema.parse(node);
    }

    private Map<String, RepositoryRecord> loadBuiltins() {
        try {
            return builtinRepositories.load();
        } catch (SourceReadException e) {
            LOG.warn("Built-in repositories unavailable: {}", e.getMessage());
            return Map.of();
        }
    }

    private static void warn(List<ScanWarning> warnings, Path source, String message) {
        LOG.warn("{}: {}", source, message);
        warnings.add(new ScanWarning(source, message));
    }
}
