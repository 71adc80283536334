package de.bsommerfeld.addons.app;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Names;
import de.bsommerfeld.addons.catalog.HashedRepositorySlugResolver;
import de.bsommerfeld.addons.catalog.RepositorySlugResolver;
import de.bsommerfeld.addons.core.config.AddonPaths;
import de.bsommerfeld.addons.core.config.ApplicationMode;
import de.bsommerfeld.addons.core.config.StoreConfig;
import de.bsommerfeld.addons.core.config.StoreConfigLoader;
import de.bsommerfeld.addons.core.domain.Architecture;
import de.bsommerfeld.addons.core.util.StorageUtils;
import de.bsommerfeld.addons.store.AddonDataService;
import de.bsommerfeld.addons.store.StateFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Guice module wiring configuration, paths and the store services.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final Path baseDir;

    /** Uses the platform data directory, or a temporary one in TEST mode. */
    public AppModule() {
        this(null);
    }

    /**
     * @param baseDir directory holding {@code addon-store.json} and the
     *                default roots, {@code null} to resolve it from the mode
     */
    public AppModule(Path baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    protected void configure() {
        try {
            Path dataDir = baseDir != null ? baseDir : resolveBaseDir();
            Files.createDirectories(dataDir);

            StoreConfig config = StoreConfigLoader.load(dataDir);
            AddonPaths paths = config.toPaths(dataDir);
            String arch = config.getArch() != null ? config.getArch() : Architecture.detect();
            LOG.info("Addon store at {} (arch {})", dataDir, arch);

            bind(StoreConfig.class).toInstance(config);
            bind(AddonPaths.class).toInstance(paths);
            bindConstant().annotatedWith(Names.named(AddonDataService.ARCH)).to(arch);
            bind(RepositorySlugResolver.class).to(HashedRepositorySlugResolver.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load addon store configuration", e);
        }
    }

    @Provides
    @Singleton
    StateFile provideStateFile(AddonPaths paths) {
        return new StateFile(paths.stateFile());
    }

    private static Path resolveBaseDir() throws IOException {
        ApplicationMode mode = ApplicationMode.get();
        LOG.info("Application Mode initialized: {}", mode);
        if (mode.isTest()) {
            return Files.createTempDirectory(StorageUtils.APP_NAME + "-test");
        }
        return StorageUtils.getAppDataDir();
    }
}
