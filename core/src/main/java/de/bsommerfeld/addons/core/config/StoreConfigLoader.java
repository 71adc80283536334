package de.bsommerfeld.addons.core.config;

import de.bsommerfeld.addons.core.util.JsonFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Loads {@link StoreConfig} from disk. A missing file is created with the
 * defaults so users have something to edit. After loading, every key can be
 * overridden by a system property {@code addons.<key>}, e.g.
 * {@code -Daddons.arch=aarch64}.
 */
public final class StoreConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(StoreConfigLoader.class);

    public static final String FILE_NAME = "addon-store.json";
    private static final String PROPERTY_PREFIX = "addons.";

    private static final Map<String, BiConsumer<StoreConfig, String>> OVERRIDES = new LinkedHashMap<>();

    static {
        OVERRIDES.put("core-addons-dir", StoreConfig::setCoreAddonsDir);
        OVERRIDES.put("local-addons-dir", StoreConfig::setLocalAddonsDir);
        OVERRIDES.put("repositories-dir", StoreConfig::setRepositoriesDir);
        OVERRIDES.put("data-dir", StoreConfig::setDataDir);
        OVERRIDES.put("extern-data-dir", StoreConfig::setExternDataDir);
        OVERRIDES.put("state-file", StoreConfig::setStateFile);
        OVERRIDES.put("arch", StoreConfig::setArch);
    }

    private StoreConfigLoader() {
    }

    /**
     * Reads {@code addon-store.json} from {@code baseDir}, writing the defaults
     * first if it does not exist yet.
     *
     * @throws IOException if the file exists but cannot be read or bound, or
     *                     the defaults cannot be written
     */
    public static StoreConfig load(Path baseDir) throws IOException {
        Path file = baseDir.resolve(FILE_NAME);
        StoreConfig config;
        if (Files.exists(file)) {
            LOG.info("Loading configuration from: {}", file.toAbsolutePath());
            config = JsonFiles.read(file, StoreConfig.class);
        } else {
            LOG.info("No configuration at {}, writing defaults", file.toAbsolutePath());
            config = new StoreConfig();
            JsonFiles.writeAtomically(file, config);
        }
        applyOverrides(config);
        return config;
    }

    static void applyOverrides(StoreConfig config) {
        OVERRIDES.forEach((key, setter) -> {
            String value = System.getProperty(PROPERTY_PREFIX + key);
            if (value != null && !value.isBlank()) {
                LOG.debug("Configuration override {}={}", key, value);
                setter.accept(config, value);
            }
        });
    }
}
