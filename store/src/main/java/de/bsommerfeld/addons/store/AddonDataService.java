package de.bsommerfeld.addons.store;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import de.bsommerfeld.addons.catalog.CatalogService;
import de.bsommerfeld.addons.core.config.AddonPaths;
import de.bsommerfeld.addons.core.domain.AddonDefinition;
import de.bsommerfeld.addons.core.domain.BootPolicy;
import de.bsommerfeld.addons.core.domain.QualifiedSlug;
import de.bsommerfeld.addons.core.domain.StartupClass;
import de.bsommerfeld.addons.core.domain.VolumeMapping;
import de.bsommerfeld.addons.core.util.JsonFiles;
import de.bsommerfeld.addons.options.OptionsValidationException;
import de.bsommerfeld.addons.options.OptionsValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Read accessors over installed state and catalog, plus generation of the
 * per-addon options file consumed by the container runtime.
 *
 * <p>
 * Display fields (name, description, repository, url, architectures, latest
 * version) come from the catalog when it knows the addon, so the newest
 * published text is shown; otherwise from the installed definition. Runtime
 * fields (options, ports, devices, environment, volumes, schema) only come
 * from the installed definition. Image name and build flag prefer the
 * installed definition and fall back to the catalog.
 *
 * <p>
 * Accessors throw {@link IllegalArgumentException} for an addon they have
 * no data for.
 */
@Singleton
public class AddonDataService {

    private static final Logger LOG = LoggerFactory.getLogger(AddonDataService.class);

    /** Binding name of the architecture string images are built for. */
    public static final String ARCH = "addons.arch";

    static final String OPTIONS_FILE = "options.json";
    private static final String ARCH_PLACEHOLDER = "{arch}";

    private final InstalledStateStore store;
    private final CatalogService catalogService;
    private final AddonPaths paths;
    private final String arch;

    @Inject
    public AddonDataService(InstalledStateStore store, CatalogService catalogService, AddonPaths paths,
            @Named(ARCH) String arch) {
        this.store = store;
        this.catalogService = catalogService;
        this.paths = paths;
        this.arch = arch;
    }

    public String arch() {
        return arch;
    }

    /**
     * Installed addons that start automatically in the given phase. An
     * installed definition without a startup phase is reported as orphaned
     * and left out.
     */
    public Set<QualifiedSlug> bootSet(StartupClass startup) {
        Set<QualifiedSlug> result = new TreeSet<>();
        for (InstalledAddon addon : store.installed()) {
            if (addon.effectiveBoot() != BootPolicy.AUTO) {
                continue;
            }
            if (addon.system().startup() == null) {
                LOG.warn("Orphaned addon detected: {} has no startup phase", addon.slug());
                continue;
            }
            if (addon.system().startup() == startup) {
                result.add(addon.slug());
            }
        }
        return result;
    }

    /** Definition defaults overlaid with the user's options, key by key. */
    public Map<String, Object> getOptions(QualifiedSlug slug) {
        InstalledAddon addon = store.requireInstalled(slug);
        Map<String, Object> merged = new LinkedHashMap<>(addon.system().options());
        merged.putAll(addon.user().options());
        return merged;
    }

    public BootPolicy getBootPolicy(QualifiedSlug slug) {
        return store.requireInstalled(slug).effectiveBoot();
    }

    // -- Catalog first --

    public String getName(QualifiedSlug slug) {
        return catalogFirst(slug, AddonDefinition::name);
    }

    public String getDescription(QualifiedSlug slug) {
        return catalogFirst(slug, AddonDefinition::description);
    }

    public String getRepository(QualifiedSlug slug) {
        return catalogFirst(slug, AddonDefinition::repository);
    }

    public String getUrl(QualifiedSlug slug) {
        return catalogFirst(slug, AddonDefinition::url);
    }

    public List<String> getArch(QualifiedSlug slug) {
        return catalogFirst(slug, AddonDefinition::arch);
    }

    /** The catalog version, or the installed one for a detached addon. */
    public String getLatestVersion(QualifiedSlug slug) {
        AddonDefinition latest = catalogService.catalog().get(slug);
        if (latest != null) {
            return latest.version();
        }
        return store.requireInstalled(slug).version();
    }

    // -- Installed only --

    public Map<String, Integer> getPorts(QualifiedSlug slug) {
        return store.requireInstalled(slug).system().ports();
    }

    public List<String> getDevices(QualifiedSlug slug) {
        return store.requireInstalled(slug).system().devices();
    }

    public Map<String, String> getEnvironment(QualifiedSlug slug) {
        return store.requireInstalled(slug).system().environment();
    }

    public Map<String, Object> getSchema(QualifiedSlug slug) {
        return store.requireInstalled(slug).system().schema();
    }

    /** Parses the installed definition's volume directives. */
    public List<VolumeMapping> mapVolumes(QualifiedSlug slug) {
        List<VolumeMapping> volumes = new ArrayList<>();
        for (String directive : store.requireInstalled(slug).system().volumes()) {
            volumes.add(VolumeMapping.parse(directive));
        }
        return volumes;
    }

    /**
     * Folder the catalog definition was read from.
     *
     * @throws IllegalArgumentException if the catalog does not contain the addon
     */
    public Path getLocation(QualifiedSlug slug) {
        AddonDefinition definition = catalogService.catalog().get(slug);
        if (definition == null) {
            throw new IllegalArgumentException("Addon '" + slug + "' is not in the catalog");
        }
        return Paths.get(definition.location());
    }

    // -- Images --

    /**
     * The image to run: the declared template with {@code {arch}} substituted,
     * or {@code <repository>/<arch>-addon-<slug>} for a locally built addon.
     */
    public String imageName(QualifiedSlug slug) {
        AddonDefinition definition = installedFirst(slug);
        if (definition.image() != null) {
            return definition.image().replace(ARCH_PLACEHOLDER, arch);
        }
        return definition.repository() + "/" + arch + "-addon-" + definition.slug();
    }

    public boolean needsBuild(QualifiedSlug slug) {
        return installedFirst(slug).needsBuild();
    }

    // -- Paths --

    public Path dataPath(QualifiedSlug slug) {
        return paths.data().resolve(slug.key());
    }

    public Path externDataPath(QualifiedSlug slug) {
        return paths.externData().resolve(slug.key());
    }

    public Path optionsPath(QualifiedSlug slug) {
        return dataPath(slug).resolve(OPTIONS_FILE);
    }

    /**
     * Validates the merged options against the installed schema and, only if
     * they pass, writes the normalized result to {@link #optionsPath}.
     *
     * @return {@code true} if the file was written
     */
    public boolean writeOptionsFile(QualifiedSlug slug) {
        InstalledAddon addon = store.requireInstalled(slug);
        Map<String, Object> normalized;
        try {
            normalized = OptionsValidator.compile(addon.system().schema()).validate(getOptions(slug));
        } catch (OptionsValidationException e) {
            LOG.error("Addon {} has invalid options: {}", slug, e.getMessage());
            return false;
        }

        Path target = optionsPath(slug);
        try {
            JsonFiles.writeAtomically(target, normalized);
            LOG.debug("Wrote options of {} to {}", slug, target);
            return true;
        } catch (IOException e) {
            LOG.error("Failed to write options of {} to {}", slug, target, e);
            return false;
        }
    }

    // Catalog entry if present, else the installed definition.
    private <T> T catalogFirst(QualifiedSlug slug, Function<AddonDefinition, T> field) {
        AddonDefinition definition = catalogService.catalog().get(slug);
        if (definition == null) {
            definition = store.requireInstalled(slug).system();
        }
        return field.apply(definition);
    }

    private AddonDefinition installedFirst(QualifiedSlug slug) {
        InstalledAddon addon = store.get(slug);
        if (addon != null) {
            return addon.system();
        }
        AddonDefinition definition = catalogService.catalog().get(slug);
        if (definition == null) {
            throw new IllegalArgumentException("Addon '" + slug + "' is neither installed nor in the catalog");
        }
        return definition;
    }
}
