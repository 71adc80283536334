package de.bsommerfeld.addons.store;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.addons.catalog.Catalog;
import de.bsommerfeld.addons.catalog.CatalogService;
import de.bsommerfeld.addons.core.domain.AddonDefinition;
import de.bsommerfeld.addons.core.domain.BootPolicy;
import de.bsommerfeld.addons.core.domain.QualifiedSlug;
import de.bsommerfeld.addons.core.event.AddonEventBus;
import de.bsommerfeld.addons.core.event.AddonEvents;
import de.bsommerfeld.addons.core.util.JsonFiles;
import de.bsommerfeld.addons.options.OptionsValidationException;
import de.bsommerfeld.addons.options.OptionsValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Single source of truth for which addons are installed, at which version
 * and with which user settings.
 *
 * <p>
 * Each installed addon has two halves that always exist together: the
 * <em>system</em> half, a copy of the catalog definition taken at install
 * time, and the <em>user</em> half ({@link UserHalf}). A rescan never touches
 * the system half; only {@link #install}, {@link #update} and
 * {@link #reconcileAutoUpdates()} replace it.
 *
 * <h3>Persistence</h3>
 * Every mutation is followed by a full rewrite of the {@link StateFile}.
 * Mutators return {@code true} when that write succeeded and {@code false}
 * when it failed; the in-memory change is kept either way and reaches disk
 * with the next successful write. Validation and catalog lookups run before
 * anything is changed, so a thrown exception leaves the state as it was.
 *
 * <p>
 * Not thread-safe. Callers serialize access.
 */
@Singleton
public class InstalledStateStore {

    private static final Logger LOG = LoggerFactory.getLogger(InstalledStateStore.class);

    private final StateFile stateFile;
    private final CatalogService catalogService;
    private final AddonEventBus eventBus;

    private final Map<QualifiedSlug, AddonDefinition> system = new TreeMap<>();
    private final Map<QualifiedSlug, UserHalf> user = new TreeMap<>();

    /**
     * @throws IllegalStateException if an existing state file cannot be read
     */
    @Inject
    public InstalledStateStore(StateFile stateFile, CatalogService catalogService, AddonEventBus eventBus) {
        this.stateFile = stateFile;
        this.catalogService = catalogService;
        this.eventBus = eventBus;
        load();
    }

    // -- Mutations --

    /**
     * Installs an addon from the current catalog. An existing install of the
     * same slug is replaced, user settings included.
     *
     * @throws UnknownAddonException if the catalog does not contain {@code slug}
     */
    public boolean install(QualifiedSlug slug, String version) throws UnknownAddonException {
        AddonDefinition definition = requireCatalogEntry(slug);
        system.put(slug, definition);
        user.put(slug, UserHalf.fresh(version));
        LOG.info("Installed addon {} version {}", slug, version);

        boolean saved = save();
        if (saved) {
            eventBus.post(new AddonEvents.AddonInstalledEvent(slug, version));
        }
        return saved;
    }

    /** Removes both halves. Uninstalling an addon that is not installed is a no-op apart from the write. */
    public boolean uninstall(QualifiedSlug slug) {
        boolean removed = system.remove(slug) != null;
        user.remove(slug);
        if (removed) {
            LOG.info("Uninstalled addon {}", slug);
        }

        boolean saved = save();
        if (saved && removed) {
            eventBus.post(new AddonEvents.AddonUninstalledEvent(slug));
        }
        return saved;
    }

    /**
     * Moves an installed addon to the current catalog definition and records
     * {@code version}. Options and boot override are kept.
     *
     * @throws UnknownAddonException    if the catalog does not contain {@code slug}
     * @throws IllegalArgumentException if the addon is not installed
     */
    public boolean update(QualifiedSlug slug, String version) throws UnknownAddonException {
        AddonDefinition definition = requireCatalogEntry(slug);
        UserHalf half = requireUserHalf(slug);
        system.put(slug, definition);
        user.put(slug, half.withVersion(version));
        LOG.info("Updated addon {} from {} to {}", slug, half.version(), version);

        boolean saved = save();
        if (saved) {
            eventBus.post(new AddonEvents.AddonUpdatedEvent(slug, version));
        }
        return saved;
    }

    /**
     * Picks up definition fixes that were published without a version bump.
     * For every installed addon whose installed version equals the catalog
     * version but whose frozen definition differs, the definition is replaced
     * by the catalog's. Detached addons are left alone. The state is written
     * once at the end, and only if something changed.
     *
     * @return the number of refreshed addons
     */
    public int reconcileAutoUpdates() {
        Catalog catalog = catalogService.catalog();
        List<QualifiedSlug> refreshed = new ArrayList<>();

        for (Map.Entry<QualifiedSlug, AddonDefinition> entry : system.entrySet()) {
            AddonDefinition latest = catalog.get(entry.getKey());
            if (latest == null) {
                continue;
            }
            String installedVersion = user.get(entry.getKey()).version();
            if (Objects.equals(installedVersion, latest.version()) && !latest.equals(entry.getValue())) {
                entry.setValue(latest);
                refreshed.add(entry.getKey());
                LOG.debug("Refreshed definition of {} at version {}", entry.getKey(), installedVersion);
            }
        }

        if (refreshed.isEmpty()) {
            return 0;
        }
        LOG.info("Reconciled {} installed addons with the catalog", refreshed.size());
        if (save()) {
            eventBus.post(new AddonEvents.AddonsReconciledEvent(List.copyOf(refreshed)));
        }
        return refreshed.size();
    }

    /**
     * Validates {@code options} against the installed definition's schema and
     * stores the normalized result as the user's overrides.
     *
     * @throws OptionsValidationException if the options do not match the
     *                                    schema; nothing is stored
     * @throws IllegalArgumentException   if the addon is not installed
     */
    public boolean setOptions(QualifiedSlug slug, Map<String, Object> options) throws OptionsValidationException {
        AddonDefinition definition = requireInstalled(slug).system();
        Map<String, Object> normalized = OptionsValidator.compile(definition.schema()).validate(options);
        user.put(slug, user.get(slug).withOptions(JsonFiles.deepCopy(normalized)));
        LOG.info("Stored options for {}", slug);

        boolean saved = save();
        if (saved) {
            eventBus.post(new AddonEvents.OptionsChangedEvent(slug));
        }
        return saved;
    }

    /**
     * Sets the user's boot override. {@code null} clears it.
     *
     * @throws IllegalArgumentException if the addon is not installed
     */
    public boolean setBoot(QualifiedSlug slug, BootPolicy boot) {
        UserHalf half = requireUserHalf(slug);
        user.put(slug, half.withBoot(boot));
        LOG.info("Boot policy of {} set to {}", slug, boot != null ? boot.value() : "default");
        return save();
    }

    // -- Queries --

    /** Returns the installed addon, or {@code null} if {@code slug} is not installed. */
    public InstalledAddon get(QualifiedSlug slug) {
        AddonDefinition definition = system.get(slug);
        return definition != null ? new InstalledAddon(slug, definition, user.get(slug)) : null;
    }

    /**
     * @throws IllegalArgumentException if the addon is not installed
     */
    public InstalledAddon requireInstalled(QualifiedSlug slug) {
        InstalledAddon addon = get(slug);
        if (addon == null) {
            throw new IllegalArgumentException("Addon '" + slug + "' is not installed");
        }
        return addon;
    }

    public List<InstalledAddon> installed() {
        List<InstalledAddon> result = new ArrayList<>(system.size());
        for (QualifiedSlug slug : system.keySet()) {
            result.add(get(slug));
        }
        return result;
    }

    public Set<QualifiedSlug> listInstalled() {
        return new TreeSet<>(system.keySet());
    }

    /** Installed addons together with everything the catalog offers. */
    public Set<QualifiedSlug> listAll() {
        Set<QualifiedSlug> all = new TreeSet<>(system.keySet());
        all.addAll(catalogService.catalog().slugs());
        return all;
    }

    /** Installed addons that no scanned repository provides anymore. */
    public Set<QualifiedSlug> listDetached() {
        Catalog catalog = catalogService.catalog();
        Set<QualifiedSlug> detached = new TreeSet<>();
        for (QualifiedSlug slug : system.keySet()) {
            if (!catalog.contains(slug)) {
                detached.add(slug);
            }
        }
        return detached;
    }

    /** True if the addon is in the catalog or installed. */
    public boolean exists(QualifiedSlug slug) {
        return system.containsKey(slug) || catalogService.catalog().contains(slug);
    }

    public boolean isInstalled(QualifiedSlug slug) {
        return system.containsKey(slug);
    }

    /** Returns the installed version, or {@code null} if the addon is not installed. */
    public String versionInstalled(QualifiedSlug slug) {
        UserHalf half = user.get(slug);
        return half != null ? half.version() : null;
    }

    // -- Internals --

    private AddonDefinition requireCatalogEntry(QualifiedSlug slug) throws UnknownAddonException {
        AddonDefinition definition = catalogService.catalog().get(slug);
        if (definition == null) {
            throw new UnknownAddonException(slug);
        }
        return definition;
    }

    private UserHalf requireUserHalf(QualifiedSlug slug) {
        UserHalf half = user.get(slug);
        if (half == null) {
            throw new IllegalArgumentException("Addon '" + slug + "' is not installed");
        }
        return half;
    }

    private void load() {
        StateDocument document;
        try {
            document = stateFile.load();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load installed state from " + stateFile.path(), e);
        }

        for (Map.Entry<String, AddonDefinition> entry : document.system().entrySet()) {
            String key = entry.getKey();
            UserHalf half = document.user().get(key);
            if (entry.getValue() == null || half == null) {
                LOG.warn("Dropping incomplete installed state for {}", key);
                continue;
            }
            QualifiedSlug slug;
            try {
                slug = QualifiedSlug.parse(key);
            } catch (IllegalArgumentException e) {
                LOG.warn("Dropping installed state with invalid key '{}'", key);
                continue;
            }
            system.put(slug, entry.getValue());
            user.put(slug, half);
        }
        for (String key : document.user().keySet()) {
            if (!document.system().containsKey(key)) {
                LOG.warn("Dropping user settings without installed definition for {}", key);
            }
        }
        LOG.info("Loaded {} installed addons from {}", system.size(), stateFile.path());
    }

    private boolean save() {
        Map<String, UserHalf> userDocument = new LinkedHashMap<>();
        Map<String, AddonDefinition> systemDocument = new LinkedHashMap<>();
        for (QualifiedSlug slug : system.keySet()) {
            userDocument.put(slug.key(), user.get(slug));
            systemDocument.put(slug.key(), system.get(slug));
        }

        try {
            stateFile.save(new StateDocument(userDocument, systemDocument));
            return true;
        } catch (IOException e) {
            LOG.error("Failed to persist installed state to {}", stateFile.path(), e);
            return false;
        }
    }
}
