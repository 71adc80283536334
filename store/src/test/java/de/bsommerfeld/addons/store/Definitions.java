package de.bsommerfeld.addons.store;

import de.bsommerfeld.addons.catalog.Catalog;
import de.bsommerfeld.addons.core.domain.AddonDefinition;
import de.bsommerfeld.addons.core.domain.Architecture;
import de.bsommerfeld.addons.core.domain.BootPolicy;
import de.bsommerfeld.addons.core.domain.QualifiedSlug;
import de.bsommerfeld.addons.core.domain.StartupClass;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds definitions and catalogs for store tests.
 */
final class Definitions {

    private Definitions() {
    }

    static AddonDefinition addon(String repository, String slug, String version) {
        return builder(repository, slug, version).build();
    }

    static Builder builder(String repository, String slug, String version) {
        return new Builder(repository, slug, version);
    }

    static Catalog catalog(AddonDefinition... definitions) {
        Map<QualifiedSlug, AddonDefinition> addons = new LinkedHashMap<>();
        for (AddonDefinition definition : definitions) {
            addons.put(definition.qualifiedSlug(), definition);
        }
        return new Catalog(addons);
    }

    static final class Builder {

        private final String repository;
        private final String slug;
        private final String version;
        private String name;
        private String description = "test addon";
        private StartupClass startup = StartupClass.AFTER;
        private BootPolicy boot = BootPolicy.AUTO;
        private String image;
        private Map<String, Object> options = Map.of();
        private Map<String, Object> schema = Map.of();
        private List<String> volumes = List.of();

        private Builder(String repository, String slug, String version) {
            this.repository = repository;
            this.slug = slug;
            this.version = version;
            this.name = slug;
        }

        Builder name(String name) {
            this.name = name;
            return this;
        }

        Builder description(String description) {
            this.description = description;
            return this;
        }

        Builder startup(StartupClass startup) {
            this.startup = startup;
            return this;
        }

        Builder boot(BootPolicy boot) {
            this.boot = boot;
            return this;
        }

        Builder image(String image) {
            this.image = image;
            return this;
        }

        Builder options(Map<String, Object> options) {
            this.options = options;
            return this;
        }

        Builder schema(Map<String, Object> schema) {
            this.schema = schema;
            return this;
        }

        Builder volumes(List<String> volumes) {
            this.volumes = volumes;
            return this;
        }

        AddonDefinition build() {
            return new AddonDefinition(slug, name, description, version, startup, boot, Architecture.SUPPORTED,
                    null, image, options, schema, Map.of(), volumes, List.of(), Map.of(), repository,
                    "/addons/" + repository + "/" + slug);
        }
    }
}
