package de.bsommerfeld.addons.core.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An addon as described by its definition file, enriched with the repository
 * tag and folder it was found in.
 *
 * <p>
 * The same record serves as the frozen system half of an installed addon, so
 * equality is what reconciliation uses to decide whether the catalog carries
 * a corrected definition. Collections are copied into unmodifiable wrappers;
 * nested option values are left as parsed and must not be mutated.
 *
 * <p>
 * {@code startup} and {@code boot} are required for catalog entries but may be
 * absent on records loaded from an old state document. Such installs are
 * reported as orphaned by the queries that need the field.
 *
 * @param slug        addon slug, unique within its repository
 * @param name        display name
 * @param description one-line description
 * @param version     addon version as published by the repository
 * @param startup     boot phase the addon belongs to
 * @param boot        default boot policy
 * @param arch        supported architectures
 * @param url         homepage, {@code null} if not declared
 * @param image       remote image template with an optional {@code {arch}}
 *                    placeholder, {@code null} for locally built addons
 * @param options     option defaults
 * @param schema      declarative option-type description
 * @param ports       container port ({@code 80/tcp}) to host port
 * @param volumes     volume directives ({@code path[:mode]})
 * @param devices     device directives ({@code host:container:perms})
 * @param environment extra environment variables
 * @param repository  tag of the contributing repository
 * @param location    folder the definition file was read from
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AddonDefinition(
        String slug,
        String name,
        String description,
        String version,
        StartupClass startup,
        BootPolicy boot,
        List<String> arch,
        String url,
        String image,
        Map<String, Object> options,
        Map<String, Object> schema,
        Map<String, Integer> ports,
        @JsonProperty("map") List<String> volumes,
        List<String> devices,
        Map<String, String> environment,
        String repository,
        String location) {

    public AddonDefinition {
        arch = freezeList(arch);
        options = freezeMap(options);
        schema = freezeMap(schema);
        ports = freezeMap(ports);
        volumes = freezeList(volumes);
        devices = freezeList(devices);
        environment = freezeMap(environment);
    }

    public QualifiedSlug qualifiedSlug() {
        return new QualifiedSlug(repository, slug);
    }

    /** True when no image template is declared and the image has to be built locally. */
    public boolean needsBuild() {
        return image == null;
    }

    /** Returns a copy that records where the definition was found. */
    public AddonDefinition withSource(String repository, String location) {
        return new AddonDefinition(slug, name, description, version, startup, boot, arch, url, image,
                options, schema, ports, volumes, devices, environment, repository, location);
    }

    private static <T> List<T> freezeList(List<T> list) {
        return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(list));
    }

    // Option values may legitimately be JSON null, which Map.copyOf rejects.
    private static <K, V> Map<K, V> freezeMap(Map<K, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
