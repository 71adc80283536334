package de.bsommerfeld.addons.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.addons.core.domain.AddonDefinition;
import de.bsommerfeld.addons.core.domain.Architecture;
import de.bsommerfeld.addons.core.domain.BootPolicy;
import de.bsommerfeld.addons.core.domain.StartupClass;
import de.bsommerfeld.addons.core.domain.VolumeMapping;
import de.bsommerfeld.addons.core.util.JsonFiles;
import de.bsommerfeld.addons.options.OptionsValidationException;
import de.bsommerfeld.addons.options.OptionsValidator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Declarative rules for {@code config.json} addon definitions.
 *
 * <h3>Fields</h3>
 * <ul>
 * <li>{@code name}, {@code version}, {@code slug}, {@code description}:
 * required, non-empty strings</li>
 * <li>{@code startup}: required, {@code before | after | once}</li>
 * <li>{@code boot}: required, {@code auto | manual}</li>
 * <li>{@code options}: required object of defaults</li>
 * <li>{@code schema}: required object, must compile as an option-type
 * description</li>
 * <li>{@code arch}: optional list of supported architectures, defaults to
 * all</li>
 * <li>{@code url}, {@code image}: optional strings</li>
 * <li>{@code ports}: optional object, {@code "<port>/<tcp|udp>"} to a host
 * port</li>
 * <li>{@code map}: optional list of {@code path[:rw|ro]} directives</li>
 * <li>{@code devices}: optional list of {@code host:container:perms}</li>
 * <li>{@code environment}: optional object of scalar values</li>
 * </ul>
 * Any other key is rejected. Diagnostics name the offending field path.
 */
public final class AddonDefinitionSchema {

    private static final Set<String> KNOWN_FIELDS = Set.of(
            "name", "version", "slug", "description", "startup", "boot", "options", "schema",
            "arch", "url", "image", "ports", "map", "devices", "environment");

    private static final Pattern SLUG = Pattern.compile("^[A-Za-z0-9_.-]+$");
    private static final Pattern PORT_KEY = Pattern.compile("^\\d+/(tcp|udp)$");
    private static final Pattern DEVICE = Pattern.compile("^(.+):(.+):([rwm]{1,3})$");

    private static final int MIN_PORT = 1;
    private static final int MAX_PORT = 65535;

    private AddonDefinitionSchema() {
    }

    /**
     * Validates a parsed definition and binds it. The result carries no
     * repository or location yet.
     *
     * @throws SchemaValidationException on the first violation
     */
    public static AddonDefinition parse(JsonNode node) throws SchemaValidationException {
        if (node == null || !node.isObject()) {
            throw new SchemaValidationException("<root>", "definition must be a JSON object");
        }
        for (Iterator<String> it = node.fieldNames(); it.hasNext();) {
            String field = it.next();
            if (!KNOWN_FIELDS.contains(field)) {
                throw new SchemaValidationException(field, "unknown field");
            }
        }

        Map<String, Object> schema = requireObject(node, "schema");
        try {
            OptionsValidator.compile(schema);
        } catch (OptionsValidationException e) {
            throw new SchemaValidationException("schema." + e.getPath(), e.getMessage());
        }

        return new AddonDefinition(
                parseSlug(node),
                requireText(node, "name"),
                requireText(node, "description"),
                requireText(node, "version"),
                parseStartup(node),
                parseBoot(node),
                parseArch(node),
                optionalText(node, "url"),
                optionalText(node, "image"),
                requireObject(node, "options"),
                schema,
                parsePorts(node),
                parseVolumes(node),
                parseDevices(node),
                parseEnvironment(node),
                null,
                null);
    }

    /** The slug names data directories, so it must stay a single path segment. */
    private static String parseSlug(JsonNode node) throws SchemaValidationException {
        String slug = requireText(node, "slug");
        if (!SLUG.matcher(slug).matches() || slug.contains("..")) {
            throw new SchemaValidationException("slug", "expected letters, digits, '.', '-' or '_' without '..'");
        }
        return slug;
    }

    private static String requireText(JsonNode node, String field) throws SchemaValidationException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new SchemaValidationException(field, "required field missing");
        }
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new SchemaValidationException(field, "expected a non-empty string");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field) throws SchemaValidationException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new SchemaValidationException(field, "expected a string");
        }
        return value.asText();
    }

    private static Map<String, Object> requireObject(JsonNode node, String field) throws SchemaValidationException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new SchemaValidationException(field, "required field missing");
        }
        if (!value.isObject()) {
            throw new SchemaValidationException(field, "expected an object");
        }
        return JsonFiles.toMap(value);
    }

    private static StartupClass parseStartup(JsonNode node) throws SchemaValidationException {
        String value = requireText(node, "startup");
        try {
            return StartupClass.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new SchemaValidationException("startup", "expected one of before, after, once but got '" + value + "'");
        }
    }

    private static BootPolicy parseBoot(JsonNode node) throws SchemaValidationException {
        String value = requireText(node, "boot");
        try {
            return BootPolicy.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new SchemaValidationException("boot", "expected one of auto, manual but got '" + value + "'");
        }
    }

    private static List<String> parseArch(JsonNode node) throws SchemaValidationException {
        List<String> arch = optionalStringList(node, "arch");
        if (arch == null) {
            return Architecture.SUPPORTED;
        }
        for (int i = 0; i < arch.size(); i++) {
            if (!Architecture.SUPPORTED.contains(arch.get(i))) {
                throw new SchemaValidationException("arch[" + i + "]", "unsupported architecture '" + arch.get(i) + "'");
            }
        }
        return arch;
    }

    private static Map<String, Integer> parsePorts(JsonNode node) throws SchemaValidationException {
        JsonNode ports = optionalObject(node, "ports");
        Map<String, Integer> result = new LinkedHashMap<>();
        if (ports == null) {
            return result;
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = ports.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> entry = it.next();
            String path = "ports." + entry.getKey();
            if (!PORT_KEY.matcher(entry.getKey()).matches()) {
                throw new SchemaValidationException(path, "expected '<port>/tcp' or '<port>/udp'");
            }
            JsonNode port = entry.getValue();
            if (!port.isIntegralNumber() || port.asLong() < MIN_PORT || port.asLong() > MAX_PORT) {
                throw new SchemaValidationException(path, "expected a port between " + MIN_PORT + " and " + MAX_PORT);
            }
            result.put(entry.getKey(), port.asInt());
        }
        return result;
    }

    private static List<String> parseVolumes(JsonNode node) throws SchemaValidationException {
        List<String> volumes = optionalStringList(node, "map");
        if (volumes == null) {
            return List.of();
        }
        for (int i = 0; i < volumes.size(); i++) {
            if (!VolumeMapping.DIRECTIVE.matcher(volumes.get(i)).matches()) {
                throw new SchemaValidationException("map[" + i + "]", "expected 'path[:rw|ro]' but got '" + volumes.get(i) + "'");
            }
        }
        return volumes;
    }

    private static List<String> parseDevices(JsonNode node) throws SchemaValidationException {
        List<String> devices = optionalStringList(node, "devices");
        if (devices == null) {
            return List.of();
        }
        for (int i = 0; i < devices.size(); i++) {
            if (!DEVICE.matcher(devices.get(i)).matches()) {
                throw new SchemaValidationException("devices[" + i + "]", "expected 'host:container:perms'");
            }
        }
        return devices;
    }

    private static Map<String, String> parseEnvironment(JsonNode node) throws SchemaValidationException {
        JsonNode environment = optionalObject(node, "environment");
        Map<String, String> result = new LinkedHashMap<>();
        if (environment == null) {
            return result;
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = environment.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (!entry.getValue().isValueNode() || entry.getValue().isNull()) {
                throw new SchemaValidationException("environment." + entry.getKey(), "expected a scalar value");
            }
            result.put(entry.getKey(), entry.getValue().asText());
        }
        return result;
    }

    private static JsonNode optionalObject(JsonNode node, String field) throws SchemaValidationException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isObject()) {
            throw new SchemaValidationException(field, "expected an object");
        }
        return value;
    }

    private static List<String> optionalStringList(JsonNode node, String field) throws SchemaValidationException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isArray()) {
            throw new SchemaValidationException(field, "expected a list");
        }
        List<String> result = new ArrayList<>(value.size());
        for (int i = 0; i < value.size(); i++) {
            JsonNode element = value.get(i);
            if (!element.isTextual()) {
                throw new SchemaValidationException(field + "[" + i + "]", "expected a string");
            }
            result.add(element.asText());
        }
        return result;
    }
}
