package de.bsommerfeld.addons.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.addons.core.domain.RepositoryRecord;
import de.bsommerfeld.addons.core.util.JsonFiles;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Display records for the two built-in repository tags, read from the
 * bundled {@code built-in.json} classpath resource. The file is a JSON object
 * keyed by tag; each value has the shape of a {@code repository.json}.
 *
 * <p>
 * The resource is read on first use and cached for the lifetime of the
 * instance.
 */
public class BuiltinRepositories {

    public static final String CORE = "core";
    public static final String LOCAL = "local";

    static final String DEFAULT_RESOURCE = "built-in.json";

    private final String resource;
    private Map<String, RepositoryRecord> records;

    public BuiltinRepositories() {
        this(DEFAULT_RESOURCE);
    }

    BuiltinRepositories(String resource) {
        this.resource = resource;
    }

    /**
     * Returns the bundled records keyed by tag.
     *
     * @throws SourceReadException if the resource is missing, unreadable or
     *                             malformed
     */
    public Map<String, RepositoryRecord> load() throws SourceReadException {
        if (records == null) {
            records = readResource();
        }
        return records;
    }

    private Map<String, RepositoryRecord> readResource() throws SourceReadException {
        JsonNode root;
        try (InputStream in = BuiltinRepositories.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new SourceReadException(null, "Built-in repository table not found: " + resource, null);
            }
            root = JsonFiles.mapper().readTree(in);
        } catch (IOException e) {
            throw new SourceReadException(null, "Failed to read built-in repository table: " + resource, e);
        }

        if (root == null || !root.isObject()) {
            throw new SourceReadException(null, "Built-in repository table is not a JSON object: " + resource, null);
        }
        Map<String, RepositoryRecord> result = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = root.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> entry = it.next();
            try {
                result.put(entry.getKey(), RepositoryConfigSchema.parse(entry.getValue(), entry.getKey()));
            } catch (SchemaValidationException e) {
                throw new SourceReadException(null,
                        "Invalid built-in repository '" + entry.getKey() + "': " + e.getMessage(), e);
            }
        }
        return Collections.unmodifiableMap(result);
    }
}
