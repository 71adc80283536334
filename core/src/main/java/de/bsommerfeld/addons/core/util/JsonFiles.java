package de.bsommerfeld.addons.core.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * Reads and writes the JSON documents the store works with: definition and
 * repository files, the state document and per-addon options files.
 *
 * <p>
 * Writes are whole-document replacements. The content goes to a {@code .tmp}
 * sibling first and is then renamed over the target with
 * {@link StandardCopyOption#ATOMIC_MOVE}, so a crash mid-write leaves either
 * the previous document or the new one, never a truncated file.
 */
public final class JsonFiles {

    public static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private JsonFiles() {
    }

    /** The shared mapper. Configured once, safe to use from any thread. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Parses a file into a tree.
     *
     * @throws IOException if the file is unreadable or not valid JSON
     */
    public static JsonNode readTree(Path file) throws IOException {
        return MAPPER.readTree(file.toFile());
    }

    /**
     * Binds a file to the given type.
     *
     * @throws IOException if the file is unreadable or does not bind
     */
    public static <T> T read(Path file, Class<T> type) throws IOException {
        return MAPPER.readValue(file.toFile(), type);
    }

    /** Converts a JSON object node into plain maps, lists and boxed scalars. */
    public static Map<String, Object> toMap(JsonNode node) {
        return MAPPER.convertValue(node, OBJECT_MAP);
    }

    /**
     * Returns a structurally independent copy of a value tree made of maps,
     * lists and scalars.
     */
    public static Map<String, Object> deepCopy(Map<String, Object> value) {
        return MAPPER.convertValue(value, OBJECT_MAP);
    }

    /**
     * Serializes {@code value} and atomically replaces {@code target} with it.
     * Parent directories are created as needed.
     *
     * @throws IOException if serialization or any file operation fails; the
     *                     previous content of {@code target} is left intact
     */
    public static void writeAtomically(Path target, Object value) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            MAPPER.writeValue(temp.toFile(), value);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
