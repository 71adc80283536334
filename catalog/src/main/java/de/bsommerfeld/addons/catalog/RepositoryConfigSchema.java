package de.bsommerfeld.addons.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.addons.core.domain.RepositoryRecord;

/**
 * Rules for the {@code repository.json} at the root of an external
 * repository: {@code name} is required, {@code url} and {@code maintainer}
 * are optional strings. Other keys are ignored.
 */
public final class RepositoryConfigSchema {

    private RepositoryConfigSchema() {
    }

    /**
     * @param slug the repository tag derived from its directory
     * @throws SchemaValidationException if a field is missing or mistyped
     */
    public static RepositoryRecord parse(JsonNode node, String slug) throws SchemaValidationException {
        if (node == null || !node.isObject()) {
            throw new SchemaValidationException("<root>", "repository file must be a JSON object");
        }
        JsonNode name = node.get("name");
        if (name == null || !name.isTextual() || name.asText().isBlank()) {
            throw new SchemaValidationException("name", "expected a non-empty string");
        }
        return new RepositoryRecord(slug, name.asText(), optionalText(node, "url"), optionalText(node, "maintainer"));
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
}
