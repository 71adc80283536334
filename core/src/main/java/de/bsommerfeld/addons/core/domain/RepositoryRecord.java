package de.bsommerfeld.addons.core.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Descriptive metadata of a repository that contributed addons to the
 * current catalog.
 *
 * @param slug       repository tag, the same value carried by its addons
 * @param name       display name
 * @param url        project or documentation URL, {@code null} if not declared
 * @param maintainer free-form maintainer line, {@code null} if not declared
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RepositoryRecord(String slug, String name, String url, String maintainer) {
}
