package de.bsommerfeld.addons.core.domain;

import java.util.Objects;

/**
 * Catalog-wide identity of an addon: the tag of the repository it comes from
 * plus the slug it declares. Two repositories may ship the same slug; the
 * qualified form keeps them apart.
 *
 * <p>
 * The string form {@code <repository>_<slug>} is what the state document and
 * the data directories are keyed by. Repository tags never contain an
 * underscore ({@code core}, {@code local} or an eight character hex hash), so
 * {@link #parse(String)} splits at the first one.
 *
 * @param repository repository tag, e.g. {@code core} or {@code 5c53de3b}
 * @param slug       the addon's own slug as declared in its definition
 */
public record QualifiedSlug(String repository, String slug) implements Comparable<QualifiedSlug> {

    private static final char SEPARATOR = '_';

    public QualifiedSlug {
        Objects.requireNonNull(repository, "repository");
        Objects.requireNonNull(slug, "slug");
        if (repository.isEmpty() || repository.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("Invalid repository tag: '" + repository + "'");
        }
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("Slug must not be empty");
        }
    }

    /**
     * Parses the {@code <repository>_<slug>} key form.
     *
     * @throws IllegalArgumentException if the key has no separator or an empty part
     */
    public static QualifiedSlug parse(String key) {
        int idx = key.indexOf(SEPARATOR);
        if (idx <= 0 || idx == key.length() - 1) {
            throw new IllegalArgumentException("Not a qualified slug: '" + key + "'");
        }
        return new QualifiedSlug(key.substring(0, idx), key.substring(idx + 1));
    }

    /** Returns the {@code <repository>_<slug>} key form. */
    public String key() {
        return repository + SEPARATOR + slug;
    }

    @Override
    public int compareTo(QualifiedSlug other) {
        return key().compareTo(other.key());
    }

    @Override
    public String toString() {
        return key();
    }
}
