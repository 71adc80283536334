package de.bsommerfeld.addons.store;

import de.bsommerfeld.addons.core.domain.QualifiedSlug;

/**
 * Thrown when an install or update names an addon the current catalog does
 * not contain. Nothing has been changed when this is thrown.
 */
public class UnknownAddonException extends Exception {

    private final QualifiedSlug slug;

    public UnknownAddonException(QualifiedSlug slug) {
        super("Addon '" + slug + "' is not in the catalog");
        this.slug = slug;
    }

    public QualifiedSlug getSlug() {
        return slug;
    }
}
