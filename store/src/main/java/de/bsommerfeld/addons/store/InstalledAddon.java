package de.bsommerfeld.addons.store;

import de.bsommerfeld.addons.core.domain.AddonDefinition;
import de.bsommerfeld.addons.core.domain.BootPolicy;
import de.bsommerfeld.addons.core.domain.QualifiedSlug;

/**
 * Read-only view of one installed addon: the definition frozen at install
 * time plus the user's half.
 */
public record InstalledAddon(QualifiedSlug slug, AddonDefinition system, UserHalf user) {

    public String version() {
        return user.version();
    }

    /** The user's boot override if present, else the definition's default. */
    public BootPolicy effectiveBoot() {
        return user.boot() != null ? user.boot() : system.boot();
    }
}
