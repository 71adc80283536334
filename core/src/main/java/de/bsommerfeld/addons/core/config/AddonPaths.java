package de.bsommerfeld.addons.core.config;

import java.nio.file.Path;

/**
 * Resolved filesystem locations the store reads from and writes to.
 *
 * @param coreAddons   built-in addons shipped with the platform
 * @param localAddons  addons the user dropped in by hand
 * @param repositories one subdirectory per external repository checkout
 * @param data         per-addon data folders as seen by this process
 * @param externData   the same folders as seen by the container runtime
 * @param stateFile    the persisted installed-state document
 */
public record AddonPaths(
        Path coreAddons,
        Path localAddons,
        Path repositories,
        Path data,
        Path externData,
        Path stateFile) {
}
