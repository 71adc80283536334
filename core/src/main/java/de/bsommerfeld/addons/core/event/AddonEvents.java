package de.bsommerfeld.addons.core.event;

import de.bsommerfeld.addons.core.domain.QualifiedSlug;

import java.util.List;

/**
 * Events posted on the {@link AddonEventBus}. State-change events are posted
 * after the new state has been persisted.
 */
public class AddonEvents {

    /**
     * Fired after every scan, once the new catalog replaced the old one.
     */
    public record CatalogRefreshedEvent(int addons, int repositories, int warnings) {
    }

    public record AddonInstalledEvent(QualifiedSlug slug, String version) {
    }

    public record AddonUpdatedEvent(QualifiedSlug slug, String version) {
    }

    public record AddonUninstalledEvent(QualifiedSlug slug) {
    }

    /**
     * Fired when reconciliation refreshed the frozen definition of one or more
     * installed addons without a version change.
     */
    public record AddonsReconciledEvent(List<QualifiedSlug> slugs) {
    }

    public record OptionsChangedEvent(QualifiedSlug slug) {
    }
}
