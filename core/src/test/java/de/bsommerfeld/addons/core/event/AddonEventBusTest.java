package de.bsommerfeld.addons.core.event;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.addons.core.domain.QualifiedSlug;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class AddonEventBusTest {

    @Test
    void post_shouldDeliverEventToRegisteredListener() {
        var eventBus = new AddonEventBus();
        var received = new AtomicReference<AddonEvents.AddonInstalledEvent>();

        Object listener = new Object() {
            @Subscribe
            public void onInstalled(AddonEvents.AddonInstalledEvent event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post(new AddonEvents.AddonInstalledEvent(new QualifiedSlug("core", "ssh"), "1.0"));

        assertNotNull(received.get());
        assertEquals("core_ssh", received.get().slug().key());
    }

    @Test
    void post_shouldOnlyDeliverMatchingEventTypes() {
        var eventBus = new AddonEventBus();
        List<Object> received = new ArrayList<>();

        Object listener = new Object() {
            @Subscribe
            public void onUninstalled(AddonEvents.AddonUninstalledEvent event) {
                received.add(event);
            }
        };

        eventBus.register(listener);
        eventBus.post(new AddonEvents.CatalogRefreshedEvent(3, 1, 0));
        eventBus.post(new AddonEvents.AddonUninstalledEvent(new QualifiedSlug("local", "web")));

        assertEquals(1, received.size());
    }

    @Test
    void unregister_shouldStopDeliveringEvents() {
        var eventBus = new AddonEventBus();
        List<Object> received = new ArrayList<>();

        Object listener = new Object() {
            @Subscribe
            public void onRefresh(AddonEvents.CatalogRefreshedEvent event) {
                received.add(event);
            }
        };

        eventBus.register(listener);
        eventBus.post(new AddonEvents.CatalogRefreshedEvent(1, 1, 0));
        eventBus.unregister(listener);
        eventBus.post(new AddonEvents.CatalogRefreshedEvent(2, 1, 0));

        assertEquals(1, received.size());
    }

    @Test
    void post_shouldKeepDeliveringWhenListenerThrows() {
        var eventBus = new AddonEventBus();
        List<Object> received = new ArrayList<>();

        Object failing = new Object() {
            @Subscribe
            public void onRefresh(AddonEvents.CatalogRefreshedEvent event) {
                throw new IllegalStateException("boom");
            }
        };
        Object healthy = new Object() {
            @Subscribe
            public void onRefresh(AddonEvents.CatalogRefreshedEvent event) {
                received.add(event);
            }
        };

        eventBus.register(failing);
        eventBus.register(healthy);

        assertDoesNotThrow(() -> eventBus.post(new AddonEvents.CatalogRefreshedEvent(1, 1, 0)));
        assertEquals(1, received.size());
    }
}
