package de.bsommerfeld.addons.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synchronous Guava {@link EventBus} through which the store announces
 * catalog refreshes and installed-state changes. Events are posted after the
 * change is persisted; a listener that throws is logged and cannot undo or
 * interrupt the mutation that posted the event.
 *
 * @see AddonEvents
 */
@Singleton
public class AddonEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(AddonEventBus.class);

    private final EventBus eventBus;

    public AddonEventBus() {
        this.eventBus = new EventBus(AddonEventBus::logListenerFailure);
    }

    public void post(Object event) {
        LOG.debug("Posting {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        eventBus.unregister(listener);
    }

    private static void logListenerFailure(Throwable failure, SubscriberExceptionContext context) {
        LOG.error("Listener {}.{} failed on {}", context.getSubscriber().getClass().getName(),
                context.getSubscriberMethod().getName(), context.getEvent(), failure);
    }
}
