package de.bsommerfeld.launchpad.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's EventBus that carries lifecycle events from
 * the engine to status displays, task switchers and the audit log.
 * A failing subscriber is logged and never affects the publisher.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::handleSubscriberException);
    }

    public void post(Object event) {
        LOG.debug("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    private static void handleSubscriberException(Throwable exception, SubscriberExceptionContext context) {
        LOG.error("Subscriber {}#{} failed on {}", context.getSubscriber().getClass().getName(),
                context.getSubscriberMethod().getName(), context.getEvent(), exception);
    }
}
