package de.bsommerfeld.cheru.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Guava {@link EventBus} carrying the {@link IndexEvents} of the catalog. The
 * UI layer subscribes here to re-run its query once icons are normalized or a
 * lazy index has been built.
 *
 * <p>
 * Events are posted from indexing threads. A subscriber that throws is
 * logged with the event it failed on and never reaches the poster, so a
 * broken listener cannot abort an index build or the icon pass.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);

    private final AtomicInteger failedDeliveries = new AtomicInteger();
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(this::onSubscriberFailure);
    }

    public void post(Object event) {
        LOG.debug("Posting {}", event);
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

    /** Number of subscriber invocations that threw since startup. */
    public int failedDeliveries() {
        return failedDeliveries.get();
    }

    private void onSubscriberFailure(Throwable exception, SubscriberExceptionContext context) {
        failedDeliveries.incrementAndGet();
        LOG.warn("Listener {}.{} failed on {}", context.getSubscriber().getClass().getName(),
                context.getSubscriberMethod().getName(), context.getEvent(), exception);
    }
}
