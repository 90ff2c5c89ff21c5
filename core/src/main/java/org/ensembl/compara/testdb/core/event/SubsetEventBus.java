package org.ensembl.compara.testdb.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Carries {@link SubsetEvents} from the build to whatever reports progress.
 * Delivery is synchronous on the posting thread, so a listener sees each
 * step before the next one starts.
 *
 * <p>
 * A failing listener is logged and skipped; it never fails the build.
 */
@Singleton
public class SubsetEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(SubsetEventBus.class);
    private final EventBus eventBus;

    public SubsetEventBus() {
        this.eventBus = new EventBus(SubsetEventBus::logListenerFailure);
    }

    public void post(Object event) {
        LOG.debug("Event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Progress listener {} registered", listener.getClass().getName());
        eventBus.register(listener);
    }

    private static void logListenerFailure(Throwable failure, SubscriberExceptionContext context) {
        LOG.warn("Listener {} failed on {}", context.getSubscriber().getClass().getName(), context.getEvent(),
                failure);
    }
}
