package de.bsommerfeld.mtgbuilder.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers {@link IngestEvents} to whoever renders progress. Events are
 * dispatched on the posting thread, so fan-out workers call subscribers
 * concurrently.
 *
 * <p>
 * A failing subscriber is logged and never reaches the pipeline.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);

    private final EventBus eventBus = new EventBus(ApplicationEventBus::logSubscriberFailure);

    public void post(Object event) {
        // Download progress fires every few hundred milliseconds
        if (!(event instanceof IngestEvents.DownloadProgressEvent))
            LOG.debug("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        eventBus.unregister(listener);
    }

    private static void logSubscriberFailure(Throwable failure, SubscriberExceptionContext context) {
        LOG.warn("Subscriber {}.{} failed on {}", context.getSubscriber().getClass().getSimpleName(),
                context.getSubscriberMethod().getName(), context.getEvent(), failure);
    }
}
