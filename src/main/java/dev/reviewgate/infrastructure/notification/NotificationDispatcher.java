package dev.reviewgate.infrastructure.notification;

import dev.reviewgate.domain.event.PullRequestEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Bridges domain events to the emitter.
 *
 * <p>
 * Uses {@code @TransactionalEventListener} so an event leaves the process only
 * after the transition that produced it has committed. A rolled-back operation
 * emits nothing.
 *
 * <p>
 * The operation is already durable when delivery runs, so a delivery failure is
 * logged with the event and does not turn the caller's successful operation into
 * an error.
 */
@Component
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final NotificationEmitter emitter;

    public NotificationDispatcher(NotificationEmitter emitter) {
        this.emitter = emitter;
    }

    @TransactionalEventListener
    public void onPullRequestEvent(PullRequestEvent event) {
        try {
            emitter.emit(event);
        } catch (RuntimeException e) {
            log.error("Notification delivery failed: event={}, pullRequestId={}",
                    event.eventName(), event.pullRequestId(), e);
        }
    }
}
