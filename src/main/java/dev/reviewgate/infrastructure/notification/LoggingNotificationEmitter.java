package dev.reviewgate.infrastructure.notification;

import dev.reviewgate.domain.event.PullRequestEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/** Local development stand-in for the SQS emitter. */
@Component
@Profile("local")
public class LoggingNotificationEmitter implements NotificationEmitter {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationEmitter.class);

    @Override
    public void emit(PullRequestEvent event) {
        log.info("Notification {} for {} by {} (state={}): {}",
                event.eventName(), event.pullRequestId(), event.actor(), event.state(), event.payload());
    }
}
