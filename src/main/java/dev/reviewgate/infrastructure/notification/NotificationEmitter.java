package dev.reviewgate.infrastructure.notification;

import dev.reviewgate.domain.event.PullRequestEvent;

/**
 * Hands a committed pull request event to an external delivery channel.
 */
public interface NotificationEmitter {

    void emit(PullRequestEvent event);
}
