package dev.reviewgate.domain.event;

import dev.reviewgate.domain.enums.PullRequestEventType;
import dev.reviewgate.domain.enums.PullRequestState;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Notification description produced by a successful mutating operation. Published as a
 * Spring application event and delivered to the emitter after the transaction commits.
 */
public record PullRequestEvent(
        PullRequestEventType type,
        UUID pullRequestId,
        String actor,
        PullRequestState state,
        Map<String, Object> payload,
        Instant occurredAt
) {
    public PullRequestEvent {
        if (type == null) throw new IllegalArgumentException("type required");
        if (pullRequestId == null) throw new IllegalArgumentException("pullRequestId required");
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        if (occurredAt == null) occurredAt = Instant.now();
    }

    public String eventName() {
        return type.getEventName();
    }
}
