package dev.reviewgate.infrastructure.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.reviewgate.domain.event.PullRequestEvent;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes notifications to SQS as JSON. Downstream consumers own delivery to people
 * (mail, chat); this service only decides what happened.
 */
@Component
@Profile("!local")
public class SqsNotificationEmitter implements NotificationEmitter {

    private static final Logger log = LoggerFactory.getLogger(SqsNotificationEmitter.class);

    private final SqsTemplate sqsTemplate;
    private final ObjectMapper objectMapper;
    private final String queueName;

    public SqsNotificationEmitter(SqsTemplate sqsTemplate, ObjectMapper objectMapper,
            @Value("${reviewgate.notifications.queue}") String queueName) {
        this.sqsTemplate = sqsTemplate;
        this.objectMapper = objectMapper;
        this.queueName = queueName;
    }

    @Override
    public void emit(PullRequestEvent event) {
        log.info("Publishing notification to SQS: event={}, pullRequestId={}, state={}",
                event.eventName(), event.pullRequestId(), event.state());

        sqsTemplate.send(queueName, toJson(event));

        log.debug("Notification published to queue: {}", queueName);
    }

    String toJson(PullRequestEvent event) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event", event.eventName());
        body.put("pullRequestId", event.pullRequestId().toString());
        body.put("actor", event.actor());
        body.put("state", event.state().getIdentifier());
        body.put("payload", event.payload());
        body.put("occurredAt", event.occurredAt().toString());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + event.eventName() + " notification", e);
        }
    }
}
