package dev.reviewgate.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.reviewgate.domain.entity.PullRequest;
import dev.reviewgate.domain.enums.PullRequestState;
import dev.reviewgate.repository.PullRequestRepository;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.messaging.Message;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PullRequestWorkflowIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private TestRestTemplate rest;

    @Autowired
    private PullRequestRepository repository;

    @Autowired
    private SqsTemplate sqsTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Test
    @DisplayName("full lifecycle over HTTP: create, review, approve, merge, then summary reflects it")
    void fullLifecycle() throws Exception {
        UUID id = create(1);

        assertThat(call("alice", HttpMethod.POST, "/pull-requests/" + id + "/ready-for-review", null)
                .getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(call("bob", HttpMethod.POST, "/pull-requests/" + id + "/review-requests", null)
                .getStatusCode()).isEqualTo(HttpStatus.OK);

        ResponseEntity<String> review = call("bob", HttpMethod.POST, "/pull-requests/" + id + "/reviews",
                Map.of("verdict", "APPROVE", "summary", "LGTM",
                        "comments", List.of(Map.of("filePath", "src/Cache.java", "lineNumber", 4, "text", "nice"))));
        assertThat(review.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(json(review).get("state").asText()).isEqualTo("APPROVED");

        ResponseEntity<String> merged = call("mike", HttpMethod.POST, "/pull-requests/" + id + "/merge",
                Map.of("commitMessage", "Add cache"));
        assertThat(merged.getStatusCode()).isEqualTo(HttpStatus.OK);
        String commitId = json(merged).get("commitId").asText();
        assertThat(commitId).hasSize(40);

        JsonNode summary = json(call("carol", HttpMethod.GET, "/pull-requests/" + id, null));
        assertThat(summary.get("state").asText()).isEqualTo("MERGED");
        assertThat(summary.get("mergeCommitId").asText()).isEqualTo(commitId);
        assertThat(summary.get("reviewCount").asInt()).isEqualTo(1);
        assertThat(summary.get("commentCount").asInt()).isEqualTo(1);
        assertThat(summary.get("reviewers").size()).isEqualTo(2);

        JsonNode reviews = json(call("alice", HttpMethod.GET, "/pull-requests/" + id + "/reviews", null));
        assertThat(reviews.size()).isEqualTo(1);
        assertThat(reviews.get(0).get("comments").size()).isEqualTo(1);
    }

    @Test
    @DisplayName("failures map to distinct statuses and leave stored state unchanged")
    void failuresLeaveNoTrace() throws Exception {
        UUID id = create(2);

        assertThat(call("bob", HttpMethod.POST, "/pull-requests/" + id + "/merge", null).getStatusCode())
                .isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(call("mike", HttpMethod.POST, "/pull-requests/" + id + "/merge", null).getStatusCode())
                .isEqualTo(HttpStatus.CONFLICT);
        assertThat(call("eve", HttpMethod.GET, "/pull-requests/" + id, null).getStatusCode())
                .isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(call("alice", HttpMethod.GET, "/pull-requests/" + UUID.randomUUID(), null).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);

        call("alice", HttpMethod.POST, "/pull-requests/" + id + "/ready-for-review", null);
        call("bob", HttpMethod.POST, "/pull-requests/" + id + "/review-requests", null);
        call("bob", HttpMethod.POST, "/pull-requests/" + id + "/reviews",
                Map.of("verdict", "REQUEST_CHANGES", "summary", "needs tests"));

        ResponseEntity<String> merge = call("mike", HttpMethod.POST, "/pull-requests/" + id + "/merge", null);
        assertThat(merge.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(json(merge).get("code").asText()).isEqualTo("MERGE_NOT_ELIGIBLE");

        JsonNode mergeable = json(call("alice", HttpMethod.GET, "/pull-requests/" + id + "/mergeable", null));
        assertThat(mergeable.get("canMerge").asBoolean()).isFalse();

        PullRequest stored = repository.findById(id).orElseThrow();
        assertThat(stored.getState()).isEqualTo(PullRequestState.CHANGES_REQUESTED);
        assertThat(stored.getMergeCommitId()).isNull();
    }

    @Test
    @DisplayName("a stale copy cannot overwrite a newer version")
    void optimisticLocking() {
        UUID id = create(2);
        PullRequest stale = transactionTemplate.execute(status -> {
            PullRequest pr = repository.findById(id).orElseThrow();
            pr.getParties();
            return pr;
        });

        call("alice", HttpMethod.POST, "/pull-requests/" + id + "/ready-for-review", null);

        stale.close("mike", "stale write");
        assertThatThrownBy(() -> repository.saveAndFlush(stale))
                .isInstanceOf(ObjectOptimisticLockingFailureException.class);
        assertThat(repository.findById(id).orElseThrow().getState()).isEqualTo(PullRequestState.OPEN);
    }

    @Test
    @DisplayName("committed operations are published to the notification queue")
    void publishesNotifications() throws Exception {
        UUID id = create(2);

        List<String> events = new ArrayList<>();
        for (int attempt = 0; attempt < 5 && !events.contains("Created"); attempt++) {
            Optional<Message<String>> message = sqsTemplate.receive(from -> from
                    .queue(NOTIFICATION_QUEUE)
                    .pollTimeout(Duration.ofSeconds(2)), String.class);
            if (message.isEmpty()) continue;
            JsonNode body = objectMapper.readTree(message.get().getPayload());
            if (id.toString().equals(body.get("pullRequestId").asText())) {
                events.add(body.get("event").asText());
            }
        }
        assertThat(events).contains("Created");
    }

    private UUID create(int requiredApprovals) {
        ResponseEntity<String> response = call("alice", HttpMethod.POST, "/pull-requests", Map.of(
                "title", "Add cache",
                "description", "Caches lookups",
                "sourceBranch", "feature/cache",
                "targetBranch", "main",
                "fileChanges", List.of(Map.of("path", "src/Cache.java", "changeType", "ADDED",
                        "linesAdded", 40, "linesDeleted", 0)),
                "reviewers", List.of("bob", "carol"),
                "maintainer", "mike",
                "requiredApprovals", requiredApprovals));
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        try {
            return UUID.fromString(json(response).get("id").asText());
        } catch (Exception e) {
            throw new AssertionError("Unreadable create response: " + response.getBody(), e);
        }
    }

    private ResponseEntity<String> call(String caller, HttpMethod method, String path, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Caller-Identity", caller);
        headers.setContentType(MediaType.APPLICATION_JSON);
        return rest.exchange(path, method, new HttpEntity<>(body, headers), String.class);
    }

    private JsonNode json(ResponseEntity<String> response) throws Exception {
        return objectMapper.readTree(response.getBody());
    }
}
