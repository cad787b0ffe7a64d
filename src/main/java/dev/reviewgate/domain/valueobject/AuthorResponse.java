package dev.reviewgate.domain.valueobject;

import dev.reviewgate.domain.workflow.WorkflowRules;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Author's reply to the reviews received so far.
 */
@Embeddable
public class AuthorResponse {

    @Column(name = "response_id", nullable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "body", nullable = false, length = 4000)
    private String text;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected AuthorResponse() {
    }

    public static AuthorResponse create(String text) {
        WorkflowRules.requireText(text, "response.text", "text");
        WorkflowRules.requireMaxLength(text, WorkflowRules.MAX_TEXT_LENGTH, "response.text.length", "text");
        AuthorResponse r = new AuthorResponse();
        r.id = UUID.randomUUID();
        r.text = text;
        r.createdAt = Instant.now();
        return r;
    }

    public UUID getId() {
        return id;
    }

    public String getText() {
        return text;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof AuthorResponse other && Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }
}
