package dev.reviewgate.domain.entity;

import dev.reviewgate.domain.enums.Verdict;
import dev.reviewgate.domain.valueobject.ReviewComment;
import dev.reviewgate.domain.workflow.WorkflowRules;
import dev.reviewgate.exception.ValidationFailedException;
import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One reviewer's verdict. Written once and never updated; a changed opinion is a new Review.
 */
@Entity
@Immutable
@Table(name = "reviews", indexes = {
        @Index(name = "idx_review_pull_request", columnList = "pull_request_id"),
        @Index(name = "idx_review_reviewer", columnList = "reviewer_id")
})
public class Review {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pull_request_id", nullable = false, updatable = false)
    private PullRequest pullRequest;

    @Column(name = "review_sequence", nullable = false, updatable = false)
    private int sequence;

    @Column(name = "reviewer_id", nullable = false, updatable = false)
    private String reviewer;

    @Enumerated(EnumType.STRING)
    @Column(name = "verdict", nullable = false, length = 20, updatable = false)
    private Verdict verdict;

    @Column(name = "summary", nullable = false, length = 4000, updatable = false)
    private String summary;

    @ElementCollection
    @CollectionTable(name = "review_comments", joinColumns = @JoinColumn(name = "review_id"))
    @OrderColumn(name = "position")
    private List<ReviewComment> comments = new ArrayList<>();

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private Instant submittedAt;

    protected Review() {
    }

    static Review submit(String reviewer, int sequence, Verdict verdict, String summary,
                         List<ReviewComment> comments) {
        if (verdict == null) {
            throw new ValidationFailedException("review.verdict", "verdict is required");
        }
        WorkflowRules.requireText(summary, "review.summary", "summary");
        WorkflowRules.requireMaxLength(summary, WorkflowRules.MAX_TEXT_LENGTH, "review.summary.length", "summary");
        Review r = new Review();
        r.id = UUID.randomUUID();
        r.reviewer = reviewer;
        r.sequence = sequence;
        r.verdict = verdict;
        r.summary = summary;
        if (comments != null) r.comments.addAll(comments);
        r.submittedAt = Instant.now();
        return r;
    }

    void setPullRequest(PullRequest pr) {
        this.pullRequest = pr;
    }

    public UUID getId() {
        return id;
    }

    public int getSequence() {
        return sequence;
    }

    public String getReviewer() {
        return reviewer;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public String getSummary() {
        return summary;
    }

    public List<ReviewComment> getComments() {
        return List.copyOf(comments);
    }

    public int getCommentCount() {
        return comments.size();
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }
}
