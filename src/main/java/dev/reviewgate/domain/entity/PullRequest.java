package dev.reviewgate.domain.entity;

import dev.reviewgate.domain.enums.PullRequestEventType;
import dev.reviewgate.domain.enums.PullRequestState;
import dev.reviewgate.domain.enums.Verdict;
import dev.reviewgate.domain.event.PullRequestEvent;
import dev.reviewgate.domain.valueobject.AuthorResponse;
import dev.reviewgate.domain.valueobject.CommentDraft;
import dev.reviewgate.domain.valueobject.FileChange;
import dev.reviewgate.domain.valueobject.FileChangeDraft;
import dev.reviewgate.domain.valueobject.Parties;
import dev.reviewgate.domain.valueobject.ReviewComment;
import dev.reviewgate.domain.valueobject.ReviewTally;
import dev.reviewgate.domain.workflow.AuthorizationGuard;
import dev.reviewgate.domain.workflow.PullRequestOperation;
import dev.reviewgate.domain.workflow.ReviewAggregator;
import dev.reviewgate.domain.workflow.WorkflowRules;
import dev.reviewgate.exception.MergeNotEligibleException;
import dev.reviewgate.exception.ValidationFailedException;
import jakarta.persistence.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Aggregate root for one pull request.
 *
 * <p>Every mutating method runs the same sequence: role check, state guard,
 * argument validation, mutation, transition. All checks come before the first
 * field is touched, so a rejected call leaves the aggregate exactly as it was.
 * Each method returns the notification describing what happened.
 *
 * <p>Concurrent writers are serialized by optimistic locking ({@code @Version}).
 * Parties are frozen at creation.
 */
@Entity
@Table(name = "pull_requests", indexes = {
        @Index(name = "idx_pull_request_state", columnList = "state"),
        @Index(name = "idx_pull_request_author", columnList = "author_id"),
        @Index(name = "idx_pull_request_created", columnList = "created_at")
})
public class PullRequest {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "title", nullable = false, length = WorkflowRules.MAX_TITLE_LENGTH)
    private String title;

    @Column(name = "description", nullable = false, length = 8000)
    private String description;

    @Column(name = "source_branch", nullable = false)
    private String sourceBranch;

    @Column(name = "target_branch", nullable = false)
    private String targetBranch;

    @Column(name = "author_id", nullable = false, updatable = false)
    private String author;

    @ElementCollection
    @CollectionTable(name = "pull_request_reviewers", joinColumns = @JoinColumn(name = "pull_request_id"))
    @Column(name = "reviewer_id", nullable = false)
    private Set<String> reviewers = new LinkedHashSet<>();

    @Column(name = "maintainer_id", nullable = false, updatable = false)
    private String maintainer;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private PullRequestState state;

    @Column(name = "required_approvals", nullable = false)
    private int requiredApprovals;

    @ElementCollection
    @CollectionTable(name = "pull_request_files", joinColumns = @JoinColumn(name = "pull_request_id"))
    @OrderColumn(name = "position")
    private List<FileChange> fileChanges = new ArrayList<>();

    @OneToMany(mappedBy = "pullRequest", cascade = CascadeType.ALL)
    @OrderBy("sequence ASC")
    private List<Review> reviews = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "pull_request_comments", joinColumns = @JoinColumn(name = "pull_request_id"))
    @OrderColumn(name = "position")
    private List<ReviewComment> discussion = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "pull_request_responses", joinColumns = @JoinColumn(name = "pull_request_id"))
    @OrderColumn(name = "position")
    private List<AuthorResponse> responses = new ArrayList<>();

    @Version
    private Long version;

    @Column(name = "merge_commit_id", length = 40)
    private String mergeCommitId;

    @Column(name = "merge_commit_message", length = 4000)
    private String mergeCommitMessage;

    @Column(name = "merged_at")
    private Instant mergedAt;

    @Column(name = "merged_by")
    private String mergedBy;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "close_reason", length = 2000)
    private String closeReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected PullRequest() {
    }

    /**
     * Creates a draft. The caller becomes the author; reviewers and maintainer are fixed from here on.
     *
     * <p>Besides the field rules, the author may not appear among the reviewers
     * ({@code reviewers.selfReview}).
     *
     * @throws ValidationFailedException if any field rule fails; nothing is created in that case
     */
    public static PullRequest create(String author, String title, String description,
                                     String sourceBranch, String targetBranch, List<FileChangeDraft> files,
                                     Set<String> reviewers, String maintainer, int requiredApprovals) {
        WorkflowRules.requireText(author, "author.required", "author");
        WorkflowRules.requireMaxLength(author, WorkflowRules.MAX_IDENTITY_LENGTH, "author.length", "author");
        WorkflowRules.requireTitle(title);
        requireDescription(description);
        WorkflowRules.requireText(sourceBranch, "branch.source", "sourceBranch");
        WorkflowRules.requireMaxLength(sourceBranch, WorkflowRules.MAX_BRANCH_LENGTH, "branch.source.length",
                "sourceBranch");
        WorkflowRules.requireText(targetBranch, "branch.target", "targetBranch");
        WorkflowRules.requireMaxLength(targetBranch, WorkflowRules.MAX_BRANCH_LENGTH, "branch.target.length",
                "targetBranch");
        if (sourceBranch.equals(targetBranch)) {
            throw new ValidationFailedException("branch.distinct",
                    "sourceBranch and targetBranch must differ, both are '%s'".formatted(sourceBranch));
        }
        List<FileChange> changes = toFileChanges(files);
        if (reviewers == null || reviewers.isEmpty()) {
            throw new ValidationFailedException("reviewers.required", "at least one reviewer is required");
        }
        for (String reviewer : reviewers) {
            WorkflowRules.requireText(reviewer, "reviewers.identity", "reviewer identity");
            WorkflowRules.requireMaxLength(reviewer, WorkflowRules.MAX_IDENTITY_LENGTH, "reviewers.identity.length",
                    "reviewer identity");
        }
        if (reviewers.contains(author)) {
            throw new ValidationFailedException("reviewers.selfReview",
                    "author '%s' cannot review their own pull request".formatted(author));
        }
        WorkflowRules.requireText(maintainer, "maintainer.required", "maintainer");
        WorkflowRules.requireMaxLength(maintainer, WorkflowRules.MAX_IDENTITY_LENGTH, "maintainer.length",
                "maintainer");
        WorkflowRules.requireApprovalThreshold(requiredApprovals);

        PullRequest pr = new PullRequest();
        pr.id = UUID.randomUUID();
        pr.author = author;
        pr.title = title;
        pr.description = description != null ? description : "";
        pr.sourceBranch = sourceBranch;
        pr.targetBranch = targetBranch;
        pr.fileChanges.addAll(changes);
        pr.reviewers.addAll(reviewers);
        pr.maintainer = maintainer;
        pr.requiredApprovals = requiredApprovals;
        pr.state = PullRequestState.DRAFT;
        pr.createdAt = Instant.now();
        pr.updatedAt = pr.createdAt;
        return pr;
    }

    public PullRequestEvent creationEvent() {
        return event(PullRequestEventType.CREATED, author, payload(
                "title", title,
                "sourceBranch", sourceBranch,
                "targetBranch", targetBranch,
                "fileCount", fileChanges.size(),
                "requiredApprovals", requiredApprovals));
    }

    public PullRequestEvent updateDetails(String caller, String newTitle, String newDescription) {
        authorize(caller, PullRequestOperation.UPDATE_DETAILS);
        WorkflowRules.requireTitle(newTitle);
        requireDescription(newDescription);

        this.title = newTitle;
        this.description = newDescription != null ? newDescription : "";
        touch();
        return event(PullRequestEventType.DETAILS_UPDATED, caller, payload("title", title));
    }

    public PullRequestEvent addFiles(String caller, List<FileChangeDraft> files) {
        authorize(caller, PullRequestOperation.ADD_FILES);
        List<FileChange> changes = toFileChanges(files);

        fileChanges.addAll(changes);
        touch();
        return event(PullRequestEventType.FILES_ADDED, caller, payload(
                "added", changes.size(),
                "fileCount", fileChanges.size()));
    }

    public PullRequestEvent markReadyForReview(String caller) {
        authorize(caller, PullRequestOperation.MARK_READY_FOR_REVIEW);
        become(PullRequestState.OPEN);
        return event(PullRequestEventType.READY_FOR_REVIEW, caller, payload());
    }

    public PullRequestEvent convertToDraft(String caller) {
        authorize(caller, PullRequestOperation.CONVERT_TO_DRAFT);
        become(PullRequestState.DRAFT);
        return event(PullRequestEventType.CONVERTED_TO_DRAFT, caller, payload());
    }

    public PullRequestEvent requestReview(String caller) {
        authorize(caller, PullRequestOperation.REQUEST_REVIEW);
        become(PullRequestState.REVIEW_REQUESTED);
        return event(PullRequestEventType.REVIEW_REQUESTED, caller, payload(
                "reviewers", List.copyOf(reviewers)));
    }

    /**
     * Appends an immutable review and moves to the state the verdict calls for.
     * REQUEST_CHANGES always wins over approvals already collected.
     */
    public PullRequestEvent submitReview(String caller, Verdict verdict, String summary,
                                         List<CommentDraft> comments) {
        authorize(caller, PullRequestOperation.SUBMIT_REVIEW);
        List<ReviewComment> validated = new ArrayList<>();
        if (comments != null) {
            for (CommentDraft draft : comments) {
                if (draft == null) {
                    throw new ValidationFailedException("comment.required", "comment entries must not be null");
                }
                validated.add(draft.toComment(caller));
            }
        }
        Review review = Review.submit(caller, reviews.size() + 1, verdict, summary, validated);

        List<Review> prospective = new ArrayList<>(reviews);
        prospective.add(review);
        ReviewTally tally = ReviewAggregator.tally(prospective);
        PullRequestState next = ReviewAggregator.nextState(state, verdict, tally, requiredApprovals);

        review.setPullRequest(this);
        reviews.add(review);
        become(next);
        return event(PullRequestEventType.REVIEW_SUBMITTED, caller, payload(
                "reviewId", review.getId(),
                "verdict", verdict.name(),
                "approvalCount", tally.approvalCount(),
                "changesRequestedCount", tally.changesRequestedCount()));
    }

    public PullRequestEvent addComment(String caller, CommentDraft draft) {
        authorize(caller, PullRequestOperation.ADD_COMMENT);
        if (draft == null) {
            throw new ValidationFailedException("comment.required", "comment is required");
        }
        ReviewComment comment = draft.toComment(caller);

        discussion.add(comment);
        touch();
        return event(PullRequestEventType.COMMENT_ADDED, caller, payload(
                "commentId", comment.getId(),
                "filePath", comment.getFilePath(),
                "lineNumber", comment.getLineNumber()));
    }

    public PullRequestEvent setRequiredApprovals(String caller, int count) {
        authorize(caller, PullRequestOperation.SET_REQUIRED_APPROVALS);
        WorkflowRules.requireApprovalThreshold(count);

        int previous = requiredApprovals;
        this.requiredApprovals = count;
        touch();
        return event(PullRequestEventType.REQUIRED_APPROVALS_CHANGED, caller, payload(
                "previous", previous,
                "requiredApprovals", count));
    }

    /**
     * Records merge metadata. No branch is touched; the commit id is derived, not produced by git.
     *
     * @throws MergeNotEligibleException when not approved, approvals are short or change requests exist
     */
    public PullRequestEvent merge(String caller, String commitMessage) {
        authorize(caller, PullRequestOperation.MERGE);
        WorkflowRules.requireMaxLength(commitMessage, WorkflowRules.MAX_TEXT_LENGTH, "merge.commitMessage.length",
                "commitMessage");
        String blocker = ReviewAggregator.mergeBlocker(state, getTally(), requiredApprovals);
        if (blocker != null) {
            throw new MergeNotEligibleException(id, "Pull request %s cannot be merged: %s".formatted(id, blocker));
        }

        Instant now = Instant.now();
        String message = commitMessage != null && !commitMessage.isBlank()
                ? commitMessage
                : "Merge %s into %s".formatted(sourceBranch, targetBranch);
        this.mergeCommitId = deriveCommitId(message, now);
        this.mergeCommitMessage = message;
        this.mergedAt = now;
        this.mergedBy = caller;
        become(PullRequestState.MERGED);
        return event(PullRequestEventType.MERGED, caller, payload(
                "mergeCommitId", mergeCommitId,
                "targetBranch", targetBranch));
    }

    public PullRequestEvent close(String caller, String reason) {
        authorize(caller, PullRequestOperation.CLOSE);
        WorkflowRules.requireMaxLength(reason, WorkflowRules.MAX_CLOSE_REASON_LENGTH, "close.reason.length",
                "reason");
        PullRequestState previous = state;

        this.closedAt = Instant.now();
        this.closeReason = reason != null && !reason.isBlank() ? reason : null;
        become(PullRequestState.CLOSED);
        return event(PullRequestEventType.CLOSED, caller, payload(
                "previousState", previous.getIdentifier(),
                "reason", closeReason));
    }

    public PullRequestEvent reopen(String caller) {
        authorize(caller, PullRequestOperation.REOPEN);

        this.closedAt = null;
        this.closeReason = null;
        become(PullRequestState.OPEN);
        return event(PullRequestEventType.REOPENED, caller, payload());
    }

    public PullRequestEvent respondToReview(String caller, String text) {
        authorize(caller, PullRequestOperation.RESPOND_TO_REVIEW);
        AuthorResponse response = AuthorResponse.create(text);

        responses.add(response);
        touch();
        return event(PullRequestEventType.AUTHOR_RESPONDED, caller, payload(
                "responseId", response.getId()));
    }

    /**
     * Read access for any party. Throws AuthorizationDeniedException for outsiders.
     */
    public void requireParticipant(String caller) {
        authorize(caller, PullRequestOperation.VIEW);
    }

    public ReviewTally getTally() {
        return ReviewAggregator.tally(reviews);
    }

    public boolean canMerge() {
        return ReviewAggregator.canMerge(state, getTally(), requiredApprovals);
    }

    public Parties getParties() {
        return new Parties(author, reviewers, maintainer);
    }

    private void authorize(String caller, PullRequestOperation operation) {
        AuthorizationGuard.check(caller, operation, getParties(), state);
    }

    private void become(PullRequestState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal transition %s -> %s".formatted(state, target));
        }
        this.state = target;
        touch();
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    private PullRequestEvent event(PullRequestEventType type, String actor, Map<String, Object> payload) {
        return new PullRequestEvent(type, id, actor, state, payload, updatedAt);
    }

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    private static void requireDescription(String description) {
        WorkflowRules.requireMaxLength(description, WorkflowRules.MAX_DESCRIPTION_LENGTH, "description.length",
                "description");
    }

    private static List<FileChange> toFileChanges(List<FileChangeDraft> files) {
        if (files == null || files.isEmpty()) {
            throw new ValidationFailedException("files.required", "at least one file change is required");
        }
        List<FileChange> changes = new ArrayList<>(files.size());
        for (FileChangeDraft draft : files) {
            if (draft == null) {
                throw new ValidationFailedException("files.required", "file change entries must not be null");
            }
            changes.add(draft.toFileChange());
        }
        return changes;
    }

    private String deriveCommitId(String message, Instant at) {
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            String material = String.join("\n", id.toString(), sourceBranch, targetBranch, message, at.toString());
            return HexFormat.of().formatHex(sha1.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    // Getters
    public UUID getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getSourceBranch() {
        return sourceBranch;
    }

    public String getTargetBranch() {
        return targetBranch;
    }

    public String getAuthor() {
        return author;
    }

    public Set<String> getReviewers() {
        return Set.copyOf(reviewers);
    }

    public String getMaintainer() {
        return maintainer;
    }

    public PullRequestState getState() {
        return state;
    }

    public int getRequiredApprovals() {
        return requiredApprovals;
    }

    public List<FileChange> getFileChanges() {
        return List.copyOf(fileChanges);
    }

    public List<Review> getReviews() {
        return List.copyOf(reviews);
    }

    public List<ReviewComment> getDiscussion() {
        return List.copyOf(discussion);
    }

    public List<AuthorResponse> getResponses() {
        return List.copyOf(responses);
    }

    public Long getVersion() {
        return version;
    }

    public String getMergeCommitId() {
        return mergeCommitId;
    }

    public String getMergeCommitMessage() {
        return mergeCommitMessage;
    }

    public Instant getMergedAt() {
        return mergedAt;
    }

    public String getMergedBy() {
        return mergedBy;
    }

    public Instant getClosedAt() {
        return closedAt;
    }

    public String getCloseReason() {
        return closeReason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
