package dev.reviewgate.service;

import dev.reviewgate.config.WorkflowProperties;
import dev.reviewgate.domain.entity.PullRequest;
import dev.reviewgate.domain.entity.Review;
import dev.reviewgate.domain.event.PullRequestEvent;
import dev.reviewgate.domain.valueobject.CommentDraft;
import dev.reviewgate.domain.valueobject.FileChangeDraft;
import dev.reviewgate.dto.request.AddFilesRequest;
import dev.reviewgate.dto.request.CommentRequest;
import dev.reviewgate.dto.request.CreatePullRequestRequest;
import dev.reviewgate.dto.request.FileChangeRequest;
import dev.reviewgate.dto.request.SubmitReviewRequest;
import dev.reviewgate.dto.request.UpdateDetailsRequest;
import dev.reviewgate.dto.response.OperationResults;
import dev.reviewgate.exception.PullRequestNotFoundException;
import dev.reviewgate.exception.PullRequestWorkflowException;
import dev.reviewgate.repository.PullRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * Command-side service. Each method is one transaction: load the aggregate, let it
 * authorize and apply the operation, flush (the optimistic version check happens here),
 * then publish the resulting event for delivery after commit.
 *
 * <p>Any exception rolls the transaction back, so a failed operation leaves no trace
 * in storage and emits nothing.
 */
@Service
public class PullRequestService {
    private static final Logger log = LoggerFactory.getLogger(PullRequestService.class);
    static final String MDC_KEY = "pullRequestId";

    private final PullRequestRepository repository;
    private final ApplicationEventPublisher eventPublisher;
    private final WorkflowProperties workflowProperties;
    private final OperationMetrics metrics;

    public PullRequestService(PullRequestRepository repository, ApplicationEventPublisher eventPublisher,
                              WorkflowProperties workflowProperties, OperationMetrics metrics) {
        this.repository = repository;
        this.eventPublisher = eventPublisher;
        this.workflowProperties = workflowProperties;
        this.metrics = metrics;
    }

    @Transactional
    public OperationResults.Created create(String caller, CreatePullRequestRequest request) {
        int threshold = request.requiredApprovals() != null
                ? request.requiredApprovals()
                : workflowProperties.defaultRequiredApprovals();
        PullRequest pr;
        try {
            pr = PullRequest.create(caller, request.title(), request.description(),
                    request.sourceBranch(), request.targetBranch(), fileDrafts(request.fileChanges()),
                    request.reviewers(), request.maintainer(), threshold);
        } catch (PullRequestWorkflowException e) {
            metrics.recordFailure("create", e.getCode());
            log.info("Rejected create by {}: {}", caller, e.getMessage());
            throw e;
        }
        repository.saveAndFlush(pr);
        eventPublisher.publishEvent(pr.creationEvent());
        metrics.recordSuccess("create");
        log.info("Created pull request {} '{}' {} -> {} by {}",
                pr.getId(), pr.getTitle(), pr.getSourceBranch(), pr.getTargetBranch(), caller);
        return new OperationResults.Created(pr.getId(), pr.getState());
    }

    @Transactional
    public OperationResults.DetailsUpdated updateDetails(UUID id, String caller, UpdateDetailsRequest request) {
        return execute(id, "updateDetails", caller,
                pr -> pr.updateDetails(caller, request.title(), request.description()),
                pr -> new OperationResults.DetailsUpdated(pr.getId(), pr.getCreatedAt(), pr.getUpdatedAt()));
    }

    @Transactional
    public OperationResults.FilesAdded addFiles(UUID id, String caller, AddFilesRequest request) {
        return execute(id, "addFiles", caller,
                pr -> pr.addFiles(caller, fileDrafts(request.files())),
                pr -> new OperationResults.FilesAdded(pr.getId(), pr.getFileChanges().size()));
    }

    @Transactional
    public OperationResults.StateChanged markReadyForReview(UUID id, String caller) {
        return execute(id, "markReadyForReview", caller, pr -> pr.markReadyForReview(caller), this::stateChanged);
    }

    @Transactional
    public OperationResults.StateChanged convertToDraft(UUID id, String caller) {
        return execute(id, "convertToDraft", caller, pr -> pr.convertToDraft(caller), this::stateChanged);
    }

    @Transactional
    public OperationResults.StateChanged requestReview(UUID id, String caller) {
        return execute(id, "requestReview", caller, pr -> pr.requestReview(caller), this::stateChanged);
    }

    @Transactional
    public OperationResults.ReviewSubmitted submitReview(UUID id, String caller, SubmitReviewRequest request) {
        List<CommentDraft> comments = request.comments() == null ? List.of()
                : request.comments().stream().map(c -> c == null ? null : c.toDraft()).toList();
        return execute(id, "submitReview", caller,
                pr -> pr.submitReview(caller, request.verdict(), request.summary(), comments),
                pr -> {
                    List<Review> reviews = pr.getReviews();
                    Review latest = reviews.get(reviews.size() - 1);
                    return new OperationResults.ReviewSubmitted(latest.getId(), pr.getState(),
                            pr.getTally().approvalCount());
                });
    }

    @Transactional
    public OperationResults.CommentAdded addComment(UUID id, String caller, CommentRequest request) {
        CommentDraft draft = request == null ? null : request.toDraft();
        return execute(id, "addComment", caller,
                pr -> pr.addComment(caller, draft),
                pr -> {
                    var discussion = pr.getDiscussion();
                    return new OperationResults.CommentAdded(discussion.get(discussion.size() - 1).getId());
                });
    }

    @Transactional
    public OperationResults.RequiredApprovalsChanged setRequiredApprovals(UUID id, String caller, int count) {
        return execute(id, "setRequiredApprovals", caller,
                pr -> pr.setRequiredApprovals(caller, count),
                pr -> new OperationResults.RequiredApprovalsChanged(pr.getId(), pr.getRequiredApprovals()));
    }

    @Transactional
    public OperationResults.Merged merge(UUID id, String caller, String commitMessage) {
        return execute(id, "merge", caller,
                pr -> pr.merge(caller, commitMessage),
                pr -> new OperationResults.Merged(pr.getId(), pr.getMergeCommitId(), pr.getState()));
    }

    @Transactional
    public OperationResults.StateChanged close(UUID id, String caller, String reason) {
        return execute(id, "close", caller, pr -> pr.close(caller, reason), this::stateChanged);
    }

    @Transactional
    public OperationResults.StateChanged reopen(UUID id, String caller) {
        return execute(id, "reopen", caller, pr -> pr.reopen(caller), this::stateChanged);
    }

    @Transactional
    public OperationResults.ResponseRecorded respondToReview(UUID id, String caller, String text) {
        return execute(id, "respondToReview", caller,
                pr -> pr.respondToReview(caller, text),
                pr -> {
                    var responses = pr.getResponses();
                    return new OperationResults.ResponseRecorded(responses.get(responses.size() - 1).getId());
                });
    }

    private <R> R execute(UUID id, String operation, String caller,
                          Function<PullRequest, PullRequestEvent> action,
                          Function<PullRequest, R> result) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_KEY, id.toString())) {
            PullRequest pr = repository.findById(id).orElseThrow(() -> new PullRequestNotFoundException(id));
            PullRequestEvent event;
            try {
                event = action.apply(pr);
            } catch (PullRequestWorkflowException e) {
                metrics.recordFailure(operation, e.getCode());
                log.info("Rejected {} on {} by {}: {}", operation, id, caller, e.getMessage());
                throw e;
            }
            repository.saveAndFlush(pr);
            eventPublisher.publishEvent(event);
            metrics.recordSuccess(operation);
            log.info("{} on {} by {} -> {}", operation, id, caller, pr.getState());
            return result.apply(pr);
        }
    }

    private OperationResults.StateChanged stateChanged(PullRequest pr) {
        return new OperationResults.StateChanged(pr.getId(), pr.getState(), pr.getUpdatedAt());
    }

    private static List<FileChangeDraft> fileDrafts(List<FileChangeRequest> files) {
        return files == null ? List.of() : files.stream().map(f -> f == null ? null : f.toDraft()).toList();
    }
}
