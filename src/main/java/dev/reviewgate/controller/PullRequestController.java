package dev.reviewgate.controller;

import dev.reviewgate.dto.request.AddFilesRequest;
import dev.reviewgate.dto.request.AuthorResponseRequest;
import dev.reviewgate.dto.request.CloseRequest;
import dev.reviewgate.dto.request.CommentRequest;
import dev.reviewgate.dto.request.CreatePullRequestRequest;
import dev.reviewgate.dto.request.MergePullRequestRequest;
import dev.reviewgate.dto.request.RequiredApprovalsRequest;
import dev.reviewgate.dto.request.SubmitReviewRequest;
import dev.reviewgate.dto.request.UpdateDetailsRequest;
import dev.reviewgate.dto.response.CountResponse;
import dev.reviewgate.dto.response.MergeabilityResponse;
import dev.reviewgate.dto.response.OperationResults;
import dev.reviewgate.dto.response.PullRequestSummary;
import dev.reviewgate.dto.response.ReviewView;
import dev.reviewgate.service.PullRequestQueryService;
import dev.reviewgate.service.PullRequestService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.security.Principal;
import java.util.List;
import java.util.UUID;

/**
 * One endpoint per workflow operation. The caller identity is the authenticated
 * principal name; all protocol decisions are made by the service and the aggregate.
 */
@RestController
@RequestMapping("/pull-requests")
public class PullRequestController {
    private final PullRequestService commandService;
    private final PullRequestQueryService queryService;

    public PullRequestController(PullRequestService commandService, PullRequestQueryService queryService) {
        this.commandService = commandService;
        this.queryService = queryService;
    }

    @PostMapping
    public ResponseEntity<OperationResults.Created> create(Principal caller,
                                                           @RequestBody CreatePullRequestRequest request) {
        OperationResults.Created created = commandService.create(caller.getName(), request);
        return ResponseEntity.created(URI.create("/pull-requests/" + created.id())).body(created);
    }

    @PutMapping("/{id}/details")
    public OperationResults.DetailsUpdated updateDetails(@PathVariable UUID id, Principal caller,
                                                         @RequestBody UpdateDetailsRequest request) {
        return commandService.updateDetails(id, caller.getName(), request);
    }

    @PostMapping("/{id}/files")
    public OperationResults.FilesAdded addFiles(@PathVariable UUID id, Principal caller,
                                                @RequestBody AddFilesRequest request) {
        return commandService.addFiles(id, caller.getName(), request);
    }

    @PostMapping("/{id}/ready-for-review")
    public OperationResults.StateChanged markReadyForReview(@PathVariable UUID id, Principal caller) {
        return commandService.markReadyForReview(id, caller.getName());
    }

    @PostMapping("/{id}/convert-to-draft")
    public OperationResults.StateChanged convertToDraft(@PathVariable UUID id, Principal caller) {
        return commandService.convertToDraft(id, caller.getName());
    }

    @PostMapping("/{id}/review-requests")
    public OperationResults.StateChanged requestReview(@PathVariable UUID id, Principal caller) {
        return commandService.requestReview(id, caller.getName());
    }

    @PostMapping("/{id}/reviews")
    @ResponseStatus(HttpStatus.CREATED)
    public OperationResults.ReviewSubmitted submitReview(@PathVariable UUID id, Principal caller,
                                                         @RequestBody SubmitReviewRequest request) {
        return commandService.submitReview(id, caller.getName(), request);
    }

    @PostMapping("/{id}/comments")
    @ResponseStatus(HttpStatus.CREATED)
    public OperationResults.CommentAdded addComment(@PathVariable UUID id, Principal caller,
                                                    @RequestBody CommentRequest request) {
        return commandService.addComment(id, caller.getName(), request);
    }

    @PutMapping("/{id}/required-approvals")
    public OperationResults.RequiredApprovalsChanged setRequiredApprovals(@PathVariable UUID id, Principal caller,
                                                                          @RequestBody RequiredApprovalsRequest request) {
        return commandService.setRequiredApprovals(id, caller.getName(), request.count());
    }

    @PostMapping("/{id}/merge")
    public OperationResults.Merged merge(@PathVariable UUID id, Principal caller,
                                         @RequestBody(required = false) MergePullRequestRequest request) {
        return commandService.merge(id, caller.getName(), request != null ? request.commitMessage() : null);
    }

    @PostMapping("/{id}/close")
    public OperationResults.StateChanged close(@PathVariable UUID id, Principal caller,
                                               @RequestBody(required = false) CloseRequest request) {
        return commandService.close(id, caller.getName(), request != null ? request.reason() : null);
    }

    @PostMapping("/{id}/reopen")
    public OperationResults.StateChanged reopen(@PathVariable UUID id, Principal caller) {
        return commandService.reopen(id, caller.getName());
    }

    @PostMapping("/{id}/responses")
    @ResponseStatus(HttpStatus.CREATED)
    public OperationResults.ResponseRecorded respondToReview(@PathVariable UUID id, Principal caller,
                                                             @RequestBody AuthorResponseRequest request) {
        return commandService.respondToReview(id, caller.getName(), request.text());
    }

    @GetMapping("/{id}")
    public PullRequestSummary getSummary(@PathVariable UUID id, Principal caller) {
        return queryService.getSummary(id, caller.getName());
    }

    @GetMapping("/{id}/reviews")
    public List<ReviewView> getReviews(@PathVariable UUID id, Principal caller) {
        return queryService.getReviews(id, caller.getName());
    }

    @GetMapping("/{id}/reviews/count")
    public CountResponse getReviewCount(@PathVariable UUID id, Principal caller) {
        return queryService.getReviewCount(id, caller.getName());
    }

    @GetMapping("/{id}/approvals/count")
    public CountResponse getApprovalCount(@PathVariable UUID id, Principal caller) {
        return queryService.getApprovalCount(id, caller.getName());
    }

    @GetMapping("/{id}/mergeable")
    public MergeabilityResponse canMerge(@PathVariable UUID id, Principal caller) {
        return queryService.canMerge(id, caller.getName());
    }
}
