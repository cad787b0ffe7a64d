package dev.reviewgate.service;

import dev.reviewgate.domain.entity.PullRequest;
import dev.reviewgate.domain.entity.Review;
import dev.reviewgate.domain.valueobject.FileChange;
import dev.reviewgate.domain.valueobject.ReviewComment;
import dev.reviewgate.domain.valueobject.ReviewTally;
import dev.reviewgate.domain.workflow.ReviewAggregator;
import dev.reviewgate.dto.response.CountResponse;
import dev.reviewgate.dto.response.MergeabilityResponse;
import dev.reviewgate.dto.response.PullRequestSummary;
import dev.reviewgate.dto.response.ReviewView;
import dev.reviewgate.exception.PullRequestNotFoundException;
import dev.reviewgate.repository.PullRequestRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/** Read-side service with read-only transactions. Every query requires the caller to be a party. */
@Service
@Transactional(readOnly = true)
public class PullRequestQueryService {
    private final PullRequestRepository repository;

    public PullRequestQueryService(PullRequestRepository repository) {
        this.repository = repository;
    }

    public PullRequestSummary getSummary(UUID id, String caller) {
        return toSummary(load(id, caller));
    }

    public List<ReviewView> getReviews(UUID id, String caller) {
        return load(id, caller).getReviews().stream().map(this::toView).toList();
    }

    public CountResponse getReviewCount(UUID id, String caller) {
        return new CountResponse(id, load(id, caller).getTally().reviewCount());
    }

    public CountResponse getApprovalCount(UUID id, String caller) {
        return new CountResponse(id, load(id, caller).getTally().approvalCount());
    }

    public MergeabilityResponse canMerge(UUID id, String caller) {
        PullRequest pr = load(id, caller);
        String blocker = ReviewAggregator.mergeBlocker(pr.getState(), pr.getTally(), pr.getRequiredApprovals());
        return new MergeabilityResponse(id, blocker == null, pr.getState(), blocker);
    }

    private PullRequest load(UUID id, String caller) {
        PullRequest pr = repository.findById(id).orElseThrow(() -> new PullRequestNotFoundException(id));
        pr.requireParticipant(caller);
        return pr;
    }

    private PullRequestSummary toSummary(PullRequest pr) {
        ReviewTally tally = pr.getTally();
        List<FileChange> files = pr.getFileChanges();
        return new PullRequestSummary(pr.getId(), pr.getTitle(), pr.getDescription(),
                pr.getSourceBranch(), pr.getTargetBranch(), pr.getState(), pr.getAuthor(),
                pr.getReviewers().stream().sorted().toList(), pr.getMaintainer(), pr.getRequiredApprovals(),
                files.stream().map(this::toFileSummary).toList(),
                files.stream().mapToInt(FileChange::getLinesAdded).sum(),
                files.stream().mapToInt(FileChange::getLinesDeleted).sum(),
                tally.reviewCount(), tally.approvalCount(), tally.changesRequestedCount(), tally.commentCount(),
                pr.getDiscussion().size(), pr.getResponses().size(),
                tally.hasUnresolvedChangeRequests(), pr.canMerge(),
                pr.getMergeCommitId(), pr.getMergedAt(), pr.getMergedBy(), pr.getClosedAt(), pr.getCloseReason(),
                pr.getCreatedAt(), pr.getUpdatedAt(), pr.getVersion());
    }

    private PullRequestSummary.FileSummary toFileSummary(FileChange f) {
        return new PullRequestSummary.FileSummary(f.getPath(), f.getChangeType(), f.getLinesAdded(),
                f.getLinesDeleted(), f.getOldPath());
    }

    private ReviewView toView(Review r) {
        return new ReviewView(r.getId(), r.getSequence(), r.getReviewer(), r.getVerdict(), r.getSummary(),
                r.getComments().stream().map(this::toCommentView).toList(), r.getSubmittedAt());
    }

    private ReviewView.CommentView toCommentView(ReviewComment c) {
        return new ReviewView.CommentView(c.getId(), c.getAuthor(), c.getFilePath(), c.getLineNumber(),
                c.getText(), c.getCreatedAt());
    }
}
