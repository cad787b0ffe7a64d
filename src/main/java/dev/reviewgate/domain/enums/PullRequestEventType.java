package dev.reviewgate.domain.enums;

/**
 * Notification names handed to the emitter, one per successful mutating operation.
 */
public enum PullRequestEventType {
    CREATED("Created"),
    READY_FOR_REVIEW("ReadyForReview"),
    CONVERTED_TO_DRAFT("ConvertedToDraft"),
    DETAILS_UPDATED("DetailsUpdated"),
    FILES_ADDED("FilesAdded"),
    REVIEW_REQUESTED("ReviewRequested"),
    REVIEW_SUBMITTED("ReviewSubmitted"),
    COMMENT_ADDED("CommentAdded"),
    REQUIRED_APPROVALS_CHANGED("RequiredApprovalsChanged"),
    MERGED("Merged"),
    CLOSED("Closed"),
    REOPENED("Reopened"),
    AUTHOR_RESPONDED("AuthorResponded");

    private final String eventName;

    PullRequestEventType(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
