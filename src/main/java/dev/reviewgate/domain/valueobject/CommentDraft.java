package dev.reviewgate.domain.valueobject;

/**
 * Unvalidated line comment as submitted by a caller.
 */
public record CommentDraft(String filePath, int lineNumber, String text) {

    public ReviewComment toComment(String author) {
        return ReviewComment.create(author, filePath, lineNumber, text);
    }
}
