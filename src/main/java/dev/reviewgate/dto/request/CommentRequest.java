package dev.reviewgate.dto.request;

import dev.reviewgate.domain.valueobject.CommentDraft;

public record CommentRequest(String filePath, int lineNumber, String text) {
    public CommentDraft toDraft() {
        return new CommentDraft(filePath, lineNumber, text);
    }
}
