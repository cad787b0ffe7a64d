package dev.reviewgate.dto.response;

import dev.reviewgate.domain.enums.Verdict;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ReviewView(UUID id, int sequence, String reviewer, Verdict verdict, String summary,
                         List<CommentView> comments, Instant submittedAt) {
    public record CommentView(UUID id, String author, String filePath, int lineNumber, String text,
                              Instant createdAt) {}
}
