package dev.reviewgate.domain.valueobject;

import dev.reviewgate.domain.workflow.WorkflowRules;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Line-anchored remark, either part of a review or added on its own via addComment.
 */
@Embeddable
public class ReviewComment {

    @Column(name = "comment_id", nullable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "author_id", nullable = false)
    private String author;

    @Column(name = "file_path", nullable = false, length = 1024)
    private String filePath;

    @Column(name = "line_number", nullable = false)
    private int lineNumber;

    @Column(name = "body", nullable = false, length = 4000)
    private String text;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected ReviewComment() {
    }

    public static ReviewComment create(String author, String filePath, int lineNumber, String text) {
        WorkflowRules.requireText(filePath, "comment.filePath", "filePath");
        WorkflowRules.requireMaxLength(filePath, WorkflowRules.MAX_PATH_LENGTH, "comment.filePath.length", "filePath");
        WorkflowRules.requirePositiveLine(lineNumber);
        WorkflowRules.requireText(text, "comment.text", "text");
        WorkflowRules.requireMaxLength(text, WorkflowRules.MAX_TEXT_LENGTH, "comment.text.length", "text");
        ReviewComment c = new ReviewComment();
        c.id = UUID.randomUUID();
        c.author = author;
        c.filePath = filePath;
        c.lineNumber = lineNumber;
        c.text = text;
        c.createdAt = Instant.now();
        return c;
    }

    public UUID getId() {
        return id;
    }

    public String getAuthor() {
        return author;
    }

    public String getFilePath() {
        return filePath;
    }

    public int getLineNumber() {
        return lineNumber;
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
        return o instanceof ReviewComment other && Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }
}
