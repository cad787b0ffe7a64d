package dev.reviewgate.domain.valueobject;

import dev.reviewgate.domain.enums.ChangeType;
import dev.reviewgate.domain.workflow.WorkflowRules;
import dev.reviewgate.exception.ValidationFailedException;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

import java.util.Objects;

/**
 * One file touched by a pull request. {@code oldPath} is present only for renames.
 */
@Embeddable
public class FileChange {

    @Column(name = "path", nullable = false, length = 1024)
    private String path;

    @Enumerated(EnumType.STRING)
    @Column(name = "change_type", nullable = false, length = 16)
    private ChangeType changeType;

    @Column(name = "lines_added", nullable = false)
    private int linesAdded;

    @Column(name = "lines_deleted", nullable = false)
    private int linesDeleted;

    @Column(name = "old_path", length = 1024)
    private String oldPath;

    protected FileChange() {
    }

    public static FileChange of(String path, ChangeType changeType, int linesAdded, int linesDeleted,
                                String oldPath) {
        WorkflowRules.requireText(path, "file.path", "path");
        WorkflowRules.requireMaxLength(path, WorkflowRules.MAX_PATH_LENGTH, "file.path.length", "path");
        if (changeType == null) {
            throw new ValidationFailedException("file.changeType", "changeType is required for " + path);
        }
        WorkflowRules.requireNonNegative(linesAdded, "file.linesAdded", "linesAdded");
        WorkflowRules.requireNonNegative(linesDeleted, "file.linesDeleted", "linesDeleted");
        boolean hasOldPath = oldPath != null && !oldPath.isBlank();
        WorkflowRules.requireMaxLength(oldPath, WorkflowRules.MAX_PATH_LENGTH, "file.oldPath.length", "oldPath");
        if (changeType == ChangeType.RENAMED && !hasOldPath) {
            throw new ValidationFailedException("file.oldPath", "renamed file %s needs oldPath".formatted(path));
        }
        if (changeType != ChangeType.RENAMED && hasOldPath) {
            throw new ValidationFailedException("file.oldPath",
                    "oldPath is only allowed for renamed files, %s is %s".formatted(path, changeType));
        }
        FileChange f = new FileChange();
        f.path = path;
        f.changeType = changeType;
        f.linesAdded = linesAdded;
        f.linesDeleted = linesDeleted;
        f.oldPath = hasOldPath ? oldPath : null;
        return f;
    }

    public static FileChange modified(String path, int linesAdded, int linesDeleted) {
        return of(path, ChangeType.MODIFIED, linesAdded, linesDeleted, null);
    }

    public String getPath() {
        return path;
    }

    public ChangeType getChangeType() {
        return changeType;
    }

    public int getLinesAdded() {
        return linesAdded;
    }

    public int getLinesDeleted() {
        return linesDeleted;
    }

    public String getOldPath() {
        return oldPath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileChange other)) return false;
        return linesAdded == other.linesAdded && linesDeleted == other.linesDeleted
                && Objects.equals(path, other.path) && changeType == other.changeType
                && Objects.equals(oldPath, other.oldPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, changeType, linesAdded, linesDeleted, oldPath);
    }
}
