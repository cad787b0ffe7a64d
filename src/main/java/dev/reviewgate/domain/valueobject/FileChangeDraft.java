package dev.reviewgate.domain.valueobject;

import dev.reviewgate.domain.enums.ChangeType;

/**
 * Unvalidated file change as submitted by a caller. Turned into a {@link FileChange}
 * only after the caller has been authorized.
 */
public record FileChangeDraft(String path, ChangeType changeType, int linesAdded, int linesDeleted,
                              String oldPath) {

    public FileChange toFileChange() {
        return FileChange.of(path, changeType, linesAdded, linesDeleted, oldPath);
    }
}
