package dev.reviewgate.dto.request;

import dev.reviewgate.domain.enums.ChangeType;
import dev.reviewgate.domain.valueobject.FileChangeDraft;

public record FileChangeRequest(String path, ChangeType changeType, int linesAdded, int linesDeleted,
                                String oldPath) {
    public FileChangeDraft toDraft() {
        return new FileChangeDraft(path, changeType, linesAdded, linesDeleted, oldPath);
    }
}
