package dev.reviewgate.domain.enums;

public enum ChangeType {
    ADDED, MODIFIED, DELETED, RENAMED
}
