package dev.reviewgate.domain.enums;

public enum Verdict {
    APPROVE, REQUEST_CHANGES, COMMENT
}
