package dev.reviewgate.domain.enums;

/**
 * Roles fixed at creation. AUTHOR and MAINTAINER hold exactly one identity each,
 * REVIEWER holds a non-empty set.
 */
public enum PartyRole {
    AUTHOR, REVIEWER, MAINTAINER
}
