package dev.reviewgate.domain.valueobject;

import dev.reviewgate.domain.enums.PartyRole;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Frozen role assignments of one pull request. Identities are opaque references
 * resolved elsewhere; membership is a plain set lookup.
 */
public record Parties(String author, Set<String> reviewers, String maintainer) {

    public Parties {
        if (author == null || author.isBlank()) throw new IllegalArgumentException("author required");
        if (maintainer == null || maintainer.isBlank()) throw new IllegalArgumentException("maintainer required");
        reviewers = reviewers == null ? Set.of() : Set.copyOf(new LinkedHashSet<>(reviewers));
    }

    public boolean isMember(String identity, PartyRole role) {
        if (identity == null) return false;
        return switch (role) {
            case AUTHOR -> author.equals(identity);
            case REVIEWER -> reviewers.contains(identity);
            case MAINTAINER -> maintainer.equals(identity);
        };
    }
}
