package dev.jobscout.model;

/**
 * A candidate with its AI fit score (0-10).
 */
public record ScoredPosting(PostingCandidate candidate, double fitScore, boolean b2cValidated, String reasoning) {
}
