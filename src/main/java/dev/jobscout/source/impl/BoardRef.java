package dev.jobscout.source.impl;

/**
 * A company's applicant-tracking board: the configured company key and the board's slug.
 */
record BoardRef(String companyKey, String boardId) {

    @Override
    public String toString() {
        return companyKey + " (" + boardId + ")";
    }
}
