package dev.jobscout.service;

import java.util.List;

/**
 * Outcome of an on-demand run. {@code errors} lists non-fatal problems met along the way.
 */
public record ScoutRunSummary(
        String runId,
        List<String> sourcesQueried,
        int totalFetched,
        int afterDedup,
        int afterPrefilter,
        int aiScored,
        int promoted,
        int savedForReview,
        int dismissed,
        List<String> errors) {

    public static ScoutRunSummary empty(String runId, List<String> sourcesQueried, List<String> errors) {
        return new ScoutRunSummary(runId, sourcesQueried, 0, 0, 0, 0, 0, 0, 0, errors);
    }
}
