package dev.jobscout.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a shared-pool run.
 */
public record PoolRunSummary(
        String runId,
        List<String> sourcesQueried,
        int totalFetched,
        int afterDedup,
        int inserted,
        int updated,
        int markedStale,
        int usersScored,
        int matchesCreated,
        List<String> errors) {

    public PoolRunSummary withError(String error) {
        List<String> all = new ArrayList<>(errors);
        all.add(error);
        return new PoolRunSummary(runId, sourcesQueried, totalFetched, afterDedup, inserted, updated,
                markedStale, usersScored, matchesCreated, List.copyOf(all));
    }
}
