package dev.jobscout.ai;

import java.util.List;

/**
 * Outcome of parsing one batch response: either the per-item scores or the reason
 * the whole batch could not be read.
 */
public record BatchScoringResult(List<ItemScore> scores, String failureReason) {

    public static BatchScoringResult success(List<ItemScore> scores) {
        return new BatchScoringResult(List.copyOf(scores), null);
    }

    public static BatchScoringResult failed(String reason) {
        return new BatchScoringResult(List.of(), reason);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }
}
