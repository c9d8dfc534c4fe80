package dev.jobscout.notify;

import java.util.List;

/**
 * A run summary ready for delivery: a subject line, a plain-text body and
 * the postings worth listing individually.
 */
public record ScoutNotification(String runId, String subject, String text, List<Highlight> highlights) {

    public ScoutNotification {
        highlights = highlights == null ? List.of() : List.copyOf(highlights);
    }

    /**
     * A posting listed in the summary, with its score on the run's scale.
     */
    public record Highlight(String title, String company, String score, String url) {
    }
}
