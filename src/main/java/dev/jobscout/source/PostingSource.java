package dev.jobscout.source;

import dev.jobscout.model.PostingCandidate;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Interface for posting sources.
 * Query-driven aggregators run every query; applicant-tracking boards ignore the queries
 * and list their configured boards.
 */
public interface PostingSource {

    /**
     * Source identifier stored on every posting (e.g. "adzuna", "greenhouse").
     */
    String getName();

    /**
     * Fetch postings for the given queries. Individual failures are logged and skipped,
     * so the stream completes with whatever was collected.
     */
    Flux<PostingCandidate> fetch(List<SearchQuery> queries);

    /**
     * A source without credentials or boards reports false and is skipped.
     */
    default boolean isEnabled() {
        return true;
    }
}
