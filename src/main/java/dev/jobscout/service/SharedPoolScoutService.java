package dev.jobscout.service;

import dev.jobscout.config.ScoringConfig;
import dev.jobscout.config.ScoutConfig;
import dev.jobscout.metrics.ScoutMetrics;
import dev.jobscout.model.ExistingPostings;
import dev.jobscout.model.PostingCandidate;
import dev.jobscout.notify.ScoutNotification;
import dev.jobscout.notify.ScoutNotifier;
import dev.jobscout.repository.UserScoutPreferencesRepository;
import dev.jobscout.service.PoolStore.UpsertOutcome;
import dev.jobscout.service.SourceAggregator.FetchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Scheduled shared-pool run: refresh the user-independent pool, retire stale postings,
 * then match every user's backlog with the deterministic scorer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SharedPoolScoutService {

    private static final String SEPARATOR = "========================================";

    private final SourceAggregator sourceAggregator;
    private final DeduplicationService deduplicationService;
    private final ScoutQueryBuilder queryBuilder;
    private final PoolStore poolStore;
    private final UserScoutPreferencesRepository preferencesRepository;
    private final ScoutNotifier notifier;
    private final ScoutConfig scoutConfig;
    private final ScoringConfig scoringConfig;
    private final ScoutMetrics metrics;
    private final Clock clock;

    public Mono<PoolRunSummary> runPool() {
        Instant now = clock.instant();
        String runId = ScoutRunIds.next(now);

        log.info(SEPARATOR);
        log.info("Shared pool run {} starting", runId);
        log.info(SEPARATOR);

        return sourceAggregator.fetchAll(queryBuilder.poolQueries(), runId)
                .flatMap(fetch -> Mono.fromCallable(() -> refreshPool(runId, now, fetch))
                        .subscribeOn(Schedulers.boundedElastic()))
                .flatMap(summary -> sendNotification(summary)
                        .map(sent -> sent ? summary : summary.withError("Notification failed")));
    }

    /**
     * Blocking part of the run. Each step commits on its own, so a failure in one user's
     * matching does not undo the pool refresh or other users' matches.
     */
    PoolRunSummary refreshPool(String runId, Instant now, FetchResult fetch) {
        List<String> errors = new ArrayList<>(fetch.notes());
        if (fetch.sourcesQueried().isEmpty()) {
            log.warn("Pool {}: no posting sources are configured", runId);
            errors.add("No posting sources configured");
            return new PoolRunSummary(runId, fetch.sourcesQueried(), 0, 0, 0, 0, 0, 0, 0, errors);
        }

        List<PostingCandidate> fetched = fetch.candidates();
        metrics.recordPostingsFetched(fetched.size());
        List<PostingCandidate> deduped = deduplicationService.deduplicate(fetched, ExistingPostings.empty());
        metrics.recordDuplicatesDropped(fetched.size() - deduped.size());
        log.info("Pool {}: {} fetched, {} unique in batch", runId, fetched.size(), deduped.size());

        UpsertOutcome upsert = new UpsertOutcome(0, 0);
        try {
            upsert = poolStore.upsert(deduped, now);
            log.info("Pool {}: {} inserted, {} refreshed", runId, upsert.inserted(), upsert.updated());
        } catch (DataAccessException e) {
            log.error("Pool {}: upsert failed and was rolled back: {}", runId, e.getMessage());
            errors.add("Pool upsert failed: " + e.getMessage());
        }

        int stale = 0;
        try {
            stale = poolStore.markStale(now.minus(Duration.ofDays(scoringConfig.getStaleAfterDays())));
            log.info("Pool {}: {} postings marked inactive", runId, stale);
        } catch (DataAccessException e) {
            log.error("Pool {}: stale sweep failed: {}", runId, e.getMessage());
            errors.add("Stale sweep failed: " + e.getMessage());
        }

        List<String> userIds = preferencesRepository.findAllUserIds();
        int usersScored = 0;
        int matchesCreated = 0;
        for (String userId : userIds) {
            try {
                matchesCreated += poolStore.matchUser(userId, now);
                usersScored++;
            } catch (DataIntegrityViolationException e) {
                log.info("Pool {}: user {} already matched by a concurrent run", runId, userId);
                usersScored++;
            } catch (DataAccessException e) {
                log.error("Pool {}: matching user {} failed: {}", runId, userId, e.getMessage());
                errors.add("Matching failed for user " + userId + ": " + e.getMessage());
            }
        }
        metrics.recordMatchesCreated(matchesCreated);
        metrics.updateLastRunStats(fetched.size(), usersScored, 0);
        log.info("Pool {} complete: {} users scored, {} matches created", runId, usersScored, matchesCreated);

        return new PoolRunSummary(runId, fetch.sourcesQueried(), fetched.size(), deduped.size(),
                upsert.inserted(), upsert.updated(), stale, usersScored, matchesCreated, List.copyOf(errors));
    }

    private Mono<Boolean> sendNotification(PoolRunSummary summary) {
        String text = String.format("Sources: %s%nFetched: %d | Unique: %d | New: %d | Refreshed: %d | Retired: %d%n"
                        + "Users scored: %d | New matches: %d%s",
                String.join(", ", summary.sourcesQueried()), summary.totalFetched(), summary.afterDedup(),
                summary.inserted(), summary.updated(), summary.markedStale(), summary.usersScored(),
                summary.matchesCreated(),
                summary.errors().isEmpty() ? "" : String.format("%nErrors: %d", summary.errors().size()));
        ScoutNotification notification = new ScoutNotification(summary.runId(),
                "Job Scout Pool Refresh (" + summary.runId() + ")", text, List.of());

        if (scoutConfig.isDryRun()) {
            log.info("DRY RUN - Would send notification:\n{}", text);
            return Mono.just(true);
        }
        return notifier.notify(scoutConfig.getNotify().getRecipient(), notification)
                .onErrorResume(e -> {
                    log.error("Pool {}: notification failed: {}", summary.runId(), e.getMessage());
                    return Mono.just(false);
                })
                .map(Boolean.TRUE::equals)
                .defaultIfEmpty(false);
    }
}
