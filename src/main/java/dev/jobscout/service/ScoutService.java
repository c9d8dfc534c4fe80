package dev.jobscout.service;

import dev.jobscout.ai.AiBatchScorer;
import dev.jobscout.config.ScoutConfig;
import dev.jobscout.entity.ScoutResult;
import dev.jobscout.entity.UserProfile;
import dev.jobscout.entity.UserScoutPreferences;
import dev.jobscout.metrics.ScoutMetrics;
import dev.jobscout.model.ExistingPostings;
import dev.jobscout.model.PostingCandidate;
import dev.jobscout.model.ScoredPosting;
import dev.jobscout.notify.ScoutNotification;
import dev.jobscout.notify.ScoutNotification.Highlight;
import dev.jobscout.notify.ScoutNotifier;
import dev.jobscout.repository.UserProfileRepository;
import dev.jobscout.service.PreFilterService.PreFilterCriteria;
import dev.jobscout.service.ScoutRunStore.SavedRun;
import dev.jobscout.service.SourceAggregator.FetchResult;
import dev.jobscout.source.SearchQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * On-demand run for one user: fetch, dedupe, pre-filter, AI-score, persist, promote, notify.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScoutService {

    private static final String SEPARATOR = "========================================";

    private final SourceAggregator sourceAggregator;
    private final DeduplicationService deduplicationService;
    private final PreFilterService preFilterService;
    private final AiBatchScorer aiBatchScorer;
    private final ScoutRunStore runStore;
    private final PreferencesService preferencesService;
    private final UserProfileRepository profileRepository;
    private final CompanyDirectory companyDirectory;
    private final ScoutQueryBuilder queryBuilder;
    private final ScoutNotifier notifier;
    private final ScoutConfig scoutConfig;
    private final ScoutMetrics metrics;
    private final Clock clock;

    /**
     * What the run needs from the database before fetching.
     */
    record RunContext(UserScoutPreferences prefs, UserProfile profile, ExistingPostings existing,
                      Set<String> excludedCompanies) {
    }

    /**
     * Run the on-demand pipeline for a user. Source and scoring failures degrade and are listed
     * in the summary's errors; so is a failed save, which rolls back all of the run's results.
     */
    public Mono<ScoutRunSummary> runForUser(String userId) {
        Instant now = clock.instant();
        String runId = ScoutRunIds.next(now);
        List<String> errors = new CopyOnWriteArrayList<>();

        log.info(SEPARATOR);
        log.info("Scout run {} starting for user {}", runId, userId);
        log.info(SEPARATOR);

        return Mono.fromCallable(() -> loadContext(userId))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(ctx -> {
                    List<SearchQuery> queries = queryBuilder.userQueries(ctx.prefs(), ctx.profile());
                    return sourceAggregator.fetchAll(queries, runId)
                            .flatMap(fetch -> process(userId, runId, now, ctx, fetch, errors));
                });
    }

    private RunContext loadContext(String userId) {
        UserScoutPreferences prefs = preferencesService.getOrCreate(userId);
        UserProfile profile = profileRepository.findByUserId(userId).orElse(null);
        if (profile == null) {
            log.info("User {} has no profile, using preferences and default targets", userId);
        }
        return new RunContext(prefs, profile, runStore.loadExisting(userId), companyDirectory.excludedNames());
    }

    private Mono<ScoutRunSummary> process(String userId, String runId, Instant now, RunContext ctx,
                                          FetchResult fetch, List<String> errors) {
        errors.addAll(fetch.notes());
        if (fetch.sourcesQueried().isEmpty()) {
            log.warn("Scout {}: no posting sources are configured", runId);
            errors.add("No posting sources configured");
            return Mono.just(ScoutRunSummary.empty(runId, fetch.sourcesQueried(), List.copyOf(errors)));
        }

        List<PostingCandidate> fetched = fetch.candidates();
        metrics.recordPostingsFetched(fetched.size());
        log.info("Scout {}: {} postings fetched from {}", runId, fetched.size(), fetch.sourcesQueried());
        if (fetched.isEmpty()) {
            log.warn("Scout {}: no results fetched from any source", runId);
        }

        List<PostingCandidate> deduped = deduplicationService.deduplicate(fetched, ctx.existing());
        metrics.recordDuplicatesDropped(fetched.size() - deduped.size());
        log.info("Scout {}: {} after dedup (from {})", runId, deduped.size(), fetched.size());

        PreFilterCriteria criteria = new PreFilterCriteria(
                queryBuilder.targetRoles(ctx.prefs(), ctx.profile()),
                queryBuilder.targetLocations(ctx.prefs(), ctx.profile()),
                ctx.excludedCompanies());
        List<PostingCandidate> filtered = preFilterService.filter(deduped, criteria);
        metrics.recordPostingsFiltered(deduped.size() - filtered.size());
        log.info("Scout {}: {} after pre-filter (from {})", runId, filtered.size(), deduped.size());

        String profileSummary = ScoutQueryBuilder.profileSummary(ctx.profile());
        return aiBatchScorer.scoreAll(filtered, profileSummary)
                .flatMap(scored -> save(userId, runId, now, scored, errors)
                        .flatMap(saved -> {
                            ScoutRunSummary summary = new ScoutRunSummary(runId, fetch.sourcesQueried(),
                                    fetched.size(), deduped.size(), filtered.size(), scored.size(),
                                    saved.promotedCount(), saved.reviewCount(), saved.dismissedCount(),
                                    errors);
                            metrics.recordPromoted(saved.promotedCount());
                            metrics.updateLastRunStats(fetched.size(), scored.size(), saved.promotedCount());
                            log.info("Scout {} complete: {} promoted, {} for review, {} dismissed", runId,
                                    saved.promotedCount(), saved.reviewCount(), saved.dismissedCount());
                            return sendNotification(recipient(ctx.profile()), summary, saved.promoted(), errors)
                                    .thenReturn(summary);
                        }))
                .map(summary -> withErrors(summary, errors));
    }

    private Mono<SavedRun> save(String userId, String runId, Instant now, List<ScoredPosting> scored,
                                List<String> errors) {
        return Mono.fromCallable(() -> runStore.saveResults(userId, runId, scored, now))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(DataAccessException.class, e -> {
                    log.error("Scout {}: saving results failed, run rolled back: {}", runId, e.getMessage());
                    errors.add("Persistence error: " + e.getMessage());
                    return Mono.just(new SavedRun(List.of(), 0, 0, 0));
                });
    }

    private Mono<Void> sendNotification(String recipient, ScoutRunSummary summary, List<ScoutResult> promoted,
                                        List<String> errors) {
        ScoutNotification notification = buildNotification(summary, promoted);
        if (notification == null) {
            return Mono.empty();
        }
        if (scoutConfig.isDryRun()) {
            log.info("DRY RUN - Would send notification:\n{}", notification.text());
            return Mono.empty();
        }
        return notifier.notify(recipient, notification)
                .onErrorResume(e -> {
                    log.error("Scout {}: notification failed: {}", summary.runId(), e.getMessage());
                    return Mono.just(false);
                })
                .doOnNext(sent -> {
                    if (!Boolean.TRUE.equals(sent)) {
                        errors.add("Notification failed");
                    }
                })
                .then();
    }

    /**
     * Promoted postings get a full summary; a run with only review items gets a short note;
     * anything else sends nothing.
     */
    static ScoutNotification buildNotification(ScoutRunSummary summary, List<ScoutResult> promoted) {
        if (summary.promoted() > 0) {
            List<Highlight> highlights = new ArrayList<>();
            StringBuilder text = new StringBuilder();
            text.append(String.format("Fetched: %d | Deduped: %d | Filtered: %d | Scored: %d%n",
                    summary.totalFetched(), summary.afterDedup(), summary.afterPrefilter(), summary.aiScored()));
            text.append(String.format("Promoted to pipeline: %d%n", summary.promoted()));
            text.append(String.format("For review: %d | Dismissed: %d%n", summary.savedForReview(),
                    summary.dismissed()));
            for (ScoutResult result : promoted) {
                String score = ScoutRunStore.formatScore(result.getFitScore()) + "/10";
                text.append(String.format("  %s @ %s -- Score: %s%n", result.getTitle(), result.getCompanyName(),
                        score));
                highlights.add(new Highlight(result.getTitle(), result.getCompanyName(), score,
                        result.getSourceUrl()));
            }
            return new ScoutNotification(summary.runId(),
                    "Job Scout Run Complete (" + summary.runId() + ")", text.toString().trim(), highlights);
        }
        if (summary.savedForReview() > 0) {
            return new ScoutNotification(summary.runId(), "Job Scout (" + summary.runId() + ")",
                    String.format("No strong matches this run. %d jobs saved for review, %d dismissed.",
                            summary.savedForReview(), summary.dismissed()),
                    List.of());
        }
        return null;
    }

    private String recipient(UserProfile profile) {
        if (profile != null && profile.getNotificationRecipient() != null
                && !profile.getNotificationRecipient().isBlank()) {
            return profile.getNotificationRecipient();
        }
        return scoutConfig.getNotify().getRecipient();
    }

    private static ScoutRunSummary withErrors(ScoutRunSummary summary, List<String> errors) {
        return new ScoutRunSummary(summary.runId(), summary.sourcesQueried(), summary.totalFetched(),
                summary.afterDedup(), summary.afterPrefilter(), summary.aiScored(), summary.promoted(),
                summary.savedForReview(), summary.dismissed(), List.copyOf(errors));
    }
}
