package dev.jobscout.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for scout runs.
 */
@Component
public class ScoutMetrics {

    private static final String TAG_SOURCE = "source";
    private final MeterRegistry registry;

    private final Counter postingsFetchedCounter;
    private final Counter duplicatesDroppedCounter;
    private final Counter postingsFilteredCounter;
    private final Counter aiBatchesCounter;
    private final Counter aiBatchFailuresCounter;
    private final Counter promotedCounter;
    private final Counter matchesCreatedCounter;

    private final ConcurrentHashMap<String, Timer> sourceTimers = new ConcurrentHashMap<>();

    private final AtomicInteger lastRunFetched = new AtomicInteger(0);
    private final AtomicInteger lastRunScored = new AtomicInteger(0);
    private final AtomicInteger lastRunPromoted = new AtomicInteger(0);

    public ScoutMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.postingsFetchedCounter = Counter.builder("job_scout_postings_fetched_total")
                .description("Total postings fetched from all sources")
                .register(registry);

        this.duplicatesDroppedCounter = Counter.builder("job_scout_duplicates_dropped_total")
                .description("Total postings dropped as duplicates")
                .register(registry);

        this.postingsFilteredCounter = Counter.builder("job_scout_postings_filtered_total")
                .description("Total postings rejected by the pre-filter")
                .register(registry);

        this.aiBatchesCounter = Counter.builder("job_scout_ai_batches_total")
                .description("Total AI scoring batches sent")
                .register(registry);

        this.aiBatchFailuresCounter = Counter.builder("job_scout_ai_batch_failures_total")
                .description("AI scoring batches degraded to zero scores")
                .register(registry);

        this.promotedCounter = Counter.builder("job_scout_promoted_total")
                .description("Scout results promoted to the application pipeline")
                .register(registry);

        this.matchesCreatedCounter = Counter.builder("job_scout_matches_created_total")
                .description("User matches created from the shared pool")
                .register(registry);

        Gauge.builder("job_scout_last_run_fetched", lastRunFetched, AtomicInteger::get)
                .description("Postings fetched in last run")
                .register(registry);

        Gauge.builder("job_scout_last_run_scored", lastRunScored, AtomicInteger::get)
                .description("Postings scored in last run")
                .register(registry);

        Gauge.builder("job_scout_last_run_promoted", lastRunPromoted, AtomicInteger::get)
                .description("Postings promoted or matched in last run")
                .register(registry);
    }

    /**
     * Get or create a fetch timer for a specific source.
     */
    public Timer getSourceTimer(String sourceName) {
        return sourceTimers.computeIfAbsent(sourceName, name ->
                Timer.builder("job_scout_source_fetch_duration")
                        .description("Time to complete one source request")
                        .tag(TAG_SOURCE, name)
                        .register(registry)
        );
    }

    public void recordPostingsFetched(int count) {
        postingsFetchedCounter.increment(count);
    }

    public void recordDuplicatesDropped(int count) {
        duplicatesDroppedCounter.increment(count);
    }

    public void recordPostingsFiltered(int count) {
        postingsFilteredCounter.increment(count);
    }

    public void recordAiBatch(boolean success) {
        aiBatchesCounter.increment();
        if (!success) {
            aiBatchFailuresCounter.increment();
        }
    }

    public void recordPromoted(int count) {
        promotedCounter.increment(count);
    }

    public void recordMatchesCreated(int count) {
        matchesCreatedCounter.increment(count);
    }

    /**
     * Update last run statistics.
     */
    public void updateLastRunStats(int fetched, int scored, int promoted) {
        lastRunFetched.set(fetched);
        lastRunScored.set(scored);
        lastRunPromoted.set(promoted);
    }

    /**
     * Increment fetch failures counter for a source.
     */
    public void incrementFetchFailures(String source) {
        Counter.builder("job_scout_fetch_failures_by_source_total")
                .tag(TAG_SOURCE, source)
                .register(registry)
                .increment();
    }

    /**
     * Increment postings discovered counter for a source.
     */
    public void incrementPostingsDiscovered(String source) {
        Counter.builder("job_scout_postings_discovered_by_source_total")
                .tag(TAG_SOURCE, source)
                .register(registry)
                .increment();
    }

    public void recordFetchLatency(String source, long latencyMs) {
        getSourceTimer(source).record(Duration.ofMillis(latencyMs));
    }
}
