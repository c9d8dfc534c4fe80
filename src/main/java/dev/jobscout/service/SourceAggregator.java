package dev.jobscout.service;

import dev.jobscout.config.SourcesConfig;
import dev.jobscout.model.PostingCandidate;
import dev.jobscout.source.PostingSource;
import dev.jobscout.source.SearchQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans a set of queries out to every enabled source concurrently and merges the results.
 * A source that fails or exceeds its time budget contributes what it had emitted so far.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SourceAggregator {

    private final List<PostingSource> postingSources;
    private final SourcesConfig sourcesConfig;

    /**
     * Merged output of one fan-out.
     *
     * @param sourcesQueried names of the sources that were called
     * @param candidates     postings from all sources, in arrival order
     * @param notes          informational skips and per-source failures
     */
    public record FetchResult(List<String> sourcesQueried, List<PostingCandidate> candidates, List<String> notes) {
    }

    public Mono<FetchResult> fetchAll(List<SearchQuery> queries, String runId) {
        List<String> notes = new CopyOnWriteArrayList<>();
        List<PostingSource> enabled = new ArrayList<>();
        for (PostingSource source : postingSources) {
            if (source.isEnabled()) {
                enabled.add(source);
            } else {
                log.info("Scout {}: {} not configured, skipping", runId, source.getName());
                notes.add(source.getName() + " not configured, skipping");
            }
        }
        List<String> names = enabled.stream().map(PostingSource::getName).toList();
        if (enabled.isEmpty()) {
            return Mono.just(new FetchResult(names, List.of(), List.copyOf(notes)));
        }

        log.info("Scout {}: querying {} sources with {} queries", runId, names, queries.size());
        return Flux.fromIterable(enabled)
                .flatMap(source -> fetchFrom(source, queries, runId, notes))
                .collectList()
                .map(candidates -> new FetchResult(names, candidates, List.copyOf(notes)));
    }

    private Flux<PostingCandidate> fetchFrom(PostingSource source, List<SearchQuery> queries, String runId,
                                             List<String> notes) {
        return source.fetch(queries)
                .takeUntilOther(Mono.delay(sourcesConfig.getAdapterTimeout())
                        .doOnNext(tick -> {
                            log.warn("Scout {}: {} exceeded {} and was cut off", runId, source.getName(),
                                    sourcesConfig.getAdapterTimeout());
                            notes.add(source.getName() + " timed out, partial results kept");
                        }))
                .onErrorResume(e -> {
                    log.warn("Scout {}: {} failed: {}", runId, source.getName(), e.getMessage());
                    notes.add(source.getName() + " fetch failed: " + e.getMessage());
                    return Flux.empty();
                })
                .doOnComplete(() -> log.debug("Scout {}: {} done", runId, source.getName()));
    }
}
