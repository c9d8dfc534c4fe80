package dev.jobscout.source.impl;

import dev.jobscout.config.SourcesConfig;
import dev.jobscout.metrics.ScoutMetrics;
import dev.jobscout.model.PostingCandidate;
import dev.jobscout.source.PostingSource;
import dev.jobscout.source.SearchQuery;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.parser.Parser;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Shared fetch loop for all sources. A source splits its work into units (one query, one board),
 * and each unit is fetched, retried on rate limiting and degraded to an empty list on failure.
 *
 * @param <U> the unit of work, e.g. a {@link SearchQuery} or a board id
 */
@Slf4j
public abstract class AbstractPostingSource<U> implements PostingSource {

    protected final WebClient webClient;
    protected final ScoutMetrics metrics;
    protected final SourcesConfig sourcesConfig;

    protected AbstractPostingSource(WebClient.Builder webClientBuilder, ScoutMetrics metrics,
                                    SourcesConfig sourcesConfig) {
        HttpClient httpClient = HttpClient.create()
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        this.webClient = webClientBuilder
                .codecs(config -> config.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("User-Agent",
                        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36")
                .defaultHeader("Accept", "application/json, text/plain, */*")
                .defaultHeader("Accept-Language", "en-US,en;q=0.9")
                .build();
        this.metrics = metrics;
        this.sourcesConfig = sourcesConfig;
    }

    /**
     * Split the requested queries into the units this source fetches.
     */
    protected abstract List<U> getUnits(List<SearchQuery> queries);

    /**
     * Fetch and map postings for a single unit.
     */
    protected abstract Mono<List<PostingCandidate>> fetchUnit(U unit);

    /**
     * Short label for a unit, used in logs.
     */
    protected String describe(U unit) {
        return String.valueOf(unit);
    }

    /**
     * Units that answered 404 or returned nothing during one fetch.
     */
    static final class FetchReport {
        final Set<String> deadUnits = Collections.newSetFromMap(new ConcurrentHashMap<>());
        final Set<String> emptyUnits = Collections.newSetFromMap(new ConcurrentHashMap<>());
    }

    @Override
    public Flux<PostingCandidate> fetch(List<SearchQuery> queries) {
        return Flux.defer(() -> fetch(queries, new FetchReport()));
    }

    Flux<PostingCandidate> fetch(List<SearchQuery> queries, FetchReport report) {
        List<U> units = getUnits(queries);
        log.info("Fetching postings from {} ({} requests)", getName(), units.size());

        return Flux.fromIterable(units)
                .delayElements(sourcesConfig.getRequestDelay())
                .flatMap(unit -> fetchUnit(unit)
                        .retryWhen(Retry.backoff(2, Duration.ofSeconds(2))
                                .filter(e -> statusOf(e) == 429))
                        .doOnNext(postings -> {
                            if (postings.isEmpty()) {
                                report.emptyUnits.add(describe(unit));
                            }
                        })
                        .doOnError(e -> {
                            if (statusOf(e) == 404) {
                                report.deadUnits.add(describe(unit));
                                log.debug("{} - {} not found, board likely moved: {}", getName(), describe(unit),
                                        e.getMessage());
                            } else {
                                log.warn("{} - {} failed: {}", getName(), describe(unit), e.getMessage());
                            }
                            metrics.incrementFetchFailures(getName());
                        })
                        .onErrorResume(e -> Mono.just(List.of()))
                        .flatMapMany(Flux::fromIterable), sourcesConfig.getConcurrency())
                .doOnTerminate(() -> logCleanupReport(report))
                .doOnNext(posting -> metrics.incrementPostingsDiscovered(getName()));
    }

    private void logCleanupReport(FetchReport report) {
        if (!report.deadUnits.isEmpty()) {
            log.info("--- CLEANUP RECOMMENDATION (NOT FOUND) for {}: {} ---", getName(),
                    String.join(", ", report.deadUnits));
        }
        if (!report.emptyUnits.isEmpty()) {
            log.info("--- EMPTY RESULTS for {}: {} ---", getName(), String.join(", ", report.emptyUnits));
        }
    }

    private static int statusOf(Throwable e) {
        return e instanceof WebClientResponseException responseException
                ? responseException.getStatusCode().value()
                : -1;
    }

    /**
     * Strip HTML tags from text, unescaping entity-encoded markup first. Blank input gives null.
     */
    protected String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return null;
        }
        String text = Jsoup.parse(Parser.unescapeEntities(html, false)).text();
        return text.isBlank() ? null : text;
    }

    /**
     * Build a candidate with common defaults.
     */
    protected PostingCandidate.PostingCandidateBuilder basePosting() {
        return PostingCandidate.builder()
                .source(getName())
                .discoveredAt(Instant.now());
    }

    /**
     * Display name for a board: lookup table by company key then slug, else the key title-cased
     * ("urban_company" -> "Urban Company").
     */
    protected String displayName(String companyKey, String slug) {
        String mapped = lookupDisplayName(companyKey);
        if (mapped == null) {
            mapped = lookupDisplayName(slug);
        }
        if (mapped != null) {
            return mapped;
        }
        return titleCase(companyKey);
    }

    private String lookupDisplayName(String key) {
        if (key == null) {
            return null;
        }
        return sourcesConfig.getDisplayNames().get(key.toLowerCase(Locale.ROOT));
    }

    static String titleCase(String slug) {
        if (slug == null || slug.isBlank()) {
            return "";
        }
        return Arrays.stream(slug.replace('-', ' ').replace('_', ' ').trim().split("\\s+"))
                .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }

    protected Duration requestTimeout() {
        return sourcesConfig.getRequestTimeout();
    }

    /**
     * Execute a timed GET request.
     */
    @SuppressWarnings("null")
    protected <T> Mono<T> timedGet(URI uri, Class<T> responseType) {
        long start = System.currentTimeMillis();
        return webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(responseType)
                .timeout(requestTimeout())
                .doOnTerminate(() -> metrics.recordFetchLatency(getName(), System.currentTimeMillis() - start));
    }

    /**
     * Execute a timed POST request with extra headers.
     */
    @SuppressWarnings("null")
    protected <T, R> Mono<T> timedPost(URI uri, R body, Class<T> responseType, Consumer<HttpHeaders> headers) {
        long start = System.currentTimeMillis();
        return webClient.post()
                .uri(uri)
                .headers(headers)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(responseType)
                .timeout(requestTimeout())
                .doOnTerminate(() -> metrics.recordFetchLatency(getName(), System.currentTimeMillis() - start));
    }
}
