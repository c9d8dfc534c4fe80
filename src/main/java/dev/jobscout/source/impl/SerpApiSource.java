package dev.jobscout.source.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.jobscout.config.SourcesConfig;
import dev.jobscout.metrics.ScoutMetrics;
import dev.jobscout.model.PostingCandidate;
import dev.jobscout.model.SalaryRange;
import dev.jobscout.normalize.PostingNormalizer;
import dev.jobscout.source.SearchQuery;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SerpApi Google Jobs engine. Results are paged by a next-page token until enough postings
 * were collected or a page comes back empty.
 */
@Slf4j
@Component
public class SerpApiSource extends AbstractPostingSource<SearchQuery> {

    private static final int MAX_DESCRIPTION = 10_000;

    public SerpApiSource(WebClient.Builder webClientBuilder, ScoutMetrics metrics, SourcesConfig sourcesConfig) {
        super(webClientBuilder, metrics, sourcesConfig);
    }

    @Override
    public String getName() {
        return "serpapi";
    }

    @Override
    public boolean isEnabled() {
        String apiKey = sourcesConfig.getSerpapi().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    protected List<SearchQuery> getUnits(List<SearchQuery> queries) {
        return queries;
    }

    @Override
    protected String describe(SearchQuery query) {
        return "'" + query.text() + "' in " + query.location();
    }

    protected URI getApiUri(SearchQuery query, String pageToken) {
        SourcesConfig.SerpApi serpApi = sourcesConfig.getSerpapi();
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(serpApi.getBaseUrl())
                .path("/search")
                .queryParam("engine", serpApi.getEngine())
                .queryParam("q", query.text())
                .queryParam("location", query.location())
                .queryParam("api_key", serpApi.getApiKey());
        if (pageToken != null) {
            builder.queryParam("next_page_token", pageToken);
        }
        return builder.build().encode().toUri();
    }

    @Override
    protected Mono<List<PostingCandidate>> fetchUnit(SearchQuery query) {
        return Mono.defer(() -> fetchPage(query, null, new ArrayList<>()));
    }

    private Mono<List<PostingCandidate>> fetchPage(SearchQuery query, String pageToken,
                                                   List<PostingCandidate> collected) {
        int wanted = sourcesConfig.getResultsPerQuery();

        Mono<List<PostingCandidate>> page = timedGet(getApiUri(query, pageToken), SerpApiResponse.class)
                .flatMap(response -> {
                    if (response.getError() != null) {
                        log.warn("serpapi - '{}' returned error: {}", query.text(), response.getError());
                        return Mono.just(limit(collected, wanted));
                    }
                    if (response.getJobsResults() == null || response.getJobsResults().isEmpty()) {
                        return Mono.just(limit(collected, wanted));
                    }

                    Instant now = Instant.now();
                    response.getJobsResults().stream()
                            .map(job -> mapToPosting(job, query, now))
                            .filter(Objects::nonNull)
                            .forEach(collected::add);

                    String next = response.getPagination() != null
                            ? response.getPagination().getNextPageToken() : null;
                    if (collected.size() >= wanted || next == null || next.isBlank()) {
                        return Mono.just(limit(collected, wanted));
                    }
                    return fetchPage(query, next, collected);
                });

        if (pageToken == null) {
            return page;
        }
        // A failing follow-up page keeps the pages already collected
        return page.onErrorResume(e -> {
            log.warn("serpapi - '{}' paging stopped after {} postings: {}", query.text(), collected.size(),
                    e.getMessage());
            return Mono.just(limit(collected, wanted));
        });
    }

    private static List<PostingCandidate> limit(List<PostingCandidate> postings, int max) {
        return postings.size() > max ? List.copyOf(postings.subList(0, max)) : List.copyOf(postings);
    }

    PostingCandidate mapToPosting(SerpApiJob job, SearchQuery query, Instant now) {
        if (job.getTitle() == null || job.getTitle().isBlank()
                || job.getCompanyName() == null || job.getCompanyName().isBlank()) {
            return null;
        }

        String applyUrl = null;
        if (job.getApplyOptions() != null && !job.getApplyOptions().isEmpty()) {
            applyUrl = job.getApplyOptions().get(0).getLink();
        }
        if (applyUrl == null || applyUrl.isBlank()) {
            applyUrl = job.getLink();
        }
        String sourceUrl = job.getShareLink() != null && !job.getShareLink().isBlank() ? job.getShareLink() : applyUrl;
        if (sourceUrl == null || sourceUrl.isBlank()) {
            return null;
        }

        DetectedExtensions extensions = job.getDetectedExtensions();
        String postedAt = extensions != null ? extensions.getPostedAt() : null;
        String salaryText = extensions != null ? extensions.getSalary() : null;

        SalaryRange salary = PostingNormalizer.parseSalary(salaryText);
        if (salary.min() == null) {
            salary = PostingNormalizer.parseSalaryRange(job.getDescription());
        }

        PostingCandidate posting = basePosting()
                .externalId(job.getJobId())
                .title(job.getTitle())
                .companyName(job.getCompanyName())
                .location(job.getLocation() == null || job.getLocation().isBlank() ? null : job.getLocation())
                .description(PostingNormalizer.truncate(job.getDescription(), MAX_DESCRIPTION))
                .salaryMin(salary.min())
                .salaryMax(salary.max())
                .salaryEstimated(salary.estimated())
                .salaryRaw(salaryText)
                .sourceUrl(sourceUrl)
                .applyUrl(applyUrl)
                .postedDate(PostingNormalizer.parsePostedDate(postedAt, now))
                .postedDateRaw(postedAt)
                .searchQuery(query.text())
                .rawPayload(job)
                .build();
        return PostingNormalizer.complete(posting);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SerpApiResponse {
        private String error;
        @JsonProperty("jobs_results")
        private List<SerpApiJob> jobsResults;
        @JsonProperty("serpapi_pagination")
        private Pagination pagination;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Pagination {
        @JsonProperty("next_page_token")
        private String nextPageToken;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SerpApiJob {
        private String title;
        @JsonProperty("company_name")
        private String companyName;
        private String location;
        private String description;
        @JsonProperty("job_id")
        private String jobId;
        @JsonProperty("share_link")
        private String shareLink;
        private String link;
        @JsonProperty("detected_extensions")
        private DetectedExtensions detectedExtensions;
        @JsonProperty("apply_options")
        private List<ApplyOption> applyOptions;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DetectedExtensions {
        @JsonProperty("posted_at")
        private String postedAt;
        private String salary;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ApplyOption {
        private String title;
        private String link;
    }
}
