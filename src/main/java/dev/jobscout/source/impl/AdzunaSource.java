package dev.jobscout.source.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.jobscout.config.SourcesConfig;
import dev.jobscout.metrics.ScoutMetrics;
import dev.jobscout.model.PostingCandidate;
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
import java.util.List;
import java.util.Objects;

/**
 * Adzuna job-search API, the primary structured source.
 */
@Slf4j
@Component
public class AdzunaSource extends AbstractPostingSource<SearchQuery> {

    private static final String SEARCH_PATH = "/v1/api/jobs/{country}/search/1";

    public AdzunaSource(WebClient.Builder webClientBuilder, ScoutMetrics metrics, SourcesConfig sourcesConfig) {
        super(webClientBuilder, metrics, sourcesConfig);
    }

    @Override
    public String getName() {
        return "adzuna";
    }

    @Override
    public boolean isEnabled() {
        SourcesConfig.Adzuna adzuna = sourcesConfig.getAdzuna();
        return adzuna.getAppId() != null && !adzuna.getAppId().isBlank()
                && adzuna.getApiKey() != null && !adzuna.getApiKey().isBlank();
    }

    @Override
    protected List<SearchQuery> getUnits(List<SearchQuery> queries) {
        return queries;
    }

    @Override
    protected String describe(SearchQuery query) {
        return "'" + query.text() + "' in " + query.location();
    }

    protected URI getApiUri(SearchQuery query) {
        SourcesConfig.Adzuna adzuna = sourcesConfig.getAdzuna();
        return UriComponentsBuilder.fromUriString(adzuna.getBaseUrl())
                .path(SEARCH_PATH)
                .queryParam("app_id", adzuna.getAppId())
                .queryParam("app_key", adzuna.getApiKey())
                .queryParam("results_per_page", sourcesConfig.getResultsPerQuery())
                .queryParam("what", query.text())
                .queryParam("where", query.location())
                .queryParam("content-type", "application/json")
                .buildAndExpand(adzuna.getCountry())
                .encode()
                .toUri();
    }

    @Override
    protected Mono<List<PostingCandidate>> fetchUnit(SearchQuery query) {
        return timedGet(getApiUri(query), AdzunaResponse.class)
                .map(response -> {
                    if (response.getResults() == null) {
                        return List.<PostingCandidate>of();
                    }
                    Instant now = Instant.now();
                    return response.getResults().stream()
                            .map(job -> mapToPosting(job, query, now))
                            .filter(Objects::nonNull)
                            .toList();
                });
    }

    PostingCandidate mapToPosting(AdzunaJob job, SearchQuery query, Instant now) {
        if (job.getTitle() == null || job.getTitle().isBlank()
                || job.getRedirectUrl() == null || job.getRedirectUrl().isBlank()) {
            return null;
        }

        String company = job.getCompany() != null && job.getCompany().getDisplayName() != null
                && !job.getCompany().getDisplayName().isBlank()
                ? job.getCompany().getDisplayName() : "Unknown";
        String location = job.getLocation() != null ? job.getLocation().getDisplayName() : null;
        Long salaryMin = job.getSalaryMin() != null ? Math.round(job.getSalaryMin()) : null;
        Long salaryMax = job.getSalaryMax() != null ? Math.round(job.getSalaryMax()) : null;

        String salaryRaw = null;
        if (salaryMin != null && salaryMax != null) {
            salaryRaw = salaryMin + "-" + salaryMax;
        } else if (salaryMin != null) {
            salaryRaw = salaryMin + "+";
        }

        PostingCandidate posting = basePosting()
                .externalId(job.getId())
                .title(PostingNormalizer.truncate(job.getTitle(), 500))
                .companyName(PostingNormalizer.truncate(company, 500))
                .location(PostingNormalizer.truncate(location, 500))
                .description(PostingNormalizer.truncate(job.getDescription(), 2000))
                .salaryMin(salaryMin)
                .salaryMax(salaryMax)
                .salaryRaw(salaryRaw)
                .sourceUrl(job.getRedirectUrl())
                .applyUrl(job.getRedirectUrl())
                .postedDate(PostingNormalizer.parsePostedDate(job.getCreated(), now))
                .postedDateRaw(job.getCreated())
                .searchQuery(query.text())
                .categoryLabel(job.getCategory() != null ? job.getCategory().getLabel() : null)
                .rawPayload(job)
                .build();
        return PostingNormalizer.complete(posting);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class AdzunaResponse {
        private List<AdzunaJob> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class AdzunaJob {
        private String id;
        private String title;
        @JsonProperty("redirect_url")
        private String redirectUrl;
        private DisplayName company;
        private DisplayName location;
        private String description;
        @JsonProperty("salary_min")
        private Double salaryMin;
        @JsonProperty("salary_max")
        private Double salaryMax;
        private String created;
        private Category category;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DisplayName {
        @JsonProperty("display_name")
        private String displayName;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Category {
        private String label;
    }
}
