package dev.jobscout.source.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.jobscout.config.SourcesConfig;
import dev.jobscout.metrics.ScoutMetrics;
import dev.jobscout.model.PostingCandidate;
import dev.jobscout.normalize.PostingNormalizer;
import dev.jobscout.source.SearchQuery;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serper.dev web search, the fallback source. Organic results carry no structured company,
 * so it is recovered from "Role at Company" style titles.
 */
@Slf4j
@Component
public class SerperSource extends AbstractPostingSource<SearchQuery> {

    private static final List<String> TITLE_SEPARATORS = List.of(" at ", " - ", " | ", " — ");
    static final String UNKNOWN_COMPANY = "Unknown";

    public SerperSource(WebClient.Builder webClientBuilder, ScoutMetrics metrics, SourcesConfig sourcesConfig) {
        super(webClientBuilder, metrics, sourcesConfig);
    }

    @Override
    public String getName() {
        return "serper";
    }

    @Override
    public boolean isEnabled() {
        String apiKey = sourcesConfig.getSerper().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    protected List<SearchQuery> getUnits(List<SearchQuery> queries) {
        return queries.stream()
                .map(query -> new SearchQuery(query.text() + " jobs", query.location()))
                .toList();
    }

    @Override
    protected String describe(SearchQuery query) {
        return "'" + query.text() + "'";
    }

    protected URI getApiUri() {
        return UriComponentsBuilder.fromUriString(sourcesConfig.getSerper().getBaseUrl())
                .path("/search")
                .build()
                .toUri();
    }

    @Override
    protected Mono<List<PostingCandidate>> fetchUnit(SearchQuery query) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("q", query.text());
        body.put("gl", sourcesConfig.getSerper().getCountry());
        if (query.location() != null) {
            body.put("location", query.location());
        }
        body.put("num", sourcesConfig.getResultsPerQuery());

        return timedPost(getApiUri(), body, SerperResponse.class, headers -> {
                    headers.set("X-API-KEY", sourcesConfig.getSerper().getApiKey());
                    headers.setContentType(MediaType.APPLICATION_JSON);
                })
                .map(response -> {
                    if (response.getOrganic() == null) {
                        return List.<PostingCandidate>of();
                    }
                    return response.getOrganic().stream()
                            .map(result -> mapToPosting(result, query))
                            .filter(Objects::nonNull)
                            .toList();
                });
    }

    PostingCandidate mapToPosting(OrganicResult result, SearchQuery query) {
        if (result.getTitle() == null || result.getTitle().isBlank()
                || result.getLink() == null || result.getLink().isBlank()) {
            return null;
        }

        String[] roleAndCompany = splitTitle(result.getTitle());

        PostingCandidate posting = basePosting()
                .title(PostingNormalizer.truncate(roleAndCompany[0], 500))
                .companyName(PostingNormalizer.truncate(roleAndCompany[1], 500))
                .description(PostingNormalizer.truncate(result.getSnippet(), 2000))
                .sourceUrl(result.getLink())
                .applyUrl(result.getLink())
                .searchQuery(query.text())
                .rawPayload(result)
                .build();
        return PostingNormalizer.complete(posting);
    }

    /**
     * Split "Role at Company" / "Role - Company" on the first separator found, in separator order.
     *
     * @return {role, company}, company "Unknown" when no separator matches
     */
    static String[] splitTitle(String title) {
        for (String separator : TITLE_SEPARATORS) {
            int idx = title.indexOf(separator);
            if (idx >= 0) {
                String role = title.substring(0, idx).trim();
                String company = title.substring(idx + separator.length()).trim();
                return new String[]{role, company.isEmpty() ? UNKNOWN_COMPANY : company};
            }
        }
        return new String[]{title.trim(), UNKNOWN_COMPANY};
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SerperResponse {
        private List<OrganicResult> organic;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class OrganicResult {
        private String title;
        private String link;
        private String snippet;
    }
}
