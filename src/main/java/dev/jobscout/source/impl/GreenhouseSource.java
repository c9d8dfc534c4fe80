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
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.Objects;

@Slf4j
@Component
public class GreenhouseSource extends AbstractPostingSource<BoardRef> {

    private static final String API_PATH = "/v1/boards/%s/jobs?content=true";

    public GreenhouseSource(WebClient.Builder webClientBuilder, ScoutMetrics metrics, SourcesConfig sourcesConfig) {
        super(webClientBuilder, metrics, sourcesConfig);
    }

    @Override
    public String getName() {
        return "greenhouse";
    }

    @Override
    public boolean isEnabled() {
        return !sourcesConfig.getGreenhouse().getBoards().isEmpty();
    }

    protected String getApiUrl(String boardId) {
        return sourcesConfig.getGreenhouse().getBaseUrl() + String.format(API_PATH, boardId);
    }

    @Override
    protected List<BoardRef> getUnits(List<SearchQuery> queries) {
        return sourcesConfig.getGreenhouse().getBoards().entrySet().stream()
                .map(entry -> new BoardRef(entry.getKey(), entry.getValue()))
                .toList();
    }

    @Override
    protected Mono<List<PostingCandidate>> fetchUnit(BoardRef board) {
        String companyName = displayName(board.companyKey(), board.boardId());

        return timedGet(URI.create(getApiUrl(board.boardId())), GreenhouseResponse.class)
                .map(response -> {
                    if (response.getJobs() == null) {
                        return List.<PostingCandidate>of();
                    }
                    return response.getJobs().stream()
                            .map(job -> mapToPosting(job, companyName))
                            .filter(Objects::nonNull)
                            .toList();
                });
    }

    private PostingCandidate mapToPosting(GreenhouseJob ghJob, String companyName) {
        if (ghJob.getTitle() == null || ghJob.getTitle().isBlank()
                || ghJob.getAbsoluteUrl() == null || ghJob.getAbsoluteUrl().isBlank()) {
            return null;
        }

        String location = ghJob.getLocation() != null ? ghJob.getLocation().getName() : null;
        if (location != null && location.isBlank()) {
            location = null;
        }

        PostingCandidate posting = basePosting()
                .externalId(ghJob.getId() != null ? String.valueOf(ghJob.getId()) : null)
                .title(ghJob.getTitle())
                .companyName(companyName)
                .location(location != null ? location.trim() : null)
                .description(stripHtml(ghJob.getContent()))
                .sourceUrl(ghJob.getAbsoluteUrl())
                .applyUrl(ghJob.getAbsoluteUrl())
                .rawPayload(ghJob)
                .build();
        return PostingNormalizer.complete(posting);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GreenhouseResponse {
        private List<GreenhouseJob> jobs;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GreenhouseJob {
        private Long id;
        private String title;
        @JsonProperty("absolute_url")
        private String absoluteUrl;
        private String content;
        private GreenhouseLocation location;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GreenhouseLocation {
        private String name;
    }
}
