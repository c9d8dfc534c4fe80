package dev.jobscout.source.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
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
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

@Slf4j
@Component
public class LeverSource extends AbstractPostingSource<BoardRef> {

    private static final String API_PATH = "/v0/postings/%s?mode=json";

    public LeverSource(WebClient.Builder webClientBuilder, ScoutMetrics metrics, SourcesConfig sourcesConfig) {
        super(webClientBuilder, metrics, sourcesConfig);
    }

    @Override
    public String getName() {
        return "lever";
    }

    @Override
    public boolean isEnabled() {
        return !sourcesConfig.getLever().getBoards().isEmpty();
    }

    protected String getApiUrl(String boardId) {
        return sourcesConfig.getLever().getBaseUrl() + String.format(API_PATH, boardId);
    }

    @Override
    protected List<BoardRef> getUnits(List<SearchQuery> queries) {
        return sourcesConfig.getLever().getBoards().entrySet().stream()
                .map(entry -> new BoardRef(entry.getKey(), entry.getValue()))
                .toList();
    }

    @Override
    protected Mono<List<PostingCandidate>> fetchUnit(BoardRef board) {
        String companyName = displayName(board.companyKey(), board.boardId());

        return timedGet(URI.create(getApiUrl(board.boardId())), LeverJob[].class)
                .map(jobs -> Arrays.stream(jobs)
                        .map(job -> mapToPosting(job, companyName))
                        .filter(Objects::nonNull)
                        .toList());
    }

    private PostingCandidate mapToPosting(LeverJob leverJob, String companyName) {
        String title = leverJob.getText() != null && !leverJob.getText().isBlank()
                ? leverJob.getText() : leverJob.getTitle();
        String url = leverJob.getHostedUrl() != null && !leverJob.getHostedUrl().isBlank()
                ? leverJob.getHostedUrl() : leverJob.getUrl();
        if (title == null || title.isBlank() || url == null || url.isBlank()) {
            return null;
        }

        String description = leverJob.getDescriptionPlain() != null && !leverJob.getDescriptionPlain().isBlank()
                ? leverJob.getDescriptionPlain() : stripHtml(leverJob.getDescription());

        PostingCandidate posting = basePosting()
                .externalId(leverJob.getId())
                .title(title)
                .companyName(companyName)
                .location(resolveLocation(leverJob.getCategories()))
                .description(description)
                .sourceUrl(url)
                .applyUrl(leverJob.getApplyUrl() != null && !leverJob.getApplyUrl().isBlank()
                        ? leverJob.getApplyUrl() : url)
                .postedDate(toDate(leverJob.getCreatedAt()))
                .categoryLabel(leverJob.getCategories() != null ? leverJob.getCategories().getTeam() : null)
                .rawPayload(leverJob)
                .build();
        return PostingNormalizer.complete(posting);
    }

    /**
     * Primary location, else all locations joined.
     */
    static String resolveLocation(LeverCategories categories) {
        if (categories == null) {
            return null;
        }
        String location = categories.getLocation();
        if ((location == null || location.isBlank()) && categories.getAllLocations() != null
                && !categories.getAllLocations().isEmpty()) {
            location = String.join(", ", categories.getAllLocations());
        }
        return location == null || location.isBlank() ? null : location.trim();
    }

    private static LocalDate toDate(Long epochMillis) {
        return epochMillis == null ? null : Instant.ofEpochMilli(epochMillis).atOffset(ZoneOffset.UTC).toLocalDate();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LeverJob {
        private String id;
        private String text;
        private String title;
        private String hostedUrl;
        private String url;
        private String applyUrl;
        private String description;
        private String descriptionPlain;
        private Long createdAt;
        private LeverCategories categories;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LeverCategories {
        private String location;
        private List<String> allLocations;
        private String team;
        private String commitment;
    }
}
