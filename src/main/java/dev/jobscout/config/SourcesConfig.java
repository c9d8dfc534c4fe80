package dev.jobscout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for posting sources: credentials, board lists and fetch limits.
 * Loaded from application.yml under 'sources' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "sources")
public class SourcesConfig {

    private Adzuna adzuna = new Adzuna();
    private SerpApi serpapi = new SerpApi();
    private Serper serper = new Serper();
    private Board greenhouse = new Board("https://boards-api.greenhouse.io");
    private Board lever = new Board("https://api.lever.co");

    // Board slug or company key -> display name, for slugs that do not title-case well
    private Map<String, String> displayNames = new LinkedHashMap<>();

    // Shared-pool queries, "{location}" is substituted per location
    private List<String> queryTemplates = new ArrayList<>(List.of(
            "VP Growth {location}",
            "Head of Growth {location}",
            "Director Growth {location}",
            "VP Marketing {location}",
            "Head of Marketing {location}"));
    private List<String> locations = new ArrayList<>(List.of("Bangalore", "India"));

    private int resultsPerQuery = 10;
    private Duration requestTimeout = Duration.ofSeconds(30);
    private Duration adapterTimeout = Duration.ofSeconds(120);
    private Duration requestDelay = Duration.ofMillis(300);
    private int concurrency = 3;

    /**
     * Get total number of configured applicant-tracking boards.
     */
    public int getTotalBoards() {
        return greenhouse.getBoards().size() + lever.getBoards().size();
    }

    @Data
    public static class Adzuna {
        private String baseUrl = "https://api.adzuna.com";
        private String appId;
        private String apiKey;
        private String country = "in";
    }

    @Data
    public static class SerpApi {
        private String baseUrl = "https://serpapi.com";
        private String apiKey;
        private String engine = "google_jobs";
    }

    @Data
    public static class Serper {
        private String baseUrl = "https://google.serper.dev";
        private String apiKey;
        private String country = "in";
    }

    @Data
    public static class Board {
        private String baseUrl;
        // Company key -> board id
        private Map<String, String> boards = new LinkedHashMap<>();

        public Board() {
        }

        public Board(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
