package dev.jobscout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Thresholds for AI batch scoring, categorization, pool staleness and preference learning.
 * Loaded from application.yml under 'scoring' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig {

    private int aiBatchSize = 5;
    private int snippetLength = 500;

    // Fit score (0-10) at or above which a result is promoted to the pipeline
    private double promoteThreshold = 7;
    // Fit score at or above which a result is kept for manual review
    private double reviewThreshold = 5;

    private int staleAfterDays = 7;

    private Learning learning = new Learning();

    @Data
    public static class Learning {
        private int dismissThreshold = 3;
        private int salaryRaisePercent = 10;
        private int companyPenalty = 15;
        private int titleWordPenalty = 5;
        private int maxTitleWords = 5;
    }
}
