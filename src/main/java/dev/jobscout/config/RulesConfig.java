package dev.jobscout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Keyword lists and similarity thresholds for the pre-filter and the deduplicator.
 * Loaded from application.yml under 'rules' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "rules")
public class RulesConfig {

    private List<String> locationKeywords = new ArrayList<>(List.of(
            "bangalore", "bengaluru", "remote", "india", "work from home",
            "hybrid", "pan india", "anywhere in india"));

    private List<String> seniorityKeywords = new ArrayList<>(List.of(
            "director", "vp", "vice president", "head of", "lead",
            "principal", "senior director", "chief", "svp", "avp",
            "general manager", "gm"));

    private List<String> b2cKeywords = new ArrayList<>(List.of(
            "b2c", "consumer", "d2c", "direct to consumer", "marketplace",
            "e-commerce", "ecommerce", "fintech", "edtech", "healthtech",
            "gaming", "social", "media", "entertainment", "food",
            "delivery", "mobility", "travel", "retail"));

    private List<String> excludedCompanyKeywords = new ArrayList<>(List.of(
            "staffing", "recruitment agency", "consulting firm",
            "body shopping", "manpower"));

    // Fuzzy partial-ratio a title must exceed against a target role
    private int roleSimilarityThreshold = 70;

    // Ratio both title and company must exceed for two postings to be the same
    private int dedupSimilarityThreshold = 85;
}
