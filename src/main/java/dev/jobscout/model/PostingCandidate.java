package dev.jobscout.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A posting as fetched from one source, normalized into the common shape.
 * Has no identity beyond {@link #fingerprint} until it is persisted.
 */
@Data
@Builder(toBuilder = true)
public class PostingCandidate {
    private String externalId;
    private String fingerprint;

    private String title;
    private String companyName;
    private String companyNameNormalized;
    private String location;
    private String city;
    private String description;

    // Salary in the base currency unit (INR)
    private Long salaryMin;
    private Long salaryMax;
    private boolean salaryEstimated;
    private String salaryRaw;

    private String source;
    private String sourceUrl;
    private String applyUrl;
    private LocalDate postedDate;
    private String postedDateRaw;
    private String searchQuery;
    private String categoryLabel;

    // Source DTO as received, serialized to JSON on persist
    private Object rawPayload;

    // Set by the pre-filter, advisory input to the AI scorer
    private boolean b2cHint;

    private Instant discoveredAt;

    /**
     * Key used for source-specific id dedup, or null when the source has no stable id.
     */
    public String getSourceKey() {
        if (externalId == null || externalId.isBlank() || source == null) {
            return null;
        }
        return source + ":" + externalId;
    }
}
