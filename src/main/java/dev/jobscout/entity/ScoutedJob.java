package dev.jobscout.entity;

import dev.jobscout.model.PostingCandidate;
import dev.jobscout.normalize.PostingNormalizer;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A posting in the shared, user-independent pool. Keyed by its dedup fingerprint and
 * never hard-deleted: postings not re-sighted for a week are marked inactive instead.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "scouted_jobs", indexes = {
        @Index(name = "idx_scouted_jobs_dedup_hash", columnList = "dedupHash", unique = true),
        @Index(name = "idx_scouted_jobs_active_posted", columnList = "active, postedDate")
})
public class ScoutedJob {

    public static final String INACTIVE_NOT_SEEN = "not_seen_7d";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String externalId;

    @Column(nullable = false, unique = true, length = 64)
    private String dedupHash;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(nullable = false)
    private String companyName;

    private String companyNameNormalized;

    private String location;

    @Column(length = 100)
    private String city;

    @Lob
    private String description;

    private Long salaryMin;
    private Long salaryMax;
    private boolean salaryEstimated;

    @Column(nullable = false, length = 50)
    private String source;

    @Column(length = 2048)
    private String sourceUrl;

    @Column(length = 2048)
    private String applyUrl;

    private LocalDate postedDate;

    @Column(nullable = false)
    private Instant scoutedAt;

    @Column(nullable = false)
    private Instant lastSeenAt;

    private boolean active;

    @Column(length = 50)
    private String inactiveReason;

    private Long matchedCompanyId;

    @Lob
    private String rawJson;

    private String searchQuery;

    @Column(length = 200)
    private String category;

    public static ScoutedJob fromCandidate(PostingCandidate candidate, String rawJson, Instant now) {
        return ScoutedJob.builder()
                .externalId(candidate.getExternalId())
                .dedupHash(candidate.getFingerprint())
                .title(candidate.getTitle())
                .companyName(candidate.getCompanyName())
                .companyNameNormalized(candidate.getCompanyNameNormalized())
                .location(candidate.getLocation())
                .city(candidate.getCity())
                .description(candidate.getDescription())
                .salaryMin(candidate.getSalaryMin())
                .salaryMax(candidate.getSalaryMax())
                .salaryEstimated(candidate.isSalaryEstimated())
                .source(candidate.getSource())
                .sourceUrl(candidate.getSourceUrl())
                .applyUrl(candidate.getApplyUrl())
                .postedDate(candidate.getPostedDate())
                .scoutedAt(now)
                .lastSeenAt(now)
                .active(true)
                .rawJson(rawJson)
                .searchQuery(candidate.getSearchQuery())
                .category(PostingNormalizer.truncate(candidate.getCategoryLabel(), 200))
                .build();
    }

    /**
     * Re-sighting: refresh the last-seen stamp and reassert the posting as active.
     */
    public void markSeen(Instant now) {
        this.lastSeenAt = now;
        this.active = true;
        this.inactiveReason = null;
    }
}
