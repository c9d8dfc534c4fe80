package dev.jobscout.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Per-user, AI-scored snapshot of a posting produced by the on-demand run.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "scout_results", indexes = {
        @Index(name = "idx_scout_results_user_status", columnList = "userId, status"),
        @Index(name = "idx_scout_results_source_url", columnList = "sourceUrl")
})
public class ScoutResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false, length = 50)
    private String source;

    private String externalId;

    @Column(length = 64)
    private String dedupHash;

    @Column(length = 2048)
    private String sourceUrl;

    @Column(length = 2048)
    private String applyUrl;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(nullable = false, length = 500)
    private String companyName;

    private String companyNameNormalized;

    @Column(length = 500)
    private String location;

    @Column(length = 100)
    private String city;

    @Lob
    private String snippet;

    private Long salaryMin;
    private Long salaryMax;
    private boolean salaryEstimated;

    @Column(length = 200)
    private String salaryRaw;

    private LocalDate postedDate;

    @Column(length = 100)
    private String postedDateRaw;

    @Column(length = 200)
    private String category;

    @Lob
    private String rawJson;

    private double fitScore;

    private boolean b2cValidated;

    @Lob
    private String aiReasoning;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private ScoutResultStatus status = ScoutResultStatus.NEW;

    private Long promotedJobId;

    @Column(length = 50)
    private String scoutRunId;

    @Column(nullable = false)
    private Instant createdAt;
}
