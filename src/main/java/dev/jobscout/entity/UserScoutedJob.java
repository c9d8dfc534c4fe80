package dev.jobscout.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Links a user to a shared {@link ScoutedJob} with its deterministic relevance score.
 * Unique per (user, scouted job).
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "user_scouted_jobs",
        uniqueConstraints = @UniqueConstraint(name = "uq_user_scouted_jobs_user_job",
                columnNames = {"user_id", "scouted_job_id"}),
        indexes = @Index(name = "idx_user_scouted_jobs_user_status", columnList = "user_id, status, matchedAt"))
public class UserScoutedJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "scouted_job_id", nullable = false)
    private ScoutedJob scoutedJob;

    @Column(nullable = false)
    private int relevanceScore;

    @Builder.Default
    @Convert(converter = ScoreBreakdownConverter.class)
    @Column(length = 1000)
    private Map<String, Integer> scoreBreakdown = new LinkedHashMap<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(length = 2000)
    private List<String> matchReasons = new ArrayList<>();

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserScoutedJobStatus status = UserScoutedJobStatus.NEW;

    @Column(nullable = false)
    private Instant matchedAt;

    private Instant viewedAt;
    private Instant savedAt;
    private Instant dismissedAt;

    @Column(length = 50)
    private String dismissReason;

    private Long pipelineJobId;
    private Instant addedToPipelineAt;
}
