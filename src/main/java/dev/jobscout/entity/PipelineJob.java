package dev.jobscout.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An entry in the user's application pipeline, created when a scouted posting is promoted.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "pipeline_jobs", indexes = @Index(name = "idx_pipeline_jobs_user", columnList = "userId"))
public class PipelineJob {

    public static final String STATUS_TRACKING = "Tracking";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false)
    private String companyName;

    @Column(nullable = false)
    private String roleTitle;

    @Column(length = 100)
    private String sourcePortal;

    @Column(length = 2048)
    private String jdUrl;

    @Lob
    private String jdText;

    @Column(nullable = false, length = 30)
    private String status;

    private Double fitScore;

    @Lob
    private String fitReasoning;

    @Column(length = 100)
    private String salaryRange;

    @Column(length = 1000)
    private String note;

    @Column(nullable = false)
    private Instant createdAt;
}
