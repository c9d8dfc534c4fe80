package dev.jobscout.service;

import dev.jobscout.entity.PipelineJob;
import dev.jobscout.entity.ScoutResult;
import dev.jobscout.entity.ScoutedJob;
import dev.jobscout.entity.UserScoutedJob;
import dev.jobscout.normalize.PostingNormalizer;
import dev.jobscout.repository.PipelineJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Copies a scouted posting into the user's application pipeline as a "Tracking" entry.
 * Callers own the transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelinePromoter {

    private static final String UNKNOWN = "Unknown";

    private final PipelineJobRepository pipelineJobRepository;
    private final Clock clock;

    public PipelineJob promote(ScoutResult result, String note) {
        PipelineJob job = PipelineJob.builder()
                .userId(result.getUserId())
                .companyName(PostingNormalizer.truncate(orUnknown(result.getCompanyName()), 255))
                .roleTitle(PostingNormalizer.truncate(orUnknown(result.getTitle()), 255))
                .sourcePortal(PostingNormalizer.truncate(result.getSource(), 100))
                .jdUrl(result.getSourceUrl())
                .jdText(result.getSnippet())
                .status(PipelineJob.STATUS_TRACKING)
                .fitScore(result.getFitScore())
                .fitReasoning(result.getAiReasoning())
                .salaryRange(PostingNormalizer.truncate(result.getSalaryRaw(), 100))
                .note(note)
                .createdAt(clock.instant())
                .build();
        PipelineJob saved = pipelineJobRepository.save(job);
        log.debug("Promoted scout result {} to pipeline job {}", result.getId(), saved.getId());
        return saved;
    }

    public PipelineJob promote(UserScoutedJob match) {
        ScoutedJob job = match.getScoutedJob();
        PipelineJob pipelineJob = PipelineJob.builder()
                .userId(match.getUserId())
                .companyName(PostingNormalizer.truncate(orUnknown(job.getCompanyName()), 255))
                .roleTitle(PostingNormalizer.truncate(orUnknown(job.getTitle()), 255))
                .sourcePortal(job.getSource())
                .jdUrl(job.getSourceUrl())
                .jdText(job.getDescription())
                .status(PipelineJob.STATUS_TRACKING)
                .fitScore(match.getRelevanceScore() / 10.0)
                .fitReasoning(String.join("; ", match.getMatchReasons()))
                .salaryRange(formatSalary(job.getSalaryMin(), job.getSalaryMax()))
                .note("Added from Job Scout. Relevance score: " + match.getRelevanceScore() + "/100.")
                .createdAt(clock.instant())
                .build();
        PipelineJob saved = pipelineJobRepository.save(pipelineJob);
        log.debug("Promoted match {} to pipeline job {}", match.getId(), saved.getId());
        return saved;
    }

    /**
     * Salary bounds as whole lakhs, e.g. "50L-80L". Null when neither bound is known.
     */
    static String formatSalary(Long min, Long max) {
        if (min == null && max == null) {
            return null;
        }
        if (min == null) {
            return lakhs(max);
        }
        if (max == null || max.equals(min)) {
            return lakhs(min);
        }
        return lakhs(min) + "-" + lakhs(max);
    }

    private static String lakhs(long rupees) {
        return (rupees / 100_000) + "L";
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }
}
