package dev.jobscout.service;

import dev.jobscout.config.ScoringConfig;
import dev.jobscout.entity.PipelineJob;
import dev.jobscout.entity.ScoutResult;
import dev.jobscout.entity.ScoutResultStatus;
import dev.jobscout.model.ExistingPostings;
import dev.jobscout.model.ExistingPostings.TitleCompany;
import dev.jobscout.model.PostingCandidate;
import dev.jobscout.model.ScoredPosting;
import dev.jobscout.normalize.PostingNormalizer;
import dev.jobscout.repository.PipelineJobRepository;
import dev.jobscout.repository.ScoutResultRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Persistence side of the on-demand run. Each public method is one transaction, so a failed
 * save leaves none of the run's results behind.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScoutRunStore {

    private final ScoutResultRepository scoutResultRepository;
    private final PipelineJobRepository pipelineJobRepository;
    private final PipelinePromoter pipelinePromoter;
    private final RawPayloadWriter rawPayloadWriter;
    private final ScoringConfig scoringConfig;

    /**
     * Counts per category plus the promoted rows, for the summary notification.
     */
    public record SavedRun(List<ScoutResult> promoted, int promotedCount, int reviewCount, int dismissedCount) {
    }

    /**
     * Everything already known for the user: earlier scout results and pipeline entries.
     */
    @Transactional(readOnly = true)
    public ExistingPostings loadExisting(String userId) {
        Set<String> urls = new HashSet<>(scoutResultRepository.findSourceUrlsByUserId(userId));
        urls.addAll(pipelineJobRepository.findJdUrlsByUserId(userId));

        List<TitleCompany> titles = new ArrayList<>();
        scoutResultRepository.findTitleCompanyPairsByUserId(userId)
                .forEach(row -> titles.add(new TitleCompany((String) row[0], (String) row[1])));
        pipelineJobRepository.findTitleCompanyPairsByUserId(userId)
                .forEach(row -> titles.add(new TitleCompany((String) row[0], (String) row[1])));

        return new ExistingPostings(
                scoutResultRepository.findSourceKeysByUserId(userId),
                scoutResultRepository.findDedupHashesByUserId(userId),
                urls,
                titles);
    }

    /**
     * Persist every scored posting with its category; promoted ones also get a pipeline job.
     */
    @Transactional
    public SavedRun saveResults(String userId, String runId, List<ScoredPosting> scored, Instant now) {
        List<ScoutResult> promoted = new ArrayList<>();
        int review = 0;
        int dismissed = 0;

        for (ScoredPosting item : scored) {
            ScoutResultStatus status = categorize(item.fitScore());
            ScoutResult result = scoutResultRepository.save(toResult(userId, runId, item, status, now));

            switch (status) {
                case PROMOTED -> {
                    PipelineJob job = pipelinePromoter.promote(result, String.format(
                            "Auto-discovered by Job Scout (run %s). Fit score: %s/10.", runId,
                            formatScore(item.fitScore())));
                    result.setPromotedJobId(job.getId());
                    promoted.add(scoutResultRepository.save(result));
                }
                case NEW -> review++;
                default -> dismissed++;
            }
        }
        log.info("Scout {}: saved {} results ({} promoted, {} for review, {} dismissed)",
                runId, scored.size(), promoted.size(), review, dismissed);
        return new SavedRun(promoted, promoted.size(), review, dismissed);
    }

    ScoutResultStatus categorize(double fitScore) {
        if (fitScore >= scoringConfig.getPromoteThreshold()) {
            return ScoutResultStatus.PROMOTED;
        }
        if (fitScore >= scoringConfig.getReviewThreshold()) {
            return ScoutResultStatus.NEW;
        }
        return ScoutResultStatus.DISMISSED;
    }

    private ScoutResult toResult(String userId, String runId, ScoredPosting item, ScoutResultStatus status,
                                 Instant now) {
        PostingCandidate candidate = item.candidate();
        return ScoutResult.builder()
                .userId(userId)
                .source(candidate.getSource() != null ? candidate.getSource() : "unknown")
                .externalId(candidate.getExternalId())
                .dedupHash(candidate.getFingerprint())
                .sourceUrl(candidate.getSourceUrl())
                .applyUrl(candidate.getApplyUrl())
                .title(PostingNormalizer.truncate(candidate.getTitle(), 500))
                .companyName(PostingNormalizer.truncate(candidate.getCompanyName(), 500))
                .companyNameNormalized(candidate.getCompanyNameNormalized())
                .location(PostingNormalizer.truncate(candidate.getLocation(), 500))
                .city(PostingNormalizer.truncate(candidate.getCity(), 100))
                .snippet(candidate.getDescription())
                .salaryMin(candidate.getSalaryMin())
                .salaryMax(candidate.getSalaryMax())
                .salaryEstimated(candidate.isSalaryEstimated())
                .salaryRaw(PostingNormalizer.truncate(candidate.getSalaryRaw(), 200))
                .postedDate(candidate.getPostedDate())
                .postedDateRaw(PostingNormalizer.truncate(candidate.getPostedDateRaw(), 100))
                .category(PostingNormalizer.truncate(candidate.getCategoryLabel(), 200))
                .rawJson(rawPayloadWriter.toJson(candidate.getRawPayload()))
                .fitScore(item.fitScore())
                .b2cValidated(item.b2cValidated())
                .aiReasoning(item.reasoning())
                .status(status)
                .scoutRunId(runId)
                .createdAt(now)
                .build();
    }

    static String formatScore(double score) {
        return score == Math.rint(score) ? String.valueOf((long) score) : String.valueOf(score);
    }
}
