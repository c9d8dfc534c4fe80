package dev.jobscout.service;

import dev.jobscout.entity.PipelineJob;
import dev.jobscout.entity.ScoutResult;
import dev.jobscout.entity.ScoutResultStatus;
import dev.jobscout.entity.UserScoutedJob;
import dev.jobscout.entity.UserScoutedJobStatus;
import dev.jobscout.repository.ScoutResultRepository;
import dev.jobscout.repository.UserScoutedJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * User actions on scouted postings: view, save, dismiss (feeds preference learning)
 * and promotion into the application pipeline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScoutFeedbackService {

    private final UserScoutedJobRepository userScoutedJobRepository;
    private final ScoutResultRepository scoutResultRepository;
    private final PreferenceLearningService learningService;
    private final PipelinePromoter pipelinePromoter;
    private final Clock clock;

    @Transactional
    public UserScoutedJob markViewed(String userId, Long matchId) {
        UserScoutedJob match = findMatch(userId, matchId);
        match.setStatus(UserScoutedJobStatus.VIEWED);
        match.setViewedAt(clock.instant());
        return userScoutedJobRepository.save(match);
    }

    @Transactional
    public UserScoutedJob markSaved(String userId, Long matchId) {
        UserScoutedJob match = findMatch(userId, matchId);
        match.setStatus(UserScoutedJobStatus.SAVED);
        match.setSavedAt(clock.instant());
        return userScoutedJobRepository.save(match);
    }

    /**
     * Dismiss a match and let preference learning react to the reason.
     * The dismissal is flushed first so threshold rules count it.
     */
    @Transactional
    public UserScoutedJob dismiss(String userId, Long matchId, String reason) {
        UserScoutedJob match = findMatch(userId, matchId);
        match.setStatus(UserScoutedJobStatus.DISMISSED);
        match.setDismissedAt(clock.instant());
        match.setDismissReason(reason);
        UserScoutedJob saved = userScoutedJobRepository.saveAndFlush(match);

        if (reason != null && !reason.isBlank()) {
            learningService.learnFromDismiss(userId, reason, match.getScoutedJob());
        }
        log.info("User {} dismissed match {} ({})", userId, matchId, reason);
        return saved;
    }

    /**
     * Copy a pool match into the user's pipeline.
     *
     * @throws IllegalStateException when the match was already added
     */
    @Transactional
    public PipelineJob addToPipeline(String userId, Long matchId) {
        UserScoutedJob match = findMatch(userId, matchId);
        if (match.getPipelineJobId() != null) {
            throw new IllegalStateException("Match " + matchId + " is already in the pipeline as job "
                    + match.getPipelineJobId());
        }
        PipelineJob pipelineJob = pipelinePromoter.promote(match);
        match.setPipelineJobId(pipelineJob.getId());
        match.setAddedToPipelineAt(clock.instant());
        userScoutedJobRepository.save(match);
        log.info("User {} added match {} to pipeline as job {}", userId, matchId, pipelineJob.getId());
        return pipelineJob;
    }

    /**
     * Manually promote an on-demand result, typically one saved for review.
     *
     * @throws IllegalStateException when the result was already promoted
     */
    @Transactional
    public PipelineJob promoteResult(String userId, Long resultId) {
        ScoutResult result = findResult(userId, resultId);
        if (result.getPromotedJobId() != null) {
            throw new IllegalStateException("Result " + resultId + " is already promoted to job "
                    + result.getPromotedJobId());
        }
        PipelineJob pipelineJob = pipelinePromoter.promote(result,
                "Promoted from Job Scout review. Fit score: " + result.getFitScore() + "/10.");
        result.setPromotedJobId(pipelineJob.getId());
        result.setStatus(ScoutResultStatus.PROMOTED);
        scoutResultRepository.save(result);
        return pipelineJob;
    }

    @Transactional
    public ScoutResult dismissResult(String userId, Long resultId) {
        ScoutResult result = findResult(userId, resultId);
        result.setStatus(ScoutResultStatus.DISMISSED);
        return scoutResultRepository.save(result);
    }

    private UserScoutedJob findMatch(String userId, Long matchId) {
        return userScoutedJobRepository.findByIdAndUserId(matchId, userId)
                .orElseThrow(() -> new IllegalArgumentException("Scouted job match not found: " + matchId));
    }

    private ScoutResult findResult(String userId, Long resultId) {
        return scoutResultRepository.findByIdAndUserId(resultId, userId)
                .orElseThrow(() -> new IllegalArgumentException("Scout result not found: " + resultId));
    }
}
