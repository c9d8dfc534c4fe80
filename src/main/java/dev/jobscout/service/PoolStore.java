package dev.jobscout.service;

import dev.jobscout.entity.Company;
import dev.jobscout.entity.ScoutedJob;
import dev.jobscout.entity.UserScoutPreferences;
import dev.jobscout.entity.UserScoutedJob;
import dev.jobscout.model.PostingCandidate;
import dev.jobscout.repository.ScoutedJobRepository;
import dev.jobscout.repository.UserScoutPreferencesRepository;
import dev.jobscout.repository.UserScoutedJobRepository;
import dev.jobscout.service.PreferenceScoringService.ScoreResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Persistence side of the shared-pool run: upsert by fingerprint, staleness sweep,
 * and per-user matching. Each public method is its own transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PoolStore {

    private final ScoutedJobRepository scoutedJobRepository;
    private final UserScoutedJobRepository userScoutedJobRepository;
    private final UserScoutPreferencesRepository preferencesRepository;
    private final PreferenceScoringService scoringService;
    private final CompanyDirectory companyDirectory;
    private final RawPayloadWriter rawPayloadWriter;

    public record UpsertOutcome(int inserted, int updated) {
    }

    /**
     * Insert unseen postings and refresh re-sighted ones.
     */
    @Transactional
    public UpsertOutcome upsert(List<PostingCandidate> candidates, Instant now) {
        if (candidates.isEmpty()) {
            return new UpsertOutcome(0, 0);
        }
        List<String> fingerprints = candidates.stream().map(PostingCandidate::getFingerprint).toList();
        Map<String, ScoutedJob> existing = scoutedJobRepository.findByDedupHashIn(fingerprints).stream()
                .collect(Collectors.toMap(ScoutedJob::getDedupHash, Function.identity()));

        List<ScoutedJob> toSave = new ArrayList<>();
        int inserted = 0;
        int updated = 0;
        for (PostingCandidate candidate : candidates) {
            ScoutedJob job = existing.get(candidate.getFingerprint());
            if (job != null) {
                job.markSeen(now);
                if (job.getMatchedCompanyId() == null) {
                    job.setMatchedCompanyId(resolveCompanyId(candidate.getCompanyName()));
                }
                updated++;
            } else {
                job = ScoutedJob.fromCandidate(candidate, rawPayloadWriter.toJson(candidate.getRawPayload()), now);
                job.setMatchedCompanyId(resolveCompanyId(candidate.getCompanyName()));
                existing.put(candidate.getFingerprint(), job);
                inserted++;
            }
            toSave.add(job);
        }
        scoutedJobRepository.saveAll(toSave);
        return new UpsertOutcome(inserted, updated);
    }

    /**
     * Deactivate pool entries not re-sighted since {@code cutoff}.
     */
    @Transactional
    public int markStale(Instant cutoff) {
        return scoutedJobRepository.markStale(cutoff, ScoutedJob.INACTIVE_NOT_SEEN);
    }

    /**
     * Score every active pool job the user has no match for and store those at or above
     * the user's threshold.
     *
     * @return number of matches created
     */
    @Transactional
    public int matchUser(String userId, Instant now) {
        Optional<UserScoutPreferences> found = preferencesRepository.findByUserId(userId);
        if (found.isEmpty()) {
            return 0;
        }
        UserScoutPreferences prefs = found.get();
        List<ScoutedJob> backlog = scoutedJobRepository.findActiveUnmatchedForUser(userId);
        Map<Long, Optional<Company>> companies = new HashMap<>();

        List<UserScoutedJob> matches = new ArrayList<>();
        for (ScoutedJob job : backlog) {
            Company company = job.getMatchedCompanyId() == null ? null
                    : companies.computeIfAbsent(job.getMatchedCompanyId(), companyDirectory::findById).orElse(null);
            ScoreResult score = scoringService.score(job, prefs, company);
            if (score.total() < prefs.getMinScore()) {
                continue;
            }
            // A concurrent run may have matched this pair since the backlog was read
            if (userScoutedJobRepository.existsByUserIdAndScoutedJobId(userId, job.getId())) {
                log.debug("User {}: job {} already matched, skipping", userId, job.getId());
                continue;
            }
            matches.add(UserScoutedJob.builder()
                    .userId(userId)
                    .scoutedJob(job)
                    .relevanceScore(score.total())
                    .scoreBreakdown(new LinkedHashMap<>(score.breakdown()))
                    .matchReasons(new ArrayList<>(score.reasons()))
                    .matchedAt(now)
                    .build());
        }
        userScoutedJobRepository.saveAll(matches);
        log.debug("User {}: {} backlog jobs scored, {} matched", userId, backlog.size(), matches.size());
        return matches.size();
    }

    private Long resolveCompanyId(String companyName) {
        return companyDirectory.resolveByName(companyName).map(Company::getId).orElse(null);
    }
}
