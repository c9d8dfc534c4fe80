package dev.jobscout.service;

import dev.jobscout.config.ScoringConfig;
import dev.jobscout.entity.LearnedAdjustment;
import dev.jobscout.entity.LearnedAdjustment.Kind;
import dev.jobscout.entity.ScoutedJob;
import dev.jobscout.entity.UserScoutPreferences;
import dev.jobscout.repository.UserScoutPreferencesRepository;
import dev.jobscout.repository.UserScoutedJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Adjusts a user's preferences from explicit dismiss feedback.
 * Adjustments compound: the same feedback given twice applies twice.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PreferenceLearningService {

    private final UserScoutPreferencesRepository preferencesRepository;
    private final UserScoutedJobRepository userScoutedJobRepository;
    private final ScoringConfig scoringConfig;

    /**
     * Apply the learning rule for a dismiss. The dismissal itself must already be saved,
     * since threshold rules count it.
     *
     * @param userId        the user who dismissed
     * @param dismissReason raw reason; unrecognized values are a no-op
     * @param job           the dismissed pool job
     */
    @Transactional
    public void learnFromDismiss(String userId, String dismissReason, ScoutedJob job) {
        Optional<DismissReason> reason = DismissReason.fromString(dismissReason);
        if (reason.isEmpty()) {
            log.debug("Dismiss reason '{}' has no learning rule", dismissReason);
            return;
        }
        Optional<UserScoutPreferences> found = preferencesRepository.findByUserId(userId);
        if (found.isEmpty()) {
            log.debug("No preferences for user {}, nothing to learn", userId);
            return;
        }
        UserScoutPreferences prefs = found.get();
        ScoringConfig.Learning learning = scoringConfig.getLearning();

        switch (reason.get()) {
            case WRONG_COMPANY -> penalizeCompany(prefs, job, learning.getCompanyPenalty());
            case SALARY_LOW -> {
                long count = userScoutedJobRepository.countByUserIdAndDismissReason(
                        userId, DismissReason.SALARY_LOW.getCode());
                if (count >= learning.getDismissThreshold() && prefs.getMinSalary() != null) {
                    long raised = prefs.getMinSalary() + prefs.getMinSalary() * learning.getSalaryRaisePercent() / 100;
                    log.info("User {} dismissed {} jobs for low salary, raising min salary {} -> {}",
                            userId, count, prefs.getMinSalary(), raised);
                    prefs.setMinSalary(raised);
                }
            }
            case WRONG_LOCATION -> {
                long count = userScoutedJobRepository.countByUserIdAndDismissReason(
                        userId, DismissReason.WRONG_LOCATION.getCode());
                if (count >= learning.getDismissThreshold() && !prefs.isStrictLocation()) {
                    log.info("User {} dismissed {} jobs for location, switching to strict location", userId, count);
                    prefs.setLocationFlexibility(UserScoutPreferences.FLEX_STRICT);
                }
            }
            case WRONG_ROLE -> {
                List<String> words = titleWords(job.getTitle(), learning.getMaxTitleWords());
                List<LearnedAdjustment> penalties = new ArrayList<>(prefs.getLearnedPenalties());
                for (String word : words) {
                    addPoints(penalties, Kind.TITLE_WORD, word, learning.getTitleWordPenalty());
                }
                prefs.setLearnedPenalties(penalties);
                log.info("User {} penalized title words {}", userId, words);
            }
        }
        preferencesRepository.save(prefs);
    }

    private void penalizeCompany(UserScoutPreferences prefs, ScoutedJob job, int points) {
        List<LearnedAdjustment> penalties = new ArrayList<>(prefs.getLearnedPenalties());
        if (job.getMatchedCompanyId() != null) {
            addPoints(penalties, Kind.COMPANY, String.valueOf(job.getMatchedCompanyId()), points);
        } else if (job.getCompanyName() != null && !job.getCompanyName().isBlank()) {
            addPoints(penalties, Kind.COMPANY_NAME, job.getCompanyName(), points);
        } else {
            return;
        }
        prefs.setLearnedPenalties(penalties);
        log.info("User {} penalized company '{}'", prefs.getUserId(), job.getCompanyName());
    }

    /**
     * Adds to an existing entry of the same kind and key, or appends a new one.
     */
    static void addPoints(List<LearnedAdjustment> adjustments, Kind kind, String key, int points) {
        for (int i = 0; i < adjustments.size(); i++) {
            LearnedAdjustment existing = adjustments.get(i);
            if (existing.kind() == kind && existing.key().equals(key)) {
                adjustments.set(i, existing.plus(points));
                return;
            }
        }
        adjustments.add(new LearnedAdjustment(kind, key, points));
    }

    /**
     * Lowercased title words of at least three characters, punctuation stripped, first {@code max}.
     */
    static List<String> titleWords(String title, int max) {
        if (title == null || title.isBlank()) {
            return List.of();
        }
        String cleaned = title.toLowerCase(Locale.ROOT).replaceAll("[^\\w\\s]", " ");
        return Arrays.stream(cleaned.trim().split("\\s+"))
                .filter(word -> word.length() >= 3)
                .limit(max)
                .toList();
    }
}
