package dev.jobscout.service;

import dev.jobscout.entity.UserProfile;
import dev.jobscout.entity.UserScoutPreferences;
import dev.jobscout.model.SalaryRange;
import dev.jobscout.normalize.PostingNormalizer;
import dev.jobscout.repository.UserProfileRepository;
import dev.jobscout.repository.UserScoutPreferencesRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Owns per-user scout preferences: derives them from the profile on first access,
 * re-syncs on request, and applies user edits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PreferencesService {

    static final List<String> DEFAULT_EXCLUDED_INDUSTRIES = List.of("Food Delivery");

    private static final Pattern FIRST_NUMBER = Pattern.compile("(\\d{1,15})");
    private static final long LAKH = 100_000L;

    private final UserScoutPreferencesRepository preferencesRepository;
    private final UserProfileRepository profileRepository;
    private final Clock clock;

    /**
     * User edits. Null fields are left unchanged.
     */
    public record PreferencesUpdate(
            List<String> targetRoles,
            List<String> roleKeywords,
            List<String> targetLocations,
            String locationFlexibility,
            Set<Long> targetCompanyIds,
            Set<Long> excludedCompanyIds,
            List<String> targetIndustries,
            List<String> excludedIndustries,
            List<String> companyStages,
            Long minSalary,
            String salaryFlexibility,
            Integer minScore) {
    }

    /**
     * Load the user's preferences, deriving and saving them from the profile when absent.
     */
    @Transactional
    public UserScoutPreferences getOrCreate(String userId) {
        Optional<UserScoutPreferences> existing = preferencesRepository.findByUserId(userId);
        if (existing.isPresent()) {
            return existing.get();
        }

        UserScoutPreferences prefs = UserScoutPreferences.builder()
                .userId(userId)
                .excludedIndustries(new ArrayList<>(DEFAULT_EXCLUDED_INDUSTRIES))
                .build();
        profileRepository.findByUserId(userId).ifPresent(profile -> applyProfile(prefs, profile));
        log.info("Created scout preferences for user {} ({} target roles, {} locations)",
                userId, prefs.getTargetRoles().size(), prefs.getTargetLocations().size());
        return preferencesRepository.save(prefs);
    }

    /**
     * Re-derive the profile-backed fields of existing preferences.
     *
     * @return the updated preferences, or empty when the user has none
     */
    @Transactional
    public Optional<UserScoutPreferences> syncFromProfile(String userId) {
        Optional<UserScoutPreferences> existing = preferencesRepository.findByUserId(userId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        UserScoutPreferences prefs = existing.get();
        profileRepository.findByUserId(userId).ifPresent(profile -> applyProfile(prefs, profile));
        prefs.setSyncedFromProfileAt(clock.instant());
        return Optional.of(preferencesRepository.save(prefs));
    }

    @Transactional
    public UserScoutPreferences update(String userId, PreferencesUpdate changes) {
        UserScoutPreferences prefs = getOrCreate(userId);
        if (changes.targetRoles() != null) {
            prefs.setTargetRoles(new ArrayList<>(changes.targetRoles()));
        }
        if (changes.roleKeywords() != null) {
            prefs.setRoleKeywords(new ArrayList<>(changes.roleKeywords()));
        }
        if (changes.targetLocations() != null) {
            prefs.setTargetLocations(new ArrayList<>(changes.targetLocations()));
        }
        if (changes.locationFlexibility() != null) {
            prefs.setLocationFlexibility(flexibility(changes.locationFlexibility(),
                    UserScoutPreferences.FLEX_PREFERRED));
        }
        if (changes.targetCompanyIds() != null) {
            prefs.setTargetCompanyIds(new LinkedHashSet<>(changes.targetCompanyIds()));
        }
        if (changes.excludedCompanyIds() != null) {
            prefs.setExcludedCompanyIds(new LinkedHashSet<>(changes.excludedCompanyIds()));
        }
        if (changes.targetIndustries() != null) {
            prefs.setTargetIndustries(new ArrayList<>(changes.targetIndustries()));
        }
        if (changes.excludedIndustries() != null) {
            prefs.setExcludedIndustries(new ArrayList<>(changes.excludedIndustries()));
        }
        if (changes.companyStages() != null) {
            prefs.setCompanyStages(new ArrayList<>(changes.companyStages()));
        }
        if (changes.minSalary() != null) {
            prefs.setMinSalary(changes.minSalary());
        }
        if (changes.salaryFlexibility() != null) {
            prefs.setSalaryFlexibility(flexibility(changes.salaryFlexibility(),
                    UserScoutPreferences.FLEX_FLEXIBLE));
        }
        if (changes.minScore() != null) {
            if (changes.minScore() < 0 || changes.minScore() > 100) {
                throw new IllegalArgumentException("minScore must be between 0 and 100: " + changes.minScore());
            }
            prefs.setMinScore(changes.minScore());
        }
        return preferencesRepository.save(prefs);
    }

    private void applyProfile(UserScoutPreferences prefs, UserProfile profile) {
        prefs.setTargetRoles(new ArrayList<>(profile.getTargetRoles()));
        prefs.setTargetLocations(new ArrayList<>(profile.getTargetLocations()));
        prefs.setMinSalary(parseMinSalary(profile.getTargetSalaryRange()));

        Set<String> keywords = new LinkedHashSet<>(profile.getCoreSkills());
        keywords.addAll(profile.getResumeKeywords());
        prefs.setRoleKeywords(new ArrayList<>(keywords));
        prefs.setTargetIndustries(new ArrayList<>(profile.getIndustries()));
    }

    /**
     * Lower bound of a salary expectation such as "50-80 Lakh" or "90 LPA". A bare number
     * below 1000 is read as lakhs, anything larger as rupees.
     */
    static Long parseMinSalary(String salaryRange) {
        if (salaryRange == null || salaryRange.isBlank()) {
            return null;
        }
        SalaryRange parsed = PostingNormalizer.parseSalary(salaryRange);
        if (parsed.min() != null) {
            return parsed.min();
        }
        Matcher m = FIRST_NUMBER.matcher(salaryRange);
        if (m.find()) {
            long value = Long.parseLong(m.group(1));
            return value < 1000 ? value * LAKH : value;
        }
        return null;
    }

    private static String flexibility(String value, String fallback) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals(UserScoutPreferences.FLEX_STRICT)
                || normalized.equals(UserScoutPreferences.FLEX_PREFERRED)
                || normalized.equals(UserScoutPreferences.FLEX_FLEXIBLE)) {
            return normalized;
        }
        log.warn("Unknown flexibility '{}', using '{}'", value, fallback);
        return fallback;
    }
}
