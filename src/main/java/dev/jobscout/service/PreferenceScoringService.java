package dev.jobscout.service;

import dev.jobscout.entity.Company;
import dev.jobscout.entity.LearnedAdjustment;
import dev.jobscout.entity.ScoutedJob;
import dev.jobscout.entity.UserScoutPreferences;
import dev.jobscout.normalize.PostingNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Deterministic, explainable relevance rubric for the shared pool (0-100).
 * No I/O: safe to call for every (user, job) pair of a large backlog.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PreferenceScoringService {

    public static final String FACTOR_HARD_FILTER = "hard_filter";
    public static final String FACTOR_TITLE = "title";
    public static final String FACTOR_COMPANY = "company";
    public static final String FACTOR_LOCATION = "location";
    public static final String FACTOR_SALARY = "salary";
    public static final String FACTOR_KEYWORDS = "keywords";
    public static final String FACTOR_RECENCY = "recency";
    public static final String FACTOR_LEARNED = "learned";

    private static final int MAX_KEYWORD_POINTS = 5;

    private final Clock clock;

    /**
     * Result of scoring a job against one user's preferences.
     *
     * @param total     clamped score, 0-100
     * @param breakdown points per factor, in rubric order
     * @param reasons   human-readable reasons for the non-zero factors
     */
    public record ScoreResult(int total, Map<String, Integer> breakdown, List<String> reasons) {

        static ScoreResult hardFiltered(String reason) {
            return new ScoreResult(0, Map.of(FACTOR_HARD_FILTER, 0), List.of(reason));
        }
    }

    /**
     * Score a pool job.
     *
     * @param job     the shared posting
     * @param prefs   the user's preferences
     * @param company the directory entry the job is linked to, or null
     */
    public ScoreResult score(ScoutedJob job, UserScoutPreferences prefs, Company company) {
        Long companyId = company != null ? company.getId() : job.getMatchedCompanyId();

        // Hard filters
        if (companyId != null && prefs.getExcludedCompanyIds().contains(companyId)) {
            return ScoreResult.hardFiltered("Company is excluded");
        }
        if (company != null && matchesAny(company.getSector(), prefs.getExcludedIndustries())) {
            return ScoreResult.hardFiltered("Industry is excluded");
        }

        Map<String, Integer> breakdown = new LinkedHashMap<>();
        List<String> reasons = new ArrayList<>();

        breakdown.put(FACTOR_TITLE, titlePoints(job, prefs, reasons));
        breakdown.put(FACTOR_COMPANY, companyPoints(companyId, company, prefs, reasons));
        breakdown.put(FACTOR_LOCATION, locationPoints(job, prefs, reasons));
        breakdown.put(FACTOR_SALARY, salaryPoints(job, prefs, reasons));
        breakdown.put(FACTOR_KEYWORDS, keywordPoints(job, prefs, reasons));
        breakdown.put(FACTOR_RECENCY, recencyPoints(job, reasons));
        breakdown.put(FACTOR_LEARNED, learnedPoints(job, companyId, prefs, reasons));

        int sum = breakdown.values().stream().mapToInt(Integer::intValue).sum();
        int total = Math.max(0, Math.min(100, sum));
        return new ScoreResult(total, breakdown, reasons);
    }

    private int titlePoints(ScoutedJob job, UserScoutPreferences prefs, List<String> reasons) {
        String title = PostingNormalizer.normalizeForMatching(job.getTitle());
        if (title.isEmpty()) {
            return 0;
        }

        List<String> targetRoles = normalizedList(prefs.getTargetRoles());
        if (targetRoles.stream().anyMatch(title::contains)) {
            reasons.add("Exact match with target role");
            return 40;
        }

        List<String> keywords = normalizedList(prefs.getRoleKeywords());
        if (keywords.isEmpty()) {
            keywords = targetRoles.stream()
                    .flatMap(role -> Arrays.stream(role.split(" ")))
                    .filter(word -> !word.isEmpty())
                    .toList();
        }
        long hits = keywords.stream().filter(title::contains).count();
        if (hits >= 2) {
            reasons.add("2+ keyword matches in title");
            return 25;
        }
        if (hits == 1) {
            reasons.add("1 keyword match in title");
            return 15;
        }
        return 0;
    }

    private int companyPoints(Long companyId, Company company, UserScoutPreferences prefs, List<String> reasons) {
        if (companyId != null && prefs.getTargetCompanyIds().contains(companyId)) {
            reasons.add("Company in target list");
            return 25;
        }
        if (company == null) {
            return 0;
        }
        if (matchesAny(company.getSector(), prefs.getTargetIndustries())) {
            reasons.add("Industry matches target");
            return 15;
        }
        if (matchesAny(company.getStage(), prefs.getCompanyStages())) {
            reasons.add("Company stage matches preferred");
            return 10;
        }
        return 0;
    }

    private int locationPoints(ScoutedJob job, UserScoutPreferences prefs, List<String> reasons) {
        String location = PostingNormalizer.normalizeForMatching(job.getLocation());
        String city = PostingNormalizer.normalizeForMatching(job.getCity());
        List<String> targets = normalizedList(prefs.getTargetLocations());

        if (location.contains("remote") || city.contains("remote")) {
            reasons.add("Remote role");
            return 15;
        }
        for (String target : targets) {
            if (location.contains(target) || city.contains(target)) {
                reasons.add("City matches target location");
                return 15;
            }
        }
        if (prefs.isStrictLocation() && !targets.isEmpty()) {
            reasons.add("Location mismatch (strict mode)");
            return -20;
        }
        return 0;
    }

    private int salaryPoints(ScoutedJob job, UserScoutPreferences prefs, List<String> reasons) {
        Long minSalary = prefs.getMinSalary();
        Long jobSalary = job.getSalaryMin() != null ? job.getSalaryMin() : job.getSalaryMax();
        if (minSalary == null || minSalary <= 0 || jobSalary == null) {
            return 0;
        }
        if (jobSalary >= minSalary) {
            reasons.add("Meets minimum salary");
            return 10;
        }
        if (jobSalary >= (long) (minSalary * 0.85)) {
            reasons.add("Within 85% of minimum salary");
            return 5;
        }
        if (prefs.isStrictSalary()) {
            reasons.add("Below minimum (strict mode)");
            return -15;
        }
        return 0;
    }

    private int keywordPoints(ScoutedJob job, UserScoutPreferences prefs, List<String> reasons) {
        String description = PostingNormalizer.normalizeForMatching(job.getDescription());
        if (description.isEmpty() || prefs.getRoleKeywords().isEmpty()) {
            return 0;
        }
        Set<String> words = new HashSet<>(Arrays.asList(description.split(" ")));
        int count = 0;
        for (String keyword : normalizedList(prefs.getRoleKeywords())) {
            boolean present = Arrays.stream(keyword.split(" "))
                    .allMatch(part -> words.contains(part) || description.contains(part));
            if (present) {
                count++;
            }
        }
        int points = Math.min(count, MAX_KEYWORD_POINTS);
        if (points > 0) {
            reasons.add(points + " role keywords in description");
        }
        return points;
    }

    private int recencyPoints(ScoutedJob job, List<String> reasons) {
        LocalDate posted = job.getPostedDate();
        if (posted == null) {
            return 0;
        }
        long days = ChronoUnit.DAYS.between(posted, LocalDate.now(clock));
        if (days <= 1) {
            reasons.add("Posted ≤1 day ago");
            return 5;
        }
        if (days <= 3) {
            reasons.add("Posted ≤3 days ago");
            return 3;
        }
        if (days <= 7) {
            reasons.add("Posted ≤7 days ago");
            return 1;
        }
        return 0;
    }

    private int learnedPoints(ScoutedJob job, Long companyId, UserScoutPreferences prefs, List<String> reasons) {
        int points = sumMatching(prefs.getLearnedBoosts(), job, companyId)
                - sumMatching(prefs.getLearnedPenalties(), job, companyId);
        if (points != 0) {
            reasons.add("Learned adjustment: " + (points > 0 ? "+" : "") + points);
        }
        return points;
    }

    private int sumMatching(List<LearnedAdjustment> adjustments, ScoutedJob job, Long companyId) {
        if (adjustments == null || adjustments.isEmpty()) {
            return 0;
        }
        String companyName = PostingNormalizer.normalizeForMatching(job.getCompanyName());
        String title = PostingNormalizer.normalizeForMatching(job.getTitle());
        int total = 0;
        for (LearnedAdjustment adjustment : adjustments) {
            boolean matches = switch (adjustment.kind()) {
                case COMPANY -> companyId != null && String.valueOf(companyId).equals(adjustment.key());
                case COMPANY_NAME -> !companyName.isEmpty()
                        && companyName.equals(PostingNormalizer.normalizeForMatching(adjustment.key()));
                case TITLE_WORD -> !title.isEmpty() && adjustment.key() != null
                        && title.contains(adjustment.key());
            };
            if (matches) {
                total += adjustment.points();
            }
        }
        return total;
    }

    /**
     * Two-way substring match between a company attribute and a preference list.
     */
    private static boolean matchesAny(String value, List<String> preferences) {
        String normalized = PostingNormalizer.normalizeForMatching(value);
        if (normalized.isEmpty() || preferences == null) {
            return false;
        }
        return normalizedList(preferences).stream()
                .anyMatch(pref -> pref.contains(normalized) || normalized.contains(pref));
    }

    private static List<String> normalizedList(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(PostingNormalizer::normalizeForMatching)
                .filter(value -> !value.isEmpty())
                .toList();
    }
}
