package dev.jobscout.service;

import dev.jobscout.config.RulesConfig;
import dev.jobscout.model.PostingCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.xdrop.fuzzywuzzy.FuzzySearch;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Cheap rule-based relevance gate applied before any paid scoring call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PreFilterService {

    private final RulesConfig rulesConfig;

    /**
     * What the gate checks a candidate against.
     *
     * @param excludedCompanies lowercase company names that are never shown
     */
    public record PreFilterCriteria(List<String> targetRoles, List<String> targetLocations,
                                    Set<String> excludedCompanies) {
    }

    /**
     * Result of the gate. The B2C hint never blocks, it is passed to the scorer.
     */
    public record PreFilterResult(boolean passed, String blockReason, boolean b2cHint) {
        public static PreFilterResult blocked(String reason) {
            return new PreFilterResult(false, reason, false);
        }

        public static PreFilterResult passed(boolean b2cHint) {
            return new PreFilterResult(true, null, b2cHint);
        }
    }

    /**
     * Keep the candidates that pass, with their B2C hint set.
     */
    public List<PostingCandidate> filter(List<PostingCandidate> candidates, PreFilterCriteria criteria) {
        List<PostingCandidate> passed = new ArrayList<>();
        for (PostingCandidate candidate : candidates) {
            PreFilterResult result = evaluate(candidate, criteria);
            if (!result.passed()) {
                log.debug("Posting '{}' @ {} filtered: {}", candidate.getTitle(), candidate.getCompanyName(),
                        result.blockReason());
                continue;
            }
            candidate.setB2cHint(result.b2cHint());
            passed.add(candidate);
        }
        log.info("Pre-filter: {} of {} postings passed", passed.size(), candidates.size());
        return passed;
    }

    public PreFilterResult evaluate(PostingCandidate candidate, PreFilterCriteria criteria) {
        String title = lower(candidate.getTitle());
        String company = lower(candidate.getCompanyName());
        String location = lower(candidate.getLocation());
        String snippet = lower(candidate.getDescription());

        if (criteria.excludedCompanies().contains(company)) {
            return PreFilterResult.blocked("Excluded company");
        }
        for (String keyword : rulesConfig.getExcludedCompanyKeywords()) {
            if (company.contains(keyword.toLowerCase(Locale.ROOT))) {
                return PreFilterResult.blocked("Excluded company keyword: " + keyword);
            }
        }

        if (!location.isEmpty() && !locationMatches(location, criteria.targetLocations())) {
            return PreFilterResult.blocked("Location not targeted");
        }

        if (!seniorityMatches(title, criteria.targetRoles())) {
            return PreFilterResult.blocked("No seniority keyword or target role in title");
        }

        String combined = title + " " + company + " " + location + " " + snippet;
        boolean b2cHint = rulesConfig.getB2cKeywords().stream()
                .anyMatch(keyword -> combined.contains(keyword.toLowerCase(Locale.ROOT)));
        return PreFilterResult.passed(b2cHint);
    }

    private boolean locationMatches(String location, List<String> targetLocations) {
        boolean allowed = rulesConfig.getLocationKeywords().stream()
                .anyMatch(keyword -> location.contains(keyword.toLowerCase(Locale.ROOT)));
        if (!allowed && targetLocations != null) {
            allowed = targetLocations.stream()
                    .filter(target -> target != null && !target.isBlank())
                    .anyMatch(target -> location.contains(target.toLowerCase(Locale.ROOT)));
        }
        return allowed;
    }

    private boolean seniorityMatches(String title, List<String> targetRoles) {
        boolean matched = rulesConfig.getSeniorityKeywords().stream()
                .anyMatch(keyword -> title.contains(keyword.toLowerCase(Locale.ROOT)));
        if (!matched && targetRoles != null) {
            int threshold = rulesConfig.getRoleSimilarityThreshold();
            matched = targetRoles.stream()
                    .filter(role -> role != null && !role.isBlank())
                    .anyMatch(role -> FuzzySearch.partialRatio(role.toLowerCase(Locale.ROOT), title) > threshold);
        }
        return matched;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
