package dev.jobscout.model;

import java.util.List;
import java.util.Set;

/**
 * Persisted state a batch is deduplicated against: source keys, fingerprints, URLs
 * and (title, company) pairs already known for the relevant scope.
 */
public record ExistingPostings(Set<String> sourceKeys,
                               Set<String> fingerprints,
                               Set<String> urls,
                               List<TitleCompany> titleCompanies) {

    public static ExistingPostings empty() {
        return new ExistingPostings(Set.of(), Set.of(), Set.of(), List.of());
    }

    public record TitleCompany(String title, String company) {
    }
}
