package dev.jobscout.service;

import dev.jobscout.config.RulesConfig;
import dev.jobscout.model.ExistingPostings;
import dev.jobscout.model.ExistingPostings.TitleCompany;
import dev.jobscout.model.PostingCandidate;
import dev.jobscout.normalize.PostingNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.xdrop.fuzzywuzzy.FuzzySearch;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes duplicate postings within a batch and against persisted state.
 * Checks run in order and the first hit drops the candidate: source id, fingerprint,
 * URL, then fuzzy title+company similarity.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeduplicationService {

    private final RulesConfig rulesConfig;

    /**
     * Filter out postings already known or already accepted earlier in the batch.
     *
     * @param candidates postings in fetch order
     * @param existing   persisted state for the relevant scope
     * @return surviving postings, in input order
     */
    public List<PostingCandidate> deduplicate(List<PostingCandidate> candidates, ExistingPostings existing) {
        if (candidates.isEmpty()) {
            return List.of();
        }

        Set<String> seenSourceKeys = new HashSet<>();
        Set<String> seenFingerprints = new HashSet<>();
        Set<String> seenUrls = new HashSet<>();
        List<TitleCompany> seenTitles = new ArrayList<>();
        List<TitleCompany> existingTitles = existing.titleCompanies().stream()
                .map(DeduplicationService::normalized)
                .toList();

        List<PostingCandidate> unique = new ArrayList<>();
        for (PostingCandidate candidate : candidates) {
            String sourceKey = candidate.getSourceKey();
            if (sourceKey != null
                    && (existing.sourceKeys().contains(sourceKey) || seenSourceKeys.contains(sourceKey))) {
                continue;
            }

            String fingerprint = candidate.getFingerprint();
            if (fingerprint != null
                    && (existing.fingerprints().contains(fingerprint) || seenFingerprints.contains(fingerprint))) {
                continue;
            }

            String url = candidate.getSourceUrl();
            if (url != null && !url.isBlank() && (existing.urls().contains(url) || seenUrls.contains(url))) {
                continue;
            }

            TitleCompany pair = normalized(new TitleCompany(candidate.getTitle(), candidate.getCompanyName()));
            if (matchesAny(pair, existingTitles) || matchesAny(pair, seenTitles)) {
                continue;
            }

            if (sourceKey != null) {
                seenSourceKeys.add(sourceKey);
            }
            if (fingerprint != null) {
                seenFingerprints.add(fingerprint);
            }
            if (url != null && !url.isBlank()) {
                seenUrls.add(url);
            }
            seenTitles.add(pair);
            unique.add(candidate);
        }

        log.info("Deduplication: {} candidates, {} duplicates, {} unique",
                candidates.size(), candidates.size() - unique.size(), unique.size());
        return unique;
    }

    private boolean matchesAny(TitleCompany pair, List<TitleCompany> known) {
        int threshold = rulesConfig.getDedupSimilarityThreshold();
        for (TitleCompany other : known) {
            if (FuzzySearch.ratio(pair.title(), other.title()) > threshold
                    && FuzzySearch.ratio(pair.company(), other.company()) > threshold) {
                return true;
            }
        }
        return false;
    }

    private static TitleCompany normalized(TitleCompany pair) {
        return new TitleCompany(PostingNormalizer.normalizeTitle(pair.title()),
                PostingNormalizer.normalizeCompany(pair.company()));
    }
}
