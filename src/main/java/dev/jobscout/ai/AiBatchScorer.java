package dev.jobscout.ai;

import dev.jobscout.config.ScoringConfig;
import dev.jobscout.metrics.ScoutMetrics;
import dev.jobscout.model.PostingCandidate;
import dev.jobscout.model.ScoredPosting;
import dev.jobscout.normalize.PostingNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores pre-filtered postings in small batches, one model call per batch.
 * A batch whose response cannot be read is scored 0 as a whole; this never fails the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AiBatchScorer {

    static final String FAILED_REASONING = "AI scoring failed";

    private final ScoringClient scoringClient;
    private final ScoringResponseParser parser;
    private final ScoringConfig scoringConfig;
    private final ScoutMetrics metrics;

    /**
     * Score every candidate. Batches run one after another to stay inside provider rate limits.
     *
     * @param candidates     pre-filtered postings
     * @param profileSummary candidate profile text embedded in each prompt
     * @return scored postings in input order
     */
    public Mono<List<ScoredPosting>> scoreAll(List<PostingCandidate> candidates, String profileSummary) {
        if (candidates.isEmpty()) {
            return Mono.just(List.of());
        }
        List<List<PostingCandidate>> batches = partition(candidates, Math.max(1, scoringConfig.getAiBatchSize()));
        log.info("AI scoring {} postings in {} batches via '{}'", candidates.size(), batches.size(),
                scoringClient.getName());

        return Flux.fromIterable(batches)
                .concatMap(batch -> scoreBatch(batch, profileSummary))
                .flatMapIterable(list -> list)
                .collectList();
    }

    Mono<List<ScoredPosting>> scoreBatch(List<PostingCandidate> batch, String profileSummary) {
        String prompt = buildPrompt(batch, profileSummary);
        return scoringClient.complete(prompt)
                .map(parser::parse)
                .defaultIfEmpty(BatchScoringResult.failed("No response from scoring backend"))
                .onErrorResume(e -> Mono.just(BatchScoringResult.failed(e.getMessage())))
                .map(result -> merge(batch, result));
    }

    /**
     * Map a batch result back onto its items by 1-based index. A failed result scores
     * every item 0; an index missing from a successful result scores that item 0.
     */
    List<ScoredPosting> merge(List<PostingCandidate> batch, BatchScoringResult result) {
        metrics.recordAiBatch(result.isSuccess());
        List<ScoredPosting> scored = new ArrayList<>(batch.size());

        if (!result.isSuccess()) {
            log.error("AI scoring returned invalid response ({}), marking batch of {} as score=0",
                    result.failureReason(), batch.size());
            for (PostingCandidate candidate : batch) {
                scored.add(new ScoredPosting(candidate, 0, false, FAILED_REASONING));
            }
            return scored;
        }

        Map<Integer, ItemScore> byIndex = new HashMap<>();
        for (ItemScore score : result.scores()) {
            byIndex.putIfAbsent(score.index(), score);
        }
        for (int i = 0; i < batch.size(); i++) {
            ItemScore score = byIndex.get(i + 1);
            if (score == null) {
                scored.add(new ScoredPosting(batch.get(i), 0, false, ""));
            } else {
                scored.add(new ScoredPosting(batch.get(i), score.fitScore(), score.b2cValidated(), score.reasoning()));
            }
        }
        return scored;
    }

    String buildPrompt(List<PostingCandidate> batch, String profileSummary) {
        StringBuilder jobs = new StringBuilder();
        for (int i = 0; i < batch.size(); i++) {
            PostingCandidate candidate = batch.get(i);
            jobs.append(String.format("%n---JOB %d---%n", i + 1));
            jobs.append(String.format("Title: %s%nCompany: %s%nLocation: %s%nSnippet: %s%nSalary: %s%n"
                            + "B2C hint from pre-filter: %s%n",
                    nullToEmpty(candidate.getTitle()),
                    nullToEmpty(candidate.getCompanyName()),
                    nullToEmpty(candidate.getLocation()),
                    nullToEmpty(PostingNormalizer.truncate(candidate.getDescription(),
                            scoringConfig.getSnippetLength())),
                    candidate.getSalaryRaw() != null ? candidate.getSalaryRaw() : "N/A",
                    candidate.isB2cHint()));
        }

        return """
                You are a job-fit scoring engine for a senior job seeker.

                CANDIDATE PROFILE:
                %s

                Score each job below on a 1-10 scale:
                - 1-4: Poor fit (wrong level, wrong domain, wrong location)
                - 5-6: Possible fit (partially matches, worth reviewing)
                - 7-10: Strong fit (right level, domain and location; B2C preferred)

                Also determine if the company is B2C (true/false).
                %s
                Return ONLY valid JSON: an array with one object per job:
                [
                  {"index": 1, "fit_score": 7, "b2c_validated": true, "reasoning": "Brief 1-2 sentence reasoning"}
                ]

                No markdown, no explanation outside the JSON array.
                """.formatted(profileSummary, jobs);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static <T> List<List<T>> partition(List<T> list, int size) {
        List<List<T>> partitions = new ArrayList<>();
        for (int i = 0; i < list.size(); i += size) {
            partitions.add(list.subList(i, Math.min(i + size, list.size())));
        }
        return partitions;
    }
}
