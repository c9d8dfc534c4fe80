package dev.jobscout.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobscout.config.ScoringConfig;
import dev.jobscout.metrics.ScoutMetrics;
import dev.jobscout.model.PostingCandidate;
import dev.jobscout.model.ScoredPosting;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AiBatchScorerTest {

  @Mock
  private ScoringClient scoringClient;

  private MeterRegistry meterRegistry;
  private AiBatchScorer scorer;

  @BeforeEach
  void setUp() {
    ScoringConfig scoringConfig = new ScoringConfig();
    scoringConfig.setAiBatchSize(2);
    meterRegistry = new SimpleMeterRegistry();
    scorer = new AiBatchScorer(scoringClient, new ScoringResponseParser(new ObjectMapper()), scoringConfig,
        new ScoutMetrics(meterRegistry));
  }

  private PostingCandidate posting(String title) {
    return PostingCandidate.builder().title(title).companyName("Acme").location("Bangalore").build();
  }

  @Test
  void shouldScoreAllBatchesInInputOrder() {
    when(scoringClient.complete(anyString())).thenReturn(
        Mono.just("""
            [{"index": 2, "fit_score": 5, "b2c_validated": false, "reasoning": "second"},
             {"index": 1, "fit_score": 8, "b2c_validated": true, "reasoning": "first"}]
            """),
        Mono.just("[{\"index\": 1, \"fit_score\": 7, \"b2c_validated\": true, \"reasoning\": \"third\"}]"));

    List<PostingCandidate> candidates = List.of(posting("A"), posting("B"), posting("C"));

    StepVerifier.create(scorer.scoreAll(candidates, "profile"))
        .assertNext(scored -> {
          assertThat(scored).extracting(s -> s.candidate().getTitle()).containsExactly("A", "B", "C");
          assertThat(scored).extracting(ScoredPosting::fitScore).containsExactly(8.0, 5.0, 7.0);
          assertThat(scored).extracting(ScoredPosting::reasoning).containsExactly("first", "second", "third");
          assertThat(scored.get(0).b2cValidated()).isTrue();
        })
        .verifyComplete();

    verify(scoringClient, times(2)).complete(anyString());
    assertThat(meterRegistry.counter("job_scout_ai_batches_total").count()).isEqualTo(2.0);
    assertThat(meterRegistry.counter("job_scout_ai_batch_failures_total").count()).isZero();
  }

  @Test
  void unreadableBatchShouldScoreZeroWithoutAffectingOthers() {
    when(scoringClient.complete(anyString())).thenReturn(
        Mono.just("Sorry, I can't help with that."),
        Mono.just("[{\"index\": 1, \"fit_score\": 9, \"b2c_validated\": true, \"reasoning\": \"great\"}]"));

    List<ScoredPosting> scored = scorer.scoreAll(
        List.of(posting("A"), posting("B"), posting("C")), "profile").block();

    assertThat(scored).hasSize(3);
    assertThat(scored.subList(0, 2)).allSatisfy(s -> {
      assertThat(s.fitScore()).isZero();
      assertThat(s.b2cValidated()).isFalse();
      assertThat(s.reasoning()).isEqualTo("AI scoring failed");
    });
    assertThat(scored.get(2).fitScore()).isEqualTo(9.0);
    assertThat(meterRegistry.counter("job_scout_ai_batch_failures_total").count()).isEqualTo(1.0);
  }

  @Test
  void backendErrorOrSilenceShouldDegradeToZero() {
    when(scoringClient.complete(anyString())).thenReturn(
        Mono.error(new IllegalStateException("connection refused")),
        Mono.empty());

    List<ScoredPosting> scored = scorer.scoreAll(
        List.of(posting("A"), posting("B"), posting("C")), "profile").block();

    assertThat(scored).extracting(ScoredPosting::fitScore).containsExactly(0.0, 0.0, 0.0);
    assertThat(scored).extracting(ScoredPosting::reasoning).containsOnly("AI scoring failed");
  }

  @Test
  void missingIndexShouldScoreThatItemZero() {
    when(scoringClient.complete(anyString())).thenReturn(
        Mono.just("[{\"index\": 1, \"fit_score\": 6, \"reasoning\": \"fine\"}]"));

    List<ScoredPosting> scored = scorer.scoreAll(List.of(posting("A"), posting("B")), "profile").block();

    assertThat(scored.get(0).fitScore()).isEqualTo(6.0);
    assertThat(scored.get(1).fitScore()).isZero();
    assertThat(scored.get(1).reasoning()).isEmpty();
  }

  @Test
  void emptyInputShouldNotCallBackend() {
    StepVerifier.create(scorer.scoreAll(List.of(), "profile"))
        .assertNext(scored -> assertThat(scored).isEmpty())
        .verifyComplete();

    verify(scoringClient, never()).complete(anyString());
  }

  @Test
  void promptShouldCarryProfileAndNumberedJobs() {
    PostingCandidate first = posting("Head of Growth");
    first.setB2cHint(true);
    PostingCandidate second = posting("VP Marketing");
    second.setSalaryRaw("40-60 LPA");

    String prompt = scorer.buildPrompt(List.of(first, second), "Growth leader, 12 years");

    assertThat(prompt)
        .contains("Growth leader, 12 years")
        .contains("---JOB 1---")
        .contains("Title: Head of Growth")
        .contains("B2C hint from pre-filter: true")
        .contains("---JOB 2---")
        .contains("Salary: 40-60 LPA")
        .contains("Salary: N/A")
        .contains("\"fit_score\"");
  }
}
