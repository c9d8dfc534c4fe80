package dev.jobscout.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobscout.config.ScoringConfig;
import dev.jobscout.entity.PipelineJob;
import dev.jobscout.entity.ScoutResult;
import dev.jobscout.entity.ScoutResultStatus;
import dev.jobscout.model.ExistingPostings;
import dev.jobscout.model.PostingCandidate;
import dev.jobscout.model.ScoredPosting;
import dev.jobscout.normalize.PostingNormalizer;
import dev.jobscout.repository.PipelineJobRepository;
import dev.jobscout.repository.ScoutResultRepository;
import dev.jobscout.service.ScoutRunStore.SavedRun;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScoutRunStoreTest {

  private static final Instant NOW = Instant.parse("2025-03-10T08:00:00Z");
  private static final String RUN_ID = "scout_20250310_080000_a1b2c3";

  @Mock
  private ScoutResultRepository scoutResultRepository;

  @Mock
  private PipelineJobRepository pipelineJobRepository;

  @Mock
  private PipelinePromoter pipelinePromoter;

  private ScoutRunStore runStore;

  @BeforeEach
  void setUp() {
    runStore = new ScoutRunStore(scoutResultRepository, pipelineJobRepository, pipelinePromoter,
        new RawPayloadWriter(new ObjectMapper()), new ScoringConfig());
    lenient().when(scoutResultRepository.save(any(ScoutResult.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
  }

  private static ScoredPosting scored(String id, String title, double score) {
    PostingCandidate candidate = PostingNormalizer.complete(PostingCandidate.builder()
        .source("serpapi")
        .externalId(id)
        .title(title)
        .companyName("Meesho")
        .location("Bangalore")
        .sourceUrl("https://jobs.example/" + id)
        .categoryLabel("Marketing")
        .rawPayload(Map.of("job_id", id))
        .build());
    return new ScoredPosting(candidate, score, true, "reason " + id);
  }

  @ParameterizedTest
  @CsvSource({
      "10.0, PROMOTED",
      "7.0, PROMOTED",
      "6.9, NEW",
      "5.0, NEW",
      "4.9, DISMISSED",
      "0.0, DISMISSED"
  })
  void categorize_shouldApplyThresholds(double score, ScoutResultStatus expected) {
    assertThat(runStore.categorize(score)).isEqualTo(expected);
  }

  @Test
  void saveResults_shouldPersistEveryPostingAndPromoteStrongOnes() {
    when(pipelinePromoter.promote(any(ScoutResult.class), anyString()))
        .thenReturn(PipelineJob.builder().id(42L).build());

    SavedRun saved = runStore.saveResults("u1", RUN_ID, List.of(
        scored("a", "Head of Growth", 8),
        scored("b", "VP Marketing", 6),
        scored("c", "Growth Lead", 3)), NOW);

    assertThat(saved.promotedCount()).isEqualTo(1);
    assertThat(saved.reviewCount()).isEqualTo(1);
    assertThat(saved.dismissedCount()).isEqualTo(1);
    assertThat(saved.promoted()).singleElement().satisfies(result -> {
      assertThat(result.getPromotedJobId()).isEqualTo(42L);
      assertThat(result.getStatus()).isEqualTo(ScoutResultStatus.PROMOTED);
      assertThat(result.getScoutRunId()).isEqualTo(RUN_ID);
      assertThat(result.getRawJson()).contains("\"job_id\":\"a\"");
      assertThat(result.getCategory()).isEqualTo("Marketing");
    });

    ArgumentCaptor<String> note = ArgumentCaptor.forClass(String.class);
    verify(pipelinePromoter).promote(any(ScoutResult.class), note.capture());
    assertThat(note.getValue()).isEqualTo(
        "Auto-discovered by Job Scout (run " + RUN_ID + "). Fit score: 8/10.");
    verify(scoutResultRepository, times(4)).save(any(ScoutResult.class));
  }

  @Test
  void loadExisting_shouldMergeScoutResultsAndPipeline() {
    when(scoutResultRepository.findSourceUrlsByUserId("u1")).thenReturn(Set.of("https://a"));
    when(pipelineJobRepository.findJdUrlsByUserId("u1")).thenReturn(Set.of("https://b"));
    when(scoutResultRepository.findTitleCompanyPairsByUserId("u1"))
        .thenReturn(List.<Object[]>of(new Object[] {"Head of Growth", "Cred"}));
    when(pipelineJobRepository.findTitleCompanyPairsByUserId("u1"))
        .thenReturn(List.<Object[]>of(new Object[] {"VP Marketing", "Zepto"}));
    when(scoutResultRepository.findSourceKeysByUserId("u1")).thenReturn(Set.of("adzuna:1"));
    when(scoutResultRepository.findDedupHashesByUserId("u1")).thenReturn(Set.of("abc"));

    ExistingPostings existing = runStore.loadExisting("u1");

    assertThat(existing.urls()).containsExactlyInAnyOrder("https://a", "https://b");
    assertThat(existing.titleCompanies()).containsExactly(
        new ExistingPostings.TitleCompany("Head of Growth", "Cred"),
        new ExistingPostings.TitleCompany("VP Marketing", "Zepto"));
    assertThat(existing.sourceKeys()).containsExactly("adzuna:1");
    assertThat(existing.fingerprints()).containsExactly("abc");
  }

  @Test
  void formatScore_shouldDropTrailingZero() {
    assertThat(ScoutRunStore.formatScore(7.0)).isEqualTo("7");
    assertThat(ScoutRunStore.formatScore(7.5)).isEqualTo("7.5");
  }
}
