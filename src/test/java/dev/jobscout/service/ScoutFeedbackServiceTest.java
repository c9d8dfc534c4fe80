package dev.jobscout.service;

import dev.jobscout.entity.PipelineJob;
import dev.jobscout.entity.ScoutResult;
import dev.jobscout.entity.ScoutResultStatus;
import dev.jobscout.entity.ScoutedJob;
import dev.jobscout.entity.UserScoutedJob;
import dev.jobscout.entity.UserScoutedJobStatus;
import dev.jobscout.repository.ScoutResultRepository;
import dev.jobscout.repository.UserScoutedJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScoutFeedbackServiceTest {

  private static final Instant NOW = Instant.parse("2025-03-10T08:00:00Z");

  @Mock
  private UserScoutedJobRepository userScoutedJobRepository;

  @Mock
  private ScoutResultRepository scoutResultRepository;

  @Mock
  private PreferenceLearningService learningService;

  @Mock
  private PipelinePromoter pipelinePromoter;

  private ScoutFeedbackService feedbackService;
  private ScoutedJob scoutedJob;
  private UserScoutedJob match;

  @BeforeEach
  void setUp() {
    feedbackService = new ScoutFeedbackService(userScoutedJobRepository, scoutResultRepository,
        learningService, pipelinePromoter, Clock.fixed(NOW, ZoneOffset.UTC));
    scoutedJob = ScoutedJob.builder().id(10L).title("VP Growth").companyName("Zepto").build();
    match = UserScoutedJob.builder().id(5L).userId("u1").scoutedJob(scoutedJob).relevanceScore(72).build();
  }

  @Test
  void markViewed_shouldStampStatus() {
    when(userScoutedJobRepository.findByIdAndUserId(5L, "u1")).thenReturn(Optional.of(match));
    when(userScoutedJobRepository.save(match)).thenReturn(match);

    UserScoutedJob viewed = feedbackService.markViewed("u1", 5L);

    assertThat(viewed.getStatus()).isEqualTo(UserScoutedJobStatus.VIEWED);
    assertThat(viewed.getViewedAt()).isEqualTo(NOW);
  }

  @Test
  void markSaved_shouldStampStatus() {
    when(userScoutedJobRepository.findByIdAndUserId(5L, "u1")).thenReturn(Optional.of(match));
    when(userScoutedJobRepository.save(match)).thenReturn(match);

    UserScoutedJob saved = feedbackService.markSaved("u1", 5L);

    assertThat(saved.getStatus()).isEqualTo(UserScoutedJobStatus.SAVED);
    assertThat(saved.getSavedAt()).isEqualTo(NOW);
  }

  @Test
  void dismiss_shouldFlushBeforeLearning() {
    when(userScoutedJobRepository.findByIdAndUserId(5L, "u1")).thenReturn(Optional.of(match));
    when(userScoutedJobRepository.saveAndFlush(match)).thenReturn(match);

    UserScoutedJob dismissed = feedbackService.dismiss("u1", 5L, "wrong_company");

    assertThat(dismissed.getStatus()).isEqualTo(UserScoutedJobStatus.DISMISSED);
    assertThat(dismissed.getDismissReason()).isEqualTo("wrong_company");
    assertThat(dismissed.getDismissedAt()).isEqualTo(NOW);

    InOrder order = inOrder(userScoutedJobRepository, learningService);
    order.verify(userScoutedJobRepository).saveAndFlush(match);
    order.verify(learningService).learnFromDismiss("u1", "wrong_company", scoutedJob);
  }

  @Test
  void dismiss_withoutReasonShouldSkipLearning() {
    when(userScoutedJobRepository.findByIdAndUserId(5L, "u1")).thenReturn(Optional.of(match));
    when(userScoutedJobRepository.saveAndFlush(match)).thenReturn(match);

    feedbackService.dismiss("u1", 5L, null);

    verify(learningService, never()).learnFromDismiss(anyString(), any(), any());
  }

  @Test
  void shouldRejectMatchOfAnotherUser() {
    when(userScoutedJobRepository.findByIdAndUserId(5L, "intruder")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> feedbackService.markViewed("intruder", 5L))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("not found");
  }

  @Test
  void addToPipeline_shouldLinkMatchOnce() {
    PipelineJob pipelineJob = PipelineJob.builder().id(77L).build();
    when(userScoutedJobRepository.findByIdAndUserId(5L, "u1")).thenReturn(Optional.of(match));
    when(pipelinePromoter.promote(match)).thenReturn(pipelineJob);

    PipelineJob created = feedbackService.addToPipeline("u1", 5L);

    assertThat(created.getId()).isEqualTo(77L);
    assertThat(match.getPipelineJobId()).isEqualTo(77L);
    assertThat(match.getAddedToPipelineAt()).isEqualTo(NOW);

    assertThatThrownBy(() -> feedbackService.addToPipeline("u1", 5L))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("already in the pipeline");
  }

  @Test
  void promoteResult_shouldMarkPromoted() {
    ScoutResult result = ScoutResult.builder().id(3L).userId("u1").fitScore(6.0).build();
    when(scoutResultRepository.findByIdAndUserId(3L, "u1")).thenReturn(Optional.of(result));
    when(pipelinePromoter.promote(eq(result), anyString())).thenReturn(PipelineJob.builder().id(9L).build());

    feedbackService.promoteResult("u1", 3L);

    assertThat(result.getStatus()).isEqualTo(ScoutResultStatus.PROMOTED);
    assertThat(result.getPromotedJobId()).isEqualTo(9L);
    verify(pipelinePromoter).promote(result, "Promoted from Job Scout review. Fit score: 6.0/10.");
  }

  @Test
  void dismissResult_shouldMarkDismissed() {
    ScoutResult result = ScoutResult.builder().id(3L).userId("u1").build();
    when(scoutResultRepository.findByIdAndUserId(3L, "u1")).thenReturn(Optional.of(result));
    when(scoutResultRepository.save(result)).thenReturn(result);

    assertThat(feedbackService.dismissResult("u1", 3L).getStatus()).isEqualTo(ScoutResultStatus.DISMISSED);
  }
}
