package dev.jobscout.config;

import dev.jobscout.ExitManager;
import dev.jobscout.PipelineRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ConfigPropertiesTest {

  @MockitoBean
  private PipelineRunner pipelineRunner;

  @MockitoBean
  private ExitManager exitManager;

  @Autowired
  private SourcesConfig sourcesConfig;

  @Autowired
  private RulesConfig rulesConfig;

  @Autowired
  private ScoringConfig scoringConfig;

  @Autowired
  private ScoutConfig scoutConfig;

  @Test
  void shouldLoadSourcesConfig() {
    assertThat(sourcesConfig.getAdzuna().getAppId()).isEqualTo("test-app");
    assertThat(sourcesConfig.getAdzuna().getCountry()).isEqualTo("in");
    assertThat(sourcesConfig.getGreenhouse().getBoards())
        .containsEntry("testco", "testco")
        .containsEntry("urban-company", "urbancompany");
    assertThat(sourcesConfig.getRequestDelay()).isEqualTo(Duration.ZERO);
    assertThat(sourcesConfig.getQueryTemplates()).contains("Head of Growth {location}");
  }

  @Test
  void shouldLoadRulesConfig() {
    assertThat(rulesConfig.getSeniorityKeywords()).contains("head of", "vp");
    assertThat(rulesConfig.getDedupSimilarityThreshold()).isEqualTo(85);
  }

  @Test
  void shouldLoadScoringConfig() {
    assertThat(scoringConfig.getPromoteThreshold()).isEqualTo(7.0);
    assertThat(scoringConfig.getReviewThreshold()).isEqualTo(5.0);
    assertThat(scoringConfig.getStaleAfterDays()).isEqualTo(7);
    assertThat(scoringConfig.getLearning().getDismissThreshold()).isEqualTo(3);
  }

  @Test
  void shouldLoadScoutConfig() {
    assertThat(scoutConfig.getOwnerUserId()).isEqualTo("owner-1");
    assertThat(scoutConfig.isDryRun()).isTrue();
    assertThat(scoutConfig.getNotify().getChannel()).isEqualTo("log");
    assertThat(scoutConfig.getScheduler().isEnabled()).isFalse();
  }
}
