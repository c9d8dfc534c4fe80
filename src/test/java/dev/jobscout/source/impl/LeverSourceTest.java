package dev.jobscout.source.impl;

import dev.jobscout.config.SourcesConfig;
import dev.jobscout.metrics.ScoutMetrics;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class LeverSourceTest {

  private MockWebServer mockWebServer;
  private SourcesConfig sourcesConfig;
  private LeverSource leverSource;

  @Mock
  private ScoutMetrics metrics;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();

    sourcesConfig = new SourcesConfig();
    sourcesConfig.setRequestDelay(Duration.ZERO);
    sourcesConfig.setRequestTimeout(Duration.ofSeconds(5));
    sourcesConfig.getLever().setBaseUrl(mockWebServer.url("/").toString().replaceAll("/$", ""));
    sourcesConfig.getLever().getBoards().put("cred", "cred");
    sourcesConfig.getDisplayNames().put("cred", "CRED");

    leverSource = new LeverSource(WebClient.builder(), metrics, sourcesConfig);
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void shouldFetchAndMapJobsCorrectly() throws InterruptedException {
    String jsonResponse = """
        [
          {
            "id": "lever-1",
            "text": "VP Growth",
            "hostedUrl": "https://jobs.lever.co/cred/lever-1",
            "applyUrl": "https://jobs.lever.co/cred/lever-1/apply",
            "descriptionPlain": "Scale member acquisition.",
            "createdAt": 1740787200000,
            "categories": {
              "allLocations": ["Bangalore", "Mumbai"],
              "team": "Growth"
            }
          },
          {
            "id": "lever-2",
            "text": "No URL"
          }
        ]
        """;
    mockWebServer.enqueue(new MockResponse()
        .setBody(jsonResponse)
        .addHeader("Content-Type", "application/json"));

    StepVerifier.create(leverSource.fetch(List.of()))
        .assertNext(posting -> {
          assertThat(posting.getTitle()).isEqualTo("VP Growth");
          assertThat(posting.getCompanyName()).isEqualTo("CRED");
          assertThat(posting.getLocation()).isEqualTo("Bangalore, Mumbai");
          assertThat(posting.getCity()).isEqualTo("Bangalore");
          assertThat(posting.getDescription()).isEqualTo("Scale member acquisition.");
          assertThat(posting.getApplyUrl()).isEqualTo("https://jobs.lever.co/cred/lever-1/apply");
          assertThat(posting.getPostedDate()).isEqualTo(LocalDate.of(2025, 3, 1));
          assertThat(posting.getCategoryLabel()).isEqualTo("Growth");
          assertThat(posting.getSource()).isEqualTo("lever");
        })
        .verifyComplete();

    assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/v0/postings/cred?mode=json");
  }

  @Test
  void shouldStripHtmlDescriptionWhenPlainMissing() {
    mockWebServer.enqueue(new MockResponse()
        .setBody("""
            [ { "id": "x", "text": "Head of Marketing", "hostedUrl": "https://jobs.lever.co/cred/x",
                "description": "<div>Build the <i>brand</i>.</div>",
                "categories": { "location": "Remote" } } ]
            """)
        .addHeader("Content-Type", "application/json"));

    StepVerifier.create(leverSource.fetch(List.of()))
        .assertNext(posting -> {
          assertThat(posting.getDescription()).isEqualTo("Build the brand.");
          assertThat(posting.getLocation()).isEqualTo("Remote");
          assertThat(posting.getApplyUrl()).isEqualTo("https://jobs.lever.co/cred/x");
        })
        .verifyComplete();
  }

  @Test
  void resolveLocation_shouldHandleMissingCategories() {
    assertThat(LeverSource.resolveLocation(null)).isNull();
    assertThat(LeverSource.resolveLocation(new LeverSource.LeverCategories())).isNull();
  }
}
