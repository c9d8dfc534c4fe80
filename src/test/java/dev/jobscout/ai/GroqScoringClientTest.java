package dev.jobscout.ai;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class GroqScoringClientTest {

  private MockWebServer mockWebServer;
  private GroqScoringClient client;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    String baseUrl = mockWebServer.url("/").toString().replaceAll("/$", "");
    client = new GroqScoringClient("gsk-test", "llama-3.3-70b-versatile", baseUrl);
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void complete_shouldReturnFirstChoice() throws InterruptedException {
    mockWebServer.enqueue(new MockResponse()
        .setBody("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"[]\"}}],\"usage\":{}}")
        .setHeader("Content-Type", "application/json"));

    StepVerifier.create(client.complete("score these"))
        .expectNext("[]")
        .verifyComplete();

    RecordedRequest request = mockWebServer.takeRequest();
    assertThat(request.getPath()).isEqualTo("/chat/completions");
    assertThat(request.getHeader("Authorization")).isEqualTo("Bearer gsk-test");
    assertThat(request.getBody().readUtf8())
        .contains("\"model\":\"llama-3.3-70b-versatile\"")
        .contains("\"max_tokens\":1500");
  }

  @Test
  void complete_shouldCompleteEmptyOnClientError() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"invalid key\"}"));

    StepVerifier.create(client.complete("score these"))
        .verifyComplete();
  }

  @Test
  void complete_shouldStopAfterThreeAttempts() {
    for (int i = 0; i < 4; i++) {
      mockWebServer.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));
    }

    StepVerifier.create(client.complete("score these"))
        .verifyComplete();
    assertThat(mockWebServer.getRequestCount()).isEqualTo(ScoringClient.MAX_ATTEMPTS);
  }

  @Test
  void complete_shouldSkipCallWithoutKey() {
    GroqScoringClient disabled = new GroqScoringClient("", "m", mockWebServer.url("/").toString());

    assertThat(disabled.isEnabled()).isFalse();
    StepVerifier.create(disabled.complete("score these")).verifyComplete();
    assertThat(mockWebServer.getRequestCount()).isZero();
  }
}
