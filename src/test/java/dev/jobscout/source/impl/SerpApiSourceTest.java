package dev.jobscout.source.impl;

import dev.jobscout.config.SourcesConfig;
import dev.jobscout.metrics.ScoutMetrics;
import dev.jobscout.model.PostingCandidate;
import dev.jobscout.source.SearchQuery;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class SerpApiSourceTest {

  private static final SearchQuery QUERY = new SearchQuery("Head of Growth", "Bangalore");

  private MockWebServer mockWebServer;
  private SourcesConfig sourcesConfig;
  private SerpApiSource serpApiSource;

  @Mock
  private ScoutMetrics metrics;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();

    sourcesConfig = new SourcesConfig();
    sourcesConfig.setRequestDelay(Duration.ZERO);
    sourcesConfig.setRequestTimeout(Duration.ofSeconds(5));
    sourcesConfig.getSerpapi().setBaseUrl(mockWebServer.url("/").toString().replaceAll("/$", ""));
    sourcesConfig.getSerpapi().setApiKey("serp-key");

    serpApiSource = new SerpApiSource(WebClient.builder(), metrics, sourcesConfig);
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  private static String page(String nextToken, String... titles) {
    StringBuilder jobs = new StringBuilder();
    for (int i = 0; i < titles.length; i++) {
      if (i > 0) {
        jobs.append(',');
      }
      jobs.append("""
          { "title": "%s", "company_name": "Cred", "location": "Bangalore", "job_id": "%s",
            "share_link": "https://g.co/jobs/%s" }
          """.formatted(titles[i], titles[i].hashCode(), i));
    }
    String pagination = nextToken == null ? ""
        : ", \"serpapi_pagination\": { \"next_page_token\": \"" + nextToken + "\" }";
    return "{ \"jobs_results\": [" + jobs + "]" + pagination + " }";
  }

  private void enqueueJson(String body) {
    mockWebServer.enqueue(new MockResponse().setBody(body).addHeader("Content-Type", "application/json"));
  }

  @Test
  void shouldFollowNextPageTokenUntilExhausted() throws InterruptedException {
    enqueueJson(page("tok-2", "Head of Growth", "VP Growth"));
    enqueueJson(page(null, "Growth Lead"));

    List<PostingCandidate> postings = serpApiSource.fetch(List.of(QUERY)).collectList().block();

    assertThat(postings).extracting(PostingCandidate::getTitle)
        .containsExactly("Head of Growth", "VP Growth", "Growth Lead");

    RecordedRequest first = mockWebServer.takeRequest();
    assertThat(first.getRequestUrl().queryParameter("next_page_token")).isNull();
    assertThat(first.getRequestUrl().queryParameter("engine")).isEqualTo("google_jobs");
    assertThat(first.getRequestUrl().queryParameter("api_key")).isEqualTo("serp-key");
    RecordedRequest second = mockWebServer.takeRequest();
    assertThat(second.getRequestUrl().queryParameter("next_page_token")).isEqualTo("tok-2");
  }

  @Test
  void shouldStopPagingOnceEnoughCollected() {
    sourcesConfig.setResultsPerQuery(2);
    enqueueJson(page("tok-2", "Head of Growth", "VP Growth", "Growth Lead"));

    List<PostingCandidate> postings = serpApiSource.fetch(List.of(QUERY)).collectList().block();

    assertThat(postings).hasSize(2);
    assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
  }

  @Test
  void shouldKeepCollectedPagesWhenFollowUpFails() {
    enqueueJson(page("tok-2", "Head of Growth", "VP Growth"));
    mockWebServer.enqueue(new MockResponse().setResponseCode(500));

    List<PostingCandidate> postings = serpApiSource.fetch(List.of(QUERY)).collectList().block();

    assertThat(postings).hasSize(2);
  }

  @Test
  void shouldReturnNothingOnApiError() {
    enqueueJson("{ \"error\": \"Invalid API key\" }");

    List<PostingCandidate> postings = serpApiSource.fetch(List.of(QUERY)).collectList().block();

    assertThat(postings).isEmpty();
  }

  @Test
  void mapToPosting_shouldPreferApplyOptionAndParseSalary() {
    SerpApiSource.SerpApiJob job = new SerpApiSource.SerpApiJob();
    job.setTitle("Director Marketing");
    job.setCompanyName("Zepto");
    job.setJobId("abc");
    job.setLink("https://fallback.example/abc");
    SerpApiSource.ApplyOption option = new SerpApiSource.ApplyOption();
    option.setLink("https://apply.example/abc");
    job.setApplyOptions(List.of(option));
    SerpApiSource.DetectedExtensions extensions = new SerpApiSource.DetectedExtensions();
    extensions.setPostedAt("3 days ago");
    extensions.setSalary("₹50–70 Lakh a year");
    job.setDetectedExtensions(extensions);

    Instant now = Instant.parse("2025-03-10T00:00:00Z");
    PostingCandidate posting = serpApiSource.mapToPosting(job, QUERY, now);

    assertThat(posting.getApplyUrl()).isEqualTo("https://apply.example/abc");
    assertThat(posting.getSourceUrl()).isEqualTo("https://apply.example/abc");
    assertThat(posting.getSalaryMin()).isEqualTo(5_000_000L);
    assertThat(posting.getSalaryMax()).isEqualTo(7_000_000L);
    assertThat(posting.getPostedDate()).isEqualTo(LocalDate.of(2025, 3, 7));
    assertThat(posting.getLocation()).isNull();
  }

  @Test
  void mapToPosting_shouldFallBackToDescriptionSalaryRange() {
    SerpApiSource.SerpApiJob job = new SerpApiSource.SerpApiJob();
    job.setTitle("Head of Growth");
    job.setCompanyName("Slice");
    job.setShareLink("https://g.co/jobs/1");
    job.setDescription("Compensation band 40-55 LPA plus ESOPs.");

    PostingCandidate posting = serpApiSource.mapToPosting(job, QUERY, Instant.now());

    assertThat(posting.getSalaryMin()).isEqualTo(4_000_000L);
    assertThat(posting.getSalaryMax()).isEqualTo(5_500_000L);
  }

  @Test
  void mapToPosting_shouldSkipWithoutCompany() {
    SerpApiSource.SerpApiJob job = new SerpApiSource.SerpApiJob();
    job.setTitle("Head of Growth");
    job.setShareLink("https://g.co/jobs/1");

    assertThat(serpApiSource.mapToPosting(job, QUERY, Instant.now())).isNull();
  }
}
