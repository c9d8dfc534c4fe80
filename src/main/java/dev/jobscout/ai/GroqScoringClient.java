package dev.jobscout.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;

/**
 * ScoringClient backed by the Groq Cloud chat completions API (OpenAI-compatible).
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "groq")
public class GroqScoringClient implements ScoringClient {

  private static final String CHAT_PATH = "/chat/completions";

  private final WebClient webClient;
  private final String apiKey;
  private final String model;

  public GroqScoringClient(
      @Value("${app.ai.groq.api-key:}") String apiKey,
      @Value("${app.ai.groq.model:llama-3.3-70b-versatile}") String model,
      @Value("${app.ai.groq.base-url:https://api.groq.com/openai/v1}") String baseUrl) {

    this.apiKey = apiKey;
    this.model = model;
    this.webClient = WebClient.builder()
        .baseUrl(baseUrl)
        .defaultHeader("Authorization", "Bearer " + apiKey)
        .defaultHeader("Content-Type", "application/json")
        .build();

    if (apiKey == null || apiKey.isBlank()) {
      log.warn("Groq API Key is missing! Every scoring batch will degrade to score 0.");
    } else {
      log.info("Groq scoring enabled with model: {}", this.model);
    }
  }

  @Override
  public Mono<String> complete(String prompt) {
    if (!isEnabled()) {
      return Mono.empty();
    }

    GroqRequest request = new GroqRequest(model, List.of(new GroqRequest.Message("user", prompt)), 0.2, 1500);

    return webClient.post()
        .uri(CHAT_PATH)
        .bodyValue(request)
        .retrieve()
        .bodyToMono(GroqResponse.class)
        .timeout(Duration.ofSeconds(60))
        .retryWhen(Retry.backoff(MAX_ATTEMPTS - 1, Duration.ofSeconds(2)).filter(this::isRetryableError))
        .mapNotNull(this::extractContent)
        .onErrorResume(e -> {
          log.warn("Groq scoring call failed permanently: {}", e.getMessage());
          return Mono.empty();
        });
  }

  @Override
  public boolean isEnabled() {
    return apiKey != null && !apiKey.isBlank();
  }

  @Override
  public String getName() {
    return "groq";
  }

  private String extractContent(GroqResponse response) {
    if (response != null && response.choices() != null && !response.choices().isEmpty()
        && response.choices().get(0).message() != null) {
      return response.choices().get(0).message().content();
    }
    return null;
  }

  private boolean isRetryableError(Throwable e) {
    if (e instanceof WebClientResponseException wcre) {
      int status = wcre.getStatusCode().value();
      return status == 429 || status == 500 || status == 503;
    }
    return false;
  }

  // DTOs
  record GroqRequest(String model, List<Message> messages, double temperature, int max_tokens) {
    record Message(String role, String content) {
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record GroqResponse(List<Choice> choices) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(Message message) {
      @JsonIgnoreProperties(ignoreUnknown = true)
      record Message(String content) {
      }
    }
  }
}
