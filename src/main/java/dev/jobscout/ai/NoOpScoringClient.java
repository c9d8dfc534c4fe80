package dev.jobscout.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * No-op ScoringClient, used when no AI provider is configured.
 * Every batch it sees degrades to score 0.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "none", matchIfMissing = true)
public class NoOpScoringClient implements ScoringClient {

    public NoOpScoringClient() {
        log.info("AI scoring disabled - using no-op scoring client");
    }

    @Override
    public Mono<String> complete(String prompt) {
        return Mono.empty();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public String getName() {
        return "none";
    }
}
