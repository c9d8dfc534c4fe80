package dev.jobscout.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Writes run summaries to the application log. Default channel.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "scout.notify.channel", havingValue = "log", matchIfMissing = true)
public class LoggingScoutNotifier implements ScoutNotifier {

    @Override
    public Mono<Boolean> notify(String recipient, ScoutNotification notification) {
        return Mono.fromCallable(() -> {
            log.info("[{}] {}\n{}", recipient != null ? recipient : "owner", notification.subject(),
                    notification.text());
            return true;
        });
    }
}
