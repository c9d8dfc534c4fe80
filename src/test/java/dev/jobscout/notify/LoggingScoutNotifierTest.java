package dev.jobscout.notify;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingScoutNotifierTest {

    private final LoggingScoutNotifier notifier = new LoggingScoutNotifier();

    @Test
    void shouldAlwaysReportDelivery() {
        ScoutNotification notification = new ScoutNotification("scout_1", "Job Scout (scout_1)",
                "No strong matches this run. 2 jobs saved for review, 4 dismissed.", null);

        StepVerifier.create(notifier.notify(null, notification))
                .expectNext(true)
                .verifyComplete();
        StepVerifier.create(notifier.notify("me@example.com", notification))
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    void notification_shouldDefaultHighlights() {
        ScoutNotification notification = new ScoutNotification("scout_1", "s", "t", null);

        assertThat(notification.highlights()).isEqualTo(List.of());
    }
}
