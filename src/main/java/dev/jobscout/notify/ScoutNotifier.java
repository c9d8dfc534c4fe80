package dev.jobscout.notify;

import reactor.core.publisher.Mono;

/**
 * Delivery channel for run summaries. Delivery is fire-and-forget from the run's
 * point of view: a failure is reported, never rolled back into persisted results.
 */
public interface ScoutNotifier {

    /**
     * Deliver a summary.
     *
     * @param recipient    channel-specific address; may be null when the channel has a default
     * @param notification what to send
     * @return Mono<Boolean> indicating success or failure
     */
    Mono<Boolean> notify(String recipient, ScoutNotification notification);
}
