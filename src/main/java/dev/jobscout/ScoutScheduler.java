package dev.jobscout;

import dev.jobscout.config.ScoutConfig;
import dev.jobscout.service.ScoutService;
import dev.jobscout.service.SharedPoolScoutService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * The fixed schedule: shared-pool refresh twice a day and the owner's on-demand run once a day.
 * Crons and zone come from {@code scout.scheduler.*}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scout.scheduler.enabled", havingValue = "true")
public class ScoutScheduler {

    private final SharedPoolScoutService sharedPoolScoutService;
    private final ScoutService scoutService;
    private final ScoutConfig scoutConfig;

    @Scheduled(cron = "${scout.scheduler.pool-cron:0 30 2,12 * * *}", zone = "${scout.scheduler.zone:UTC}")
    public void runSharedPool() {
        try {
            sharedPoolScoutService.runPool().block();
        } catch (Exception e) {
            log.error("Scheduled pool run failed", e);
        }
    }

    @Scheduled(cron = "${scout.scheduler.owner-cron:0 0 3 * * *}", zone = "${scout.scheduler.zone:UTC}")
    public void runOwnerScout() {
        String owner = scoutConfig.getOwnerUserId();
        if (owner == null || owner.isBlank()) {
            log.debug("No owner user configured, skipping scheduled on-demand run");
            return;
        }
        try {
            scoutService.runForUser(owner).block();
        } catch (Exception e) {
            log.error("Scheduled scout run for {} failed", owner, e);
        }
    }
}
