package dev.jobscout;

import dev.jobscout.service.PoolRunSummary;
import dev.jobscout.service.ScoutRunSummary;
import dev.jobscout.service.ScoutService;
import dev.jobscout.service.SharedPoolScoutService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Runs one triggered scout pipeline to completion and logs its summary.
 * Separated from the main Application class for better testability and SRP.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

  private static final String SEPARATOR = "========================================";

  private final ScoutService scoutService;
  private final SharedPoolScoutService sharedPoolScoutService;

  @Value("${scout.metrics-wait-seconds:0}")
  private int metricsWaitSeconds;

  /**
   * Executes the triggered pipeline and handles the post-execution wait.
   *
   * @return Number of postings promoted (user run) or matches created (pool run)
   */
  public int execute(RunTrigger trigger) {
    log.info(SEPARATOR);
    log.info("Job Scout Starting ({})", trigger);
    log.info(SEPARATOR);

    try {
      int count = switch (trigger.type()) {
        case POOL -> reportPool(sharedPoolScoutService.runPool().block());
        case USER -> reportUser(scoutService.runForUser(trigger.userId()).block());
      };

      handleMetricsWait();

      return count;
    } catch (Exception e) {
      log.error("Job Scout failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Pipeline execution failed", e);
    }
  }

  private int reportUser(ScoutRunSummary summary) {
    if (summary == null) {
      throw new IllegalStateException("Scout run produced no summary");
    }
    log.info(SEPARATOR);
    log.info("Scout run {} completed", summary.runId());
    log.info("Fetched: {} | Deduped: {} | Filtered: {} | Scored: {}", summary.totalFetched(),
        summary.afterDedup(), summary.afterPrefilter(), summary.aiScored());
    log.info("Promoted: {} | For review: {} | Dismissed: {}", summary.promoted(),
        summary.savedForReview(), summary.dismissed());
    summary.errors().forEach(error -> log.warn("  ! {}", error));
    log.info(SEPARATOR);
    return summary.promoted();
  }

  private int reportPool(PoolRunSummary summary) {
    if (summary == null) {
      throw new IllegalStateException("Pool run produced no summary");
    }
    log.info(SEPARATOR);
    log.info("Pool run {} completed", summary.runId());
    log.info("Fetched: {} | Unique: {} | Inserted: {} | Refreshed: {} | Retired: {}", summary.totalFetched(),
        summary.afterDedup(), summary.inserted(), summary.updated(), summary.markedStale());
    log.info("Users scored: {} | Matches created: {}", summary.usersScored(), summary.matchesCreated());
    summary.errors().forEach(error -> log.warn("  ! {}", error));
    log.info(SEPARATOR);
    return summary.matchesCreated();
  }

  private void handleMetricsWait() {
    if (metricsWaitSeconds > 0) {
      log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
      try {
        Thread.sleep(metricsWaitSeconds * 1000L);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        log.warn("Metrics wait interrupted");
      }
    }
  }
}
