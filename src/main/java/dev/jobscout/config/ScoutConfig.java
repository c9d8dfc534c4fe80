package dev.jobscout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Run-level settings: owner, fallback search targets, notifications and scheduling.
 * Loaded from application.yml under 'scout' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scout")
public class ScoutConfig {

    private String ownerUserId;

    // Used for on-demand queries when the user's profile has none
    private List<String> defaultTargetRoles = new ArrayList<>(List.of(
            "Head of Growth", "VP Growth", "Director Growth Marketing",
            "Head of Marketing", "Growth Lead"));
    private List<String> defaultTargetLocations = new ArrayList<>(List.of("Bangalore", "Remote"));

    private int maxQueryRoles = 5;

    private boolean dryRun = false;

    private int metricsWaitSeconds = 0;

    private Notify notify = new Notify();
    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Notify {
        private String channel = "log";
        private String recipient;
        private String from;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = false;
        private String zone = "UTC";
        private String poolCron = "0 30 2,12 * * *";
        private String ownerCron = "0 0 3 * * *";
    }
}
