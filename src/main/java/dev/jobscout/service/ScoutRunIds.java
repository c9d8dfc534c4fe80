package dev.jobscout.service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Run ids of the form {@code scout_yyyyMMdd_HHmmss_xxxxxx}, UTC.
 */
public final class ScoutRunIds {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
            .withZone(ZoneOffset.UTC);

    private ScoutRunIds() {
    }

    public static String next(Instant now) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 6);
        return "scout_" + STAMP.format(now) + "_" + suffix;
    }
}
