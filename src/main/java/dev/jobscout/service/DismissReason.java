package dev.jobscout.service;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Dismiss reasons that feed preference learning. Free-text reasons outside this set are
 * stored on the match but do not change preferences.
 */
public enum DismissReason {
    WRONG_COMPANY("wrong_company"),
    SALARY_LOW("salary_low"),
    WRONG_LOCATION("wrong_location"),
    WRONG_ROLE("wrong_role");

    private final String code;

    DismissReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<DismissReason> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(reason -> reason.code.equals(normalized))
                .findFirst();
    }
}
