package dev.jobscout.model;

/**
 * Salary bounds parsed from free text, in INR.
 */
public record SalaryRange(Long min, Long max, boolean estimated) {

    public static SalaryRange none() {
        return new SalaryRange(null, null, false);
    }

    public boolean isEmpty() {
        return min == null && max == null;
    }
}
