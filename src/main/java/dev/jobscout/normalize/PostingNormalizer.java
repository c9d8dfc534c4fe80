package dev.jobscout.normalize;

import dev.jobscout.model.PostingCandidate;
import dev.jobscout.model.SalaryRange;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure normalization helpers shared by every source adapter.
 * The fingerprint computed here is the dedup join key across sources and runs.
 */
public final class PostingNormalizer {

    private static final List<Pattern> COMPANY_SUFFIXES = List.of(
            Pattern.compile("\\s+india\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+pvt\\.?\\s*ltd\\.?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+private\\s+limited", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+technologies\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+tech\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+limited\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+ltd\\.?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+inc\\.?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+llc\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+corp\\.?", Pattern.CASE_INSENSITIVE));

    private static final Map<Pattern, String> TITLE_ABBREVIATIONS = new LinkedHashMap<>();

    static {
        TITLE_ABBREVIATIONS.put(Pattern.compile("\\bvice president\\b"), "vp");
        TITLE_ABBREVIATIONS.put(Pattern.compile("\\bsenior\\b"), "sr");
        TITLE_ABBREVIATIONS.put(Pattern.compile("\\bassistant\\b"), "asst");
        TITLE_ABBREVIATIONS.put(Pattern.compile("\\bassociate\\b"), "assoc");
        TITLE_ABBREVIATIONS.put(Pattern.compile("\\bdirector\\b"), "dir");
        TITLE_ABBREVIATIONS.put(Pattern.compile("\\bmanager\\b"), "mgr");
    }

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}_\\s]");

    private static final Pattern ISO_DATE_PREFIX = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern DAYS_AGO = Pattern.compile("(\\d+)\\s*days?\\s*ago");
    private static final Pattern WEEKS_AGO = Pattern.compile("(\\d+)\\s*weeks?\\s*ago");
    private static final Pattern MONTHS_AGO = Pattern.compile("(\\d+)\\s*months?\\s*ago");

    private static final Pattern HEDGING = Pattern.compile(
            "estimated|approx\\.?|approximately|~|up to", Pattern.CASE_INSENSITIVE);
    private static final Pattern LAKH_RANGE = Pattern.compile(
            "(?:₹|Rs\\.?|INR)?\\s*([\\d.]+)\\s*(?:lakh|lpa|lac)?\\s*(?:-|–|—|to)\\s*([\\d.]+)\\s*(?:lakh|lpa|lac)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern LAKH_SINGLE = Pattern.compile(
            "(?:₹|Rs\\.?|INR)?\\s*([\\d.]+)\\s*(?:lakh|lpa|lac)",
            Pattern.CASE_INSENSITIVE);

    private static final long LAKH = 100_000L;

    private PostingNormalizer() {
    }

    /**
     * Lowercase and strip legal-entity suffixes ("India", "Pvt Ltd", "Technologies", "Inc", ...).
     */
    public static String normalizeCompany(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String s = name.toLowerCase(Locale.ROOT).trim();
        for (Pattern suffix : COMPANY_SUFFIXES) {
            s = suffix.matcher(s).replaceAll("");
        }
        return collapse(s);
    }

    /**
     * Lowercase, drop punctuation and abbreviate common title terms ("vice president" -> "vp", "senior" -> "sr").
     */
    public static String normalizeTitle(String title) {
        if (title == null || title.isBlank()) {
            return "";
        }
        String s = PUNCTUATION.matcher(title.toLowerCase(Locale.ROOT)).replaceAll(" ");
        for (Map.Entry<Pattern, String> abbreviation : TITLE_ABBREVIATIONS.entrySet()) {
            s = abbreviation.getKey().matcher(s).replaceAll(abbreviation.getValue());
        }
        return collapse(s);
    }

    /**
     * Lowercase, replace punctuation with spaces and collapse whitespace.
     */
    public static String normalizeForMatching(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String s = PUNCTUATION.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return collapse(s);
    }

    /**
     * First comma-delimited segment of a location, or null when there is none.
     */
    public static String extractCity(String location) {
        if (location == null || location.isBlank()) {
            return null;
        }
        String city = location.split(",", -1)[0].trim();
        return city.isEmpty() ? null : city;
    }

    /**
     * SHA-256 over {@code normalizedCompany|normalizedTitle|lowercaseCity}.
     */
    public static String dedupFingerprint(String company, String title, String location) {
        String city = extractCity(location);
        String payload = normalizeCompany(company) + "|" + normalizeTitle(title) + "|"
                + (city == null ? "" : city.toLowerCase(Locale.ROOT).trim());
        return sha256Hex(payload);
    }

    public static Instant parseRelativeDate(String text) {
        return parseRelativeDate(text, Instant.now());
    }

    /**
     * Maps "X days/weeks/months ago", "yesterday", "today", "just posted", "last week/month"
     * to an instant relative to {@code now}. Unrecognized text gives null.
     */
    public static Instant parseRelativeDate(String text, Instant now) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String s = text.toLowerCase(Locale.ROOT).trim();

        Matcher m = DAYS_AGO.matcher(s);
        if (m.find()) {
            return now.minus(Long.parseLong(m.group(1)), ChronoUnit.DAYS);
        }
        m = WEEKS_AGO.matcher(s);
        if (m.find()) {
            return now.minus(Long.parseLong(m.group(1)) * 7, ChronoUnit.DAYS);
        }
        m = MONTHS_AGO.matcher(s);
        if (m.find()) {
            return now.minus(Long.parseLong(m.group(1)) * 30, ChronoUnit.DAYS);
        }
        if (s.contains("yesterday")) {
            return now.minus(1, ChronoUnit.DAYS);
        }
        if (s.contains("today") || s.contains("just posted")) {
            return now;
        }
        if (s.contains("last week")) {
            return now.minus(7, ChronoUnit.DAYS);
        }
        if (s.contains("last month")) {
            return now.minus(30, ChronoUnit.DAYS);
        }
        return null;
    }

    /**
     * Posted date from either an ISO-8601 value (date part taken as is) or relative text.
     */
    public static LocalDate parsePostedDate(String text, Instant now) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String s = text.trim();
        if (ISO_DATE_PREFIX.matcher(s).lookingAt()) {
            try {
                return LocalDate.parse(s.substring(0, 10));
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        Instant relative = parseRelativeDate(s, now);
        return relative == null ? null : relative.atOffset(ZoneOffset.UTC).toLocalDate();
    }

    /**
     * Extracts (min, max) in INR from "₹X–Y Lakh", "X-Y LPA", "X Lakh" style text.
     */
    public static SalaryRange parseSalary(String text) {
        if (text == null || text.isBlank()) {
            return SalaryRange.none();
        }
        boolean estimated = HEDGING.matcher(text).find();

        Matcher range = LAKH_RANGE.matcher(text);
        if (range.find()) {
            Long min = lakhsToRupees(range.group(1));
            Long max = lakhsToRupees(range.group(2));
            if (min != null && max != null) {
                return new SalaryRange(min, max, estimated);
            }
        }

        Matcher single = LAKH_SINGLE.matcher(text);
        if (single.find()) {
            Long value = lakhsToRupees(single.group(1));
            if (value != null) {
                return new SalaryRange(value, value, estimated);
            }
        }
        return SalaryRange.none();
    }

    /**
     * Range-only variant of {@link #parseSalary(String)} for salary figures buried in a description.
     */
    public static SalaryRange parseSalaryRange(String text) {
        if (text == null || text.isBlank()) {
            return SalaryRange.none();
        }
        Matcher range = LAKH_RANGE.matcher(text);
        if (range.find()) {
            Long min = lakhsToRupees(range.group(1));
            Long max = lakhsToRupees(range.group(2));
            if (min != null && max != null) {
                return new SalaryRange(min, max, false);
            }
        }
        return SalaryRange.none();
    }

    /**
     * Fills the derived fields (normalized company, city, fingerprint) of a mapped candidate.
     */
    public static PostingCandidate complete(PostingCandidate candidate) {
        candidate.setCompanyNameNormalized(normalizeCompany(candidate.getCompanyName()));
        candidate.setCity(extractCity(candidate.getLocation()));
        candidate.setFingerprint(dedupFingerprint(
                candidate.getCompanyName(), candidate.getTitle(), candidate.getLocation()));
        return candidate;
    }

    public static String truncate(String value, int maxLength) {
        if (value == null) {
            return null;
        }
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }

    private static Long lakhsToRupees(String number) {
        try {
            return Math.round(Double.parseDouble(number) * LAKH);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String collapse(String s) {
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder();
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
