package dev.jobscout.entity;

/**
 * One learned score adjustment. {@code points} is a magnitude; whether it raises or lowers
 * the score depends on the list it is stored in (boosts or penalties).
 */
public record LearnedAdjustment(Kind kind, String key, int points) {

    public enum Kind {
        /** Keyed by company directory id. */
        COMPANY,
        /** Keyed by company name, compared after normalization. */
        COMPANY_NAME,
        /** Keyed by a word matched as a substring of the normalized title. */
        TITLE_WORD
    }

    public LearnedAdjustment plus(int delta) {
        return new LearnedAdjustment(kind, key, points + delta);
    }
}
