package dev.jobscout.ai;

/**
 * One scored item as returned by the model. {@code index} is 1-based within its batch.
 */
public record ItemScore(int index, double fitScore, boolean b2cValidated, String reasoning) {
}
