package dev.jobscout;

import java.util.Arrays;
import java.util.Optional;

/**
 * A one-shot run requested on the command line: {@code --run=pool} or {@code --run=user:<userId>}.
 */
public record RunTrigger(Type type, String userId) {

    static final String ARG_PREFIX = "--run=";
    private static final String USER_PREFIX = "user:";

    public enum Type {
        POOL,
        USER
    }

    public static RunTrigger pool() {
        return new RunTrigger(Type.POOL, null);
    }

    public static RunTrigger user(String userId) {
        return new RunTrigger(Type.USER, userId);
    }

    /**
     * Read the trigger from application arguments.
     *
     * @return the trigger, or empty when no {@code --run} argument is present
     * @throws IllegalArgumentException when the {@code --run} value is not understood
     */
    public static Optional<RunTrigger> fromArgs(String... args) {
        if (args == null) {
            return Optional.empty();
        }
        Optional<String> value = Arrays.stream(args)
                .filter(arg -> arg != null && arg.startsWith(ARG_PREFIX))
                .map(arg -> arg.substring(ARG_PREFIX.length()).trim())
                .findFirst();
        if (value.isEmpty()) {
            return Optional.empty();
        }

        String run = value.get();
        if (run.equalsIgnoreCase("pool")) {
            return Optional.of(pool());
        }
        if (run.startsWith(USER_PREFIX) && !run.substring(USER_PREFIX.length()).isBlank()) {
            return Optional.of(user(run.substring(USER_PREFIX.length()).trim()));
        }
        throw new IllegalArgumentException("Unknown run trigger '" + run + "', expected 'pool' or 'user:<userId>'");
    }

    @Override
    public String toString() {
        return type == Type.POOL ? "pool" : "user:" + userId;
    }
}
