package io.procmon.core;

/**
 * Remaining trigger count of a monitor: a finite count or {@link #UNBOUNDED}.
 */
public record Repetitions(long count) {

    public static final Repetitions UNBOUNDED = new Repetitions(-1);

    public static final String UNBOUNDED_TEXT = "inf";

    public Repetitions {
        if (count < -1) {
            throw new IllegalArgumentException("repetitions must not be negative: " + count);
        }
    }

    public static Repetitions of(long count) {
        if (count <= 0) {
            throw new IllegalArgumentException("repetitions must be positive: " + count);
        }
        return new Repetitions(count);
    }

    /**
     * Parses a positive integer or "inf" (case-insensitive).
     */
    public static Repetitions parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("repetitions must not be blank");
        }
        String s = text.trim();
        if (UNBOUNDED_TEXT.equalsIgnoreCase(s)) {
            return UNBOUNDED;
        }
        if (!s.matches("^\\d+$")) {
            throw new IllegalArgumentException("Invalid repetitions (expected a positive integer or 'inf'): " + text);
        }
        try {
            return of(Long.parseLong(s));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("repetitions out of range: " + text);
        }
    }

    public boolean isUnbounded() {
        return count == -1;
    }

    public boolean isExhausted() {
        return count == 0;
    }

    /**
     * One trigger consumed. Unbounded stays unbounded; zero stays zero.
     */
    public Repetitions decrement() {
        if (isUnbounded() || count == 0) {
            return this;
        }
        return new Repetitions(count - 1);
    }

    @Override
    public String toString() {
        return isUnbounded() ? UNBOUNDED_TEXT : Long.toString(count);
    }
}
