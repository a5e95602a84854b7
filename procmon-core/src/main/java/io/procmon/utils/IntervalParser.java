package io.procmon.utils;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses monitor intervals into {@link Duration}.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Clock intervals: "hh:mm:ss" with optional milliseconds, e.g. "00:00:30", "01:02:03.250"</li>
 *   <li>Numeric seconds: "30"</li>
 *   <li>Compact intervals: "30s", "5m", "2h", "1d", "1w"</li>
 *   <li>Human-readable intervals: "5 minutes", "2 hours", "1 day 3 hours"</li>
 * </ul>
 */
public final class IntervalParser {

    private static final Pattern CLOCK = Pattern.compile("^(\\d+):([0-5]?\\d):([0-5]?\\d)(?:\\.(\\d{1,3}))?$");

    private IntervalParser() {
    }

    /**
     * Parse an interval spec. Zero is accepted; callers decide whether a zero interval is meaningful.
     */
    public static Duration parseInterval(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        Matcher clock = CLOCK.matcher(s);
        if (clock.matches()) {
            return parseClock(clock, spec);
        }
        return parseHumanDuration(s);
    }

    /**
     * Same as {@link #parseInterval(String)} but rejects zero.
     */
    public static Duration parsePositiveInterval(String spec) {
        Duration d = parseInterval(spec);
        if (d.isZero()) {
            throw new IllegalArgumentException("interval must be positive: " + spec);
        }
        return d;
    }

    /**
     * Formats as "hh:mm:ss", adding ".fff" only when there are milliseconds.
     */
    public static String format(Duration duration) {
        Objects.requireNonNull(duration, "duration must not be null");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative: " + duration);
        }
        long hours = duration.toHours();
        int minutes = duration.toMinutesPart();
        int seconds = duration.toSecondsPart();
        int millis = duration.toMillisPart();

        String base = String.format("%02d:%02d:%02d", hours, minutes, seconds);
        return millis == 0 ? base : base + String.format(".%03d", millis);
    }

    private static Duration parseClock(Matcher m, String original) {
        long hours;
        try {
            hours = Long.parseLong(m.group(1));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Interval hours out of range: " + original);
        }
        long minutes = Long.parseLong(m.group(2));
        long seconds = Long.parseLong(m.group(3));

        long millis = 0;
        String fraction = m.group(4);
        if (fraction != null) {
            // ".5" is half a second, not five milliseconds
            StringBuilder padded = new StringBuilder(fraction);
            while (padded.length() < 3) {
                padded.append('0');
            }
            millis = Long.parseLong(padded.toString());
        }

        try {
            return Duration.ofHours(hours)
                    .plusMinutes(minutes)
                    .plusSeconds(seconds)
                    .plusMillis(millis);
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Interval out of range: " + original);
        }
    }

    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            try {
                return Duration.ofSeconds(Long.parseLong(s));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Interval seconds out of range: " + input);
            }
        }

        if (s.matches("^\\d+\\s*(ms|[smhdw])$")) {
            String digits = s.replaceAll("[^0-9]", "");
            String unit = s.replaceAll("[0-9\\s]", "");
            long n;
            try {
                n = Long.parseLong(digits);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Interval out of range: " + input);
            }
            try {
                return switch (unit) {
                    case "ms" -> Duration.ofMillis(n);
                    case "s" -> Duration.ofSeconds(n);
                    case "m" -> Duration.ofMinutes(n);
                    case "h" -> Duration.ofHours(n);
                    case "d" -> Duration.ofDays(n);
                    case "w" -> Duration.ofDays(Math.multiplyExact(7L, n));
                    default -> throw new IllegalArgumentException("Unsupported compact unit: " + unit);
                };
            } catch (ArithmeticException ex) {
                throw new IllegalArgumentException("Interval out of range: " + input);
            }
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected hh:mm:ss or pairs like '3 minutes': " + input);
        }

        boolean seenWeek = false, seenDay = false, seenHour = false, seenMinute = false, seenSecond = false;
        long totalSeconds = 0;

        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid number in interval: " + parts[i]);
            }
            if (n < 0) {
                throw new IllegalArgumentException("Interval values must be non-negative");
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            switch (unit) {
                case "week" -> {
                    if (seenWeek) throw new IllegalArgumentException("Duplicate unit: week");
                    seenWeek = true;
                    totalSeconds = addUnits(totalSeconds, n, ChronoUnit.WEEKS, input);
                }
                case "day" -> {
                    if (seenDay) throw new IllegalArgumentException("Duplicate unit: day");
                    seenDay = true;
                    totalSeconds = addUnits(totalSeconds, n, ChronoUnit.DAYS, input);
                }
                case "hour" -> {
                    if (seenHour) throw new IllegalArgumentException("Duplicate unit: hour");
                    seenHour = true;
                    totalSeconds = addUnits(totalSeconds, n, ChronoUnit.HOURS, input);
                }
                case "minute" -> {
                    if (seenMinute) throw new IllegalArgumentException("Duplicate unit: minute");
                    seenMinute = true;
                    totalSeconds = addUnits(totalSeconds, n, ChronoUnit.MINUTES, input);
                }
                case "second" -> {
                    if (seenSecond) throw new IllegalArgumentException("Duplicate unit: second");
                    seenSecond = true;
                    totalSeconds = addUnits(totalSeconds, n, ChronoUnit.SECONDS, input);
                }
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            }
        }

        return Duration.ofSeconds(totalSeconds);
    }

    private static long addUnits(long totalSeconds, long n, ChronoUnit unit, String input) {
        try {
            return Math.addExact(totalSeconds, Math.multiplyExact(unit.getDuration().getSeconds(), n));
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Interval out of range: " + input);
        }
    }
}
