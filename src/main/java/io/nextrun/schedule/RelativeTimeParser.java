package io.nextrun.schedule;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses relative time expressions such as {@code +30m}, {@code +2h} or {@code +1d}.
 */
public final class RelativeTimeParser {

    private static final Pattern RELATIVE = Pattern.compile("\\+(\\d+)([mhd])");

    private RelativeTimeParser() {
    }

    /**
     * Parses a relative time expression into a duration.
     *
     * @param value the expression, {@code '+'} followed by digits and one of m, h, d (case-insensitive)
     * @return the duration the expression denotes
     * @throws ScheduleUpdateException with kind INVALID_FORMAT if the expression does not match
     */
    public static Duration parse(String value) {
        if (value == null) {
            throw invalid(null);
        }
        Matcher matcher = RELATIVE.matcher(value.toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw invalid(value);
        }

        try {
            long amount = Long.parseLong(matcher.group(1));
            return switch (matcher.group(2)) {
                case "m" -> Duration.ofMinutes(amount);
                case "h" -> Duration.ofHours(amount);
                case "d" -> Duration.ofDays(amount);
                default -> throw invalid(value);
            };
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.INVALID_FORMAT,
                    "Relative time out of range: " + value, e);
        }
    }

    private static ScheduleUpdateException invalid(String value) {
        return new ScheduleUpdateException(ScheduleUpdateException.Kind.INVALID_FORMAT,
                "Invalid relative time format: %s. Use '+30m', '+2h', '+1d' etc.".formatted(value));
    }
}
