package io.nextrun.schedule;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * One-time schedule expressions of the form {@code at(yyyy-MM-ddTHH:mm:ss)}.
 * The date-time carries no offset; it is read in the schedule's timezone.
 */
public final class ScheduleExpressions {

    private static final DateTimeFormatter AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
    private static final int MAX_YEAR = 9999;

    private ScheduleExpressions() {
    }

    /**
     * Formats an instant as an {@code at(...)} expression in the given zone, truncated to seconds.
     *
     * @throws ScheduleUpdateException with kind INVALID_FORMAT if the local date-time falls after year 9999
     */
    public static String at(Instant instant, ZoneId zone) {
        ZonedDateTime local;
        try {
            local = instant.atZone(zone);
        } catch (DateTimeException e) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.INVALID_FORMAT,
                    "Schedule time out of range: " + instant, e);
        }
        if (local.getYear() > MAX_YEAR) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.INVALID_FORMAT,
                    "Schedule time must not be later than year " + MAX_YEAR + ": " + instant);
        }
        return "at(" + AT_FORMAT.format(local) + ")";
    }

    /**
     * Parses an {@code at(...)} expression back to an instant.
     *
     * @throws ScheduleUpdateException with kind INVALID_FORMAT if the expression is not a one-time expression
     */
    public static Instant parseAt(String expression, ZoneId zone) {
        if (expression == null || !expression.startsWith("at(") || !expression.endsWith(")")) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.INVALID_FORMAT,
                    "Not a one-time schedule expression: " + expression);
        }
        String body = expression.substring(3, expression.length() - 1);
        try {
            return LocalDateTime.parse(body, AT_FORMAT).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.INVALID_FORMAT,
                    "Invalid schedule expression: " + expression, e);
        }
    }

    /**
     * Resolves an IANA zone id.
     *
     * @throws ScheduleUpdateException with kind INVALID_FORMAT for unknown zones
     */
    public static ZoneId zone(String timezone) {
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException | NullPointerException e) {
            throw new ScheduleUpdateException(ScheduleUpdateException.Kind.INVALID_FORMAT,
                    "Unknown timezone: " + timezone, e);
        }
    }
}
