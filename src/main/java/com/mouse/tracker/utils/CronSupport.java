package com.mouse.tracker.utils;

import com.mouse.tracker.exception.InvalidScheduleException;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Cron parsing on top of Spring's {@link CronExpression}. Classic five-field expressions
 * ({@code min hour dom mon dow}) get a leading seconds field of {@code 0}.
 */
public final class CronSupport {

    private CronSupport() {
    }

    public static String normalize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("Cron expression is empty");
        }
        String trimmed = expression.trim().replaceAll("\\s+", " ");
        int fields = trimmed.split(" ").length;
        if (fields == 5) {
            return "0 " + trimmed;
        }
        if (fields == 6) {
            return trimmed;
        }
        throw new InvalidScheduleException("Cron expression must have 5 or 6 fields: '" + expression + "'");
    }

    public static CronExpression parse(String expression) {
        String normalized = normalize(expression);
        try {
            return CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidScheduleException e) {
            return false;
        }
    }

    /** First fire time strictly after {@code from}. */
    public static Instant next(String expression, Instant from, ZoneId zone) {
        ZonedDateTime next = parse(expression).next(from.atZone(zone));
        if (next == null) {
            throw new InvalidScheduleException("Cron expression '" + expression + "' never fires again");
        }
        return next.toInstant();
    }

    public static List<Instant> nextRuns(String expression, Instant from, ZoneId zone, int count) {
        CronExpression cron = parse(expression);
        List<Instant> runs = new ArrayList<>(count);
        ZonedDateTime cursor = from.atZone(zone);
        for (int i = 0; i < count; i++) {
            cursor = cron.next(cursor);
            if (cursor == null) {
                break;
            }
            runs.add(cursor.toInstant());
        }
        return runs;
    }
}
