package io.cronhook.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.TimeZone;

/**
 * Cron helpers backed by Quartz {@link CronExpression}.
 * <p>
 * Accepted formats:
 * <ul>
 *   <li>5 fields (Unix): minute hour day-of-month month day-of-week</li>
 *   <li>6 fields: second minute hour day-of-month month day-of-week</li>
 * </ul>
 * <p>
 * Numeric day-of-week values follow Unix cron (0 or 7 = Sunday) and are translated to Quartz numbering
 * (1 = Sunday). Quartz also requires one of day-of-month / day-of-week to be {@code ?}; that is filled in here.
 * When both fields are restricted the expression fires when either matches, as in Unix cron, so it is split
 * into one Quartz expression per field and the earliest fire time wins.
 */
public final class CronExpressions {
    private CronExpressions() {
    }

    /**
     * Returns the reason the spec is not a usable cron expression, or empty if it is valid.
     */
    public static Optional<String> validationError(String spec) {
        if (spec == null || spec.isBlank()) {
            return Optional.of("cron expression must not be empty");
        }
        int fields = spec.trim().split("\\s+").length;
        if (fields != 5 && fields != 6) {
            return Optional.of("cron expression must have 5 or 6 fields, got " + fields);
        }
        try {
            for (String expression : toQuartzExpressions(spec)) {
                CronExpression.validateExpression(expression);
            }
            return Optional.empty();
        } catch (ParseException | IllegalArgumentException e) {
            return Optional.of("invalid cron expression '" + spec.trim() + "': " + e.getMessage());
        }
    }

    public static boolean isValid(String spec) {
        return validationError(spec).isEmpty();
    }

    /**
     * Translate a cron spec to Quartz syntax:
     * - 5-field cron gets a leading seconds "0".
     * - 6-field cron is taken as-is.
     * Returns two expressions when both day-of-month and day-of-week are restricted, one otherwise.
     */
    public static List<String> toQuartzExpressions(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        throw new IllegalArgumentException("cron expression must have 5 or 6 fields: " + spec);
    }

    private static List<String> toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = toQuartzDayOfWeek(dayOfWeek);

        if (isRestricted(dom) && isRestricted(dow)) {
            return List.of(
                    String.join(" ", sec, min, hour, dom, month, "?"),
                    String.join(" ", sec, min, hour, "?", month, dow));
        }

        if ("*".equals(dom) && "*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom) && !"?".equals(dow)) {
            dom = "?";
        } else if ("*".equals(dow) && !"?".equals(dom)) {
            dow = "?";
        }

        return List.of(String.join(" ", sec, min, hour, dom, month, dow));
    }

    private static boolean isRestricted(String field) {
        return !"*".equals(field) && !"?".equals(field);
    }

    // Unix 0-7 (Sun=0/7) -> Quartz 1-7 (Sun=1). Steps after '/' are left untouched.
    private static String toQuartzDayOfWeek(String field) {
        List<String> items = new ArrayList<>();
        for (String item : field.split(",")) {
            String range = item;
            String step = null;
            int slash = item.indexOf('/');
            if (slash >= 0) {
                range = item.substring(0, slash);
                step = item.substring(slash + 1);
            }

            String converted;
            int dash = range.indexOf('-');
            if (dash > 0) {
                converted = shiftDay(range.substring(0, dash)) + "-" + shiftDay(range.substring(dash + 1));
            } else {
                converted = shiftDay(range);
            }
            items.add(step == null ? converted : converted + "/" + step);
        }
        return String.join(",", items);
    }

    private static String shiftDay(String token) {
        if (!token.matches("\\d+")) {
            return token;
        }
        int day = Integer.parseInt(token);
        if (day > 7) {
            return token;
        }
        return Integer.toString((day % 7) + 1);
    }

    /**
     * Next fire time strictly after {@code after}, or {@code null} if the expression never fires again.
     *
     * @param spec cron spec (5 or 6 fields)
     * @param zone zone the expression is evaluated in; null means UTC
     */
    public static Instant nextFireTime(String spec, ZoneId zone, Instant after) {
        if (after == null) {
            throw new IllegalArgumentException("after must not be null");
        }
        TimeZone timeZone = TimeZone.getTimeZone(zone != null ? zone : ZoneId.of("UTC"));
        Date earliest = null;
        for (String expression : toQuartzExpressions(spec)) {
            CronExpression exp;
            try {
                exp = new CronExpression(expression);
            } catch (ParseException e) {
                throw new IllegalArgumentException("Invalid cron expression: " + spec, e);
            }
            exp.setTimeZone(timeZone);

            Date next = exp.getNextValidTimeAfter(Date.from(after));
            if (next != null && (earliest == null || next.before(earliest))) {
                earliest = next;
            }
        }
        return earliest == null ? null : earliest.toInstant();
    }

    /**
     * Next fire time after the later of the previous scheduled time and {@code now}. A schedule that fell
     * behind is moved forward instead of replaying every missed occurrence.
     */
    public static Instant computeNextRunAt(String spec, ZoneId zone, Instant previousRunAt, Instant now) {
        return nextFireTime(spec, zone, laterOf(previousRunAt, now));
    }

    /* ================= helper ================= */

    private static Instant laterOf(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
