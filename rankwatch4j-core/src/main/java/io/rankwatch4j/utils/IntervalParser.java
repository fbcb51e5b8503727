package io.rankwatch4j.utils;

import org.quartz.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TimeZone;

/**
 * Parses trigger expressions and computes run times.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Human-readable intervals: "30 minutes", "2 hours", "1 day 3 hours"</li>
 *   <li>Compact intervals: "30m", "1h", "7d"; plain numbers are seconds</li>
 *   <li>Cron expressions, 5-field (minute hour day-of-month month day-of-week) or 6-field with seconds</li>
 *   <li>Daily fixed time: "AT 06:00"</li>
 * </ul>
 */
public final class IntervalParser {
    public static final String DAILY_PREFIX = "AT ";

    private static final Map<String, Long> UNIT_SECONDS = Map.of(
            "month", 30L * 86_400L,
            "week", 7L * 86_400L,
            "day", 86_400L,
            "hour", 3_600L,
            "minute", 60L,
            "second", 1L
    );

    private IntervalParser() {
    }

    /**
     * 5-field cron from the minute / hour / day-of-week fields of a trigger.
     * Null fields mean "every".
     */
    public static String cronFields(String minute, String hour, String dayOfWeek) {
        return String.join(" ",
                blankToStar(minute),
                blankToStar(hour),
                "*",
                "*",
                blankToStar(dayOfWeek));
    }

    /**
     * Validates {@code expression}; a valid one is accepted by every other method of this class.
     *
     * @throws IllegalArgumentException describing what is wrong
     */
    public static void validate(String expression, String timezone) {
        Objects.requireNonNull(expression, "expression must not be null");
        zoneOf(timezone);
        String s = expression.trim();
        if (s.startsWith(DAILY_PREFIX)) {
            parseTimeOfDay(s.substring(DAILY_PREFIX.length()));
            return;
        }
        if (looksLikeCron(s)) {
            return;
        }
        Duration d = parseHumanDuration(s);
        if (d.isZero()) {
            throw new IllegalArgumentException("interval must be positive: " + expression);
        }
    }

    /**
     * First run of a recurring trigger registered at {@code now}: the next calendar occurrence for cron
     * and daily triggers, {@code now + interval} for intervals.
     */
    public static Instant firstRunAt(String expression, String timezone, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        return now.plus(parseDuration(expression, timezone, now));
    }

    /**
     * Computes the next run time of a recurring trigger.
     *
     * @param expression        trigger expression
     * @param timezone          IANA zone id, nullable
     * @param previousNextRunAt the run time that just fired
     * @param finishedAt        when that run was handed off
     * @return next scheduled run time, or {@code null} when {@code expression} is blank (one-shot)
     */
    public static Instant computeNextRunAt(
            String expression,
            String timezone,
            Instant previousNextRunAt,
            Instant finishedAt
    ) {
        if (expression == null || expression.isBlank()) {
            return null;
        }

        Instant base = laterOf(previousNextRunAt, finishedAt);
        if (base == null) {
            throw new IllegalArgumentException("previousNextRunAt or finishedAt is required");
        }
        return base.plus(parseDuration(expression, timezone, base));
    }

    private static Instant laterOf(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }

    /**
     * Parse a trigger expression into the {@link Duration} from {@code from} to its next run.
     * For cron and daily triggers the result depends on {@code from}.
     *
     * @param timezone IANA time zone id (e.g. "Asia/Shanghai"); if null, system default is used
     */
    public static Duration parseDuration(String expression, String timezone, Instant from) {
        if (expression == null) {
            throw new IllegalArgumentException("expression must not be null");
        }
        if (from == null) {
            throw new IllegalArgumentException("from must not be null");
        }

        String s = expression.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("expression must not be empty");
        }

        ZoneId zone = zoneOf(timezone);

        if (s.startsWith(DAILY_PREFIX)) {
            LocalTime lt = parseTimeOfDay(s.substring(DAILY_PREFIX.length()));
            ZonedDateTime base = ZonedDateTime.ofInstant(from, zone);
            ZonedDateTime candidate = base.with(lt);
            if (!candidate.isAfter(base)) {
                candidate = candidate.plusDays(1);
            }
            return Duration.between(from, candidate.toInstant());
        }

        if (looksLikeCron(s)) {
            return parseCronDuration(normalizeCron(s), zone, from);
        }
        return parseHumanDuration(s);
    }

    public static Duration parseDuration(String expression) {
        return parseDuration(expression, null, Instant.now());
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * - Accepts 6-field cron with seconds.
     * - Accepts 5-field cron by prepending seconds "0".
     * - Quartz needs "?" in one of day-of-month / day-of-week.
     */
    public static String normalizeCron(String cron) {
        Objects.requireNonNull(cron, "cron must not be null");
        String[] parts = cron.trim().split("\\s+");
        return switch (parts.length) {
            case 5 -> toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
            case 6 -> toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
            default -> cron.trim();
        };
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if ("*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom)) {
            dom = "?";
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    /**
     * Returns true if the string can be parsed as a Quartz {@link CronExpression}.
     */
    public static boolean looksLikeCron(String expression) {
        if (expression == null || expression.trim().split("\\s+").length < 5) {
            return false;
        }
        try {
            return CronExpression.isValidExpression(normalizeCron(expression));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Compute duration from {@code from} to the next cron occurrence.
     */
    public static Duration parseCronDuration(String cron, ZoneId zone, Instant from) {
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (java.text.ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));

        Date nextDate = exp.getNextValidTimeAfter(Date.from(from));
        if (nextDate == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + cron);
        }
        return Duration.between(from, nextDate.toInstant());
    }

    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            long seconds;
            try {
                seconds = Long.parseLong(s);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Interval seconds out of range: " + input);
            }
            if (seconds <= 0) {
                throw new IllegalArgumentException("Interval seconds must be positive: " + input);
            }
            return Duration.ofSeconds(seconds);
        }

        if (s.matches("^\\d+\\s*[smhdw]$")) {
            long n = Long.parseLong(s.replaceAll("[^0-9]", ""));
            char u = s.charAt(s.length() - 1);
            return switch (u) {
                case 's' -> Duration.ofSeconds(n);
                case 'm' -> Duration.ofMinutes(n);
                case 'h' -> Duration.ofHours(n);
                case 'd' -> Duration.ofDays(n);
                case 'w' -> Duration.ofDays(7L * n);
                default -> throw new IllegalArgumentException("Unsupported compact unit: " + u);
            };
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '30 minutes': " + input);
        }

        Set<String> seen = new HashSet<>();
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
            Long unitSeconds = UNIT_SECONDS.get(unit);
            if (unitSeconds == null) {
                throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            }
            if (!seen.add(unit)) {
                throw new IllegalArgumentException("Duplicate unit: " + unit);
            }
            totalSeconds += unitSeconds * n;
        }

        return Duration.ofSeconds(totalSeconds);
    }

    private static LocalTime parseTimeOfDay(String timeOfDay) {
        try {
            return LocalTime.parse(timeOfDay.trim());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid time of day. Expected HH:mm or HH:mm:ss: " + timeOfDay, ex);
        }
    }

    private static ZoneId zoneOf(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone);
        } catch (java.time.DateTimeException ex) {
            throw new IllegalArgumentException("Invalid timezone: " + timezone, ex);
        }
    }

    private static String blankToStar(String field) {
        return field == null || field.isBlank() ? "*" : field.trim();
    }
}
