package io.rankwatch4j.core;

import io.rankwatch4j.utils.IntervalParser;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * When a job fires: a fixed interval, a cron field set, a daily time, or once at {@code runAt}.
 *
 * @param expression interval / cron / "AT HH:mm" text; null for {@link TriggerType#ONCE}
 * @param runAt      fire time of a {@link TriggerType#ONCE} trigger; null otherwise
 * @param timezone   IANA zone for cron and daily triggers; null means system default
 */
public record TriggerSpec(TriggerType type, String expression, Instant runAt, String timezone) {

    public TriggerSpec {
        Objects.requireNonNull(type, "type must not be null");
        if (type == TriggerType.ONCE) {
            Objects.requireNonNull(runAt, "runAt must not be null for a one-shot trigger");
        } else {
            Objects.requireNonNull(expression, "expression must not be null for a recurring trigger");
            IntervalParser.validate(expression, timezone);
        }
    }

    /**
     * Detects the trigger type from the expression text.
     *
     * @throws IllegalArgumentException when the expression is not a valid trigger
     */
    public static TriggerSpec parse(String expression, String timezone) {
        Objects.requireNonNull(expression, "expression must not be null");
        String s = expression.trim();
        if (s.startsWith(IntervalParser.DAILY_PREFIX)) {
            return new TriggerSpec(TriggerType.DAILY, s, null, timezone);
        }
        if (IntervalParser.looksLikeCron(s)) {
            return new TriggerSpec(TriggerType.CRON, s, null, timezone);
        }
        return new TriggerSpec(TriggerType.INTERVAL, s, null, timezone);
    }

    public static TriggerSpec cronFields(String minute, String hour, String dayOfWeek, String timezone) {
        return new TriggerSpec(TriggerType.CRON, IntervalParser.cronFields(minute, hour, dayOfWeek), null, timezone);
    }

    public static TriggerSpec once(Instant runAt) {
        return new TriggerSpec(TriggerType.ONCE, null, runAt, null);
    }

    public boolean isRecurring() {
        return type.isRecurring();
    }

    /**
     * First fire time for a job registered at {@code now}.
     */
    public Instant firstRunAt(Instant now) {
        if (type == TriggerType.ONCE) {
            return runAt;
        }
        return IntervalParser.firstRunAt(expression, timezone, now);
    }

    /**
     * Fire time following {@code fired}, or {@code null} for a one-shot trigger. Always after
     * {@code evaluatedAt}: a scheduler that was down does not replay missed ticks. Intervals stay
     * aligned to {@code fired}.
     */
    public Instant nextRunAfter(Instant fired, Instant evaluatedAt) {
        Objects.requireNonNull(fired, "fired must not be null");
        Objects.requireNonNull(evaluatedAt, "evaluatedAt must not be null");
        if (type == TriggerType.ONCE) {
            return null;
        }
        if (type == TriggerType.INTERVAL) {
            Duration interval = IntervalParser.parseHumanDuration(expression);
            Instant next = fired.plus(interval);
            if (!next.isAfter(evaluatedAt)) {
                long missed = Duration.between(fired, evaluatedAt).toMillis() / interval.toMillis();
                next = fired.plus(interval.multipliedBy(missed + 1));
            }
            return next;
        }
        return IntervalParser.computeNextRunAt(expression, timezone, fired, evaluatedAt);
    }

    @Override
    public String toString() {
        return type == TriggerType.ONCE ? "ONCE@" + runAt : type + "(" + expression + ")";
    }
}
