package io.rankwatch4j.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntervalParserTest {

    @Test
    void parseHumanDurationShouldAcceptPairsCompactAndSeconds() {
        assertEquals(Duration.ofHours(2), IntervalParser.parseHumanDuration("2 hours"));
        assertEquals(Duration.ofMinutes(90), IntervalParser.parseHumanDuration("1 hour 30 minutes"));
        assertEquals(Duration.ofMinutes(30), IntervalParser.parseHumanDuration("30m"));
        assertEquals(Duration.ofSeconds(45), IntervalParser.parseHumanDuration("45"));
    }

    @Test
    void parseHumanDurationShouldRejectDuplicateAndUnknownUnits() {
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parseHumanDuration("1 hour 2 hours"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parseHumanDuration("3 fortnights"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parseHumanDuration("0"));
    }

    @Test
    void parseCronDurationShouldSupportFiveFieldCron() {
        Duration duration = IntervalParser.parseDuration("*/5 * * * *", "UTC", Instant.parse("2026-01-01T00:01:00Z"));
        assertEquals(Duration.ofMinutes(4), duration);
    }

    @Test
    void cronFieldsShouldDefaultMissingFieldsToEvery() {
        assertEquals("0 6,12,18 * * *", IntervalParser.cronFields("0", "6,12,18", null));

        Duration untilNoon = IntervalParser.parseDuration(
                IntervalParser.cronFields("0", "6,12,18", null), "UTC", Instant.parse("2026-01-01T07:00:00Z"));
        assertEquals(Duration.ofHours(5), untilNoon);
    }

    @Test
    void computeNextRunAtShouldUseLaterOfPreviousAndFinished() {
        Instant previousNextRunAt = Instant.parse("2026-01-01T00:05:00Z");
        Instant finishedAt = Instant.parse("2026-01-01T00:06:00Z");

        Instant next = IntervalParser.computeNextRunAt("*/5 * * * *", "UTC", previousNextRunAt, finishedAt);

        assertEquals(Instant.parse("2026-01-01T00:10:00Z"), next);
    }

    @Test
    void computeNextRunAtShouldSupportAtSyntax() {
        Instant previousNextRunAt = Instant.parse("2026-01-01T10:00:00Z");
        Instant finishedAt = Instant.parse("2026-01-01T10:01:00Z");

        Instant next = IntervalParser.computeNextRunAt("AT 10:00", "UTC", previousNextRunAt, finishedAt);

        assertEquals(Instant.parse("2026-01-02T10:00:00Z"), next);
    }

    @Test
    void computeNextRunAtShouldReturnNullForBlankExpression() {
        assertNull(IntervalParser.computeNextRunAt(" ", "UTC", Instant.now(), Instant.now()));
    }

    @Test
    void dailyTriggerShouldHonorTimezone() {
        Instant from = Instant.parse("2026-01-01T00:00:00Z"); // 08:00 in Shanghai
        Instant first = IntervalParser.firstRunAt("AT 09:30", "Asia/Shanghai", from);
        assertEquals(Instant.parse("2026-01-01T01:30:00Z"), first);
    }

    @Test
    void validateShouldRejectBadTimezoneAndTimeOfDay() {
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.validate("1 hour", "Mars/Olympus"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.validate("AT 25:00", "UTC"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.validate("0 minutes", "UTC"));
    }

    @Test
    void looksLikeCronShouldRecognizeValidSpec() {
        assertTrue(IntervalParser.looksLikeCron("0 */10 * * * *"));
        assertFalse(IntervalParser.looksLikeCron("2 hours"));
        assertFalse(IntervalParser.looksLikeCron("99 99 * * *"));
    }
}
