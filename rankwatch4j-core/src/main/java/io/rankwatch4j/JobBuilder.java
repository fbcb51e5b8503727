package io.rankwatch4j;

import io.rankwatch4j.core.JobDefinition;
import io.rankwatch4j.core.PersistResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Fluent builder for configuring a job before registering it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory definition</li>
 *   <li>save(): build() + register with the scheduler</li>
 * </ul>
 */
public interface JobBuilder {

    /**
     * Source ids to crawl; keywords ({@code all}, {@code category}) are expanded on save.
     * More than one target makes a batch job.
     */
    JobBuilder targets(String... targets);

    JobBuilder targets(List<String> targets);

    /**
     * Repeat by an interval ("1 hour", "30m"), a cron expression, or "AT HH:mm".
     */
    JobBuilder every(String expression);

    /**
     * Repeat on a cron field set; null fields mean "every".
     */
    JobBuilder cron(String minute, String hour, String dayOfWeek);

    /**
     * Run once at {@code time}.
     */
    JobBuilder runAt(Instant time);

    /**
     * IANA zone for cron and daily triggers. Null means system default.
     */
    JobBuilder timezone(String timezone);

    JobBuilder maxRetries(int maxRetries);

    JobBuilder retryBackoff(Duration retryBackoff);

    JobDefinition build();

    PersistResult save();
}
