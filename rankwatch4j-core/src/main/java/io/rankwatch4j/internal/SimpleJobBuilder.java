package io.rankwatch4j.internal;

import io.rankwatch4j.JobBuilder;
import io.rankwatch4j.core.JobDefinition;
import io.rankwatch4j.core.PersistResult;
import io.rankwatch4j.core.TriggerSpec;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation used by the scheduler.
 */
public class SimpleJobBuilder implements JobBuilder {

    private final String jobId;
    private final Function<JobDefinition, PersistResult> persister;

    private final List<String> targets = new ArrayList<>();
    private String expression;
    private String[] cronFields;
    private Instant runAt;
    private String timezone;
    private int maxRetries;
    private Duration retryBackoff;

    public SimpleJobBuilder(String jobId,
                            int defaultMaxRetries,
                            Duration defaultRetryBackoff,
                            Function<JobDefinition, PersistResult> persister) {
        this.jobId = Objects.requireNonNull(jobId, "jobId must not be null");
        if (jobId.isBlank()) throw new IllegalArgumentException("jobId must not be blank");
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
        this.maxRetries = defaultMaxRetries;
        this.retryBackoff = Objects.requireNonNull(defaultRetryBackoff, "defaultRetryBackoff must not be null");
    }

    @Override
    public JobBuilder targets(String... targets) {
        Objects.requireNonNull(targets, "targets must not be null");
        return targets(Arrays.asList(targets));
    }

    @Override
    public JobBuilder targets(List<String> targets) {
        Objects.requireNonNull(targets, "targets must not be null");
        for (String t : targets) {
            if (t == null || t.isBlank()) {
                throw new IllegalArgumentException("targets must not contain blank values");
            }
            this.targets.add(t.trim());
        }
        return this;
    }

    @Override
    public JobBuilder every(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        this.expression = expression;
        this.cronFields = null;
        this.runAt = null;
        return this;
    }

    @Override
    public JobBuilder cron(String minute, String hour, String dayOfWeek) {
        this.cronFields = new String[]{minute, hour, dayOfWeek};
        this.expression = null;
        this.runAt = null;
        return this;
    }

    @Override
    public JobBuilder runAt(Instant time) {
        Objects.requireNonNull(time, "time must not be null");
        this.runAt = time;
        this.expression = null;
        this.cronFields = null;
        return this;
    }

    @Override
    public JobBuilder timezone(String timezone) {
        Objects.requireNonNull(timezone, "timezone must not be null");
        ZoneId.of(timezone);
        this.timezone = timezone;
        return this;
    }

    @Override
    public JobBuilder maxRetries(int maxRetries) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must not be negative");
        this.maxRetries = maxRetries;
        return this;
    }

    @Override
    public JobBuilder retryBackoff(Duration retryBackoff) {
        Objects.requireNonNull(retryBackoff, "retryBackoff must not be null");
        this.retryBackoff = retryBackoff;
        return this;
    }

    @Override
    public JobDefinition build() {
        List<String> t = targets.isEmpty() ? List.of(jobId) : List.copyOf(targets);
        return new JobDefinition(jobId, t, trigger(), maxRetries, retryBackoff);
    }

    @Override
    public PersistResult save() {
        return persister.apply(build());
    }

    private TriggerSpec trigger() {
        if (runAt != null) {
            return TriggerSpec.once(runAt);
        }
        if (cronFields != null) {
            return TriggerSpec.cronFields(cronFields[0], cronFields[1], cronFields[2], timezone);
        }
        if (expression != null) {
            return TriggerSpec.parse(expression, timezone);
        }
        throw new IllegalStateException("job " + jobId + " needs a trigger: every(), cron() or runAt()");
    }
}
