package io.rankwatch4j.config;

import io.rankwatch4j.CrawlScheduler;
import io.rankwatch4j.JobBuilder;
import io.rankwatch4j.monitor.TaskMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Map;

/**
 * Bridges scheduler and monitor start/stop with the Spring container lifecycle.
 *
 * <p>On start, every configured source with a trigger and every configured batch job is registered
 * (upserted by id), then the scheduler and the monitor are started.
 */
public class RankwatchLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(RankwatchLifecycle.class);

    private final CrawlScheduler scheduler;
    private final TaskMonitor monitor;
    private final RankwatchProperties props;
    private volatile boolean running = false;

    /**
     * @param monitor may be null when the monitor is disabled
     */
    public RankwatchLifecycle(CrawlScheduler scheduler, TaskMonitor monitor, RankwatchProperties props) {
        this.scheduler = scheduler;
        this.monitor = monitor;
        this.props = props;
    }

    @Override
    public void start() {
        registerConfiguredJobs();
        scheduler.start();
        if (monitor != null) {
            monitor.start();
        }
        running = true;
    }

    @Override
    public void stop() {
        if (monitor != null) {
            monitor.stop();
        }
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    void registerConfiguredJobs() {
        int registered = 0;
        for (Map.Entry<String, SourceProperties> e : props.getSources().entrySet()) {
            SourceProperties source = e.getValue();
            if (source.getTrigger() == null || source.getTrigger().isBlank()) {
                continue;
            }
            JobBuilder builder = scheduler.create(e.getKey()).every(source.getTrigger());
            if (source.getTimezone() != null) {
                builder.timezone(source.getTimezone());
            }
            if (source.getMaxRetries() != null) {
                builder.maxRetries(source.getMaxRetries());
            }
            if (source.getRetryBackoff() != null) {
                builder.retryBackoff(source.getRetryBackoff());
            }
            builder.save();
            registered++;
        }

        for (Map.Entry<String, BatchJobProperties> e : props.getJobs().entrySet()) {
            BatchJobProperties job = e.getValue();
            if (job.getTrigger() == null || job.getTrigger().isBlank()) {
                log.warn("batch job has no trigger; not registered jobId={}", e.getKey());
                continue;
            }
            JobBuilder builder = scheduler.create(e.getKey())
                    .targets(job.getTargets())
                    .every(job.getTrigger());
            if (job.getTimezone() != null) {
                builder.timezone(job.getTimezone());
            }
            builder.save();
            registered++;
        }
        log.info("Configured jobs registered count={}", registered);
    }
}
