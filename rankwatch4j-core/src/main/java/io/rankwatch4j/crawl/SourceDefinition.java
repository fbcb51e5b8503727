package io.rankwatch4j.crawl;

import io.rankwatch4j.config.SourceProperties;
import io.rankwatch4j.exception.ConfigurationException;
import io.rankwatch4j.utils.IntervalParser;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only description of a configured source: URL template, params and schedule.
 */
public record SourceDefinition(
        String id,
        SourceKind kind,
        String template,
        Map<String, String> params,
        String trigger,
        String timezone,
        boolean followDetails,
        Duration monitorInterval,
        boolean monitored
) {
    public SourceDefinition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(template, "template must not be null");
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static SourceDefinition of(String id, SourceProperties props) {
        Objects.requireNonNull(props, "props must not be null");
        if (props.getTemplate() == null || props.getTemplate().isBlank()) {
            throw new ConfigurationException("source " + id + " has no template");
        }
        String trigger = props.getTrigger();
        Duration monitorInterval = props.getMonitorInterval();
        if (trigger != null && !trigger.isBlank()) {
            try {
                IntervalParser.validate(trigger, props.getTimezone());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("invalid trigger for source " + id + ": " + e.getMessage());
            }
            if (monitorInterval == null && !IntervalParser.looksLikeCron(trigger)
                    && !trigger.trim().startsWith(IntervalParser.DAILY_PREFIX)) {
                monitorInterval = IntervalParser.parseHumanDuration(trigger);
            }
        }
        return new SourceDefinition(
                id,
                props.getKind(),
                props.getTemplate(),
                props.getParams(),
                props.getTrigger(),
                props.getTimezone(),
                props.isFollowDetails(),
                monitorInterval,
                props.isMonitored()
        );
    }

    public boolean isScheduled() {
        return trigger != null && !trigger.isBlank();
    }
}
