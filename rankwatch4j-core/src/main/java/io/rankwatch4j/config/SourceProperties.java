package io.rankwatch4j.config;

import io.rankwatch4j.crawl.SourceKind;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One configured crawl source.
 */
public class SourceProperties {
    private SourceKind kind = SourceKind.CATEGORY;
    private String template;
    private Map<String, String> params = new LinkedHashMap<>();
    /** Interval, cron or "AT HH:mm". Null means the source is only crawled on demand. */
    private String trigger;
    private String timezone;
    private boolean followDetails = false;
    /** Spacing of expected runs for gap detection. Null derives it from an interval trigger. */
    private Duration monitorInterval;
    private boolean monitored = true;
    private Integer maxRetries;
    private Duration retryBackoff;

    public SourceKind getKind() {
        return kind;
    }

    public void setKind(SourceKind kind) {
        this.kind = kind;
    }

    public String getTemplate() {
        return template;
    }

    public void setTemplate(String template) {
        this.template = template;
    }

    public Map<String, String> getParams() {
        return params;
    }

    public void setParams(Map<String, String> params) {
        this.params = params;
    }

    public String getTrigger() {
        return trigger;
    }

    public void setTrigger(String trigger) {
        this.trigger = trigger;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public boolean isFollowDetails() {
        return followDetails;
    }

    public void setFollowDetails(boolean followDetails) {
        this.followDetails = followDetails;
    }

    public Duration getMonitorInterval() {
        return monitorInterval;
    }

    public void setMonitorInterval(Duration monitorInterval) {
        this.monitorInterval = monitorInterval;
    }

    public boolean isMonitored() {
        return monitored;
    }

    public void setMonitored(boolean monitored) {
        this.monitored = monitored;
    }

    public Integer getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(Integer maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }
}
