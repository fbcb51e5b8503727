package io.rankwatch4j.config;

import java.util.ArrayList;
import java.util.List;

/**
 * A recurring job over several sources. Targets may use the {@code all} and {@code category} keywords.
 */
public class BatchJobProperties {
    private List<String> targets = new ArrayList<>();
    private String trigger;
    private String timezone;

    public List<String> getTargets() {
        return targets;
    }

    public void setTargets(List<String> targets) {
        this.targets = targets;
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
}
