package io.rankwatch4j.monitor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record MonitorStatus(boolean running, Duration interval, Instant lastCheckAt, List<GapRecord> gaps) {
    public MonitorStatus {
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
    }
}
