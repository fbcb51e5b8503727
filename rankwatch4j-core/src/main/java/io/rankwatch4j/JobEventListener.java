package io.rankwatch4j;

import io.rankwatch4j.core.JobEvent;

/**
 * Notified on the scheduler's event thread after an outcome has been recorded.
 * Implementations must not block.
 */
@FunctionalInterface
public interface JobEventListener {

    void onEvent(JobEvent event);
}
