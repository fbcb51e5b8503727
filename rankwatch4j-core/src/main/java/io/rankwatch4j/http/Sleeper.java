package io.rankwatch4j.http;

import java.time.Duration;

/**
 * Blocking wait, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
