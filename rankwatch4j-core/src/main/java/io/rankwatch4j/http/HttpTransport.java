package io.rankwatch4j.http;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Sends one GET request. Implementations do no retrying or throttling of their own.
 */
@FunctionalInterface
public interface HttpTransport {

    TransportResponse get(String url, Duration timeout, Map<String, String> headers) throws IOException, InterruptedException;
}
