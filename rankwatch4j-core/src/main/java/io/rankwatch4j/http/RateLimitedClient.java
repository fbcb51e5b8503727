package io.rankwatch4j.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.rankwatch4j.config.HttpClientProperties;
import io.rankwatch4j.exception.MalformedResponseException;
import io.rankwatch4j.exception.TransientCrawlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * GET-only JSON client shared by every crawl run.
 *
 * <p>Sends are spaced at least {@code rateLimitDelay} apart, retries included. Each send reserves the
 * next free slot under a lock and sleeps outside it, so concurrent callers queue up instead of
 * sending together.
 *
 * <p>Failure contract:
 * <ul>
 *   <li>transport error or non-2xx status: retried up to {@code maxRetries} times with
 *       {@link RetryPolicy} backoff, then {@link TransientCrawlException}</li>
 *   <li>2xx body that is not JSON: {@link MalformedResponseException} at once, no retry</li>
 * </ul>
 */
public class RateLimitedClient {
    private static final Logger log = LoggerFactory.getLogger(RateLimitedClient.class);

    private final HttpTransport transport;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final Duration rateLimitDelay;
    private final Duration timeout;
    private final Map<String, String> headers;
    private final Clock clock;
    private final Sleeper sleeper;

    private final Object throttleLock = new Object();
    private Instant nextSlot;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicReference<Instant> lastRequestAt = new AtomicReference<>();

    public RateLimitedClient(HttpClientProperties props, ObjectMapper objectMapper) {
        this(props, new JdkHttpTransport(props.getConnectTimeout()), objectMapper, Clock.systemUTC(), Sleeper.THREAD);
    }

    public RateLimitedClient(HttpClientProperties props,
                             HttpTransport transport,
                             ObjectMapper objectMapper,
                             Clock clock,
                             Sleeper sleeper) {
        Objects.requireNonNull(props, "props must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.retryPolicy = RetryPolicy.from(props);
        this.rateLimitDelay = Objects.requireNonNull(props.getRateLimitDelay(), "rateLimitDelay must not be null");
        this.timeout = Objects.requireNonNull(props.getTimeout(), "timeout must not be null");
        if (rateLimitDelay.isNegative()) {
            throw new IllegalArgumentException("rateLimitDelay must not be negative");
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }

        Map<String, String> h = new LinkedHashMap<>();
        h.put("Accept", "application/json");
        if (props.getUserAgent() != null && !props.getUserAgent().isBlank()) {
            h.put("User-Agent", props.getUserAgent());
        }
        this.headers = Map.copyOf(h);
    }

    /**
     * Fetch {@code url} and decode its body as JSON.
     *
     * @throws TransientCrawlException     retries exhausted, or the calling thread was interrupted
     * @throws MalformedResponseException the body is not JSON
     */
    public JsonNode get(String url) {
        Objects.requireNonNull(url, "url must not be null");

        int maxRetries = retryPolicy.maxRetries();
        Integer lastStatus = null;
        Exception lastError = null;
        String lastMessage = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                if (attempt > 0) {
                    Duration delay = retryPolicy.delayFor(attempt - 1);
                    retries.incrementAndGet();
                    log.warn("http retry scheduled url={} attempt={} delay={} lastError={}", url, attempt, delay, lastMessage);
                    sleeper.sleep(delay);
                }
                throttle();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransientCrawlException("interrupted while waiting to send url=" + url, lastStatus, attempt, e);
            }

            TransportResponse response;
            try {
                totalRequests.incrementAndGet();
                response = transport.get(url, timeout, headers);
            } catch (IOException e) {
                failedRequests.incrementAndGet();
                lastStatus = null;
                lastError = e;
                lastMessage = e.getClass().getSimpleName() + ": " + e.getMessage();
                log.warn("http request failed url={} attempt={} msg={}", url, attempt + 1, lastMessage);
                continue;
            } catch (InterruptedException e) {
                failedRequests.incrementAndGet();
                Thread.currentThread().interrupt();
                throw new TransientCrawlException("interrupted during request url=" + url, null, attempt + 1, e);
            } finally {
                lastRequestAt.set(clock.instant());
            }

            if (!response.isSuccessful()) {
                failedRequests.incrementAndGet();
                lastStatus = response.statusCode();
                lastError = null;
                lastMessage = "HTTP " + response.statusCode();
                log.warn("http request returned error status url={} attempt={} status={}", url, attempt + 1, response.statusCode());
                continue;
            }

            try {
                JsonNode node = objectMapper.readTree(response.body());
                if (node == null || node.isMissingNode()) {
                    failedRequests.incrementAndGet();
                    throw new MalformedResponseException("empty response body url=" + url, response.body(), null);
                }
                successfulRequests.incrementAndGet();
                log.debug("http request succeeded url={} attempt={}", url, attempt + 1);
                return node;
            } catch (JsonProcessingException e) {
                failedRequests.incrementAndGet();
                throw new MalformedResponseException("response is not valid JSON url=" + url, response.body(), e);
            }
        }

        throw new TransientCrawlException(
                "request failed after " + (maxRetries + 1) + " attempts url=" + url + " lastError=" + lastMessage,
                lastStatus,
                maxRetries + 1,
                lastError
        );
    }

    /**
     * Counters since construction or the last {@link #resetStats()}.
     */
    public ClientStats stats() {
        return new ClientStats(
                totalRequests.get(),
                successfulRequests.get(),
                failedRequests.get(),
                retries.get(),
                lastRequestAt.get()
        );
    }

    public void resetStats() {
        totalRequests.set(0);
        successfulRequests.set(0);
        failedRequests.set(0);
        retries.set(0);
        lastRequestAt.set(null);
    }

    private void throttle() throws InterruptedException {
        Duration wait;
        synchronized (throttleLock) {
            Instant now = clock.instant();
            Instant sendAt = (nextSlot == null || !nextSlot.isAfter(now)) ? now : nextSlot;
            nextSlot = sendAt.plus(rateLimitDelay);
            wait = Duration.between(now, sendAt);
        }
        if (!wait.isZero() && !wait.isNegative()) {
            log.debug("http throttle wait={}", wait);
            sleeper.sleep(wait);
        }
    }
}
