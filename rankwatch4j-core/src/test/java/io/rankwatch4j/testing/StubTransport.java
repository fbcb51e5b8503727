package io.rankwatch4j.testing;

import io.rankwatch4j.http.HttpTransport;
import io.rankwatch4j.http.TransportResponse;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Scripted transport: answers from a queue, then from per-URL routes, then 404.
 * Records every request URL and the clock time it was sent at.
 */
public class StubTransport implements HttpTransport {
    private final Clock clock;
    private final Deque<Object> script = new ArrayDeque<>();
    private final Map<String, Function<String, TransportResponse>> routes = new HashMap<>();
    private final List<String> urls = new ArrayList<>();
    private final List<Instant> sentAt = new ArrayList<>();
    private Map<String, String> lastHeaders = Map.of();

    public StubTransport(Clock clock) {
        this.clock = clock;
    }

    public synchronized StubTransport respond(int status, String body) {
        script.add(new TransportResponse(status, body));
        return this;
    }

    public synchronized StubTransport fail(IOException error) {
        script.add(error);
        return this;
    }

    /**
     * Serve every URL containing {@code fragment} with {@code body}.
     */
    public synchronized StubTransport route(String fragment, Function<String, TransportResponse> handler) {
        routes.put(fragment, handler);
        return this;
    }

    @Override
    public synchronized TransportResponse get(String url, Duration timeout, Map<String, String> headers) throws IOException {
        urls.add(url);
        sentAt.add(clock.instant());
        lastHeaders = headers;

        Object next = script.poll();
        if (next instanceof IOException e) {
            throw e;
        }
        if (next instanceof TransportResponse r) {
            return r;
        }
        for (Map.Entry<String, Function<String, TransportResponse>> route : routes.entrySet()) {
            if (url.contains(route.getKey())) {
                return route.getValue().apply(url);
            }
        }
        return new TransportResponse(404, "");
    }

    public synchronized List<String> urls() {
        return List.copyOf(urls);
    }

    public synchronized List<Instant> sentAt() {
        return List.copyOf(sentAt);
    }

    public synchronized Map<String, String> lastHeaders() {
        return lastHeaders;
    }
}
