package io.rankwatch4j.http;

/**
 * Raw HTTP response as seen by {@link RateLimitedClient}.
 */
public record TransportResponse(int statusCode, String body) {

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
