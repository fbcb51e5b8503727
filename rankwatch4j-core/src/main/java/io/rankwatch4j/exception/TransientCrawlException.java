package io.rankwatch4j.exception;

/**
 * Network, timeout or retryable upstream status failure.
 */
public class TransientCrawlException extends CrawlException {

    private final Integer statusCode;
    private final int attempts;

    public TransientCrawlException(String message) {
        this(message, null, 0, null);
    }

    public TransientCrawlException(String message, Throwable cause) {
        this(message, null, 0, cause);
    }

    public TransientCrawlException(String message, Integer statusCode, int attempts, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.attempts = attempts;
    }

    /**
     * Last HTTP status seen, or {@code null} when the last attempt never got a response.
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
