package io.rankwatch4j.exception;

/**
 * Base type for every failure raised while crawling a source.
 *
 * <p>Subclasses decide whether the scheduler may retry the job: {@link TransientCrawlException} is
 * retryable, {@link FatalCrawlException} is not.
 */
public abstract class CrawlException extends RuntimeException {

    protected CrawlException(String message) {
        super(message);
    }

    protected CrawlException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether running the same request again may produce a different outcome.
     */
    public abstract boolean isRetryable();
}
