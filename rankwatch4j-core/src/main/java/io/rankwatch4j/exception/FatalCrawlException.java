package io.rankwatch4j.exception;

/**
 * Failure that will reproduce on every retry, e.g. structurally wrong data.
 */
public class FatalCrawlException extends CrawlException {

    public FatalCrawlException(String message) {
        super(message);
    }

    public FatalCrawlException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
