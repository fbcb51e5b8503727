package io.rankwatch4j.crawl;

import io.rankwatch4j.exception.CrawlException;

import java.util.Objects;

/**
 * Typed error carried by a {@link CrawlResult}.
 */
public record CrawlFailure(FailureKind kind, String errorType, String message) {

    public CrawlFailure {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static CrawlFailure of(CrawlException e) {
        return new CrawlFailure(
                e.isRetryable() ? FailureKind.TRANSIENT : FailureKind.FATAL,
                e.getClass().getSimpleName(),
                e.getMessage()
        );
    }

    public static CrawlFailure transientFailure(Throwable t) {
        return new CrawlFailure(FailureKind.TRANSIENT, t.getClass().getSimpleName(), t.getMessage());
    }

    public boolean isRetryable() {
        return kind == FailureKind.TRANSIENT;
    }

    @Override
    public String toString() {
        return kind + " " + errorType + ": " + message;
    }
}
