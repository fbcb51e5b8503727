package io.rankwatch4j.crawl;

public enum FailureKind {
    /** Retrying the job may succeed. */
    TRANSIENT,
    /** Retrying reproduces the failure; the job fails terminally. */
    FATAL
}
