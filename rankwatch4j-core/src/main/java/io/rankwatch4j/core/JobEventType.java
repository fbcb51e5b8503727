package io.rankwatch4j.core;

public enum JobEventType {
    /** The run finished and its crawl result carries no failure. */
    SUCCEEDED,
    /** The run finished with a typed crawl failure. */
    FAILED,
    /** The run threw. */
    ERRORED
}
