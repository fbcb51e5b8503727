package io.rankwatch4j.core;

/**
 * Why an execution was created.
 */
public enum ExecutionOrigin {
    SCHEDULED,
    MANUAL,
    RETRY,
    BATCH_CHILD
}
