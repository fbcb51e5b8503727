package io.rankwatch4j.core;

public enum CancelMode {
    /** Keep the definition but clear its next run. */
    DISABLE,
    /** Remove the definition. Execution history is kept. */
    DELETE
}
