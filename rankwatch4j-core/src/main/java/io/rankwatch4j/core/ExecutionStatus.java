package io.rankwatch4j.core;

/**
 * {@code PENDING -> RUNNING -> COMPLETED | FAILED}. A retry is a new execution, never a revived one.
 */
public enum ExecutionStatus {
    PENDING(false),
    RUNNING(false),
    COMPLETED(true),
    FAILED(true);

    private final boolean terminal;

    ExecutionStatus(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
