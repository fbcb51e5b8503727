package io.rankwatch4j.core;

/**
 * Filter and page for listing executions, newest first.
 *
 * <p>This is an API-layer object; each store translates it into its own query.
 */
public final class ExecutionQuery {
    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 500;

    private final String jobId;
    private final ExecutionStatus status;
    private final ExecutionOrigin origin;
    private final String parentExecutionId;
    private final int page;
    private final int size;

    private ExecutionQuery(Builder b) {
        this.jobId = blankToNull(b.jobId);
        this.status = b.status;
        this.origin = b.origin;
        this.parentExecutionId = blankToNull(b.parentExecutionId);
        this.page = b.page;
        this.size = b.size;
    }

    public static ExecutionQuery all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String jobId() {
        return jobId;
    }

    public ExecutionStatus status() {
        return status;
    }

    public ExecutionOrigin origin() {
        return origin;
    }

    public String parentExecutionId() {
        return parentExecutionId;
    }

    /**
     * 0-based page index.
     */
    public int page() {
        return page;
    }

    public int size() {
        return size;
    }

    public int offset() {
        return page * size;
    }

    public boolean matches(JobExecution e) {
        return (jobId == null || jobId.equals(e.getJobId()))
                && (status == null || status == e.getStatus())
                && (origin == null || origin == e.getOrigin())
                && (parentExecutionId == null || parentExecutionId.equals(e.getParentExecutionId()));
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }

    public static final class Builder {
        private String jobId;
        private ExecutionStatus status;
        private ExecutionOrigin origin;
        private String parentExecutionId;
        private int page = 0;
        private int size = DEFAULT_PAGE_SIZE;

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder origin(ExecutionOrigin origin) {
            this.origin = origin;
            return this;
        }

        public Builder parentExecutionId(String parentExecutionId) {
            this.parentExecutionId = parentExecutionId;
            return this;
        }

        public Builder page(int page, int size) {
            if (page < 0) {
                throw new IllegalArgumentException("page must not be negative");
            }
            if (size <= 0 || size > MAX_PAGE_SIZE) {
                throw new IllegalArgumentException("size must be between 1 and " + MAX_PAGE_SIZE);
            }
            this.page = page;
            this.size = size;
            return this;
        }

        public ExecutionQuery build() {
            return new ExecutionQuery(this);
        }
    }
}
