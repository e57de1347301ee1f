package com.judgmentrag.service.workflow;

/**
 * Result of one workflow stage. A DEGRADED value is usable but came from a fallback;
 * a FATAL value ends the workflow.
 */
public record StageOutcome<T>(Status status, T value, String reason) {

    public enum Status {
        OK,
        DEGRADED,
        FATAL
    }

    public static <T> StageOutcome<T> ok(T value) {
        return new StageOutcome<>(Status.OK, value, null);
    }

    public static <T> StageOutcome<T> degraded(T value, String reason) {
        return new StageOutcome<>(Status.DEGRADED, value, reason);
    }

    public static <T> StageOutcome<T> fatal(T value, String reason) {
        return new StageOutcome<>(Status.FATAL, value, reason);
    }

    public boolean isFatal() {
        return status == Status.FATAL;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }
}
