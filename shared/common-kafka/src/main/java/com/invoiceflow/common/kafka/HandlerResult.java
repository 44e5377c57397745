package com.invoiceflow.common.kafka;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Outcome of one handler invocation, returned to {@link PipelineConsumer}.
 * <p>
 * Transport-level signalling only. Business decisions such as NEEDS_REVIEW or a
 * failed posting are persisted by the handler and reported as {@link Outcome#SUCCESS}.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class HandlerResult {

    private static final HandlerResult SUCCESS = new HandlerResult(Outcome.SUCCESS, null, null);

    private final Outcome outcome;
    private final String reason;
    @ToString.Exclude
    private final Throwable cause;

    public static HandlerResult success() {
        return SUCCESS;
    }

    public static HandlerResult retryable(String reason) {
        return new HandlerResult(Outcome.RETRYABLE_FAILURE, reason, null);
    }

    public static HandlerResult retryable(String reason, Throwable cause) {
        return new HandlerResult(Outcome.RETRYABLE_FAILURE, reason, cause);
    }

    public static HandlerResult permanent(String reason) {
        return new HandlerResult(Outcome.PERMANENT_FAILURE, reason, null);
    }

    public static HandlerResult permanent(String reason, Throwable cause) {
        return new HandlerResult(Outcome.PERMANENT_FAILURE, reason, cause);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public boolean isRetryable() {
        return outcome == Outcome.RETRYABLE_FAILURE;
    }

    public boolean isPermanent() {
        return outcome == Outcome.PERMANENT_FAILURE;
    }

    public enum Outcome {
        SUCCESS,
        RETRYABLE_FAILURE,
        PERMANENT_FAILURE
    }
}
