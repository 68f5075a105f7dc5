package adcp.workflow.service;

import adcp.workflow.model.ErrorCode;
import adcp.workflow.operation.ExecutionResult;

/**
 * Typed outcome of {@link OperationInterceptor#intercept}; never an exception.
 *
 * @param result  adapter result when EXECUTED
 * @param taskId  approval task when DEFERRED, background task when EXECUTED but still pending on the platform
 */
public record InterceptResult(
        Outcome outcome,
        ExecutionResult result,
        String taskId,
        ErrorCode errorCode,
        String message) {

    public enum Outcome {
        EXECUTED,
        DEFERRED,
        REJECTED,
        FAILED
    }

    /** Status string reported upstream for deferred operations. */
    public static final String PENDING_MANUAL = "pending_manual";

    public static InterceptResult executed(ExecutionResult result) {
        return new InterceptResult(Outcome.EXECUTED, result, null, null, null);
    }

    public static InterceptResult executedPending(ExecutionResult result, String backgroundTaskId) {
        return new InterceptResult(Outcome.EXECUTED, result, backgroundTaskId, null, null);
    }

    public static InterceptResult deferred(String taskId) {
        return new InterceptResult(Outcome.DEFERRED, null, taskId, null, null);
    }

    public static InterceptResult rejected(ErrorCode code, String message) {
        return new InterceptResult(Outcome.REJECTED, null, null, code, message);
    }

    public static InterceptResult failed(ErrorCode code, String message) {
        return new InterceptResult(Outcome.FAILED, null, null, code, message);
    }

    public String responseStatus() {
        return switch (outcome) {
            case EXECUTED -> result.status().wireName();
            case DEFERRED -> PENDING_MANUAL;
            case REJECTED -> "rejected";
            case FAILED -> "failed";
        };
    }
}
