package adcp.workflow.model;

import java.util.Locale;

/**
 * Error taxonomy surfaced at the public boundaries (interceptor, task API, controllers).
 */
public enum ErrorCode {
    /** Tenant configuration missing - operation rejected, nothing persisted */
    POLICY_LOOKUP_FAILURE,
    /** Adapter failed transiently; the caller must resubmit */
    ADAPTER_TRANSIENT,
    /** Adapter refused the operation */
    ADAPTER_PERMANENT,
    /** Background polling exceeded its maximum duration */
    POLLING_TIMEOUT,
    TASK_NOT_FOUND,
    /** Task was already resolved; reported, never treated as a failure */
    DUPLICATE_RESOLUTION,
    /** Background tasks cannot be approved by a reviewer */
    NOT_RESOLVABLE,
    INVALID_REQUEST,
    /** Task storage failed; the operation state is whatever was persisted before the failure */
    INTERNAL_ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
