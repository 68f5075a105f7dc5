package adcp.workflow.audit;

import java.util.List;

/**
 * Append-only audit log. Implementations never update or delete entries.
 */
public interface AuditSink {

    void record(AuditEntry entry);

    /**
     * Entries for one task, oldest first.
     */
    List<AuditEntry> findByTaskId(String taskId);
}
