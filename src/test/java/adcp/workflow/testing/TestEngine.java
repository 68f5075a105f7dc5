package adcp.workflow.testing;

import adcp.workflow.audit.AuditEntry;
import adcp.workflow.config.Dependencies;
import adcp.workflow.config.WorkflowConfig;
import adcp.workflow.model.Task;
import adcp.workflow.model.TaskStatus;
import adcp.workflow.model.TenantPolicy;
import adcp.workflow.operation.OperationKind;

import java.util.EnumSet;
import java.util.List;

/**
 * Fully wired engine on a private in-memory database, with a scriptable adapter,
 * a recording webhook receiver and a frozen clock.
 */
public final class TestEngine implements AutoCloseable {

    public static final String REVIEWED_TENANT = "tenant-reviewed";
    public static final String AUTO_TENANT = "tenant-auto";

    public final MutableClock clock = new MutableClock(Fixtures.NOW);
    public final RecordingAdapter adapter = new RecordingAdapter();
    public final RecordingReceiver receiver = new RecordingReceiver();
    public final Dependencies deps;

    public TestEngine(String name) {
        this(Fixtures.testConfig(name));
    }

    public TestEngine(WorkflowConfig config) {
        this.deps = Dependencies.create(config, clock);
        deps.adapters().register(adapter);
        deps.webhookDispatcher().register(receiver);
        deps.tenantPolicyRepository().save(new TenantPolicy(REVIEWED_TENANT, true,
                EnumSet.allOf(OperationKind.class), RecordingAdapter.NAME));
        deps.tenantPolicyRepository().save(TenantPolicy.autoApprove(AUTO_TENANT, RecordingAdapter.NAME));
    }

    public Task task(String id) {
        return deps.taskRepository().findById(id)
                .orElseThrow(() -> new AssertionError("task not found: " + id));
    }

    public TaskStatus status(String id) {
        return task(id).status();
    }

    public List<String> auditEvents(String taskId) {
        return deps.auditSink().findByTaskId(taskId).stream().map(AuditEntry::event).toList();
    }

    public void awaitStatus(String taskId, TaskStatus status) {
        Await.until(taskId + " to become " + status.wireName(), () -> status(taskId) == status);
    }

    @Override
    public void close() {
        deps.close();
    }
}
