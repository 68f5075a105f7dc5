package adcp.workflow.service;

import adcp.workflow.adapter.AdapterException;
import adcp.workflow.adapter.PlatformStatus;
import adcp.workflow.audit.AuditEntry;
import adcp.workflow.model.ErrorCode;
import adcp.workflow.model.StepType;
import adcp.workflow.model.Task;
import adcp.workflow.model.TaskAction;
import adcp.workflow.model.TaskOwner;
import adcp.workflow.model.TaskQuery;
import adcp.workflow.model.TaskStatus;
import adcp.workflow.model.TenantPolicy;
import adcp.workflow.operation.ActionDetails;
import adcp.workflow.operation.CreateMediaBuyOperation;
import adcp.workflow.operation.OperationKind;
import adcp.workflow.testing.Await;
import adcp.workflow.testing.Fixtures;
import adcp.workflow.testing.RecordingAdapter;
import adcp.workflow.testing.TestEngine;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;

import static adcp.workflow.testing.TestEngine.AUTO_TENANT;
import static adcp.workflow.testing.TestEngine.REVIEWED_TENANT;
import static org.junit.jupiter.api.Assertions.*;

class OperationInterceptorTest {

    private TestEngine engine;
    private OperationInterceptor interceptor;

    @BeforeEach
    void setup() {
        engine = new TestEngine("interceptor");
        interceptor = engine.deps.interceptor();
    }

    @AfterEach
    void teardown() {
        engine.close();
    }

    private List<Task> allTasks() {
        return engine.deps.taskRepository().list(TaskQuery.all(), engine.clock.instant());
    }

    @Test
    @DisplayName("Operation for a tenant with review enabled becomes a pending creation task")
    void deferredCreateMediaBuy() {
        CreateMediaBuyOperation op = Fixtures.createMediaBuy();

        InterceptResult result = interceptor.intercept(REVIEWED_TENANT, "principal-1", op);

        assertEquals(InterceptResult.Outcome.DEFERRED, result.outcome());
        assertEquals(InterceptResult.PENDING_MANUAL, result.responseStatus());
        assertEquals(0, engine.adapter.mutatingCalls());

        Task task = engine.task(result.taskId());
        assertTrue(task.id().startsWith("c_"));
        assertEquals(StepType.CREATION, task.stepType());
        assertEquals(TaskStatus.PENDING_APPROVAL, task.status());
        assertEquals(TaskOwner.PUBLISHER, task.owner());
        assertEquals(TaskAction.CREATE, task.action());
        assertEquals("create_media_buy", task.toolName());
        assertEquals("principal-1", task.principalId());
        assertNull(task.mediaBuyId());
        assertEquals(Fixtures.NOW.plus(Duration.ofHours(4)), task.dueAt());

        assertEquals(op, engine.deps.codec().decodeOperation(task.requestContext(), task.toolName()));
        ActionDetails details = engine.deps.codec().decodeActionDetails(task.requestContext());
        assertEquals("Recording Ad Server", details.platform());
        assertEquals(ActionDetails.MODE_MANUAL, details.automationMode());

        assertEquals(List.of(AuditEntry.TASK_CREATED), engine.auditEvents(task.id()));
        Await.until("task_created webhook", () -> engine.receiver.forTask(task.id()).size() == 1);
        assertEquals("pending_approval", engine.receiver.forTask(task.id()).get(0).status());
    }

    @Test
    void deferredUpdateAndCreativesUseTheirSla() {
        InterceptResult update = interceptor.intercept(REVIEWED_TENANT, "principal-1", Fixtures.pause("mb_1"));
        InterceptResult creatives = interceptor.intercept(REVIEWED_TENANT, "principal-1", Fixtures.creatives("mb_1"));

        Task updateTask = engine.task(update.taskId());
        assertTrue(updateTask.id().startsWith("a_"));
        assertEquals(StepType.APPROVAL, updateTask.stepType());
        assertEquals(TaskAction.PAUSE, updateTask.action());
        assertEquals("mb_1", updateTask.mediaBuyId());
        assertEquals(Fixtures.NOW.plus(Duration.ofHours(2)), updateTask.dueAt());

        Task creativeTask = engine.task(creatives.taskId());
        assertEquals(TaskAction.APPROVE, creativeTask.action());
        assertEquals(Fixtures.NOW.plus(Duration.ofHours(24)), creativeTask.dueAt());
    }

    @Test
    @DisplayName("Tenant without review executes immediately and persists no task")
    void immediateExecution() {
        InterceptResult result = interceptor.intercept(AUTO_TENANT, "principal-1", Fixtures.createMediaBuy());

        assertEquals(InterceptResult.Outcome.EXECUTED, result.outcome());
        assertEquals("active", result.responseStatus());
        assertEquals("mb_recorded", result.result().mediaBuyId());
        assertNull(result.taskId());
        assertEquals(1, engine.adapter.createCalls.get());
        assertTrue(allTasks().isEmpty());
        assertTrue(engine.deps.deliveryTracking().isTracking("mb_recorded"));
    }

    @Test
    void policyIsPerOperationKind() {
        engine.deps.tenantPolicyRepository().save(new TenantPolicy("tenant-partial", true,
                EnumSet.of(OperationKind.CREATE_MEDIA_BUY), RecordingAdapter.NAME));

        InterceptResult create = interceptor.intercept("tenant-partial", "p", Fixtures.createMediaBuy());
        InterceptResult pause = interceptor.intercept("tenant-partial", "p", Fixtures.pause("mb_1"));

        assertEquals(InterceptResult.Outcome.DEFERRED, create.outcome());
        assertEquals(InterceptResult.Outcome.EXECUTED, pause.outcome());
        assertEquals(1, engine.adapter.updateCalls.get());
        assertEquals(0, engine.adapter.createCalls.get());
    }

    @Test
    void unknownTenantIsRejectedWithoutSideEffects() {
        InterceptResult result = interceptor.intercept("tenant-unknown", "p", Fixtures.createMediaBuy());

        assertEquals(InterceptResult.Outcome.REJECTED, result.outcome());
        assertEquals(ErrorCode.POLICY_LOOKUP_FAILURE, result.errorCode());
        assertTrue(allTasks().isEmpty());
        assertEquals(0, engine.adapter.mutatingCalls());
    }

    @Test
    void unregisteredAdServerIsPolicyLookupFailure() {
        engine.deps.tenantPolicyRepository().save(TenantPolicy.reviewAll("tenant-gam", "gam"));

        InterceptResult result = interceptor.intercept("tenant-gam", "p", Fixtures.createMediaBuy());

        assertEquals(ErrorCode.POLICY_LOOKUP_FAILURE, result.errorCode());
        assertTrue(result.message().contains("gam"));
        assertTrue(allTasks().isEmpty());
    }

    @Test
    void invalidOperationIsRejected() {
        CreateMediaBuyOperation noPackages = new CreateMediaBuyOperation("ref", null, null, List.of(),
                Fixtures.FLIGHT_START, Fixtures.FLIGHT_END, 100.0, "USD");

        InterceptResult deferred = interceptor.intercept(REVIEWED_TENANT, "p", noPackages);
        InterceptResult immediate = interceptor.intercept(AUTO_TENANT, "p", noPackages);
        InterceptResult missing = interceptor.intercept(AUTO_TENANT, "p", null);

        assertEquals(ErrorCode.INVALID_REQUEST, deferred.errorCode());
        assertEquals(ErrorCode.INVALID_REQUEST, immediate.errorCode());
        assertEquals(ErrorCode.INVALID_REQUEST, missing.errorCode());
        assertTrue(allTasks().isEmpty());
        assertEquals(0, engine.adapter.mutatingCalls());
    }

    @Test
    @DisplayName("Immediate adapter failure is returned to the caller and not retried")
    void immediateAdapterFailure() {
        engine.adapter.failingWith(AdapterException.transientFailure("gateway timeout"));

        InterceptResult result = interceptor.intercept(AUTO_TENANT, "p", Fixtures.createMediaBuy());

        assertEquals(InterceptResult.Outcome.FAILED, result.outcome());
        assertEquals(ErrorCode.ADAPTER_TRANSIENT, result.errorCode());
        assertEquals("gateway timeout", result.message());
        assertEquals(1, engine.adapter.createCalls.get());
        assertTrue(allTasks().isEmpty());
    }

    @Test
    void immediatePlatformRejectionIsPermanentFailure() {
        engine.adapter.withUpdateStatus(PlatformStatus.REJECTED);

        InterceptResult result = interceptor.intercept(AUTO_TENANT, "p", Fixtures.pause("mb_1"));

        assertEquals(ErrorCode.ADAPTER_PERMANENT, result.errorCode());
        assertTrue(result.message().startsWith("platform reported rejected"));
    }

    @Test
    @DisplayName("Immediate execution left pending on the platform starts a parentless background task")
    void immediatePendingStartsPolling() {
        engine.adapter.withCreateStatus(PlatformStatus.PENDING);

        InterceptResult result = interceptor.intercept(AUTO_TENANT, "p", Fixtures.createMediaBuy());

        assertEquals(InterceptResult.Outcome.EXECUTED, result.outcome());
        assertEquals("pending", result.responseStatus());
        assertNotNull(result.taskId());

        Task background = engine.task(result.taskId());
        assertTrue(background.isBackground());
        assertEquals(TaskStatus.WORKING, background.status());
        assertEquals(TaskOwner.SYSTEM, background.owner());
        assertNull(background.parentTaskId());
        assertEquals("mb_recorded", background.mediaBuyId());
        assertTrue(engine.deps.supervisor().isPolling(background.id()));
        assertFalse(engine.deps.deliveryTracking().isTracking("mb_recorded"));
    }

    @Test
    @DisplayName("Storage failure while deferring comes back as an internal error")
    void storageFailureOnDeferIsTyped() {
        TenantPolicy policy = engine.deps.policyResolver().policyFor(REVIEWED_TENANT);
        engine.deps.database().close();

        InterceptResult result = interceptor.intercept("p", Fixtures.createMediaBuy(), policy);

        assertEquals(InterceptResult.Outcome.FAILED, result.outcome());
        assertEquals(ErrorCode.INTERNAL_ERROR, result.errorCode());
        assertEquals(0, engine.adapter.mutatingCalls());
    }

    @Test
    @DisplayName("Storage failure after a pending immediate execution names the media buy")
    void storageFailureAfterPendingExecutionIsTyped() {
        engine.adapter.withCreateStatus(PlatformStatus.PENDING);
        TenantPolicy policy = engine.deps.policyResolver().policyFor(AUTO_TENANT);
        engine.deps.database().close();

        InterceptResult result = interceptor.intercept("p", Fixtures.createMediaBuy(), policy);

        assertEquals(InterceptResult.Outcome.FAILED, result.outcome());
        assertEquals(ErrorCode.INTERNAL_ERROR, result.errorCode());
        assertTrue(result.message().contains("mb_recorded"));
        assertEquals(1, engine.adapter.createCalls.get());
    }

    @Test
    @DisplayName("Storage failure during policy lookup is an internal error, not an exception")
    void storageFailureOnPolicyLookupIsTyped() {
        engine.deps.database().close();

        InterceptResult result = interceptor.intercept(REVIEWED_TENANT, "p", Fixtures.createMediaBuy());

        assertEquals(ErrorCode.INTERNAL_ERROR, result.errorCode());
        assertEquals("failed", result.responseStatus());
    }
}
