package adcp.workflow.integration;

import adcp.workflow.adapter.PlatformStatus;
import adcp.workflow.audit.AuditEntry;
import adcp.workflow.config.WorkflowConfig;
import adcp.workflow.model.Resolution;
import adcp.workflow.model.Task;
import adcp.workflow.model.TaskStatus;
import adcp.workflow.service.ExecutionOutcome;
import adcp.workflow.service.InterceptResult;
import adcp.workflow.service.TaskResolution;
import adcp.workflow.testing.Await;
import adcp.workflow.testing.Fixtures;
import adcp.workflow.testing.TestEngine;
import adcp.workflow.webhook.WebhookPayload;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static adcp.workflow.testing.TestEngine.AUTO_TENANT;
import static adcp.workflow.testing.TestEngine.REVIEWED_TENANT;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end flows through the wired engine: interception, review, execution,
 * background polling, webhooks and delivery simulation.
 */
class FullFlowIntegrationTest {

    @Test
    @DisplayName("Deferred create: approve, platform pending, background poll completes parent")
    void deferredCreateApprovedAndPolled() {
        try (TestEngine engine = new TestEngine("flow-async")) {
            engine.adapter.withMediaBuyId("mb_async")
                    .withCreateStatus(PlatformStatus.PENDING)
                    .withStatuses(PlatformStatus.PENDING, PlatformStatus.ACTIVE);

            InterceptResult intercepted = engine.deps.interceptor()
                    .intercept(REVIEWED_TENANT, "principal-1", Fixtures.createMediaBuy());
            assertEquals(InterceptResult.Outcome.DEFERRED, intercepted.outcome());
            String parentId = intercepted.taskId();

            TaskResolution resolution = engine.deps.taskService()
                    .completeTask(parentId, Resolution.APPROVED, "ok", "alice");
            assertTrue(resolution.isSuccess());
            assertEquals(ExecutionOutcome.DEFERRED_TO_BACKGROUND, resolution.execution());
            assertEquals(1, engine.adapter.createCalls.get());

            List<Task> children = engine.deps.taskRepository().findByParentId(parentId);
            assertEquals(1, children.size());
            Task background = children.get(0);
            assertTrue(background.isBackground());
            assertEquals("mb_async", background.mediaBuyId());
            assertEquals("mb_async", engine.task(parentId).mediaBuyId());

            engine.awaitStatus(background.id(), TaskStatus.COMPLETED);
            engine.awaitStatus(parentId, TaskStatus.COMPLETED);
            assertEquals(1, engine.adapter.createCalls.get());

            List<String> parentEvents = engine.auditEvents(parentId);
            assertTrue(parentEvents.contains(AuditEntry.TASK_CREATED));
            assertTrue(parentEvents.contains(AuditEntry.TASK_EXECUTED));
            assertTrue(engine.auditEvents(background.id()).contains(AuditEntry.TASK_BACKGROUND_STARTED));

            Await.until("parent completion webhook", () -> engine.receiver.forTask(parentId).stream()
                    .anyMatch(p -> "completed".equals(p.status())));
            assertTrue(engine.receiver.forTask(parentId).stream()
                    .anyMatch(p -> "pending_approval".equals(p.status())));
        }
    }

    @Test
    void rejectedCreateNeverReachesAdapter() {
        try (TestEngine engine = new TestEngine("flow-reject")) {
            String taskId = engine.deps.interceptor()
                    .intercept(REVIEWED_TENANT, "principal-1", Fixtures.createMediaBuy()).taskId();

            TaskResolution resolution = engine.deps.taskService()
                    .completeTask(taskId, Resolution.REJECTED, "budget too high", "bob");

            assertEquals(ExecutionOutcome.REJECTED, resolution.execution());
            assertEquals(TaskStatus.REJECTED, engine.status(taskId));
            assertEquals(0, engine.adapter.mutatingCalls());
            Await.until("rejection webhook", () -> engine.receiver.forTask(taskId).stream()
                    .anyMatch(p -> "rejected".equals(p.status())));
        }
    }

    @Test
    @DisplayName("Pollers left running by a previous process are re-attached on startup")
    void restartRecoversBackgroundPolling() {
        WorkflowConfig config = Fixtures.testConfig("flow-restart");
        String parentId;
        String backgroundId;

        try (TestEngine first = new TestEngine(config)) {
            first.adapter.withMediaBuyId("mb_restart").withCreateStatus(PlatformStatus.PENDING);
            parentId = first.deps.interceptor()
                    .intercept(REVIEWED_TENANT, "principal-1", Fixtures.createMediaBuy()).taskId();
            first.deps.taskService().completeTask(parentId, Resolution.APPROVED, null, "alice");
            backgroundId = first.deps.taskRepository().findByParentId(parentId).get(0).id();
            assertEquals(TaskStatus.WORKING, first.status(backgroundId));
        }

        try (TestEngine second = new TestEngine(config)) {
            assertEquals(TaskStatus.WORKING, second.status(backgroundId));
            second.adapter.withStatuses(PlatformStatus.ACTIVE);

            second.deps.startBackground();

            second.awaitStatus(backgroundId, TaskStatus.COMPLETED);
            second.awaitStatus(parentId, TaskStatus.COMPLETED);
            assertEquals(0, second.adapter.createCalls.get());
        }
    }

    @Test
    @DisplayName("Auto-approved create executes at once and simulated delivery runs to completion")
    void immediateCreateDeliversToCompletion() {
        WorkflowConfig config = Fixtures.testConfig("flow-delivery")
                .withSimulationAcceleration(8_640_000)
                .withSimulationInterval(Duration.ofMillis(10));

        try (TestEngine engine = new TestEngine(config)) {
            InterceptResult result = engine.deps.interceptor()
                    .intercept(AUTO_TENANT, "principal-1", Fixtures.createMediaBuy());

            assertEquals(InterceptResult.Outcome.EXECUTED, result.outcome());
            assertEquals("mb_recorded", result.result().mediaBuyId());

            Await.until("delivery completed webhook", () -> engine.receiver.forTask("mb_recorded").stream()
                    .anyMatch(p -> "completed".equals(p.status())));

            List<WebhookPayload> delivery = engine.receiver.forTask("mb_recorded");
            assertTrue(delivery.stream().anyMatch(p -> "started".equals(p.status())));
            assertTrue(delivery.stream().anyMatch(p -> "delivering".equals(p.status())));
        }
    }
}
