package adcp.workflow.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    private static final Instant CREATED = Instant.parse("2026-03-02T09:00:00Z");

    private static Task.Builder base() {
        return Task.builder()
                .id("a_1")
                .tenantId("tenant-1")
                .toolName("update_media_buy")
                .action(TaskAction.PAUSE)
                .requestContext("{}")
                .createdAt(CREATED)
                .dueAt(CREATED.plus(Duration.ofHours(2)));
    }

    @Test
    void builderDefaults() {
        Task task = base().build();

        assertEquals(StepType.APPROVAL, task.stepType());
        assertEquals(TaskStatus.PENDING_APPROVAL, task.status());
        assertEquals(TaskOwner.PUBLISHER, task.owner());
        assertFalse(task.isResolved());
        assertFalse(task.isBackground());
        assertEquals(0, task.version());
    }

    @Test
    void dueAtMustBeAfterCreatedAt() {
        assertThrows(IllegalArgumentException.class, () -> base().dueAt(CREATED).build());
        assertThrows(IllegalArgumentException.class, () -> base().dueAt(CREATED.minusSeconds(1)).build());
    }

    @Test
    void backgroundTaskMustBeSystemOwned() {
        assertThrows(IllegalArgumentException.class,
                () -> base().stepType(StepType.BACKGROUND_TASK).owner(TaskOwner.PUBLISHER).build());

        Task ok = base().stepType(StepType.BACKGROUND_TASK).owner(TaskOwner.SYSTEM).status(TaskStatus.WORKING).build();
        assertTrue(ok.isBackground());
    }

    @Test
    void actionIsRequired() {
        assertThrows(NullPointerException.class, () -> base().action(null).build());
    }

    @Test
    void overdueOnlyWhilePendingApproval() {
        Task task = base().build();
        Instant afterDue = task.dueAt().plusSeconds(1);

        assertFalse(task.isOverdue(task.dueAt()));
        assertTrue(task.isOverdue(afterDue));

        Task working = task.toBuilder().status(TaskStatus.WORKING).build();
        assertFalse(working.isOverdue(afterDue));
    }

    @Test
    void toBuilderCopiesAllFields() {
        Task original = base()
                .principalId("principal-1")
                .mediaBuyId("mb_1")
                .assignedTo("ops")
                .parentTaskId("a_0")
                .resolution(Resolution.APPROVED)
                .resolvedBy("alice")
                .resolvedAt(CREATED.plusSeconds(60))
                .resolutionDetail("ok")
                .version(3)
                .build();

        Task copy = original.toBuilder().build();

        assertEquals(original, copy);
        assertEquals("principal-1", copy.principalId());
        assertEquals("mb_1", copy.mediaBuyId());
        assertEquals("ops", copy.assignedTo());
        assertEquals("a_0", copy.parentTaskId());
        assertEquals(Resolution.APPROVED, copy.resolution());
        assertEquals("alice", copy.resolvedBy());
        assertEquals("ok", copy.resolutionDetail());
        assertTrue(copy.isResolved());
    }

    @Test
    void equalityUsesIdAndVersion() {
        Task v0 = base().build();
        Task v1 = v0.toBuilder().version(1).build();

        assertNotEquals(v0, v1);
        assertEquals(v0, base().status(TaskStatus.WORKING).build());
    }

    @Test
    void statusAndResolutionWireNames() {
        assertEquals(TaskStatus.PENDING_APPROVAL, TaskStatus.fromWire("pending_approval"));
        assertEquals(TaskStatus.FAILED, TaskStatus.fromWire(" FAILED "));
        assertThrows(IllegalArgumentException.class, () -> TaskStatus.fromWire("done"));

        assertEquals(Resolution.APPROVED, Resolution.fromWire("approve"));
        assertEquals(Resolution.REJECTED, Resolution.fromWire("Rejected"));
        assertThrows(IllegalArgumentException.class, () -> Resolution.fromWire("maybe"));
        assertThrows(IllegalArgumentException.class, () -> Resolution.fromWire(null));
    }

    @Test
    void updateActionsMapToTaskActions() {
        assertEquals(TaskAction.ACTIVATE, TaskAction.forUpdateAction("activate_order"));
        assertEquals(TaskAction.PAUSE, TaskAction.forUpdateAction("pause_package"));
        assertEquals(TaskAction.RESUME, TaskAction.forUpdateAction("resume_media_buy"));
        assertEquals(TaskAction.UPDATE, TaskAction.forUpdateAction("update_package_budget"));
    }
}
