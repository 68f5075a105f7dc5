package adcp.workflow.api.v1.dto;

import adcp.workflow.model.Resolution;
import adcp.workflow.model.Task;
import adcp.workflow.model.TaskAction;
import adcp.workflow.model.TaskStatus;
import adcp.workflow.operation.ActionDetailsBuilders;
import adcp.workflow.operation.CreateMediaBuyOperation;
import adcp.workflow.operation.RequestContextCodec;
import adcp.workflow.service.TaskSummary;
import adcp.workflow.testing.Fixtures;
import adcp.workflow.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Mapping of stored tasks to the reviewer-facing JSON.
 */
class TaskSummaryResponseTest {

    private static Task.Builder pendingCreate() {
        CreateMediaBuyOperation op = Fixtures.createMediaBuy();
        String context = new RequestContextCodec().encode(op,
                ActionDetailsBuilders.creation(op, "Mock Ad Server"));
        return Task.builder()
                .id("c_0001")
                .tenantId("tenant-1")
                .principalId("principal-1")
                .toolName("create_media_buy")
                .action(TaskAction.CREATE)
                .requestContext(context)
                .createdAt(Fixtures.NOW)
                .dueAt(Fixtures.NOW.plus(Duration.ofHours(4)));
    }

    @Test
    @DisplayName("Pending task carries action details and omits resolution fields")
    void pendingTask() throws Exception {
        TaskSummaryResponse dto = TaskSummaryResponse.from(new TaskSummary(pendingCreate().build(), false));

        assertEquals("c_0001", dto.taskId());
        assertEquals("approval", dto.stepType());
        assertEquals("pending_approval", dto.status());
        assertEquals("publisher", dto.owner());
        assertEquals("create", dto.action());
        assertNull(dto.resolution());
        assertNotNull(dto.actionDetails());
        assertEquals(ActionDetailsBuilders.ACTION_CREATE_MEDIA_BUY, dto.actionDetails().get("action_type").asText());

        JsonNode json = Json.mapper().readTree(Json.mapper().writeValueAsString(dto));
        assertEquals("2026-03-02T09:00:00Z", json.get("created_at").asText());
        assertEquals("2026-03-02T13:00:00Z", json.get("due_at").asText());
        assertFalse(json.get("overdue").asBoolean());
        assertFalse(json.has("resolution"));
        assertFalse(json.has("resolved_at"));
        assertFalse(json.has("media_buy_id"));
    }

    @Test
    void resolvedTask() {
        Task task = pendingCreate()
                .status(TaskStatus.COMPLETED)
                .mediaBuyId("mb_1")
                .resolution(Resolution.APPROVED)
                .resolutionDetail("created media_buy_id=mb_1")
                .resolvedBy("alice")
                .resolvedAt(Fixtures.NOW.plusSeconds(60))
                .build();

        TaskSummaryResponse dto = TaskSummaryResponse.from(new TaskSummary(task, false));

        assertEquals("completed", dto.status());
        assertEquals("approved", dto.resolution());
        assertEquals("alice", dto.resolvedBy());
        assertEquals("mb_1", dto.mediaBuyId());
    }

    @Test
    void unreadableContextDropsActionDetails() {
        Task task = pendingCreate().requestContext("{broken").build();

        TaskSummaryResponse dto = TaskSummaryResponse.from(new TaskSummary(task, true));

        assertNull(dto.actionDetails());
        assertTrue(dto.overdue());
    }
}
