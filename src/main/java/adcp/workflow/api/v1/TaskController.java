package adcp.workflow.api.v1;

import adcp.workflow.api.Controller;
import adcp.workflow.api.v1.dto.CompleteTaskRequest;
import adcp.workflow.api.v1.dto.CompleteTaskResponse;
import adcp.workflow.api.v1.dto.ErrorResponse;
import adcp.workflow.api.v1.dto.TaskSummaryResponse;
import adcp.workflow.model.ErrorCode;
import adcp.workflow.model.TaskStatus;
import adcp.workflow.service.TaskResolution;
import adcp.workflow.service.TaskService;
import adcp.workflow.service.TaskSummary;
import adcp.workflow.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reviewer-facing task API.
 *
 * GET /api/v1/tasks?tenant_id=&status=&overdue= - List tasks (pending_approval by default)
 * GET /api/v1/tasks/{taskId} - Get one task
 * POST /api/v1/tasks/{taskId}/complete - Approve or reject a task
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");
    private static final Pattern COMPLETE_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/complete$");

    private final TaskService taskService;
    private final Clock clock;

    public TaskController(TaskService taskService, Clock clock) {
        this.taskService = taskService;
        this.clock = clock;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return COMPLETE_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return TASKS_PATTERN.matcher(path).matches() || TASK_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher completeMatcher = COMPLETE_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.POST) && completeMatcher.matches()) {
                return handleComplete(completeMatcher.group(1), req);
            }

            if (TASKS_PATTERN.matcher(path).matches()) {
                return handleList(req);
            }

            Matcher taskMatcher = TASK_BY_ID_PATTERN.matcher(path);
            if (taskMatcher.matches()) {
                return handleGet(taskMatcher.group(1));
            }

            return ControllerResponse.message(HttpResponseStatus.NOT_FOUND, "unknown task endpoint");

        } catch (IllegalArgumentException e) {
            return errorResponse(HttpResponseStatus.BAD_REQUEST, ErrorCode.INVALID_REQUEST, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Task controller error on {}", path, e);
            return ControllerResponse.message(HttpResponseStatus.INTERNAL_SERVER_ERROR, "internal error");
        }
    }

    /**
     * GET /api/v1/tasks
     */
    private ControllerResponse handleList(FullHttpRequest req) {
        Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();
        String tenantId = param(params, "tenant_id");
        String status = param(params, "status");
        String overdue = param(params, "overdue");

        List<TaskSummaryResponse> tasks = taskService.getPendingTasks(
                        tenantId,
                        status != null ? TaskStatus.fromWire(status) : null,
                        overdue != null ? parseBoolean("overdue", overdue) : null)
                .stream()
                .map(TaskSummaryResponse::from)
                .toList();

        return ControllerResponse.ok(Map.of(
                "count", tasks.size(),
                "tasks", tasks));
    }

    /**
     * GET /api/v1/tasks/{taskId}
     */
    private ControllerResponse handleGet(String taskId) {
        Optional<TaskSummary> task = taskService.findTask(taskId);
        if (task.isEmpty()) {
            return errorResponse(HttpResponseStatus.NOT_FOUND, ErrorCode.TASK_NOT_FOUND, "task not found: " + taskId);
        }
        return ControllerResponse.ok(TaskSummaryResponse.from(task.get()));
    }

    /**
     * POST /api/v1/tasks/{taskId}/complete
     */
    private ControllerResponse handleComplete(String taskId, FullHttpRequest req) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        CompleteTaskRequest request;
        try {
            request = Json.mapper().readValue(body, CompleteTaskRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed request body: " + e.getOriginalMessage());
        }
        request.validate();

        TaskResolution result = taskService.completeTask(taskId, request.parsedResolution(), request.detail(),
                request.resolvedBy());

        if (!result.isSuccess()) {
            HttpResponseStatus status = switch (result.errorCode()) {
                case TASK_NOT_FOUND -> HttpResponseStatus.NOT_FOUND;
                case NOT_RESOLVABLE -> HttpResponseStatus.CONFLICT;
                case INVALID_REQUEST -> HttpResponseStatus.BAD_REQUEST;
                default -> HttpResponseStatus.INTERNAL_SERVER_ERROR;
            };
            return errorResponse(status, result.errorCode(), result.message());
        }

        return ControllerResponse.ok(CompleteTaskResponse.from(result, clock.instant()));
    }

    private static ControllerResponse errorResponse(HttpResponseStatus status, ErrorCode code, String message) {
        return ControllerResponse.of(status, ErrorResponse.of(code, message));
    }

    private static String param(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }

    private static boolean parseBoolean(String name, String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "1" -> true;
            case "false", "0" -> false;
            default -> throw new IllegalArgumentException(name + " must be true or false: " + value);
        };
    }
}
