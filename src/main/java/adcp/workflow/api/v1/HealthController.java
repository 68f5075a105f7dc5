package adcp.workflow.api.v1;

import adcp.workflow.api.Controller;
import adcp.workflow.api.v1.dto.HealthResponse;
import adcp.workflow.scheduler.BackgroundPollerSupervisor;
import adcp.workflow.service.TaskService;
import adcp.workflow.store.Database;
import adcp.workflow.webhook.WebhookDispatcher;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final TaskService taskService;
    private final BackgroundPollerSupervisor supervisor;
    private final WebhookDispatcher webhooks;

    public HealthController(Database database, TaskService taskService, BackgroundPollerSupervisor supervisor,
            WebhookDispatcher webhooks) {
        this.database = database;
        this.taskService = taskService;
        this.supervisor = supervisor;
        this.webhooks = webhooks;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return ControllerResponse.of(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        HealthResponse.unhealthy("connection failed"));
            }

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    taskService.getPendingTasks(null, null, null).size(),
                    supervisor.activeCount(),
                    webhooks.deliveredCount(),
                    webhooks.failedCount());

            return ControllerResponse.ok(response);

        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return ControllerResponse.message(HttpResponseStatus.INTERNAL_SERVER_ERROR,
                    "health check failed: " + e.getMessage());
        }
    }

    private String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
