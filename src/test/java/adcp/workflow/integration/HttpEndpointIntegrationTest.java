package adcp.workflow.integration;

import adcp.workflow.model.TaskStatus;
import adcp.workflow.operation.ActionDetailsBuilders;
import adcp.workflow.operation.CreateMediaBuyOperation;
import adcp.workflow.server.WorkflowHttpServer;
import adcp.workflow.testing.Fixtures;
import adcp.workflow.testing.TestEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static adcp.workflow.testing.TestEngine.REVIEWED_TENANT;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits the HTTP endpoints of a running server.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TestEngine engine;
    private WorkflowHttpServer server;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        engine = new TestEngine("http");
        server = new WorkflowHttpServer(engine.deps.routerHandler());
        int port = server.start("127.0.0.1", 0);
        baseUrl = "http://127.0.0.1:" + port;

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        engine.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private String deferredCreate() {
        return engine.deps.interceptor()
                .intercept(REVIEWED_TENANT, "principal-1", Fixtures.createMediaBuy()).taskId();
    }

    @Test
    void health() throws Exception {
        deferredCreate();

        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("healthy", body.get("status").asText());
        assertEquals("ok", body.get("database").asText());
        assertEquals(1, body.get("pending_tasks").asInt());
    }

    @Test
    @DisplayName("Listing defaults to pending tasks and filters on tenant and overdue")
    void listTasks() throws Exception {
        String taskId = deferredCreate();

        JsonNode pending = MAPPER.readTree(get("/api/v1/tasks?tenant_id=" + REVIEWED_TENANT).body());
        assertEquals(1, pending.get("count").asInt());
        JsonNode task = pending.get("tasks").get(0);
        assertEquals(taskId, task.get("task_id").asText());
        assertEquals("pending_approval", task.get("status").asText());
        assertEquals("create_media_buy", task.get("action_details").get("action_type").asText());

        assertEquals(0, MAPPER.readTree(get("/api/v1/tasks?tenant_id=other").body()).get("count").asInt());
        assertEquals(0, MAPPER.readTree(get("/api/v1/tasks?overdue=true").body()).get("count").asInt());

        engine.clock.advance(Duration.ofHours(5));
        JsonNode overdue = MAPPER.readTree(get("/api/v1/tasks?overdue=true").body());
        assertEquals(1, overdue.get("count").asInt());
        assertTrue(overdue.get("tasks").get(0).get("overdue").asBoolean());
    }

    @Test
    void listRejectsBadFilters() throws Exception {
        assertEquals(400, get("/api/v1/tasks?status=sleeping").statusCode());
        assertEquals(400, get("/api/v1/tasks?overdue=maybe").statusCode());
    }

    @Test
    void getTask() throws Exception {
        String taskId = deferredCreate();

        HttpResponse<String> found = get("/api/v1/tasks/" + taskId);
        assertEquals(200, found.statusCode());
        assertEquals(taskId, MAPPER.readTree(found.body()).get("task_id").asText());

        HttpResponse<String> missing = get("/api/v1/tasks/c_missing");
        assertEquals(404, missing.statusCode());
        assertEquals("task_not_found", MAPPER.readTree(missing.body()).get("error_code").asText());
    }

    @Test
    @DisplayName("Approve over HTTP executes the operation; a repeat is a successful duplicate")
    void approveAndRepeat() throws Exception {
        String taskId = deferredCreate();
        String body = """
                {"resolution":"approved","detail":"ok","resolved_by":"alice"}
                """;

        HttpResponse<String> first = post("/api/v1/tasks/" + taskId + "/complete", body);
        assertEquals(200, first.statusCode(), first.body());
        JsonNode firstJson = MAPPER.readTree(first.body());
        assertTrue(firstJson.get("success").asBoolean());
        assertFalse(firstJson.get("duplicate").asBoolean());
        assertEquals("completed", firstJson.get("execution").asText());
        assertEquals("completed", firstJson.get("task").get("status").asText());
        assertEquals(TaskStatus.COMPLETED, engine.status(taskId));

        HttpResponse<String> second = post("/api/v1/tasks/" + taskId + "/complete", """
                {"resolution":"rejected","resolved_by":"bob"}
                """);
        assertEquals(200, second.statusCode());
        JsonNode secondJson = MAPPER.readTree(second.body());
        assertTrue(secondJson.get("duplicate").asBoolean());
        assertEquals("approved", secondJson.get("task").get("resolution").asText());
        assertEquals("alice", secondJson.get("task").get("resolved_by").asText());
        assertEquals(1, engine.adapter.createCalls.get());
    }

    @Test
    void completeValidation() throws Exception {
        String taskId = deferredCreate();
        String path = "/api/v1/tasks/" + taskId + "/complete";

        assertEquals(400, post(path, "").statusCode());
        assertEquals(400, post(path, "{not json").statusCode());
        assertEquals(400, post(path, "{\"resolution\":\"approved\"}").statusCode());
        assertEquals(400, post(path, "{\"resolution\":\"later\",\"resolved_by\":\"a\"}").statusCode());
        assertEquals(TaskStatus.PENDING_APPROVAL, engine.status(taskId));
    }

    @Test
    void completeUnknownTask() throws Exception {
        HttpResponse<String> response = post("/api/v1/tasks/c_missing/complete",
                "{\"resolution\":\"approved\",\"resolved_by\":\"alice\"}");

        assertEquals(404, response.statusCode());
    }

    @Test
    void approvingBackgroundTaskConflicts() throws Exception {
        CreateMediaBuyOperation op = Fixtures.createMediaBuy();
        String backgroundId = engine.deps.taskFactory().createBackgroundTask(REVIEWED_TENANT, "principal-1", null,
                op, "mb_bg", ActionDetailsBuilders.backgroundPolling("mb_bg", op, "x", Duration.ofSeconds(30),
                        Duration.ofMinutes(15)),
                Duration.ofMinutes(15)).id();

        HttpResponse<String> response = post("/api/v1/tasks/" + backgroundId + "/complete",
                "{\"resolution\":\"approved\",\"resolved_by\":\"alice\"}");

        assertEquals(409, response.statusCode());
        assertEquals("not_resolvable", MAPPER.readTree(response.body()).get("error_code").asText());
        assertEquals(TaskStatus.WORKING, engine.status(backgroundId));
    }

    @Test
    void unknownPathIs404() throws Exception {
        assertEquals(404, get("/api/v1/nothing").statusCode());
        assertEquals(404, post("/api/v1/tasks", "{}").statusCode());
    }
}
