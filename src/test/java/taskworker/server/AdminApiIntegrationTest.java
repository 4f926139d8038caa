package taskworker.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import taskworker.MutableClock;
import taskworker.TaskWorker;
import taskworker.config.WorkerConfig;
import taskworker.registry.TaskSignature;
import taskworker.scheduler.ExecutionScope;
import taskworker.scheduler.SimulatedSchedulingEngine;
import taskworker.trigger.CronSchedule;
import org.junit.jupiter.api.*;

import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Admin API over a real socket, with time driven by a simulated engine.
 */
class AdminApiIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final String KEY = "test-key";

    private MutableClock clock;
    private SimulatedSchedulingEngine engine;
    private TaskWorker worker;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        clock = new MutableClock(T0);
        engine = new SimulatedSchedulingEngine(clock);
        worker = new TaskWorker(clock, ExecutionScope.direct(), engine);
        worker.init(WorkerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-admin-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withAdminPort(port)
                .withAdminKey(KEY));

        worker.defineTask("send_email", TaskSignature.of("to", "subject"), args -> {
            if ("bounce@x.com".equals(args.get("to"))) {
                throw new IllegalStateException("mailbox unavailable");
            }
            return "sent";
        });
        worker.defineCronTask("heartbeat", CronSchedule.create().second("*/5"), () -> "alive");
        worker.start();

        baseUrl = "http://127.0.0.1:" + worker.adminServer().boundPort();
        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        worker.shutdown();
    }

    @Test
    void health() throws Exception {
        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode(), response.body());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("healthy", body.get("status").asText());
        assertEquals("H2", body.get("backend").asText());
        assertEquals(0, body.get("jobs").get("PENDING").asInt());
    }

    @Test
    void listTasks() throws Exception {
        JsonNode body = MAPPER.readTree(get("/api/v1/tasks").body());

        JsonNode task = body.get("tasks").get(0);
        assertEquals("send_email", task.get("name").asText());
        assertEquals(2, task.get("required").size());
    }

    @Test
    void applyRequiresAdminKey() throws Exception {
        HttpResponse<String> response = httpClient.send(
                HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + "/api/v1/tasks/send_email/apply"))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString("{\"to\":\"a@x.com\",\"subject\":\"hi\"}"))
                        .build(),
                HttpResponse.BodyHandlers.ofString());

        assertEquals(403, response.statusCode());
        assertEquals("forbidden", MAPPER.readTree(response.body()).get("error").asText());
        assertEquals(0, worker.jobStore().findRecent(10).size());
    }

    @Test
    @DisplayName("Apply via HTTP, run on the next tick, inspect the job")
    void applyRunAndInspect() throws Exception {
        HttpResponse<String> applied = post("/api/v1/tasks/send_email/apply?delay=3",
                "{\"to\":\"a@x.com\",\"subject\":\"hi\"}");

        assertEquals(201, applied.statusCode(), applied.body());
        JsonNode created = MAPPER.readTree(applied.body());
        assertTrue(created.get("success").asBoolean());
        String jobId = created.get("jobId").asText();
        assertEquals("2024-01-01T00:00:03Z", created.get("scheduledDate").asText());

        JsonNode pending = MAPPER.readTree(get("/api/v1/jobs/" + jobId).body());
        assertEquals("PENDING", pending.get("status").asText());
        assertEquals("a@x.com", pending.get("payload").get("to").asText());

        engine.advance(Duration.ofSeconds(5));

        JsonNode done = MAPPER.readTree(get("/api/v1/jobs/" + jobId).body());
        assertEquals("COMPLETED", done.get("status").asText());
        assertEquals("sent", done.get("result").asText());

        JsonNode list = MAPPER.readTree(get("/api/v1/jobs?status=completed").body());
        assertEquals(1, list.get("count").asInt());
        assertEquals(jobId, list.get("jobs").get(0).get("jobId").asText());
    }

    @Test
    void applyRejectsUnknownTaskAndBadPayload() throws Exception {
        assertEquals(404, post("/api/v1/tasks/nope/apply", "{}").statusCode());

        HttpResponse<String> missing = post("/api/v1/tasks/send_email/apply", "{\"to\":\"a@x.com\"}");
        assertEquals(400, missing.statusCode());
        assertTrue(missing.body().contains("subject"));

        assertEquals(400, post("/api/v1/tasks/send_email/apply", "[1,2]").statusCode());
        assertEquals(400, post("/api/v1/tasks/send_email/apply?at=tomorrow",
                "{\"to\":\"a\",\"subject\":\"s\"}").statusCode());
    }

    @Test
    void resubmitFailedJob() throws Exception {
        String jobId = MAPPER.readTree(post("/api/v1/tasks/send_email/apply",
                "{\"to\":\"bounce@x.com\",\"subject\":\"hi\"}").body()).get("jobId").asText();
        engine.advance(Duration.ofSeconds(5));

        JsonNode failed = MAPPER.readTree(get("/api/v1/jobs/" + jobId).body());
        assertEquals("FAILED", failed.get("status").asText());
        assertEquals("mailbox unavailable", failed.get("failMessage").asText());

        HttpResponse<String> resubmitted = post("/api/v1/jobs/" + jobId + "/resubmit", "");
        assertEquals(200, resubmitted.statusCode(), resubmitted.body());
        assertEquals("PENDING", MAPPER.readTree(resubmitted.body()).get("status").asText());

        assertEquals(409, post("/api/v1/jobs/" + jobId + "/resubmit", "").statusCode());
        assertEquals(404, post("/api/v1/jobs/missing/resubmit", "").statusCode());
    }

    @Test
    void executions() throws Exception {
        engine.advance(Duration.ofSeconds(11));

        JsonNode body = MAPPER.readTree(get("/api/v1/executions?task=heartbeat&limit=1").body());

        assertEquals(1, body.get("count").asInt());
        assertEquals(2, body.get("total").asInt());
        JsonNode latest = body.get("executions").get(0);
        assertEquals("CRON", latest.get("trigger").asText());
        assertEquals("alive", latest.get("output").asText());
        assertEquals("2024-01-01T00:00:10Z", latest.get("startedAt").asText());
    }

    @Test
    void badLimitAndUnknownPaths() throws Exception {
        HttpResponse<String> badLimit = get("/api/v1/executions?limit=0");
        assertEquals(400, badLimit.statusCode());
        assertEquals("limit must be between 1 and 500", MAPPER.readTree(badLimit.body()).get("error").asText());
        assertEquals(404, get("/api/v1/jobs/missing").statusCode());
        assertEquals(404, get("/api/v2/jobs").statusCode());
        assertEquals(404, get("/").statusCode());
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
                        .header(RouterHandler.KEY_HEADER, KEY)
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }
}
