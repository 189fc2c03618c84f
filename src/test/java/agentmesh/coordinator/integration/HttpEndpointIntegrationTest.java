package agentmesh.coordinator.integration;

import agentmesh.coordinator.config.CoordinatorConfig;
import agentmesh.coordinator.config.Dependencies;
import agentmesh.coordinator.invoker.InvocationResult;
import agentmesh.coordinator.server.CoordinatorServer;
import agentmesh.coordinator.server.RouterHandler;
import agentmesh.coordinator.testsupport.Await;
import agentmesh.coordinator.testsupport.ScriptedAgentInvoker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints through the Netty server.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int TEST_PORT = 18080;
    private static final String BASE_URL = "http://localhost:" + TEST_PORT;
    private static final String AGENT_KEY = "test-key";

    private ScriptedAgentInvoker invoker;
    private Dependencies deps;
    private CoordinatorServer server;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withAgentKey(AGENT_KEY)
                .withMaxConcurrentTasks(1)
                .withLaneCapacity(1)
                .withRetryDelays(Duration.ofMillis(5), Duration.ofMillis(20));

        invoker = new ScriptedAgentInvoker();
        deps = Dependencies.create(config, invoker);
        server = new CoordinatorServer(deps.routerHandler());
        assertTrue(server.start("127.0.0.1", TEST_PORT), "server should bind");
        deps.start();

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        deps.close();
    }

    // ===== helpers =====

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder(URI.create(BASE_URL + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return httpClient.send(HttpRequest.newBuilder(URI.create(BASE_URL + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> delete(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder(URI.create(BASE_URL + path)).DELETE().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> registerAgent(String agentId, String capability) throws Exception {
        String body = """
                {"agentId": "%s", "endpoint": "http://agents.local/%s", "tags": ["crm"],
                 "capabilities": {"%s": 0.9}}
                """.formatted(agentId, agentId, capability);
        return httpClient.send(HttpRequest.newBuilder(URI.create(BASE_URL + "/internal/v1/agents"))
                .header("Content-Type", "application/json")
                .header(RouterHandler.AGENT_KEY_HEADER, AGENT_KEY)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build(), HttpResponse.BodyHandlers.ofString());
    }

    private String createTask(String json) throws Exception {
        HttpResponse<String> response = post("/api/v1/tasks", json);
        assertEquals(201, response.statusCode(), "Create task should return 201. Body: " + response.body());
        return MAPPER.readTree(response.body()).get("taskId").asText();
    }

    private String state(String taskId) {
        try {
            return MAPPER.readTree(get("/api/v1/tasks/" + taskId).body()).get("state").asText();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    // ===== tests =====

    @Test
    void internalApiRequiresAgentKey() throws Exception {
        HttpResponse<String> denied = post("/internal/v1/agents",
                "{\"agentId\":\"a1\",\"endpoint\":\"e\",\"capabilities\":{\"x\":0.5}}");
        assertEquals(403, denied.statusCode());

        HttpResponse<String> accepted = registerAgent("a1", "x");
        assertEquals(201, accepted.statusCode(), accepted.body());

        JsonNode agent = MAPPER.readTree(get("/api/v1/agents/a1").body());
        assertEquals("a1", agent.get("agentId").asText());

        HttpResponse<String> deleted = httpClient.send(HttpRequest.newBuilder(
                URI.create(BASE_URL + "/internal/v1/agents/a1"))
                .header(RouterHandler.AGENT_KEY_HEADER, AGENT_KEY)
                .DELETE().build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(200, deleted.statusCode());
        assertEquals(404, get("/api/v1/agents/a1").statusCode());
    }

    @Test
    @DisplayName("Full HTTP flow: register agent, submit task, poll until completed")
    void submitAndComplete() throws Exception {
        registerAgent("enricher", "crm.company.enrich");

        String taskId = createTask("""
                {"capabilityId": "crm.company.enrich", "contextId": "deal-1", "priority": "HIGH",
                 "payload": {"domain": "example.com"}}
                """);

        Await.until("task completed", () -> "COMPLETED".equals(state(taskId)));

        JsonNode task = MAPPER.readTree(get("/api/v1/tasks/" + taskId).body());
        assertEquals("ok:" + taskId, task.get("result").asText());
        assertEquals("enricher", task.get("assignedAgent").asText());
        assertEquals("HIGH", task.get("priority").asText());

        JsonNode list = MAPPER.readTree(get("/api/v1/tasks?contextId=deal-1").body());
        assertEquals(1, list.get("count").asInt());

        JsonNode stats = MAPPER.readTree(get("/api/v1/stats").body());
        assertEquals(1, stats.get("tasks").get("totalTasks").asInt());
        assertEquals(1, stats.get("agents").get("totalAgents").asInt());

        JsonNode candidates = MAPPER.readTree(get("/api/v1/capabilities/crm.company.enrich/candidates").body());
        assertEquals("enricher", candidates.get("candidates").get(0).get("agentId").asText());

        JsonNode preferred = MAPPER.readTree(get("/api/v1/capabilities/crm.company.enrich/candidates?tag=crm").body());
        assertEquals(0.1, preferred.get("candidates").get(0).get("preferenceBonus").asDouble(), 1e-9);
    }

    @Test
    void errorStatuses() throws Exception {
        assertEquals(404, get("/api/v1/tasks/does-not-exist").statusCode());
        assertEquals(404, get("/api/v1/nothing-here").statusCode());

        assertEquals(400, post("/api/v1/tasks", "{not json").statusCode());
        assertEquals(400, post("/api/v1/tasks", "{\"capabilityId\":\"x\"}").statusCode());
        assertEquals(400, post("/api/v1/tasks",
                "{\"capabilityId\":\"x\",\"contextId\":\"c\",\"dependsOn\":[\"ghost\"]}").statusCode());

        HttpResponse<String> cycle = post("/api/v1/tasks",
                "{\"taskId\":\"self\",\"capabilityId\":\"x\",\"contextId\":\"c\",\"dependsOn\":[\"self\"]}");
        assertEquals(409, cycle.statusCode());
        assertTrue(cycle.body().contains("cycle"));
    }

    @Test
    void fullLaneAnswers429() throws Exception {
        registerAgent("slow", "x");
        invoker.hold();

        String running = createTask("{\"capabilityId\":\"x\",\"contextId\":\"c\"}");
        Await.until("first task running", () -> "RUNNING".equals(state(running)));
        createTask("{\"capabilityId\":\"x\",\"contextId\":\"c\"}");

        HttpResponse<String> rejected = post("/api/v1/tasks", "{\"capabilityId\":\"x\",\"contextId\":\"c\"}");
        assertEquals(429, rejected.statusCode());

        // a different lane still has room
        createTask("{\"capabilityId\":\"x\",\"contextId\":\"c\",\"priority\":\"urgent\"}");
    }

    @Test
    void cancelAndDependencies() throws Exception {
        registerAgent("worker", "x");
        invoker.hold();

        String first = createTask("{\"taskId\":\"first\",\"capabilityId\":\"x\",\"contextId\":\"c\"}");
        Await.until("first running", () -> "RUNNING".equals(state(first)));
        String second = createTask("{\"taskId\":\"second\",\"capabilityId\":\"x\",\"contextId\":\"c\","
                + "\"priority\":\"urgent\"}");

        // second is still queued behind the only slot
        HttpResponse<String> dep = post("/api/v1/tasks/" + second + "/dependencies", "{\"dependsOn\":\"first\"}");
        assertEquals(200, dep.statusCode(), dep.body());
        assertEquals("BLOCKED", MAPPER.readTree(dep.body()).get("state").asText());

        HttpResponse<String> cycle = post("/api/v1/tasks/" + first + "/dependencies", "{\"dependsOn\":\"second\"}");
        assertEquals(400, cycle.statusCode(), "a dispatched task takes no new dependencies");

        HttpResponse<String> cancel = post("/api/v1/tasks/" + first + "/cancel", "");
        assertEquals(200, cancel.statusCode());
        assertEquals("CANCELLED", MAPPER.readTree(cancel.body()).get("result").asText());
        assertEquals("CANCELLED", state(second));

        HttpResponse<String> again = post("/api/v1/tasks/" + first + "/cancel", "");
        assertEquals("ALREADY_TERMINAL", MAPPER.readTree(again.body()).get("result").asText());
    }

    @Test
    void removingTheLastDependencyReleasesTheTask() throws Exception {
        registerAgent("worker", "x");
        invoker.hold();

        String first = createTask("{\"taskId\":\"first\",\"capabilityId\":\"x\",\"contextId\":\"c\"}");
        Await.until("first running", () -> "RUNNING".equals(state(first)));
        createTask("{\"taskId\":\"second\",\"capabilityId\":\"x\",\"contextId\":\"c\","
                + "\"priority\":\"urgent\",\"dependsOn\":[\"first\"]}");
        assertEquals("BLOCKED", state("second"));

        HttpResponse<String> removed = delete("/api/v1/tasks/second/dependencies/first");
        assertEquals(200, removed.statusCode(), removed.body());
        JsonNode task = MAPPER.readTree(removed.body());
        assertEquals("QUEUED", task.get("state").asText());
        assertEquals(0, task.get("dependencies").size());

        assertEquals(404, delete("/api/v1/tasks/ghost/dependencies/first").statusCode());
        assertEquals(400, delete("/api/v1/tasks/first/dependencies/second").statusCode(),
                "a dispatched task keeps its dependency set");
    }

    @Test
    void eventStreamEndsWithTerminalEvent() throws Exception {
        registerAgent("worker", "x");
        invoker.hold();
        String taskId = createTask("{\"capabilityId\":\"x\",\"contextId\":\"c\"}");
        Await.until("task running", () -> "RUNNING".equals(state(taskId)));

        int listenersBefore = deps.eventBus().listenerCount();
        CompletableFuture<HttpResponse<String>> stream = httpClient.sendAsync(
                HttpRequest.newBuilder(URI.create(BASE_URL + "/api/v1/tasks/" + taskId + "/events")).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        Await.until("stream subscribed", () -> deps.eventBus().listenerCount() > listenersBefore);

        invoker.held().get(0).complete(InvocationResult.ok("streamed"));

        HttpResponse<String> response = stream.get(10, TimeUnit.SECONDS);
        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("content-type").orElse("").startsWith("text/event-stream"));
        String body = response.body();
        assertTrue(body.startsWith("event: snapshot\n"), body);
        assertTrue(body.contains("event: completed\n"), body);
        assertTrue(body.contains("\"state\":\"COMPLETED\""), body);

        assertEquals(404, get("/api/v1/tasks/missing/events").statusCode());
    }

    @Test
    void healthEndpoint() throws Exception {
        registerAgent("a1", "x");

        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode());
        JsonNode health = MAPPER.readTree(response.body());
        assertEquals("healthy", health.get("status").asText());
        assertEquals(1, health.get("agents").asInt());
    }
}
