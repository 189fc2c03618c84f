package agentmesh.coordinator.api.v1.dto;

import agentmesh.coordinator.model.Priority;
import agentmesh.coordinator.model.RoutingPreferences;
import agentmesh.coordinator.model.Task;
import agentmesh.coordinator.model.TaskRequest;
import agentmesh.coordinator.model.TaskState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CreateTaskRequestTest {

    private final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void deserializeFromJson() throws Exception {
        String json = """
                {
                  "taskId": "enrich-1",
                  "capabilityId": "crm.company.enrich",
                  "contextId": "deal-42",
                  "priority": "high",
                  "dependsOn": ["lookup-1"],
                  "timeoutMs": 1500,
                  "maxRetries": 2,
                  "payload": { "domain": "example.com" },
                  "metadata": { "source": "crm" }
                }
                """;

        CreateTaskRequest req = mapper.readValue(json, CreateTaskRequest.class);
        req.validate();
        TaskRequest task = req.toTaskRequest();

        assertEquals("enrich-1", task.taskId());
        assertEquals(Priority.HIGH, task.priority());
        assertEquals(List.of("lookup-1"), task.dependencyList());
        assertEquals(Duration.ofMillis(1500), task.timeout());
        assertEquals(2, task.maxRetries());
        assertEquals("{\"domain\":\"example.com\"}", task.payload());
        assertEquals(Map.of("source", "crm"), task.metadata());
    }

    @Test
    void minimalRequestUsesDefaults() throws Exception {
        CreateTaskRequest req = mapper.readValue("""
                { "capabilityId": "crm.contact.lookup", "contextId": "c1", "payload": "plain text" }
                """, CreateTaskRequest.class);

        TaskRequest task = req.toTaskRequest();

        assertNull(task.taskId());
        assertEquals(Priority.MEDIUM, task.priority());
        assertTrue(task.dependencyList().isEmpty());
        assertNull(task.timeout());
        assertNull(task.maxRetries());
        assertEquals("plain text", task.payload());
    }

    @Test
    void validationErrors() {
        assertThrows(IllegalArgumentException.class,
                () -> new CreateTaskRequest(null, null, "c", null, null, null, null, null, null, null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new CreateTaskRequest(null, "cap", " ", null, null, null, null, null, null, null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new CreateTaskRequest(null, "cap", "c", "someday", null, null, null, null, null, null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new CreateTaskRequest(null, "cap", "c", null, null, 0L, null, null, null, null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new CreateTaskRequest(null, "cap", "c", null, null, null, -1, null, null, null).validate());
    }

    @Test
    void nullEntriesAreRejectedAsBadRequest() throws Exception {
        CreateTaskRequest nullDependency = mapper.readValue("""
                { "capabilityId": "cap", "contextId": "c", "dependsOn": [null] }
                """, CreateTaskRequest.class);
        CreateTaskRequest nullMetadata = mapper.readValue("""
                { "capabilityId": "cap", "contextId": "c", "metadata": { "k": null } }
                """, CreateTaskRequest.class);
        CreateTaskRequest nullTag = mapper.readValue("""
                { "capabilityId": "cap", "contextId": "c", "routing": { "tags": [null] } }
                """, CreateTaskRequest.class);

        assertThrows(IllegalArgumentException.class, nullDependency::validate);
        assertThrows(IllegalArgumentException.class, nullMetadata::validate);
        assertThrows(IllegalArgumentException.class, nullTag::validate);
    }

    @Test
    void routingPreferencesReachTheTaskRequest() throws Exception {
        CreateTaskRequest req = mapper.readValue("""
                {
                  "capabilityId": "crm.company.enrich",
                  "contextId": "deal-42",
                  "routing": { "tags": ["eu", "premium"], "version": "2.1.0" }
                }
                """, CreateTaskRequest.class);
        req.validate();

        RoutingPreferences routing = req.toTaskRequest().routing();

        assertEquals(Set.of("eu", "premium"), routing.tags());
        assertEquals("2.1.0", routing.version());
        assertSame(RoutingPreferences.NONE, new CreateTaskRequest(null, "cap", "c", null, null, null, null, null,
                null, null).toTaskRequest().routing());
    }

    @Test
    void taskResponseSerialization() throws Exception {
        Task task = Task.builder()
                .id("t1")
                .contextId("c1")
                .capabilityId("crm.company.enrich")
                .priority(Priority.URGENT)
                .state(TaskState.QUEUED)
                .maxRetries(3)
                .timeout(Duration.ofSeconds(30))
                .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();

        JsonNode node = mapper.readTree(mapper.writeValueAsString(TaskResponse.from(task)));

        assertEquals("t1", node.get("taskId").asText());
        assertEquals("URGENT", node.get("priority").asText());
        assertEquals("QUEUED", node.get("state").asText());
        assertEquals(30000, node.get("timeoutMs").asLong());
        assertEquals("2024-01-01T00:00:00Z", node.get("createdAt").asText());
        assertFalse(node.has("result"));
        assertFalse(node.has("error"));
    }
}
