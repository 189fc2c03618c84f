package agentmesh.coordinator.api.internal.v1.dto;

import agentmesh.coordinator.error.ValidationException;
import agentmesh.coordinator.model.AgentDescriptor;
import agentmesh.coordinator.model.HealthStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RegisterAgentRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void deserializeAndConvert() throws Exception {
        String json = """
                {
                  "agentId": "enricher-1",
                  "name": "Company enricher",
                  "endpoint": "http://10.0.0.5:9000",
                  "version": "2.1.0",
                  "tags": ["crm", "eu"],
                  "capabilities": { "crm.company.enrich": 0.9, "crm.contact.lookup": 0.4 }
                }
                """;

        RegisterAgentRequest req = mapper.readValue(json, RegisterAgentRequest.class);
        req.validate();
        AgentDescriptor agent = req.toDescriptor();

        assertEquals("enricher-1", agent.agentId());
        assertEquals("Company enricher", agent.name());
        assertEquals("2.1.0", agent.version());
        assertEquals(Set.of("crm", "eu"), agent.tags());
        assertEquals(0.9, agent.confidenceFor("crm.company.enrich"), 1e-9);
        assertEquals(HealthStatus.UNKNOWN, agent.healthStatus());
    }

    @Test
    void nameDefaultsToId() {
        RegisterAgentRequest req = new RegisterAgentRequest("a1", null, "sim://a1", null, null,
                Map.of("x", 0.5));

        AgentDescriptor agent = req.toDescriptor();

        assertEquals("a1", agent.name());
        assertEquals("1.0.0", agent.version());
        assertTrue(agent.tags().isEmpty());
    }

    @Test
    void validation() {
        assertThrows(IllegalArgumentException.class,
                () -> new RegisterAgentRequest(" ", null, "e", null, null, Map.of("x", 0.5)).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new RegisterAgentRequest("a", null, null, null, null, Map.of("x", 0.5)).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new RegisterAgentRequest("a", null, "e", null, List.of(), Map.of()).validate());
    }

    @Test
    void confidenceOutOfRangeRejectedByDescriptor() {
        RegisterAgentRequest req = new RegisterAgentRequest("a", null, "e", null, null, Map.of("x", 1.5));
        req.validate();

        assertThrows(ValidationException.class, req::toDescriptor);
    }

    @Test
    void operationResponseShapes() throws Exception {
        String ok = mapper.writeValueAsString(OperationResponse.success("a1"));
        String missing = mapper.writeValueAsString(OperationResponse.agentNotFound("a2"));

        assertTrue(ok.contains("\"ok\":true"));
        assertTrue(missing.contains("\"ok\":false"));
        assertTrue(missing.contains("agent_not_found"));
    }
}
