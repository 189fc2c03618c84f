package agentmesh.coordinator.model;

import agentmesh.coordinator.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AgentDescriptorTest {

    @Test
    void defaults() {
        AgentDescriptor agent = AgentDescriptor.builder()
                .agentId("A1")
                .endpoint("http://a1:9000")
                .capability("x", 0.9)
                .build();

        assertEquals("A1", agent.name());
        assertEquals("1.0.0", agent.version());
        assertEquals(HealthStatus.UNKNOWN, agent.healthStatus());
        assertNull(agent.avgResponseTimeMs());
        assertTrue(agent.declares("x"));
        assertFalse(agent.declares("y"));
        assertEquals(0.9, agent.confidenceFor("x"), 1e-9);
    }

    @Test
    void rejectsConfidenceOutsideUnitInterval() {
        assertThrows(ValidationException.class, () -> AgentDescriptor.builder()
                .agentId("A1").capability("x", 1.2).build());
        assertThrows(ValidationException.class, () -> AgentDescriptor.builder()
                .agentId("A1").capability("x", -0.1).build());
    }

    @Test
    void rejectsBlankAgentId() {
        assertThrows(ValidationException.class, () -> AgentDescriptor.builder().agentId(" ").build());
    }

    @Test
    void capabilitiesAreImmutable() {
        AgentDescriptor agent = AgentDescriptor.builder().agentId("A1").capability("x", 0.5).build();
        assertThrows(UnsupportedOperationException.class, () -> agent.capabilities().put("y", 0.1));
    }
}
