package agentmesh.coordinator.simulation;

import agentmesh.coordinator.event.EventBus;
import agentmesh.coordinator.invoker.HealthSample;
import agentmesh.coordinator.invoker.InvocationRequest;
import agentmesh.coordinator.invoker.InvocationResult;
import agentmesh.coordinator.model.AgentDescriptor;
import agentmesh.coordinator.registry.CapabilityRegistry;
import agentmesh.coordinator.registry.CapabilityRouter;
import agentmesh.coordinator.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static agentmesh.coordinator.model.RoutingPreferences.NONE;
import static org.junit.jupiter.api.Assertions.*;

class SimulationServiceTest {

    private EventBus bus;
    private CapabilityRegistry registry;
    private SimulationService simulation;
    private SimulatedAgentInvoker invoker;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        registry = new CapabilityRegistry(bus, new MutableClock(), 0.3);
        simulation = new SimulationService(registry);
        invoker = new SimulatedAgentInvoker(1, 5, 0.0);
    }

    @AfterEach
    void tearDown() {
        invoker.close();
        bus.close();
    }

    private InvocationRequest request(AgentDescriptor agent) {
        return new InvocationRequest("t1", "ctx", "crm.company.enrich", agent, "{}", Map.of(),
                Duration.ofSeconds(1), 1);
    }

    @Test
    void registersAgentsWithDescendingConfidence() {
        simulation.start(3, List.of("crm.company.enrich", "crm.contact.lookup"));

        assertTrue(simulation.isRunning());
        assertEquals(List.of("sim-1", "sim-2", "sim-3"), simulation.agentIds());
        assertEquals(3, registry.findByTag(SimulationService.SIMULATED_TAG).size());
        assertEquals(0.9, registry.find("sim-1").orElseThrow().confidenceFor("crm.contact.lookup"), 1e-9);
        assertEquals(0.8, registry.find("sim-3").orElseThrow().confidenceFor("crm.company.enrich"), 1e-9);

        CapabilityRouter router = new CapabilityRouter(registry, 0.7, 0.3);
        assertEquals("sim-1", router.route("crm.company.enrich", NONE).agentId());
    }

    @Test
    void stopDeregistersEverything() {
        simulation.start(2, List.of("demo.echo"));
        simulation.stop();

        assertFalse(simulation.isRunning());
        assertEquals(0, registry.size());
        assertTrue(simulation.agentIds().isEmpty());
    }

    @Test
    void requiresACapability() {
        assertThrows(IllegalArgumentException.class, () -> simulation.start(1, List.of()));
    }

    @Test
    void invokerCompletesWithJsonOutput() throws Exception {
        simulation.start(1, List.of("crm.company.enrich"));
        AgentDescriptor agent = registry.find("sim-1").orElseThrow();

        InvocationResult result = invoker.invoke(request(agent)).get(5, TimeUnit.SECONDS);

        assertTrue(result.success());
        assertTrue(result.output().contains("\"agent\":\"sim-1\""));
    }

    @Test
    void downAgentFailsProbesAndInvocations() throws Exception {
        simulation.start(1, List.of("crm.company.enrich"));
        AgentDescriptor agent = registry.find("sim-1").orElseThrow();

        invoker.markDown("sim-1");
        HealthSample sample = invoker.probe(agent, Duration.ofSeconds(1)).get(5, TimeUnit.SECONDS);
        InvocationResult result = invoker.invoke(request(agent)).get(5, TimeUnit.SECONDS);

        assertFalse(sample.healthy());
        assertFalse(result.success());

        invoker.markUp("sim-1");
        assertTrue(invoker.probe(agent, Duration.ofSeconds(1)).get(5, TimeUnit.SECONDS).healthy());
    }

    @Test
    void alwaysFailingInvoker() throws Exception {
        try (SimulatedAgentInvoker failing = new SimulatedAgentInvoker(0, 0, 1.0)) {
            simulation.start(1, List.of("crm.company.enrich"));
            CompletableFuture<InvocationResult> f = failing.invoke(request(registry.find("sim-1").orElseThrow()));

            assertFalse(f.get(5, TimeUnit.SECONDS).success());
        }
    }
}
