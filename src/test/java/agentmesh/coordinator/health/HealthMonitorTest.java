package agentmesh.coordinator.health;

import agentmesh.coordinator.config.CoordinatorConfig;
import agentmesh.coordinator.event.AgentEvent;
import agentmesh.coordinator.event.AgentEventType;
import agentmesh.coordinator.event.EventBus;
import agentmesh.coordinator.event.Subscription;
import agentmesh.coordinator.invoker.HealthSample;
import agentmesh.coordinator.model.AgentDescriptor;
import agentmesh.coordinator.model.HealthStatus;
import agentmesh.coordinator.registry.CapabilityRegistry;
import agentmesh.coordinator.testsupport.MutableClock;
import agentmesh.coordinator.testsupport.ScriptedAgentInvoker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Probe cycles are driven by hand against a {@link MutableClock}; the
 * monitor's own schedule is never started.
 */
class HealthMonitorTest {

    private static final Duration INTERVAL = Duration.ofSeconds(10);

    private EventBus bus;
    private MutableClock clock;
    private CapabilityRegistry registry;
    private ScriptedAgentInvoker invoker;
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        clock = new MutableClock();
        registry = new CapabilityRegistry(bus, clock, 1.0);
        invoker = new ScriptedAgentInvoker();
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withHealthProbeInterval(INTERVAL)
                .withProbeTimeout(Duration.ofMillis(100))
                .withUnreachableAfterFailures(3)
                .withMaxProbeBackoff(Duration.ofMinutes(5));
        monitor = new HealthMonitor(registry, invoker, bus, clock, config);
    }

    @AfterEach
    void tearDown() {
        monitor.close();
        bus.close();
    }

    private void register(String agentId) throws InterruptedException {
        registry.register(AgentDescriptor.builder().agentId(agentId).capability("x", 0.9).build());
        // the monitor resets probe state on the registration event
        assertTrue(bus.flush(Duration.ofSeconds(5)));
    }

    private void cycle() throws Exception {
        monitor.runProbeCycle().get(5, TimeUnit.SECONDS);
    }

    private HealthStatus health(String agentId) {
        return registry.find(agentId).orElseThrow().healthStatus();
    }

    @Test
    void successfulProbeMarksHealthyAndRecordsLatency() throws Exception {
        register("A1");
        invoker.probeHealthy("A1", Duration.ofMillis(42));

        cycle();

        AgentDescriptor agent = registry.find("A1").orElseThrow();
        assertEquals(HealthStatus.HEALTHY, agent.healthStatus());
        assertEquals(42.0, agent.avgResponseTimeMs(), 1e-9);
        assertEquals(clock.instant(), agent.lastProbeTime());
        assertEquals(0, monitor.consecutiveFailures("A1"));
    }

    @Test
    @DisplayName("Failures degrade, then mark unreachable, with growing probe intervals")
    void failuresEscalateWithBackoff() throws Exception {
        register("A1");
        invoker.probeUnhealthy("A1");
        Instant start = clock.instant();

        cycle();
        assertEquals(HealthStatus.DEGRADED, health("A1"));
        assertEquals(1, monitor.consecutiveFailures("A1"));
        assertEquals(start.plus(INTERVAL.multipliedBy(2)), monitor.nextProbeAt("A1"));

        // not due yet
        cycle();
        assertEquals(1, invoker.probesOf("A1"));

        clock.advance(Duration.ofSeconds(20));
        cycle();
        assertEquals(2, invoker.probesOf("A1"));
        assertEquals(HealthStatus.DEGRADED, health("A1"));
        assertEquals(clock.instant().plus(INTERVAL.multipliedBy(4)), monitor.nextProbeAt("A1"));

        clock.advance(Duration.ofSeconds(40));
        cycle();
        assertEquals(3, monitor.consecutiveFailures("A1"));
        assertEquals(HealthStatus.UNREACHABLE, health("A1"));
    }

    @Test
    void recoveryResetsFailureCount() throws Exception {
        register("A1");
        invoker.probeThrows("A1");
        cycle();
        assertEquals(HealthStatus.DEGRADED, health("A1"));

        invoker.probeHealthy("A1", Duration.ofMillis(5));
        clock.advance(Duration.ofSeconds(20));
        cycle();

        assertEquals(HealthStatus.HEALTHY, health("A1"));
        assertEquals(0, monitor.consecutiveFailures("A1"));
        assertEquals(Instant.MIN, monitor.nextProbeAt("A1"));
    }

    @Test
    void backoffIsCapped() throws Exception {
        register("A1");
        invoker.probeUnhealthy("A1");

        for (int i = 0; i < 8; i++) {
            clock.advance(Duration.ofMinutes(10));
            cycle();
        }

        assertEquals(8, monitor.consecutiveFailures("A1"));
        assertEquals(clock.instant().plus(Duration.ofMinutes(5)), monitor.nextProbeAt("A1"));
    }

    @Test
    void hangingProbeTimesOut() throws Exception {
        register("A1");
        invoker.probeHangs("A1");

        cycle();

        assertEquals(HealthStatus.DEGRADED, health("A1"));
        assertEquals(1, monitor.consecutiveFailures("A1"));
    }

    @Test
    void reRegistrationStartsOver() throws Exception {
        register("A1");
        invoker.probeUnhealthy("A1");
        cycle();
        assertEquals(1, monitor.consecutiveFailures("A1"));

        register("A1");

        assertEquals(0, monitor.consecutiveFailures("A1"));
        assertNull(monitor.nextProbeAt("A1"));
        assertEquals(HealthStatus.UNKNOWN, health("A1"));
    }

    @Test
    void checkStartedBeforeReRegistrationDoesNotOverwriteIt() throws Exception {
        monitor.close();
        monitor = new HealthMonitor(registry, invoker, bus, clock, CoordinatorConfig.defaults()
                .withHealthProbeInterval(INTERVAL)
                .withProbeTimeout(Duration.ofSeconds(5)));
        register("A1");
        CompletableFuture<HealthSample> answer = new CompletableFuture<>();
        invoker.healthCheckAnswers("A1", answer);
        CompletableFuture<Void> recorded = monitor.runProbeCycle();

        // hold the event thread so the monitor has not yet seen the re-registration
        CountDownLatch gate = new CountDownLatch(1);
        Subscription blocker = bus.subscribe(AgentEvent.class, e -> "gate".equals(e.agentId()), e -> {
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
        bus.publishTo(blocker, new AgentEvent(AgentEventType.REGISTERED, "gate", HealthStatus.UNKNOWN, null,
                clock.instant()));
        try {
            clock.advance(Duration.ofSeconds(1));
            registry.register(AgentDescriptor.builder().agentId("A1").capability("x", 0.9).build());

            answer.complete(HealthSample.healthy(Duration.ofMillis(5)));
            recorded.get(5, TimeUnit.SECONDS);

            AgentDescriptor agent = registry.find("A1").orElseThrow();
            assertEquals(HealthStatus.UNKNOWN, agent.healthStatus());
            assertNull(agent.avgResponseTimeMs());
            assertNull(agent.lastProbeTime());
        } finally {
            gate.countDown();
        }
        assertTrue(bus.flush(Duration.ofSeconds(5)));
        assertNull(monitor.nextProbeAt("A1"));
    }

    @Test
    void onlyDueAgentsAreProbed() throws Exception {
        register("good");
        register("bad");
        invoker.probeUnhealthy("bad");

        cycle();
        cycle();

        assertEquals(2, invoker.probesOf("good"));
        assertEquals(1, invoker.probesOf("bad"));
    }

    @Test
    void startAndStop() {
        assertFalse(monitor.isRunning());
        monitor.start();
        assertTrue(monitor.isRunning());
        monitor.stop();
        assertFalse(monitor.isRunning());
    }
}
