package agentmesh.coordinator.health;

import agentmesh.coordinator.config.CoordinatorConfig;
import agentmesh.coordinator.event.AgentEvent;
import agentmesh.coordinator.event.AgentEventType;
import agentmesh.coordinator.event.EventBus;
import agentmesh.coordinator.event.Subscription;
import agentmesh.coordinator.invoker.AgentInvoker;
import agentmesh.coordinator.invoker.HealthSample;
import agentmesh.coordinator.model.AgentDescriptor;
import agentmesh.coordinator.model.HealthStatus;
import agentmesh.coordinator.registry.CapabilityRegistry;
import agentmesh.coordinator.util.ExponentialBackoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background prober that keeps agent health in the registry current.
 *
 * Every cycle probes each agent that is due. A success marks the agent
 * HEALTHY and feeds its latency average. A failure marks it DEGRADED, or
 * UNREACHABLE after {@code unreachableAfterFailures} in a row, and pushes
 * its next probe out by {@code interval * 2^failures} (capped) until it
 * recovers.
 *
 * The monitor only writes to the registry; dispatch never waits on it.
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final CapabilityRegistry registry;
    private final AgentInvoker invoker;
    private final Clock clock;
    private final Duration interval;
    private final Duration probeTimeout;
    private final int unreachableAfterFailures;
    private final ExponentialBackoff backoff;
    private final ScheduledExecutorService executor;
    private final Subscription registrations;

    private final Map<String, ProbeState> states = new ConcurrentHashMap<>();

    private volatile boolean running = false;

    private static final class ProbeState {
        int consecutiveFailures;
        Instant nextProbeAt = Instant.MIN;
        boolean inFlight;
    }

    public HealthMonitor(CapabilityRegistry registry, AgentInvoker invoker, EventBus eventBus, Clock clock,
            CoordinatorConfig config) {
        this.registry = registry;
        this.invoker = invoker;
        this.clock = clock;
        this.interval = config.healthProbeInterval();
        this.probeTimeout = config.probeTimeout();
        this.unreachableAfterFailures = Math.max(1, config.unreachableAfterFailures());
        this.backoff = new ExponentialBackoff(interval, config.maxProbeBackoff());
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agentmesh-health");
            t.setDaemon(true);
            return t;
        });
        // a re-registered agent starts over with a clean failure count
        this.registrations = eventBus.subscribe(AgentEvent.class,
                e -> e.type() == AgentEventType.REGISTERED || e.type() == AgentEventType.DEREGISTERED,
                e -> states.remove(e.agentId()));
    }

    /**
     * Start periodic probing. The first cycle runs immediately.
     */
    public void start() {
        if (running) {
            log.warn("Health monitor already running");
            return;
        }
        running = true;
        executor.scheduleWithFixedDelay(() -> {
            try {
                runProbeCycle();
            } catch (Exception e) {
                log.error("Health probe cycle error", e);
            }
        }, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Health monitor scheduled every {}ms (probe timeout {}ms)", interval.toMillis(),
                probeTimeout.toMillis());
    }

    /**
     * Stop the monitor gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Health monitor forcefully stopped");
            } else {
                log.info("Health monitor stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        registrations.close();
        stop();
        executor.shutdownNow();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Probe every agent that is due now.
     *
     * @return completes once every probe started by this cycle has been recorded
     */
    public CompletableFuture<Void> runProbeCycle() {
        Instant now = clock.instant();
        List<AgentDescriptor> agents = registry.listAgents();
        states.keySet().removeIf(id -> registry.find(id).isEmpty());

        List<CompletableFuture<Void>> pending = new ArrayList<>();
        for (AgentDescriptor agent : agents) {
            ProbeState state = states.computeIfAbsent(agent.agentId(), id -> new ProbeState());
            synchronized (state) {
                if (state.inFlight || now.isBefore(state.nextProbeAt)) {
                    continue;
                }
                state.inFlight = true;
            }
            pending.add(probe(agent, state));
        }

        if (!pending.isEmpty()) {
            log.debug("Probing {} of {} agents", pending.size(), agents.size());
        }
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]));
    }

    /** Consecutive failed probes for an agent, 0 if unknown */
    public int consecutiveFailures(String agentId) {
        ProbeState state = states.get(agentId);
        if (state == null) {
            return 0;
        }
        synchronized (state) {
            return state.consecutiveFailures;
        }
    }

    /** When the agent will next be probed, or null if it has no probe history */
    public Instant nextProbeAt(String agentId) {
        ProbeState state = states.get(agentId);
        if (state == null) {
            return null;
        }
        synchronized (state) {
            return state.nextProbeAt;
        }
    }

    private CompletableFuture<Void> probe(AgentDescriptor agent, ProbeState state) {
        long startedNanos = System.nanoTime();
        CompletableFuture<HealthSample> future;
        try {
            future = invoker.probe(agent, probeTimeout);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future
                .orTimeout(probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((sample, error) -> {
                    double elapsedMs = (System.nanoTime() - startedNanos) / 1_000_000.0;
                    record(agent, state, sample, error, elapsedMs);
                    return null;
                });
    }

    private void record(AgentDescriptor agent, ProbeState state, HealthSample sample, Throwable error,
            double elapsedMs) {
        String agentId = agent.agentId();
        HealthStatus status;
        Double latency = null;
        int failures;

        synchronized (state) {
            state.inFlight = false;
            if (states.get(agentId) != state || !isCurrentRegistration(agent)) {
                // re-registered or removed while the probe was out
                log.debug("Discarded health check of agent {} from an earlier registration", agentId);
                return;
            }
            if (error == null && sample != null && sample.healthy()) {
                state.consecutiveFailures = 0;
                state.nextProbeAt = Instant.MIN;
                status = HealthStatus.HEALTHY;
                latency = sample.latency() != null ? (double) sample.latency().toMillis() : elapsedMs;
            } else {
                state.consecutiveFailures++;
                state.nextProbeAt = clock.instant().plus(backoff.delay(state.consecutiveFailures));
                status = state.consecutiveFailures >= unreachableAfterFailures
                        ? HealthStatus.UNREACHABLE
                        : HealthStatus.DEGRADED;
            }
            failures = state.consecutiveFailures;
        }

        if (!registry.updateHealth(agentId, agent.registeredAt(), status, latency)) {
            log.debug("Agent {} re-registered or removed before its health check was recorded", agentId);
            return;
        }

        if (status == HealthStatus.HEALTHY) {
            log.debug("Agent {} healthy ({}ms)", agentId, latency);
        } else {
            String reason = error != null ? error.toString() : (sample != null ? sample.detail() : "no sample");
            if (status == HealthStatus.UNREACHABLE) {
                log.warn("Agent {} unreachable after {} failed probes: {}", agentId, failures, reason);
            } else {
                log.info("Agent {} degraded ({} failed probes): {}", agentId, failures, reason);
            }
        }
    }

    private boolean isCurrentRegistration(AgentDescriptor agent) {
        return registry.find(agent.agentId())
                .map(current -> Objects.equals(current.registeredAt(), agent.registeredAt()))
                .orElse(false);
    }
}
