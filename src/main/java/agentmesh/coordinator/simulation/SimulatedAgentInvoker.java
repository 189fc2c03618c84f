package agentmesh.coordinator.simulation;

import agentmesh.coordinator.invoker.AgentInvoker;
import agentmesh.coordinator.invoker.HealthSample;
import agentmesh.coordinator.invoker.InvocationRequest;
import agentmesh.coordinator.invoker.InvocationResult;
import agentmesh.coordinator.model.AgentDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * In-process stand-in for remote agents.
 * Each invocation completes after a random delay and fails with probability {@code failRate}.
 * Agents marked down fail their probes and every invocation.
 */
public final class SimulatedAgentInvoker implements AgentInvoker, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SimulatedAgentInvoker.class);

    private final int delayMinMs;
    private final int delayMaxMs;
    private final double failRate;
    private final Set<String> down = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService executor;

    public SimulatedAgentInvoker(int delayMinMs, int delayMaxMs, double failRate) {
        if (delayMinMs < 0 || delayMaxMs < 0) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (failRate < 0.0 || failRate > 1.0) {
            throw new IllegalArgumentException("failRate must be within [0, 1]");
        }
        this.delayMinMs = delayMinMs;
        this.delayMaxMs = delayMaxMs;
        this.failRate = failRate;
        this.executor = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "agentmesh-sim");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<InvocationResult> invoke(InvocationRequest request) {
        String agentId = request.agent().agentId();
        CompletableFuture<InvocationResult> future = new CompletableFuture<>();
        int delay = delayMinMs >= delayMaxMs ? delayMinMs
                : ThreadLocalRandom.current().nextInt(delayMinMs, delayMaxMs);

        ScheduledFuture<?> work = executor.schedule(() -> {
            if (down.contains(agentId)) {
                future.complete(InvocationResult.failed("agent " + agentId + " is down"));
                return;
            }
            boolean shouldFail = failRate > 0 && ThreadLocalRandom.current().nextDouble() < failRate;
            if (shouldFail) {
                log.debug("Sim {} failed task {} attempt {}", agentId, request.taskId(), request.attempt());
                future.complete(InvocationResult.failed("Simulated failure"));
            } else {
                String output = String.format("{\"sim\":true,\"agent\":\"%s\",\"capability\":\"%s\",\"delayMs\":%d}",
                        agentId, request.capabilityId(), delay);
                log.debug("Sim {} completed task {} in {}ms", agentId, request.taskId(), delay);
                future.complete(InvocationResult.ok(output));
            }
        }, delay, TimeUnit.MILLISECONDS);

        // cancellation from the coordinator drops the pending work
        future.whenComplete((r, e) -> {
            if (future.isCancelled()) {
                work.cancel(false);
            }
        });
        return future;
    }

    @Override
    public CompletableFuture<HealthSample> probe(AgentDescriptor agent, Duration timeout) {
        if (down.contains(agent.agentId())) {
            return CompletableFuture.completedFuture(HealthSample.unhealthy("agent is down"));
        }
        long latency = ThreadLocalRandom.current().nextLong(1, Math.max(2, delayMinMs + 1L));
        return CompletableFuture.completedFuture(HealthSample.healthy(Duration.ofMillis(latency)));
    }

    /** Make an agent fail its probes and invocations until {@link #markUp(String)} */
    public void markDown(String agentId) {
        down.add(agentId);
        log.info("Sim agent {} marked down", agentId);
    }

    public void markUp(String agentId) {
        if (down.remove(agentId)) {
            log.info("Sim agent {} marked up", agentId);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
