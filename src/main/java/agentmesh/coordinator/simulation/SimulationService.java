package agentmesh.coordinator.simulation;

import agentmesh.coordinator.model.AgentDescriptor;
import agentmesh.coordinator.registry.CapabilityRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Registers simulated agents served by a {@link SimulatedAgentInvoker}.
 * Call start() to register N agents, stop() to deregister them all.
 */
public final class SimulationService {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    public static final String SIMULATED_TAG = "simulated";

    private final CapabilityRegistry registry;
    private final List<String> agentIds = new ArrayList<>();
    private volatile boolean running;

    public SimulationService(CapabilityRegistry registry) {
        this.registry = registry;
    }

    /**
     * Register agents {@code sim-1 .. sim-N}, each declaring every given
     * capability. Confidence steps down from 0.9 so routing has a favourite.
     */
    public synchronized void start(int agents, List<String> capabilities) {
        if (running) {
            log.warn("Simulation already running");
            return;
        }
        if (capabilities.isEmpty()) {
            throw new IllegalArgumentException("at least one capability is required");
        }

        agentIds.clear();
        for (int i = 1; i <= agents; i++) {
            String agentId = "sim-" + i;
            double confidence = Math.max(0.5, 0.9 - 0.05 * (i - 1));
            AgentDescriptor.Builder builder = AgentDescriptor.builder()
                    .agentId(agentId)
                    .name("Simulated agent " + i)
                    .endpoint("sim://" + agentId)
                    .tag(SIMULATED_TAG);
            for (String capability : capabilities) {
                builder.capability(capability, confidence);
            }
            registry.register(builder.build());
            agentIds.add(agentId);
        }

        running = true;
        log.info("Simulation started: {} agents for {}", agents, capabilities);
    }

    /**
     * Deregister every simulated agent.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        for (String id : agentIds) {
            registry.deregister(id);
        }
        agentIds.clear();
        log.info("Simulation stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized List<String> agentIds() {
        return List.copyOf(agentIds);
    }
}
