package agentmesh.coordinator.registry;

import agentmesh.coordinator.event.AgentEvent;
import agentmesh.coordinator.event.AgentEventType;
import agentmesh.coordinator.event.EventBus;
import agentmesh.coordinator.model.AgentDescriptor;
import agentmesh.coordinator.model.CapabilityCandidate;
import agentmesh.coordinator.model.HealthStatus;
import agentmesh.coordinator.model.RegistryStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of known agents with capability and tag indices.
 *
 * Writers take the write lock for the whole upsert (old index entries out,
 * new ones in), so readers never see an agent half-indexed. Descriptors are
 * immutable; health updates replace the stored instance.
 */
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, AgentDescriptor> agents = new HashMap<>();
    // capability -> agentId -> declared confidence; sorted for deterministic reads
    private final Map<String, TreeMap<String, Double>> capabilityIndex = new HashMap<>();
    private final Map<String, TreeSet<String>> tagIndex = new HashMap<>();

    private final EventBus eventBus;
    private final Clock clock;
    private final double latencyEmaWeight;

    public CapabilityRegistry(EventBus eventBus, Clock clock, double latencyEmaWeight) {
        if (latencyEmaWeight <= 0.0 || latencyEmaWeight > 1.0) {
            throw new IllegalArgumentException("latencyEmaWeight must be within (0, 1]");
        }
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.latencyEmaWeight = latencyEmaWeight;
    }

    /**
     * Register or replace an agent. A replaced agent loses its old capability
     * set and tags, and its health goes back to UNKNOWN until the next probe.
     */
    public AgentDescriptor register(AgentDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        AgentDescriptor stored = descriptor.toBuilder()
                .healthStatus(HealthStatus.UNKNOWN)
                .lastProbeTime(null)
                .avgResponseTimeMs(null)
                .registeredAt(clock.instant())
                .build();

        boolean replaced;
        lock.writeLock().lock();
        try {
            AgentDescriptor previous = agents.put(stored.agentId(), stored);
            replaced = previous != null;
            if (replaced) {
                unindex(previous);
            }
            index(stored);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("{} agent {} with capabilities {}", replaced ? "Re-registered" : "Registered",
                stored.agentId(), stored.capabilities().keySet());
        eventBus.publish(new AgentEvent(AgentEventType.REGISTERED, stored.agentId(), HealthStatus.UNKNOWN, null,
                stored.registeredAt()));
        return stored;
    }

    /**
     * Remove an agent and its index entries.
     *
     * @return false if the agent was not registered
     */
    public boolean deregister(String agentId) {
        AgentDescriptor removed;
        lock.writeLock().lock();
        try {
            removed = agents.remove(agentId);
            if (removed != null) {
                unindex(removed);
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (removed == null) {
            log.debug("Deregister of unknown agent {} ignored", agentId);
            return false;
        }
        log.info("Deregistered agent {}", agentId);
        eventBus.publish(new AgentEvent(AgentEventType.DEREGISTERED, agentId, removed.healthStatus(), null,
                clock.instant()));
        return true;
    }

    /**
     * All agents declaring a capability, ordered by agent id.
     */
    public List<CapabilityCandidate> findByCapability(String capabilityId) {
        lock.readLock().lock();
        try {
            TreeMap<String, Double> entries = capabilityIndex.get(capabilityId);
            if (entries == null) {
                return List.of();
            }
            List<CapabilityCandidate> result = new ArrayList<>(entries.size());
            for (Map.Entry<String, Double> e : entries.entrySet()) {
                result.add(new CapabilityCandidate(agents.get(e.getKey()), e.getValue()));
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * All agents carrying a tag, ordered by agent id.
     */
    public List<AgentDescriptor> findByTag(String tag) {
        lock.readLock().lock();
        try {
            TreeSet<String> ids = tagIndex.get(tag);
            if (ids == null) {
                return List.of();
            }
            List<AgentDescriptor> result = new ArrayList<>(ids.size());
            for (String id : ids) {
                result.add(agents.get(id));
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<AgentDescriptor> find(String agentId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(agents.get(agentId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of all agents, ordered by agent id.
     */
    public List<AgentDescriptor> listAgents() {
        lock.readLock().lock();
        try {
            List<AgentDescriptor> result = new ArrayList<>(agents.values());
            result.sort((a, b) -> a.agentId().compareTo(b.agentId()));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Record a probe outcome. The latency average is an exponential moving
     * average seeded by the first sample; a null sample leaves it unchanged.
     * The update is dropped when {@code registeredAt} is non-null and no
     * longer matches the agent's registration.
     *
     * @return false if the agent is unknown or the registration has changed
     */
    public boolean updateHealth(String agentId, Instant registeredAt, HealthStatus status, Double latencySampleMs) {
        Objects.requireNonNull(status, "status");
        Instant now = clock.instant();
        HealthStatus previous;

        lock.writeLock().lock();
        try {
            AgentDescriptor current = agents.get(agentId);
            if (current == null) {
                return false;
            }
            if (registeredAt != null && !registeredAt.equals(current.registeredAt())) {
                log.debug("Dropped health update for agent {} from an earlier registration", agentId);
                return false;
            }
            previous = current.healthStatus();
            Double avg = current.avgResponseTimeMs();
            if (latencySampleMs != null) {
                avg = avg == null
                        ? latencySampleMs
                        : latencyEmaWeight * latencySampleMs + (1.0 - latencyEmaWeight) * avg;
            }
            agents.put(agentId, current.toBuilder()
                    .healthStatus(status)
                    .lastProbeTime(now)
                    .avgResponseTimeMs(avg)
                    .build());
        } finally {
            lock.writeLock().unlock();
        }

        if (previous != status) {
            eventBus.publish(new AgentEvent(AgentEventType.HEALTH_CHANGED, agentId, status, previous, now));
        }
        return true;
    }

    public RegistryStats stats() {
        lock.readLock().lock();
        try {
            Map<HealthStatus, Integer> byHealth = new EnumMap<>(HealthStatus.class);
            for (HealthStatus s : HealthStatus.values()) {
                byHealth.put(s, 0);
            }
            for (AgentDescriptor a : agents.values()) {
                byHealth.merge(a.healthStatus(), 1, Integer::sum);
            }
            Map<String, Integer> coverage = new LinkedHashMap<>();
            new TreeMap<>(capabilityIndex).forEach((cap, ids) -> coverage.put(cap, ids.size()));
            return new RegistryStats(agents.size(), byHealth, capabilityIndex.size(), coverage);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return agents.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // caller holds the write lock
    private void index(AgentDescriptor agent) {
        agent.capabilities().forEach((cap, confidence) -> capabilityIndex
                .computeIfAbsent(cap, k -> new TreeMap<>())
                .put(agent.agentId(), confidence));
        for (String tag : agent.tags()) {
            tagIndex.computeIfAbsent(tag, k -> new TreeSet<>()).add(agent.agentId());
        }
    }

    // caller holds the write lock
    private void unindex(AgentDescriptor agent) {
        for (String cap : agent.capabilities().keySet()) {
            TreeMap<String, Double> entries = capabilityIndex.get(cap);
            if (entries != null) {
                entries.remove(agent.agentId());
                if (entries.isEmpty()) {
                    capabilityIndex.remove(cap);
                }
            }
        }
        for (String tag : agent.tags()) {
            TreeSet<String> ids = tagIndex.get(tag);
            if (ids != null) {
                ids.remove(agent.agentId());
                if (ids.isEmpty()) {
                    tagIndex.remove(tag);
                }
            }
        }
    }
}
