package agentmesh.coordinator.registry;

import agentmesh.coordinator.error.NoAgentAvailableException;
import agentmesh.coordinator.model.AgentDescriptor;
import agentmesh.coordinator.model.CapabilityCandidate;
import agentmesh.coordinator.model.HealthStatus;
import agentmesh.coordinator.model.RoutingPreferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Picks the best live agent for a capability.
 *
 * <pre>
 * score = confidenceWeight * confidence + latencyWeight * (1 - avgLatency / maxAvgLatency)
 * </pre>
 *
 * HEALTHY and UNKNOWN agents are preferred; DEGRADED agents are only
 * considered when no preferred agent exists; UNREACHABLE agents never are.
 * Ties go to the lexicographically smallest agent id. Every call reads the
 * registry afresh, nothing is cached.
 *
 * <p>{@link RoutingPreferences} add a fixed bonus on top of the score: one
 * for sharing a preferred tag, one for running the preferred version.
 */
public class CapabilityRouter {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRouter.class);

    private static final Set<HealthStatus> PREFERRED = EnumSet.of(HealthStatus.HEALTHY, HealthStatus.UNKNOWN);
    private static final Set<HealthStatus> FALLBACK = EnumSet.of(HealthStatus.HEALTHY, HealthStatus.UNKNOWN,
            HealthStatus.DEGRADED);

    private static final Comparator<ScoredCandidate> BEST_FIRST = Comparator
            .comparingDouble(ScoredCandidate::score).reversed()
            .thenComparing(ScoredCandidate::agentId);

    static final double DEFAULT_TAG_BONUS = 0.1;
    static final double DEFAULT_VERSION_BONUS = 0.05;

    private final CapabilityRegistry registry;
    private final double confidenceWeight;
    private final double latencyWeight;
    private final double tagBonus;
    private final double versionBonus;

    public CapabilityRouter(CapabilityRegistry registry, double confidenceWeight, double latencyWeight) {
        this(registry, confidenceWeight, latencyWeight, DEFAULT_TAG_BONUS, DEFAULT_VERSION_BONUS);
    }

    public CapabilityRouter(CapabilityRegistry registry, double confidenceWeight, double latencyWeight,
            double tagBonus, double versionBonus) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.confidenceWeight = confidenceWeight;
        this.latencyWeight = latencyWeight;
        this.tagBonus = tagBonus;
        this.versionBonus = versionBonus;
    }

    /**
     * @throws NoAgentAvailableException if no HEALTHY, UNKNOWN or DEGRADED agent declares the capability
     */
    public AgentDescriptor route(String capabilityId, RoutingPreferences preferences) {
        List<CapabilityCandidate> all = registry.findByCapability(capabilityId);
        List<ScoredCandidate> ranked = rank(all, preferences);
        if (ranked.isEmpty()) {
            log.debug("No live agent for {} ({} declared)", capabilityId, all.size());
            throw new NoAgentAvailableException(capabilityId);
        }
        String winner = ranked.get(0).agentId();
        for (CapabilityCandidate c : all) {
            if (c.agentId().equals(winner)) {
                log.debug("Routed {} to {} (score {})", capabilityId, winner, ranked.get(0).score());
                return c.agent();
            }
        }
        throw new NoAgentAvailableException(capabilityId);
    }

    /**
     * Eligible candidates for a capability, best first. Empty when routing
     * would fail.
     */
    public List<ScoredCandidate> rank(String capabilityId, RoutingPreferences preferences) {
        return rank(registry.findByCapability(capabilityId), preferences);
    }

    private List<ScoredCandidate> rank(List<CapabilityCandidate> all, RoutingPreferences preferences) {
        RoutingPreferences prefs = preferences == null ? RoutingPreferences.NONE : preferences;
        List<CapabilityCandidate> eligible = filter(all, PREFERRED);
        if (eligible.isEmpty()) {
            eligible = filter(all, FALLBACK);
        }
        if (eligible.isEmpty()) {
            return List.of();
        }

        double maxLatency = 0.0;
        for (CapabilityCandidate c : eligible) {
            Double avg = c.agent().avgResponseTimeMs();
            if (avg != null && avg > maxLatency) {
                maxLatency = avg;
            }
        }

        List<ScoredCandidate> scored = new ArrayList<>(eligible.size());
        for (CapabilityCandidate c : eligible) {
            double normalized = normalizedLatency(c.agent().avgResponseTimeMs(), maxLatency, eligible.size());
            double bonus = (prefs.matchesTag(c.agent()) ? tagBonus : 0.0)
                    + (prefs.matchesVersion(c.agent()) ? versionBonus : 0.0);
            double score = confidenceWeight * c.confidence() + latencyWeight * (1.0 - normalized) + bonus;
            scored.add(new ScoredCandidate(c.agentId(), c.healthStatus(), c.confidence(), normalized, bonus, score));
        }
        scored.sort(BEST_FIRST);
        return scored;
    }

    private static double normalizedLatency(Double avg, double maxLatency, int candidates) {
        if (candidates <= 1 || avg == null || maxLatency <= 0.0) {
            return 0.0;
        }
        return avg / maxLatency;
    }

    private static List<CapabilityCandidate> filter(List<CapabilityCandidate> all, Set<HealthStatus> allowed) {
        List<CapabilityCandidate> result = new ArrayList<>();
        for (CapabilityCandidate c : all) {
            if (allowed.contains(c.healthStatus())) {
                result.add(c);
            }
        }
        return result;
    }
}
