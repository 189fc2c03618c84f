package agentmesh.coordinator.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults.
 *
 * Sources, lowest precedence first: defaults, the INI file named by
 * {@code AGENTMESH_CONFIG}, environment variables.
 */
public final class CoordinatorConfig {

    public static final String CONFIG_FILE_ENV = "AGENTMESH_CONFIG";

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private String agentKey = null; // If set, /internal/ calls must carry X-Agentmesh-Key

    // Scheduler settings
    private int maxConcurrentTasks = 10;
    private int laneCapacity = 1000;
    private int defaultMaxRetries = 3;
    private Duration defaultTaskTimeout = Duration.ofMinutes(5);
    private Duration maxTaskTimeout = Duration.ofHours(24);

    // Retry backoff
    private Duration retryBaseDelay = Duration.ofSeconds(1);
    private Duration retryMaxDelay = Duration.ofSeconds(60);

    // Health monitor
    private Duration healthProbeInterval = Duration.ofSeconds(30);
    private Duration probeTimeout = Duration.ofSeconds(5);
    private int unreachableAfterFailures = 3;
    private Duration maxProbeBackoff = Duration.ofMinutes(5);
    private double latencyEmaWeight = 0.3;

    // Routing
    private double confidenceWeight = 0.7;
    private double latencyWeight = 0.3;
    private double preferredTagBonus = 0.1;
    private double preferredVersionBonus = 0.05;

    // Simulation
    private int simulatedAgents = 0;
    private List<String> simulatedCapabilities = List.of("demo.echo");
    private int simulationDelayMinMs = 50;
    private int simulationDelayMaxMs = 250;
    private double simulationFailRate = 0.0;

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    /**
     * Defaults, then the INI file from {@code AGENTMESH_CONFIG}, then the
     * process environment.
     */
    public static CoordinatorConfig load() {
        return load(System.getenv());
    }

    static CoordinatorConfig load(Map<String, String> env) {
        CoordinatorConfig config = new CoordinatorConfig();

        String file = env.get(CONFIG_FILE_ENV);
        if (file != null && !file.isBlank()) {
            try {
                config.applyIni(Path.of(file));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read config file " + file, e);
            }
        }

        config.applyEnv(env);
        return config;
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();
        config.applyEnv(System.getenv());
        return config;
    }

    /**
     * Load settings from an INI file on top of the defaults.
     * Sections: [server], [scheduler], [retry], [health], [routing], [simulation].
     */
    public static CoordinatorConfig fromIni(Path path) throws IOException {
        CoordinatorConfig config = new CoordinatorConfig();
        config.applyIni(path);
        return config;
    }

    private void applyIni(Path path) throws IOException {
        if (!Files.isReadable(path)) {
            throw new IOException("not readable: " + path);
        }
        Ini ini = new Ini(path.toFile());

        Profile.Section server = ini.get("server");
        if (server != null) {
            serverHost = opt(server, "host", serverHost);
            serverPort = optInt(server, "port", serverPort);
            String key = server.get("agent_key");
            if (key != null && !key.isBlank()) {
                agentKey = key.trim();
            }
        }

        Profile.Section scheduler = ini.get("scheduler");
        if (scheduler != null) {
            maxConcurrentTasks = optInt(scheduler, "max_concurrent_tasks", maxConcurrentTasks);
            laneCapacity = optInt(scheduler, "lane_capacity", laneCapacity);
            defaultMaxRetries = optInt(scheduler, "max_retries", defaultMaxRetries);
            defaultTaskTimeout = optMillis(scheduler, "task_timeout_ms", defaultTaskTimeout);
            maxTaskTimeout = optMillis(scheduler, "max_task_timeout_ms", maxTaskTimeout);
        }

        Profile.Section retry = ini.get("retry");
        if (retry != null) {
            retryBaseDelay = optMillis(retry, "base_delay_ms", retryBaseDelay);
            retryMaxDelay = optMillis(retry, "max_delay_ms", retryMaxDelay);
        }

        Profile.Section health = ini.get("health");
        if (health != null) {
            healthProbeInterval = optMillis(health, "probe_interval_ms", healthProbeInterval);
            probeTimeout = optMillis(health, "probe_timeout_ms", probeTimeout);
            unreachableAfterFailures = optInt(health, "unreachable_after_failures", unreachableAfterFailures);
            maxProbeBackoff = optMillis(health, "max_probe_backoff_ms", maxProbeBackoff);
            latencyEmaWeight = optDouble(health, "latency_ema_weight", latencyEmaWeight);
        }

        Profile.Section routing = ini.get("routing");
        if (routing != null) {
            confidenceWeight = optDouble(routing, "confidence_weight", confidenceWeight);
            latencyWeight = optDouble(routing, "latency_weight", latencyWeight);
            preferredTagBonus = optDouble(routing, "tag_bonus", preferredTagBonus);
            preferredVersionBonus = optDouble(routing, "version_bonus", preferredVersionBonus);
        }

        Profile.Section simulation = ini.get("simulation");
        if (simulation != null) {
            simulatedAgents = optInt(simulation, "agents", simulatedAgents);
            String caps = simulation.get("capabilities");
            if (caps != null && !caps.isBlank()) {
                simulatedCapabilities = splitList(caps);
            }
            simulationDelayMinMs = optInt(simulation, "delay_min_ms", simulationDelayMinMs);
            simulationDelayMaxMs = optInt(simulation, "delay_max_ms", simulationDelayMaxMs);
            simulationFailRate = optDouble(simulation, "fail_rate", simulationFailRate);
        }
    }

    private void applyEnv(Map<String, String> env) {
        String port = env.get("AGENTMESH_PORT");
        if (port != null && !port.isBlank()) {
            serverPort = Integer.parseInt(port.trim());
        }

        String key = env.get("AGENTMESH_AGENT_KEY");
        if (key != null && !key.isBlank()) {
            agentKey = key;
        }

        String concurrent = env.get("AGENTMESH_MAX_CONCURRENT");
        if (concurrent != null && !concurrent.isBlank()) {
            maxConcurrentTasks = Integer.parseInt(concurrent.trim());
        }

        String maxRetries = env.get("AGENTMESH_MAX_RETRIES");
        if (maxRetries != null && !maxRetries.isBlank()) {
            defaultMaxRetries = Integer.parseInt(maxRetries.trim());
        }

        String simAgents = env.get("AGENTMESH_SIM_AGENTS");
        if (simAgents != null && !simAgents.isBlank()) {
            simulatedAgents = Integer.parseInt(simAgents.trim());
        }
    }

    // Getters
    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String agentKey() {
        return agentKey;
    }

    public boolean hasAgentKey() {
        return agentKey != null && !agentKey.isBlank();
    }

    public int maxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    public int laneCapacity() {
        return laneCapacity;
    }

    public int defaultMaxRetries() {
        return defaultMaxRetries;
    }

    public Duration defaultTaskTimeout() {
        return defaultTaskTimeout;
    }

    /** Upper bound for per-task timeouts; longer requests are rejected */
    public Duration maxTaskTimeout() {
        return maxTaskTimeout;
    }

    public Duration retryBaseDelay() {
        return retryBaseDelay;
    }

    public Duration retryMaxDelay() {
        return retryMaxDelay;
    }

    public Duration healthProbeInterval() {
        return healthProbeInterval;
    }

    public Duration probeTimeout() {
        return probeTimeout;
    }

    public int unreachableAfterFailures() {
        return unreachableAfterFailures;
    }

    public Duration maxProbeBackoff() {
        return maxProbeBackoff;
    }

    public double latencyEmaWeight() {
        return latencyEmaWeight;
    }

    public double confidenceWeight() {
        return confidenceWeight;
    }

    public double latencyWeight() {
        return latencyWeight;
    }

    public double preferredTagBonus() {
        return preferredTagBonus;
    }

    public double preferredVersionBonus() {
        return preferredVersionBonus;
    }

    public int simulatedAgents() {
        return simulatedAgents;
    }

    public List<String> simulatedCapabilities() {
        return simulatedCapabilities;
    }

    public int simulationDelayMinMs() {
        return simulationDelayMinMs;
    }

    public int simulationDelayMaxMs() {
        return simulationDelayMaxMs;
    }

    public double simulationFailRate() {
        return simulationFailRate;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withAgentKey(String key) {
        this.agentKey = key;
        return this;
    }

    public CoordinatorConfig withMaxConcurrentTasks(int maxConcurrentTasks) {
        this.maxConcurrentTasks = maxConcurrentTasks;
        return this;
    }

    public CoordinatorConfig withLaneCapacity(int laneCapacity) {
        this.laneCapacity = laneCapacity;
        return this;
    }

    public CoordinatorConfig withMaxRetries(int retries) {
        this.defaultMaxRetries = retries;
        return this;
    }

    public CoordinatorConfig withTaskTimeout(Duration timeout) {
        this.defaultTaskTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withMaxTaskTimeout(Duration timeout) {
        this.maxTaskTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withRetryDelays(Duration base, Duration max) {
        this.retryBaseDelay = base;
        this.retryMaxDelay = max;
        return this;
    }

    public CoordinatorConfig withHealthProbeInterval(Duration interval) {
        this.healthProbeInterval = interval;
        return this;
    }

    public CoordinatorConfig withProbeTimeout(Duration timeout) {
        this.probeTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withUnreachableAfterFailures(int failures) {
        this.unreachableAfterFailures = failures;
        return this;
    }

    public CoordinatorConfig withMaxProbeBackoff(Duration backoff) {
        this.maxProbeBackoff = backoff;
        return this;
    }

    public CoordinatorConfig withRoutingWeights(double confidenceWeight, double latencyWeight) {
        this.confidenceWeight = confidenceWeight;
        this.latencyWeight = latencyWeight;
        return this;
    }

    public CoordinatorConfig withPreferenceBonuses(double tagBonus, double versionBonus) {
        this.preferredTagBonus = tagBonus;
        this.preferredVersionBonus = versionBonus;
        return this;
    }

    public CoordinatorConfig withSimulation(int agents, List<String> capabilities, int delayMinMs, int delayMaxMs,
            double failRate) {
        this.simulatedAgents = agents;
        this.simulatedCapabilities = List.copyOf(capabilities);
        this.simulationDelayMinMs = delayMinMs;
        this.simulationDelayMaxMs = delayMaxMs;
        this.simulationFailRate = failRate;
        return this;
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key, String def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    private static int optInt(Profile.Section s, String key, int def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : Integer.parseInt(v.trim());
    }

    private static double optDouble(Profile.Section s, String key, double def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : Double.parseDouble(v.trim());
    }

    private static Duration optMillis(Profile.Section s, String key, Duration def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : Duration.ofMillis(Long.parseLong(v.trim()));
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                items.add(part.trim());
            }
        }
        return List.copyOf(items);
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "serverPort=" + serverPort +
                ", maxConcurrentTasks=" + maxConcurrentTasks +
                ", laneCapacity=" + laneCapacity +
                ", maxRetries=" + defaultMaxRetries +
                ", probeInterval=" + healthProbeInterval +
                ", simulatedAgents=" + simulatedAgents +
                ", agentKeySet=" + hasAgentKey() +
                '}';
    }
}
