package agentmesh.coordinator.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorConfigTest {

    private static Path fixture() throws URISyntaxException {
        return Path.of(CoordinatorConfigTest.class.getResource("/coordinator-test.ini").toURI());
    }

    @Test
    void defaults() {
        CoordinatorConfig config = CoordinatorConfig.defaults();

        assertEquals(8080, config.serverPort());
        assertFalse(config.hasAgentKey());
        assertEquals(10, config.maxConcurrentTasks());
        assertEquals(1000, config.laneCapacity());
        assertEquals(3, config.defaultMaxRetries());
        assertEquals(Duration.ofMinutes(5), config.defaultTaskTimeout());
        assertEquals(Duration.ofHours(24), config.maxTaskTimeout());
        assertEquals(Duration.ofSeconds(1), config.retryBaseDelay());
        assertEquals(Duration.ofSeconds(60), config.retryMaxDelay());
        assertEquals(Duration.ofSeconds(30), config.healthProbeInterval());
        assertEquals(Duration.ofSeconds(5), config.probeTimeout());
        assertEquals(3, config.unreachableAfterFailures());
        assertEquals(Duration.ofMinutes(5), config.maxProbeBackoff());
        assertEquals(0.3, config.latencyEmaWeight(), 1e-9);
        assertEquals(0.7, config.confidenceWeight(), 1e-9);
        assertEquals(0.3, config.latencyWeight(), 1e-9);
        assertEquals(0.1, config.preferredTagBonus(), 1e-9);
        assertEquals(0.05, config.preferredVersionBonus(), 1e-9);
        assertEquals(0, config.simulatedAgents());
    }

    @Test
    void readsEverySectionOfIniFile() throws Exception {
        CoordinatorConfig config = CoordinatorConfig.fromIni(fixture());

        assertEquals("127.0.0.1", config.serverHost());
        assertEquals(19090, config.serverPort());
        assertEquals("s3cret", config.agentKey());
        assertEquals(4, config.maxConcurrentTasks());
        assertEquals(50, config.laneCapacity());
        assertEquals(5, config.defaultMaxRetries());
        assertEquals(Duration.ofMillis(2000), config.defaultTaskTimeout());
        assertEquals(Duration.ofMillis(60000), config.maxTaskTimeout());
        assertEquals(Duration.ofMillis(10), config.retryBaseDelay());
        assertEquals(Duration.ofMillis(80), config.retryMaxDelay());
        assertEquals(Duration.ofMillis(1000), config.healthProbeInterval());
        assertEquals(Duration.ofMillis(250), config.probeTimeout());
        assertEquals(2, config.unreachableAfterFailures());
        assertEquals(Duration.ofMillis(8000), config.maxProbeBackoff());
        assertEquals(0.5, config.latencyEmaWeight(), 1e-9);
        assertEquals(0.6, config.confidenceWeight(), 1e-9);
        assertEquals(0.4, config.latencyWeight(), 1e-9);
        assertEquals(0.25, config.preferredTagBonus(), 1e-9);
        assertEquals(0.15, config.preferredVersionBonus(), 1e-9);
        assertEquals(3, config.simulatedAgents());
        assertEquals(List.of("crm.company.enrich", "crm.contact.lookup"), config.simulatedCapabilities());
        assertEquals(0.1, config.simulationFailRate(), 1e-9);
    }

    @Test
    void partialIniKeepsDefaults(@TempDir Path dir) throws IOException {
        Path ini = dir.resolve("partial.ini");
        Files.writeString(ini, "[scheduler]\nmax_concurrent_tasks = 2\n");

        CoordinatorConfig config = CoordinatorConfig.fromIni(ini);

        assertEquals(2, config.maxConcurrentTasks());
        assertEquals(1000, config.laneCapacity());
        assertEquals(8080, config.serverPort());
    }

    @Test
    void environmentOverridesIniFile() throws Exception {
        CoordinatorConfig config = CoordinatorConfig.load(Map.of(
                CoordinatorConfig.CONFIG_FILE_ENV, fixture().toString(),
                "AGENTMESH_PORT", "18181",
                "AGENTMESH_MAX_CONCURRENT", "7",
                "AGENTMESH_AGENT_KEY", "from-env"));

        assertEquals(18181, config.serverPort());
        assertEquals(7, config.maxConcurrentTasks());
        assertEquals("from-env", config.agentKey());
        // untouched by the environment
        assertEquals(50, config.laneCapacity());
    }

    @Test
    void missingConfigFileFails() {
        assertThrows(UncheckedIOException.class, () -> CoordinatorConfig.load(
                Map.of(CoordinatorConfig.CONFIG_FILE_ENV, "/no/such/agentmesh.ini")));
    }

    @Test
    void fluentSetters() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withMaxConcurrentTasks(1)
                .withRetryDelays(Duration.ofMillis(5), Duration.ofMillis(20))
                .withRoutingWeights(0.5, 0.5);

        assertEquals(1, config.maxConcurrentTasks());
        assertEquals(Duration.ofMillis(5), config.retryBaseDelay());
        assertEquals(0.5, config.latencyWeight(), 1e-9);
    }
}
