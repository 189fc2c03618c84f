package agentmesh.coordinator.api.v1;

import agentmesh.coordinator.api.Controller;
import agentmesh.coordinator.api.v1.dto.HealthResponse;
import agentmesh.coordinator.model.HealthStatus;
import agentmesh.coordinator.model.ManagerStats;
import agentmesh.coordinator.model.RegistryStats;
import agentmesh.coordinator.model.TaskState;
import agentmesh.coordinator.registry.CapabilityRegistry;
import agentmesh.coordinator.scheduler.TaskManager;
import agentmesh.coordinator.server.RouterHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final CapabilityRegistry registry;
    private final TaskManager taskManager;

    public HealthController(CapabilityRegistry registry, TaskManager taskManager) {
        this.registry = registry;
        this.taskManager = taskManager;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        RegistryStats agents = registry.stats();
        ManagerStats tasks = taskManager.managerStats();

        HealthResponse response = HealthResponse.healthy(
                formatUptime(),
                VERSION,
                agents.totalAgents(),
                agents.count(HealthStatus.HEALTHY),
                tasks.count(TaskState.QUEUED),
                tasks.runningTasks());
        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (JsonProcessingException e) {
            log.error("Health check failed", e);
            return ControllerResponse.error("health check failed");
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
