package agentmesh.coordinator.api.v1;

import agentmesh.coordinator.api.Controller;
import agentmesh.coordinator.api.v1.dto.StatsResponse;
import agentmesh.coordinator.registry.CapabilityRegistry;
import agentmesh.coordinator.scheduler.TaskManager;
import agentmesh.coordinator.server.RouterHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * GET /api/v1/stats - task manager and registry counters
 */
public class StatsController implements Controller {

    private final CapabilityRegistry registry;
    private final TaskManager taskManager;

    public StatsController(CapabilityRegistry registry, TaskManager taskManager) {
        this.registry = registry;
        this.taskManager = taskManager;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/stats".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        StatsResponse response = new StatsResponse(taskManager.managerStats(), registry.stats());
        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (JsonProcessingException e) {
            return ControllerResponse.error("cannot serialize stats: " + e.getOriginalMessage());
        }
    }
}
