package agentmesh.coordinator.api.v1;

import agentmesh.coordinator.api.Controller;
import agentmesh.coordinator.api.v1.dto.AgentResponse;
import agentmesh.coordinator.model.AgentDescriptor;
import agentmesh.coordinator.model.RoutingPreferences;
import agentmesh.coordinator.registry.CapabilityRegistry;
import agentmesh.coordinator.registry.CapabilityRouter;
import agentmesh.coordinator.registry.ScoredCandidate;
import agentmesh.coordinator.server.RouterHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only view of the registry (public API).
 *
 * GET /api/v1/agents[?tag=..] - List agents
 * GET /api/v1/agents/{agentId} - Agent details
 * GET /api/v1/capabilities/{capabilityId}/candidates[?tag=..&version=..] - Routing candidates, best first,
 *     scored with the given routing preferences
 */
public class AgentController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private static final Pattern AGENTS_PATTERN = Pattern.compile("^/api/v1/agents$");
    private static final Pattern AGENT_BY_ID_PATTERN = Pattern.compile("^/api/v1/agents/([^/]+)$");
    private static final Pattern CANDIDATES_PATTERN = Pattern.compile("^/api/v1/capabilities/([^/]+)/candidates$");

    private final CapabilityRegistry registry;
    private final CapabilityRouter router;

    public AgentController(CapabilityRegistry registry, CapabilityRouter router) {
        this.registry = registry;
        this.router = router;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && (AGENTS_PATTERN.matcher(path).matches()
                || AGENT_BY_ID_PATTERN.matcher(path).matches()
                || CANDIDATES_PATTERN.matcher(path).matches());
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (AGENTS_PATTERN.matcher(path).matches()) {
                List<String> tags = new QueryStringDecoder(req.uri()).parameters().get("tag");
                List<AgentDescriptor> agents = tags == null || tags.isEmpty()
                        ? registry.listAgents()
                        : registry.findByTag(tags.get(0));
                List<AgentResponse> items = agents.stream().map(AgentResponse::from).toList();
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                        Map.of("count", items.size(), "agents", items)));
            }

            Matcher byId = AGENT_BY_ID_PATTERN.matcher(path);
            if (byId.matches()) {
                Optional<AgentDescriptor> agent = registry.find(byId.group(1));
                if (agent.isEmpty()) {
                    return ControllerResponse.notFound("agent not found: " + byId.group(1));
                }
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                        AgentResponse.from(agent.get())));
            }

            Matcher candidates = CANDIDATES_PATTERN.matcher(path);
            if (candidates.matches()) {
                String capabilityId = candidates.group(1);
                Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();
                List<String> version = params.get("version");
                RoutingPreferences preferences = RoutingPreferences.of(
                        new LinkedHashSet<>(params.getOrDefault("tag", List.of())),
                        version == null || version.isEmpty() ? null : version.get(0));
                List<ScoredCandidate> ranked = router.rank(capabilityId, preferences);
                Map<String, Object> response = new LinkedHashMap<>();
                response.put("capabilityId", capabilityId);
                response.put("declared", registry.findByCapability(capabilityId).size());
                response.put("candidates", ranked);
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
            }

            return ControllerResponse.notFound("unknown agent endpoint");

        } catch (JsonProcessingException e) {
            log.error("Agent controller serialization error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
