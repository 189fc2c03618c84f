package agentmesh.coordinator.api.internal.v1;

import agentmesh.coordinator.api.Controller;
import agentmesh.coordinator.api.internal.v1.dto.OperationResponse;
import agentmesh.coordinator.api.internal.v1.dto.RegisterAgentRequest;
import agentmesh.coordinator.api.v1.dto.AgentResponse;
import agentmesh.coordinator.model.AgentDescriptor;
import agentmesh.coordinator.registry.CapabilityRegistry;
import agentmesh.coordinator.server.RouterHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Agent self-registration (internal API).
 *
 * POST   /internal/v1/agents - Register or replace an agent
 * DELETE /internal/v1/agents/{agentId} - Deregister an agent
 */
public class AgentRegistrationController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistrationController.class);

    private static final Pattern AGENTS_PATTERN = Pattern.compile("^/internal/v1/agents$");
    private static final Pattern AGENT_BY_ID_PATTERN = Pattern.compile("^/internal/v1/agents/([^/]+)$");

    private final CapabilityRegistry registry;

    public AgentRegistrationController(CapabilityRegistry registry) {
        this.registry = registry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return AGENTS_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.DELETE)) {
            return AGENT_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST)) {
                return handleRegister(req);
            }
            Matcher byId = AGENT_BY_ID_PATTERN.matcher(path);
            if (byId.matches()) {
                return handleDeregister(byId.group(1));
            }
            return ControllerResponse.notFound("unknown agent endpoint");

        } catch (JsonProcessingException e) {
            log.debug("Malformed registration body: {}", e.getOriginalMessage());
            return ControllerResponse.badRequest("malformed JSON: " + e.getOriginalMessage());
        }
    }

    /**
     * POST /internal/v1/agents
     */
    private ControllerResponse handleRegister(FullHttpRequest req) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        RegisterAgentRequest request = RouterHandler.mapper().readValue(body, RegisterAgentRequest.class);
        if (request == null) {
            return ControllerResponse.badRequest("request body is required");
        }
        request.validate();

        AgentDescriptor stored = registry.register(request.toDescriptor());
        return ControllerResponse.json(HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(AgentResponse.from(stored)));
    }

    /**
     * DELETE /internal/v1/agents/{agentId}
     */
    private ControllerResponse handleDeregister(String agentId) throws JsonProcessingException {
        if (!registry.deregister(agentId)) {
            return ControllerResponse.json(HttpResponseStatus.NOT_FOUND,
                    RouterHandler.mapper().writeValueAsString(OperationResponse.agentNotFound(agentId)));
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success(agentId)));
    }
}
