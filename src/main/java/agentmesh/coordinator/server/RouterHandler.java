package agentmesh.coordinator.server;

import agentmesh.coordinator.api.Controller;
import agentmesh.coordinator.api.Controller.ControllerResponse;
import agentmesh.coordinator.config.CoordinatorConfig;
import agentmesh.coordinator.error.CycleException;
import agentmesh.coordinator.error.ResourceExhaustedException;
import agentmesh.coordinator.error.TaskNotFoundException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.CONFLICT;
import static io.netty.handler.codec.http.HttpResponseStatus.FORBIDDEN;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpResponseStatus.TOO_MANY_REQUESTS;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Dispatches HTTP requests to the first registered controller that matches.
 *
 * Paths:
 * - /api/v1/* (public API)
 * - /internal/v1/* (agent registration, guarded by X-Agentmesh-Key when a key is configured)
 *
 * Coordinator exceptions thrown by controllers become status codes here:
 * validation 400, unknown task 404, cycle 409, full lane 429, anything else 500.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    public static final String AGENT_KEY_HEADER = "X-Agentmesh-Key";

    private static final String JSON = "application/json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new ArrayList<>();
    private final byte[] agentKey;

    public RouterHandler(CoordinatorConfig config) {
        this.agentKey = config.hasAgentKey() ? config.agentKey().getBytes(StandardCharsets.UTF_8) : null;
    }

    /**
     * Controllers are tried in registration order, so register the more
     * specific paths first.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        HttpMethod method = req.method();
        String uri = req.uri();
        int query = uri.indexOf('?');
        String path = query >= 0 ? uri.substring(0, query) : uri;

        if (path.startsWith("/internal/") && !authorized(req)) {
            log.warn("Rejected {} {}: missing or wrong agent key", method, path);
            writeError(ctx, req, FORBIDDEN, "forbidden");
            return;
        }

        Controller controller = find(method, path);
        if (controller == null) {
            log.debug("No handler for: {} {}", method, path);
            writeError(ctx, req, NOT_FOUND, "not found");
            return;
        }

        try {
            ControllerResponse response = controller.handle(ctx, req, path);
            // streaming controllers own the channel from here on
            if (!response.isStreaming()) {
                write(ctx, req, response.status(), response.contentType(), response.body());
            }
        } catch (Exception e) {
            HttpResponseStatus status = statusFor(e);
            if (status == INTERNAL_SERVER_ERROR) {
                log.error("Handler error: {} {} - Body: [{}]", method, path,
                        req.content().toString(StandardCharsets.UTF_8), e);
                writeError(ctx, req, status, describeChain(e));
            } else {
                log.info("{} {} -> {}: {}", method, path, status.code(), e.getMessage());
                writeError(ctx, req, status, e.getMessage());
            }
        }
    }

    private Controller find(HttpMethod method, String path) {
        for (Controller controller : controllers) {
            if (controller.matches(method, path)) {
                return controller;
            }
        }
        return null;
    }

    private boolean authorized(FullHttpRequest req) {
        if (agentKey == null) {
            return true;
        }
        String provided = req.headers().get(AGENT_KEY_HEADER);
        return provided != null && MessageDigest.isEqual(agentKey, provided.getBytes(StandardCharsets.UTF_8));
    }

    static HttpResponseStatus statusFor(Exception e) {
        if (e instanceof TaskNotFoundException) {
            return NOT_FOUND;
        }
        if (e instanceof CycleException) {
            return CONFLICT;
        }
        if (e instanceof ResourceExhaustedException) {
            return TOO_MANY_REQUESTS;
        }
        if (e instanceof IllegalArgumentException) {
            return BAD_REQUEST;
        }
        return INTERNAL_SERVER_ERROR;
    }

    private static String describeChain(Throwable e) {
        StringBuilder chain = new StringBuilder(e.toString());
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            chain.append(" <- ").append(cause);
        }
        return chain.toString();
    }

    private void writeError(ChannelHandlerContext ctx, FullHttpRequest req, HttpResponseStatus status,
            String message) {
        String body;
        try {
            body = MAPPER.writeValueAsString(Map.of("error", message != null ? message : status.reasonPhrase()));
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize error message", e);
            body = "{\"error\":\"" + status.reasonPhrase() + "\"}";
        }
        write(ctx, req, status, JSON, body);
    }

    private void write(ChannelHandlerContext ctx, FullHttpRequest req, HttpResponseStatus status, String contentType,
            String body) {
        byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType + "; charset=utf-8");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);

        boolean keepAlive = HttpUtil.isKeepAlive(req);
        HttpUtil.setKeepAlive(response, keepAlive);
        if (keepAlive) {
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }

    /**
     * Shared mapper for every controller: ISO-8601 dates, unknown request
     * fields ignored.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
