package agentmesh.coordinator.api.v1;

import agentmesh.coordinator.api.Controller;
import agentmesh.coordinator.event.Subscription;
import agentmesh.coordinator.event.TaskEvent;
import agentmesh.coordinator.scheduler.TaskManager;
import agentmesh.coordinator.server.RouterHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.LastHttpContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Server-sent event stream of one task's status.
 * GET /api/v1/tasks/{taskId}/events
 *
 * The first event is a snapshot of the current state; the stream ends, and
 * the connection closes, after the terminal event.
 */
public class TaskEventsController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskEventsController.class);

    private static final Pattern EVENTS_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/events$");

    private final TaskManager taskManager;

    public TaskEventsController(TaskManager taskManager) {
        this.taskManager = taskManager;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && EVENTS_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher m = EVENTS_PATTERN.matcher(path);
        if (!m.matches()) {
            return ControllerResponse.notFound("unknown events endpoint");
        }
        String taskId = m.group(1);

        // 404 before any header goes out
        taskManager.getTask(taskId);

        HttpResponse head = new DefaultHttpResponse(HTTP_1_1, HttpResponseStatus.OK);
        head.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/event-stream; charset=utf-8");
        head.headers().set(HttpHeaderNames.CACHE_CONTROL, HttpHeaderValues.NO_CACHE);
        head.headers().set(HttpHeaderNames.TRANSFER_ENCODING, HttpHeaderValues.CHUNKED);
        ctx.writeAndFlush(head);

        Subscription subscription = taskManager.streamStatus(taskId, event -> send(ctx, event));
        ctx.channel().closeFuture().addListener(f -> subscription.close());
        log.debug("Streaming events of task {} to {}", taskId, ctx.channel().remoteAddress());
        return ControllerResponse.streaming();
    }

    private void send(ChannelHandlerContext ctx, TaskEvent event) {
        if (!ctx.channel().isActive()) {
            return;
        }
        String data;
        try {
            data = RouterHandler.mapper().writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize {} event of task {}", event.type(), event.taskId(), e);
            return;
        }
        String frame = "event: " + event.type().name().toLowerCase() + "\ndata: " + data + "\n\n";
        ctx.writeAndFlush(new DefaultHttpContent(Unpooled.copiedBuffer(frame, StandardCharsets.UTF_8)));
        if (event.isTerminal()) {
            ctx.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT).addListener(ChannelFutureListener.CLOSE);
        }
    }
}
