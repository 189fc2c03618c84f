package agentmesh.coordinator.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * One HTTP resource. {@code RouterHandler} asks each registered controller
 * in turn whether it owns a method and path, then lets the first match answer.
 */
public interface Controller {

    /** Path arrives without its query string. */
    boolean matches(HttpMethod method, String path);

    /**
     * Coordinator exceptions may propagate; the router maps them to status
     * codes. Controllers that write to the channel themselves return
     * {@link ControllerResponse#streaming()}.
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /** Status, content type and body to write back; null fields only for the streaming marker. */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        private static final ControllerResponse STREAMING = new ControllerResponse(null, null, null);

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        public static ControllerResponse notFound(String message) {
            return errorJson(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return errorJson(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse error(String message) {
            return errorJson(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        /** The controller already answered on the channel */
        public static ControllerResponse streaming() {
            return STREAMING;
        }

        public boolean isStreaming() {
            return this == STREAMING;
        }

        private static ControllerResponse errorJson(HttpResponseStatus status, String message) {
            return new ControllerResponse(status, "application/json",
                    "{\"error\":\"" + escapeJson(message) + "\"}");
        }

        static String escapeJson(String s) {
            if (s == null)
                return "";
            return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
        }
    }
}
