package fleetmon.monitoring.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import fleetmon.monitoring.util.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * True for {@code <itemPrefix><id>} where the id is non-empty and has no further '/'.
     */
    static boolean isItemPath(String path, String itemPrefix) {
        return path.startsWith(itemPrefix) && path.length() > itemPrefix.length()
                && path.indexOf('/', itemPrefix.length()) < 0;
    }

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        /**
         * Serialize a DTO with the shared mapper. Serialization failures bubble
         * to RouterHandler as a 500.
         */
        public static ControllerResponse ofJson(HttpResponseStatus status, Object dto) {
            try {
                return json(status, Json.mapper().writeValueAsString(dto));
            } catch (JsonProcessingException e) {
                throw new RuntimeException("Failed to serialize " + dto.getClass().getSimpleName(), e);
            }
        }

        public static ControllerResponse ofJson(Object dto) {
            return ofJson(HttpResponseStatus.OK, dto);
        }

        public static ControllerResponse notFound(String message) {
            return errorJson(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return errorJson(HttpResponseStatus.BAD_REQUEST, message);
        }

        private static ControllerResponse errorJson(HttpResponseStatus status, String message) {
            return new ControllerResponse(status, "application/json",
                    "{\"error\":\"" + escapeJson(message) + "\"}");
        }

        private static String escapeJson(String s) {
            if (s == null)
                return "";
            return s.replace("\\", "\\\\").replace("\"", "\\\"");
        }
    }
}
