package fleetmon.monitoring.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import fleetmon.monitoring.api.Controller;
import fleetmon.monitoring.api.internal.v1.dto.ContainerListRequest;
import fleetmon.monitoring.api.internal.v1.dto.NodeInfoRequest;
import fleetmon.monitoring.api.internal.v1.dto.OperationResponse;
import fleetmon.monitoring.core.InboundQueue;
import fleetmon.monitoring.model.ContainerList;
import fleetmon.monitoring.model.NodeInfo;
import fleetmon.monitoring.util.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Controller for agent telemetry (internal API).
 * POST /internal/v1/nodeinfo - utilization sample
 * POST /internal/v1/containers - container inventory
 *
 * Messages are only enqueued here; the dispatcher loops apply them.
 * A full queue answers 503.
 */
public class TelemetryController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TelemetryController.class);

    static final String NODE_INFO_PATH = "/internal/v1/nodeinfo";
    static final String CONTAINERS_PATH = "/internal/v1/containers";

    private final InboundQueue<NodeInfo> nodeQueue;
    private final InboundQueue<ContainerList> containerQueue;

    public TelemetryController(InboundQueue<NodeInfo> nodeQueue, InboundQueue<ContainerList> containerQueue) {
        this.nodeQueue = nodeQueue;
        this.containerQueue = containerQueue;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return NODE_INFO_PATH.equals(path) || CONTAINERS_PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        try {
            if (NODE_INFO_PATH.equals(path)) {
                NodeInfoRequest request = Json.mapper().readValue(body, NodeInfoRequest.class);
                request.validate();
                return enqueue(nodeQueue, request.toDomain());
            } else {
                ContainerListRequest request = Json.mapper().readValue(body, ContainerListRequest.class);
                request.validate();
                return enqueue(containerQueue, request.toDomain());
            }
        } catch (JsonProcessingException e) {
            log.debug("Malformed telemetry body on {}: {}", path, e.getMessage());
            return ControllerResponse.badRequest("malformed JSON: " + e.getOriginalMessage());
        }
    }

    private <T> ControllerResponse enqueue(InboundQueue<T> queue, T message) {
        try {
            if (!queue.offer(message)) {
                log.warn("{} queue full ({}), rejecting message", queue.name(), queue.capacity());
                return ControllerResponse.ofJson(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        OperationResponse.queueFull());
            }
        } catch (IllegalStateException e) {
            return ControllerResponse.ofJson(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    OperationResponse.shuttingDown());
        }
        return ControllerResponse.ofJson(HttpResponseStatus.ACCEPTED, OperationResponse.accepted(queue.size()));
    }
}
