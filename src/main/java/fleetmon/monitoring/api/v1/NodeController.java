package fleetmon.monitoring.api.v1;

import fleetmon.monitoring.api.Controller;
import fleetmon.monitoring.api.v1.dto.NodeInfoResponse;
import fleetmon.monitoring.service.MonitoringService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Controller for node queries.
 * GET /api/v1/nodes - List all nodes
 * GET /api/v1/nodes/{name} - One node
 * DELETE /api/v1/nodes/{name} - Remove a decommissioned node
 *
 * Exceptions bubble to RouterHandler for proper error responses.
 */
public class NodeController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(NodeController.class);

    private static final String BASE = "/api/v1/nodes";
    private static final String ITEM_PREFIX = BASE + "/";

    private final MonitoringService service;

    public NodeController(MonitoringService service) {
        this.service = service;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return BASE.equals(path) || Controller.isItemPath(path, ITEM_PREFIX);
        }
        return method.equals(HttpMethod.DELETE) && Controller.isItemPath(path, ITEM_PREFIX);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (BASE.equals(path)) {
            List<NodeInfoResponse> nodes = service.allNodes().stream()
                    .map(NodeInfoResponse::from)
                    .toList();
            return ControllerResponse.ofJson(Map.of("nodes", nodes));
        }

        String name = QueryStringDecoder.decodeComponent(path.substring(ITEM_PREFIX.length()));

        if (req.method().equals(HttpMethod.DELETE)) {
            if (!service.removeNode(name)) {
                return ControllerResponse.notFound("node not found: " + name);
            }
            log.info("Node {} removed via API", name);
            return ControllerResponse.ofJson(Map.of("ok", true));
        }

        return service.findNode(name)
                .map(node -> ControllerResponse.ofJson(NodeInfoResponse.from(node)))
                .orElseGet(() -> ControllerResponse.notFound("node not found: " + name));
    }
}
