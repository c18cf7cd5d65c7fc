package fleetmon.monitoring.api.v1;

import fleetmon.monitoring.api.Controller;
import fleetmon.monitoring.api.v1.dto.SocInfoResponse;
import fleetmon.monitoring.service.MonitoringService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.util.List;
import java.util.Map;

/**
 * Controller for SoC aggregates.
 * GET /api/v1/socs - List all SoCs
 * GET /api/v1/socs/{id} - One SoC
 */
public class SocController implements Controller {

    private static final String BASE = "/api/v1/socs";
    private static final String ITEM_PREFIX = BASE + "/";

    private final MonitoringService service;

    public SocController(MonitoringService service) {
        this.service = service;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && (BASE.equals(path) || Controller.isItemPath(path, ITEM_PREFIX));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (BASE.equals(path)) {
            List<SocInfoResponse> socs = service.allSocs().stream()
                    .map(SocInfoResponse::from)
                    .toList();
            return ControllerResponse.ofJson(Map.of("socs", socs));
        }

        String socId = QueryStringDecoder.decodeComponent(path.substring(ITEM_PREFIX.length()));
        return service.findSoc(socId)
                .map(soc -> ControllerResponse.ofJson(SocInfoResponse.from(soc)))
                .orElseGet(() -> ControllerResponse.notFound("soc not found: " + socId));
    }
}
