package fleetmon.monitoring.api.v1;

import fleetmon.monitoring.api.Controller;
import fleetmon.monitoring.service.MonitoringService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * Fleet-wide summary.
 * GET /api/v1/summary
 */
public class SummaryController implements Controller {

    private final MonitoringService service;

    public SummaryController(MonitoringService service) {
        this.service = service;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/summary".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        return ControllerResponse.ofJson(service.summary());
    }
}
