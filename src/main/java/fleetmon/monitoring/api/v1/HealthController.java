package fleetmon.monitoring.api.v1;

import fleetmon.monitoring.api.Controller;
import fleetmon.monitoring.api.v1.dto.HealthResponse;
import fleetmon.monitoring.model.SystemSummary;
import fleetmon.monitoring.scheduler.TelemetryDispatcher;
import fleetmon.monitoring.service.MonitoringService;
import fleetmon.monitoring.store.Database;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 *
 * Storage being down makes the server unhealthy; storage being disabled does not.
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final MonitoringService service;
    private final TelemetryDispatcher dispatcher;

    /**
     * @param database   the storage pool, or null when storage is disabled
     * @param service    monitoring service
     * @param dispatcher consumer loops, for queue depths
     */
    public HealthController(Database database, MonitoringService service, TelemetryDispatcher dispatcher) {
        this.database = database;
        this.service = service;
        this.dispatcher = dispatcher;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        String storage = "disabled";
        if (service.persistenceEnabled() && database != null) {
            if (!database.isHealthy()) {
                log.warn("Health check: storage connection failed");
                return ControllerResponse.ofJson(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        HealthResponse.unhealthy("connection failed"));
            }
            storage = "ok";
        }

        SystemSummary summary = service.summary();
        HealthResponse response = HealthResponse.healthy(
                storage,
                formatUptime(),
                VERSION,
                summary.totalNodes(),
                summary.totalSocs(),
                summary.totalBoards(),
                service.totalContainers(),
                dispatcher.nodeQueue().size(),
                dispatcher.containerQueue().size());

        return ControllerResponse.ofJson(response);
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
