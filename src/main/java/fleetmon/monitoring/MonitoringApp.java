package fleetmon.monitoring;

import fleetmon.monitoring.config.Dependencies;
import fleetmon.monitoring.config.MonitoringConfig;
import fleetmon.monitoring.model.MonitoringSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Duration;

/**
 * Monitoring server entry point.
 *
 * Usage: {@code java -jar fleetmon-monitoring.jar [config.ini]}
 */
public final class MonitoringApp {

    private static final Logger log = LoggerFactory.getLogger(MonitoringApp.class);

    private MonitoringApp() {
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        MonitoringConfig config = args.length > 0
                ? MonitoringConfig.fromIni(new File(args[0]))
                : MonitoringConfig.fromEnv();

        Dependencies deps = Dependencies.create(config);
        Runtime.getRuntime().addShutdownHook(new Thread(deps::close, "monitor-shutdown"));

        if (!deps.start()) {
            log.error("Monitoring server failed to start, exiting");
            deps.close();
            System.exit(1);
        }

        log.info("Monitoring server running");

        // Runs until both inbound streams are closed (shutdown hook)
        while (!deps.dispatcher().awaitTermination(Duration.ofMinutes(1))) {
            MonitoringSnapshot snapshot = deps.monitoringService().snapshot();
            log.info("Monitoring: {} nodes, {} socs, {} boards",
                    snapshot.nodes().size(), snapshot.socs().size(), snapshot.boards().size());
        }
        log.info("Monitoring stopped");
    }
}
