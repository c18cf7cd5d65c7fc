package fleetmon.monitoring.config;

import fleetmon.monitoring.api.internal.v1.TelemetryController;
import fleetmon.monitoring.api.v1.BoardController;
import fleetmon.monitoring.api.v1.HealthController;
import fleetmon.monitoring.api.v1.NodeController;
import fleetmon.monitoring.api.v1.SocController;
import fleetmon.monitoring.api.v1.SummaryController;
import fleetmon.monitoring.core.InboundQueue;
import fleetmon.monitoring.model.ContainerList;
import fleetmon.monitoring.model.NodeInfo;
import fleetmon.monitoring.repository.KeyValueStore;
import fleetmon.monitoring.scheduler.TelemetryDispatcher;
import fleetmon.monitoring.server.MonitoringNettyServer;
import fleetmon.monitoring.server.RouterHandler;
import fleetmon.monitoring.service.MonitoringService;
import fleetmon.monitoring.store.DataStore;
import fleetmon.monitoring.store.Database;
import fleetmon.monitoring.store.JdbcKeyValueStore;
import fleetmon.monitoring.store.MonitoringRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(MonitoringConfig.fromEnv());
 * deps.start(); // consumer loops + HTTP server
 * // ... serve ...
 * deps.close(); // drain queues, stop server, close storage
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final MonitoringConfig config;
    private final Database database; // null when storage is disabled
    private final MonitoringRecordStore recordStore;
    private final MonitoringService monitoringService;
    private final InboundQueue<NodeInfo> nodeQueue;
    private final InboundQueue<ContainerList> containerQueue;
    private final TelemetryDispatcher dispatcher;

    // Router and server (lazy-initialized)
    private RouterHandler routerHandler;
    private MonitoringNettyServer server;

    private Dependencies(MonitoringConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Storage
        if (config.storageEnabled()) {
            this.database = new Database(config);
            KeyValueStore kv = new JdbcKeyValueStore(database);
            this.recordStore = new MonitoringRecordStore(kv);
        } else {
            this.database = null;
            this.recordStore = null;
            log.info("Persistent storage disabled, monitoring data is kept in memory only");
        }

        // Core
        this.monitoringService = new MonitoringService(new DataStore(), recordStore);
        this.nodeQueue = new InboundQueue<>("nodeinfo", config.queueCapacity());
        this.containerQueue = new InboundQueue<>("containers", config.queueCapacity());
        this.dispatcher = new TelemetryDispatcher(nodeQueue, containerQueue, monitoringService);

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(MonitoringConfig config) {
        return new Dependencies(config);
    }

    // Getters
    public MonitoringService monitoringService() {
        return monitoringService;
    }

    public MonitoringRecordStore recordStore() {
        return recordStore;
    }

    public TelemetryDispatcher dispatcher() {
        return dispatcher;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(new HealthController(database, monitoringService, dispatcher))
                    .registerController(new SummaryController(monitoringService))
                    .registerController(new NodeController(monitoringService))
                    .registerController(new SocController(monitoringService))
                    .registerController(new BoardController(monitoringService))
                    .registerController(new TelemetryController(nodeQueue, containerQueue));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    public synchronized MonitoringNettyServer server() {
        if (server == null) {
            server = new MonitoringNettyServer(config.serverHost(), config.serverPort(), routerHandler());
        }
        return server;
    }

    /**
     * Start the consumer loops, then the HTTP server.
     *
     * @return true if the server bound successfully
     */
    public boolean start() {
        dispatcher.start();
        return server().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop accepting telemetry first, then drain what is queued
        if (server != null) {
            try {
                server.stop();
            } catch (Exception e) {
                log.warn("Error stopping server: {}", e.getMessage());
            }
        }

        try {
            dispatcher.close();
        } catch (Exception e) {
            log.warn("Error stopping dispatcher: {}", e.getMessage());
        }

        if (database != null) {
            try {
                database.close();
            } catch (Exception e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }
}
