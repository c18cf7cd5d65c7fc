package fleetmon.monitoring.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.util.Map;

/**
 * Configuration holder for the monitoring server.
 * All settings have sensible defaults.
 *
 * Sources, later ones winning: defaults, optional INI file, environment.
 */
public final class MonitoringConfig {

    // Server settings
    private String serverHost = "0.0.0.0";
    private int serverPort = 47098;
    private String agentKey = null; // If set, agents must provide X-Monitor-Key header

    // Storage settings
    private boolean storageEnabled = true;
    private String databaseUrl = "jdbc:h2:file:./data/monitoring;AUTO_SERVER=TRUE;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 4;

    // Ingest settings
    private int queueCapacity = 1024;

    private MonitoringConfig() {
    }

    public static MonitoringConfig defaults() {
        return new MonitoringConfig();
    }

    public static MonitoringConfig fromEnv() {
        return defaults().applyEnv(System.getenv());
    }

    /**
     * Load from an INI file, then apply environment overrides.
     *
     * Sections: [SERVER] host, port, agent_key; [STORAGE] enabled, db_url,
     * pool_size; [INGEST] queue_capacity. Missing sections keep defaults.
     */
    public static MonitoringConfig fromIni(File file) throws IOException {
        return defaults().applyIni(file).applyEnv(System.getenv());
    }

    MonitoringConfig applyIni(File file) throws IOException {
        Ini ini = new Ini(file);

        Profile.Section server = ini.get("SERVER");
        if (server != null) {
            serverHost = opt(server, "host", serverHost);
            serverPort = Integer.parseInt(opt(server, "port", String.valueOf(serverPort)));
            agentKey = opt(server, "agent_key", agentKey);
        }

        Profile.Section storage = ini.get("STORAGE");
        if (storage != null) {
            storageEnabled = Boolean.parseBoolean(opt(storage, "enabled", String.valueOf(storageEnabled)));
            databaseUrl = opt(storage, "db_url", databaseUrl);
            databasePoolSize = Integer.parseInt(opt(storage, "pool_size", String.valueOf(databasePoolSize)));
        }

        Profile.Section ingest = ini.get("INGEST");
        if (ingest != null) {
            queueCapacity = Integer.parseInt(opt(ingest, "queue_capacity", String.valueOf(queueCapacity)));
        }

        return this;
    }

    MonitoringConfig applyEnv(Map<String, String> env) {
        String port = env.get("MONITOR_PORT");
        if (port != null && !port.isBlank()) {
            serverPort = Integer.parseInt(port.trim());
        }

        String dbUrl = env.get("MONITOR_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            databaseUrl = dbUrl;
        }

        String key = env.get("MONITOR_AGENT_KEY");
        if (key != null && !key.isBlank()) {
            agentKey = key;
        }

        String capacity = env.get("MONITOR_QUEUE_CAPACITY");
        if (capacity != null && !capacity.isBlank()) {
            queueCapacity = Integer.parseInt(capacity.trim());
        }

        String enabled = env.get("MONITOR_STORAGE_ENABLED");
        if (enabled != null && !enabled.isBlank()) {
            storageEnabled = Boolean.parseBoolean(enabled.trim());
        }

        return this;
    }

    private static String opt(Profile.Section section, String key, String def) {
        String value = section.get(key);
        return (value == null || value.isBlank()) ? def : value.trim();
    }

    // Getters
    public String serverHost() {
        return serverHost;
    }

    public int serverPort() {
        return serverPort;
    }

    public String agentKey() {
        return agentKey;
    }

    public boolean hasAgentKey() {
        return agentKey != null && !agentKey.isBlank();
    }

    public boolean storageEnabled() {
        return storageEnabled;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int queueCapacity() {
        return queueCapacity;
    }

    // Fluent setters for testing/customization
    public MonitoringConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public MonitoringConfig withAgentKey(String key) {
        this.agentKey = key;
        return this;
    }

    public MonitoringConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public MonitoringConfig withStorageEnabled(boolean enabled) {
        this.storageEnabled = enabled;
        return this;
    }

    public MonitoringConfig withQueueCapacity(int capacity) {
        this.queueCapacity = capacity;
        return this;
    }

    @Override
    public String toString() {
        return "MonitoringConfig{" +
                "serverPort=" + serverPort +
                ", storageEnabled=" + storageEnabled +
                ", databaseUrl='" + databaseUrl + '\'' +
                ", queueCapacity=" + queueCapacity +
                ", agentKeySet=" + hasAgentKey() +
                '}';
    }
}
