package fleetmon.monitoring.store;

import fleetmon.monitoring.repository.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of KeyValueStore on the {@code monitoring_kv} table.
 */
public class JdbcKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcKeyValueStore.class);

    private static final String LIKE_ESCAPE = "\\";

    private final Database db;

    public JdbcKeyValueStore(Database db) {
        this.db = db;
    }

    @Override
    public void put(String key, String value) {
        String sql = """
                    MERGE INTO monitoring_kv (kv_key, kv_value, updated_at)
                    KEY (kv_key)
                    VALUES (?, ?, CURRENT_TIMESTAMP)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            ps.setString(2, value);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to put key: " + key, e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        String sql = "SELECT kv_value FROM monitoring_kv WHERE kv_key = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getString(1));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to get key: " + key, e);
        }
    }

    @Override
    public List<KeyValue> listByPrefix(String prefix) {
        String sql = "SELECT kv_key, kv_value FROM monitoring_kv WHERE kv_key LIKE ? ESCAPE '"
                + LIKE_ESCAPE + "' ORDER BY kv_key";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, escapeLike(prefix) + "%");
            List<KeyValue> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(new KeyValue(rs.getString(1), rs.getString(2)));
                }
            }
            log.debug("Listed {} entries under {}", results.size(), prefix);
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list prefix: " + prefix, e);
        }
    }

    @Override
    public boolean delete(String key) {
        String sql = "DELETE FROM monitoring_kv WHERE kv_key = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete key: " + key, e);
        }
    }

    /** Match the prefix literally: escape LIKE wildcards and the escape char itself */
    static String escapeLike(String s) {
        return s.replace(LIKE_ESCAPE, LIKE_ESCAPE + LIKE_ESCAPE)
                .replace("%", LIKE_ESCAPE + "%")
                .replace("_", LIKE_ESCAPE + "_");
    }
}
