package fleetmon.monitoring.repository;

import java.util.List;
import java.util.Optional;

/**
 * Durable key-value storage used to persist monitoring records.
 * Backend failures surface as unchecked exceptions.
 */
public interface KeyValueStore {

    /**
     * Insert or replace a value.
     *
     * @param key   the key
     * @param value the value
     */
    void put(String key, String value);

    /**
     * Read a value.
     *
     * @param key the key
     * @return the value, empty if the key is absent
     */
    Optional<String> get(String key);

    /**
     * List every entry whose key starts with the prefix, ordered by key.
     *
     * @param prefix key prefix, matched literally
     * @return matching entries
     */
    List<KeyValue> listByPrefix(String prefix);

    /**
     * Delete a key.
     *
     * @param key the key
     * @return true if the key existed
     */
    boolean delete(String key);

    /**
     * One stored entry.
     */
    record KeyValue(String key, String value) {
    }
}
