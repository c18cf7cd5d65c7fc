package fleetmon.monitoring.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fleetmon.monitoring.model.BoardInfo;
import fleetmon.monitoring.model.NodeInfo;
import fleetmon.monitoring.model.SocInfo;
import fleetmon.monitoring.repository.KeyValueStore;
import fleetmon.monitoring.repository.KeyValueStore.KeyValue;
import fleetmon.monitoring.store.model.BoardDocument;
import fleetmon.monitoring.store.model.NodeDocument;
import fleetmon.monitoring.store.model.SocDocument;
import fleetmon.monitoring.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Persists nodes, SoCs and boards as JSON in a {@link KeyValueStore}.
 *
 * Key layout:
 * - monitoring/nodes/&lt;node-name&gt;
 * - monitoring/socs/&lt;soc-id&gt;
 * - monitoring/boards/&lt;board-id&gt;
 *
 * Bulk reads skip records that fail to decode so one corrupt entry cannot
 * hide the rest of a collection.
 */
public class MonitoringRecordStore {

    private static final Logger log = LoggerFactory.getLogger(MonitoringRecordStore.class);

    public static final String NODES_PREFIX = "monitoring/nodes/";
    public static final String SOCS_PREFIX = "monitoring/socs/";
    public static final String BOARDS_PREFIX = "monitoring/boards/";

    private final KeyValueStore kv;
    private final ObjectMapper mapper;

    public MonitoringRecordStore(KeyValueStore kv) {
        this(kv, Json.mapper());
    }

    public MonitoringRecordStore(KeyValueStore kv, ObjectMapper mapper) {
        this.kv = kv;
        this.mapper = mapper;
    }

    // ---- store ----

    public void storeNode(NodeInfo node) {
        kv.put(NODES_PREFIX + node.nodeName(), encode(NodeDocument.from(node), "NodeInfo", node.nodeName()));
        log.debug("Stored NodeInfo for node: {}", node.nodeName());
    }

    public void storeSoc(SocInfo soc) {
        kv.put(SOCS_PREFIX + soc.socId(), encode(SocDocument.from(soc), "SocInfo", soc.socId()));
        log.debug("Stored SocInfo for SoC: {}", soc.socId());
    }

    public void storeBoard(BoardInfo board) {
        kv.put(BOARDS_PREFIX + board.boardId(), encode(BoardDocument.from(board), "BoardInfo", board.boardId()));
        log.debug("Stored BoardInfo for board: {}", board.boardId());
    }

    // ---- single lookups ----

    /**
     * @throws DeserializationException if the stored value is corrupt
     */
    public Optional<NodeInfo> findNode(String nodeName) {
        String key = NODES_PREFIX + nodeName;
        return kv.get(key).map(json -> decode(key, json, NodeDocument.class, NodeDocument::toDomain));
    }

    public Optional<SocInfo> findSoc(String socId) {
        String key = SOCS_PREFIX + socId;
        return kv.get(key).map(json -> decode(key, json, SocDocument.class, SocDocument::toDomain));
    }

    public Optional<BoardInfo> findBoard(String boardId) {
        String key = BOARDS_PREFIX + boardId;
        return kv.get(key).map(json -> decode(key, json, BoardDocument.class, BoardDocument::toDomain));
    }

    // ---- bulk reads ----

    public List<NodeInfo> findAllNodes() {
        return decodeAll(NODES_PREFIX, NodeDocument.class, NodeDocument::toDomain);
    }

    public List<SocInfo> findAllSocs() {
        return decodeAll(SOCS_PREFIX, SocDocument.class, SocDocument::toDomain);
    }

    public List<BoardInfo> findAllBoards() {
        return decodeAll(BOARDS_PREFIX, BoardDocument.class, BoardDocument::toDomain);
    }

    // ---- delete ----

    public boolean deleteNode(String nodeName) {
        boolean deleted = kv.delete(NODES_PREFIX + nodeName);
        log.debug("Deleted NodeInfo for node: {} ({})", nodeName, deleted);
        return deleted;
    }

    public boolean deleteSoc(String socId) {
        boolean deleted = kv.delete(SOCS_PREFIX + socId);
        log.debug("Deleted SocInfo for SoC: {} ({})", socId, deleted);
        return deleted;
    }

    public boolean deleteBoard(String boardId) {
        boolean deleted = kv.delete(BOARDS_PREFIX + boardId);
        log.debug("Deleted BoardInfo for board: {} ({})", boardId, deleted);
        return deleted;
    }

    // Helper methods

    private String encode(Object document, String kind, String id) {
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize " + kind + " " + id, e);
        }
    }

    private <D, T> T decode(String key, String json, Class<D> type, Function<D, T> toDomain) {
        try {
            return toDomain.apply(mapper.readValue(json, type));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new DeserializationException(key, e);
        }
    }

    private <D, T> List<T> decodeAll(String prefix, Class<D> type, Function<D, T> toDomain) {
        List<KeyValue> entries = kv.listByPrefix(prefix);
        List<T> results = new ArrayList<>(entries.size());
        for (KeyValue entry : entries) {
            try {
                results.add(decode(entry.key(), entry.value(), type, toDomain));
            } catch (DeserializationException e) {
                log.warn("Skipping corrupt record {}: {}", entry.key(), e.getCause().getMessage());
            }
        }
        return results;
    }
}
