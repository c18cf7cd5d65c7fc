package fleetmon.monitoring.store;

import com.fasterxml.jackson.databind.JsonNode;
import fleetmon.monitoring.model.BoardInfo;
import fleetmon.monitoring.model.NodeInfo;
import fleetmon.monitoring.model.SocInfo;
import fleetmon.monitoring.repository.InMemoryKeyValueStore;
import fleetmon.monitoring.util.Json;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MonitoringRecordStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private InMemoryKeyValueStore kv;
    private MonitoringRecordStore records;

    @BeforeEach
    void setUp() {
        kv = new InMemoryKeyValueStore();
        records = new MonitoringRecordStore(kv);
    }

    private static NodeInfo node(String name, String ip, double cpu) {
        return NodeInfo.builder()
                .nodeName(name)
                .ip(ip)
                .cpuUsage(cpu)
                .memUsage(25.0)
                .cpuCount(8)
                .gpuCount(2)
                .usedMemory(2048)
                .totalMemory(8192)
                .rxBytes(1)
                .txBytes(2)
                .readBytes(3)
                .writeBytes(4)
                .os("linux")
                .arch("x86_64")
                .build();
    }

    @Test
    void nodeIsStoredAsSnakeCaseJsonUnderNodesPrefix() throws Exception {
        records.storeNode(node("n1", "10.0.0.201", 12.5));

        String json = kv.entries().get("monitoring/nodes/n1");
        assertNotNull(json);
        JsonNode tree = Json.mapper().readTree(json);
        assertEquals("n1", tree.get("node_name").asText());
        assertEquals(12.5, tree.get("cpu_usage").asDouble(), 0.001);
        assertEquals(8192, tree.get("total_memory").asLong());
        assertFalse(tree.has("nodeName"));
    }

    @Test
    void nodeRoundTrip() {
        NodeInfo original = node("n1", "10.0.0.201", 12.5);
        records.storeNode(original);

        assertEquals(original, records.findNode("n1").orElseThrow());
        assertTrue(records.findNode("missing").isEmpty());
    }

    @Test
    void socAndBoardRoundTrip() throws Exception {
        NodeInfo a = node("a", "10.0.0.201", 10.0);
        NodeInfo b = node("b", "10.0.0.202", 30.0);
        SocInfo soc = new SocInfo("10.0.0.200", List.of(a, b), NOW);
        BoardInfo board = new BoardInfo("10.0.0.200", List.of(a, b), List.of(soc), NOW);

        records.storeSoc(soc);
        records.storeBoard(board);

        SocInfo loadedSoc = records.findSoc("10.0.0.200").orElseThrow();
        assertEquals(soc, loadedSoc);
        assertEquals(20.0, loadedSoc.totals().avgCpuUsage(), 0.001);

        BoardInfo loadedBoard = records.findBoard("10.0.0.200").orElseThrow();
        assertEquals(board, loadedBoard);
        assertEquals(1, loadedBoard.socs().size());

        JsonNode tree = Json.mapper().readTree(kv.entries().get("monitoring/socs/10.0.0.200"));
        assertEquals("2024-05-01T12:00:00Z", tree.get("last_updated").asText());
        assertEquals(16, tree.get("total_cpu_count").asLong());
    }

    @Test
    void bulkReadSkipsCorruptRecords() {
        records.storeNode(node("n1", "10.0.0.1", 1.0));
        records.storeNode(node("n3", "10.0.0.3", 3.0));
        kv.put("monitoring/nodes/n2", "{not json");
        kv.put("monitoring/nodes/n4", "{\"ip\":\"10.0.0.4\"}"); // no name

        List<NodeInfo> nodes = records.findAllNodes();

        assertEquals(List.of("n1", "n3"), nodes.stream().map(NodeInfo::nodeName).toList());
    }

    @Test
    void singleLookupOfCorruptRecordFails() {
        kv.put("monitoring/socs/10.0.0.0", "[]");

        DeserializationException e = assertThrows(DeserializationException.class,
                () -> records.findSoc("10.0.0.0"));
        assertEquals("monitoring/socs/10.0.0.0", e.key());
    }

    @Test
    void unknownFieldsAreIgnored() {
        kv.put("monitoring/nodes/n1", "{\"node_name\":\"n1\",\"ip\":\"10.0.0.1\",\"extra\":true}");

        NodeInfo loaded = records.findNode("n1").orElseThrow();
        assertEquals("10.0.0.1", loaded.ip());
    }

    @Test
    void collectionsAreScopedByPrefix() {
        NodeInfo a = node("a", "10.0.0.201", 10.0);
        records.storeNode(a);
        records.storeSoc(SocInfo.create("10.0.0.200", a, NOW));
        records.storeBoard(BoardInfo.create("10.0.0.200", a, NOW));

        assertEquals(1, records.findAllNodes().size());
        assertEquals(1, records.findAllSocs().size());
        assertEquals(1, records.findAllBoards().size());
    }

    @Test
    void deleteRemovesRecords() {
        NodeInfo a = node("a", "10.0.0.201", 10.0);
        records.storeNode(a);
        records.storeSoc(SocInfo.create("10.0.0.200", a, NOW));

        assertTrue(records.deleteNode("a"));
        assertTrue(records.deleteSoc("10.0.0.200"));
        assertFalse(records.deleteBoard("10.0.0.200"));
        assertTrue(kv.entries().isEmpty());
    }
}
