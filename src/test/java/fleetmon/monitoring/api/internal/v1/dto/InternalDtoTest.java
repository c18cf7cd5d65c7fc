package fleetmon.monitoring.api.internal.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import fleetmon.monitoring.model.ContainerList;
import fleetmon.monitoring.model.NodeInfo;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InternalDtoTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void nodeInfoRequestDeserialization() throws Exception {
        String json = """
                {
                  "nodeName": "edge-17",
                  "ip": "10.0.0.201",
                  "cpuUsage": 45.2,
                  "cpuCount": 8,
                  "gpuCount": 1,
                  "usedMemory": 2048,
                  "totalMemory": 8192,
                  "memUsage": 25.0,
                  "rxBytes": 10,
                  "txBytes": 20,
                  "readBytes": 30,
                  "writeBytes": 40,
                  "os": "linux",
                  "arch": "aarch64",
                  "agentVersion": "ignored"
                }
                """;

        NodeInfoRequest req = mapper.readValue(json, NodeInfoRequest.class);
        assertDoesNotThrow(req::validate);

        NodeInfo node = req.toDomain();
        assertEquals("edge-17", node.nodeName());
        assertEquals("10.0.0.201", node.ip());
        assertEquals(45.2, node.cpuUsage(), 0.01);
        assertEquals(8, node.cpuCount());
        assertEquals(8192, node.totalMemory());
        assertEquals("aarch64", node.arch());
    }

    @Test
    void nodeInfoRequestValidation() {
        NodeInfoRequest noName = new NodeInfoRequest(" ", "10.0.0.1", 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, null, null);
        assertThrows(IllegalArgumentException.class, noName::validate);

        NodeInfoRequest noIp = new NodeInfoRequest("n1", null, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, null, null);
        assertThrows(IllegalArgumentException.class, noIp::validate);

        NodeInfoRequest negative = new NodeInfoRequest("n1", "10.0.0.1", 0, -1, 0, 0, 0, 0, 0, 0, 0, 0, null, null);
        assertThrows(IllegalArgumentException.class, negative::validate);

        // malformed addresses are left to the store
        NodeInfoRequest badIp = new NodeInfoRequest("n1", "not-an-ip", 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, null, null);
        assertDoesNotThrow(badIp::validate);
    }

    @Test
    void missingOsAndArchBecomeEmpty() {
        NodeInfo node = new NodeInfoRequest("n1", "10.0.0.1", 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, null, null).toDomain();
        assertEquals("", node.os());
        assertEquals("", node.arch());
    }

    @Test
    void containerListRequestDeserialization() throws Exception {
        String json = """
                {
                  "nodeName": "edge-17",
                  "containers": [
                    {"id": "abc", "names": ["/web"], "image": "nginx:1.25"},
                    {"id": "def", "image": "redis"}
                  ]
                }
                """;

        ContainerListRequest req = mapper.readValue(json, ContainerListRequest.class);
        assertDoesNotThrow(req::validate);

        ContainerList list = req.toDomain();
        assertEquals("edge-17", list.nodeName());
        assertEquals(2, list.containers().size());
        assertEquals("nginx:1.25", list.containers().get(0).image());
        assertTrue(list.containers().get(1).names().isEmpty());
    }

    @Test
    void containerListRequestValidation() {
        assertThrows(IllegalArgumentException.class, new ContainerListRequest(null, null)::validate);
        assertTrue(new ContainerListRequest("n1", null).toDomain().containers().isEmpty());
    }

    @Test
    void containerListRequestRejectsNullEntries() {
        ContainerListRequest nullEntry = new ContainerListRequest("n1",
                Arrays.asList((ContainerListRequest.Container) null));
        assertThrows(IllegalArgumentException.class, nullEntry::validate);

        ContainerListRequest nullName = new ContainerListRequest("n1",
                List.of(new ContainerListRequest.Container("c1", Arrays.asList("web", null), "nginx")));
        assertThrows(IllegalArgumentException.class, nullName::validate);
    }

    @Test
    void containerListWithNullEntryParsesThenFailsValidation() throws Exception {
        ContainerListRequest request = mapper.readValue(
                "{\"nodeName\":\"n1\",\"containers\":[null]}", ContainerListRequest.class);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, request::validate);
        assertTrue(e.getMessage().contains("null"));
    }

    @Test
    void operationResponseSerialization() throws Exception {
        String json = mapper.writeValueAsString(OperationResponse.accepted(3));
        assertTrue(json.contains("\"ok\":true"));
        assertTrue(json.contains("\"queued\":3"));
        assertFalse(json.contains("error")); // null fields excluded

        json = mapper.writeValueAsString(OperationResponse.queueFull());
        assertTrue(json.contains("\"ok\":false"));
        assertTrue(json.contains("\"error\":\"queue_full\""));
        assertFalse(json.contains("queued"));
    }
}
