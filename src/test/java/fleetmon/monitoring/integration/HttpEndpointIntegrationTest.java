package fleetmon.monitoring.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fleetmon.monitoring.config.Dependencies;
import fleetmon.monitoring.config.MonitoringConfig;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints.
 * Telemetry goes in through the internal API, passes the node loop and
 * comes back out of the public query API.
 */
class HttpEndpointIntegrationTest {

        private static final ObjectMapper MAPPER = new ObjectMapper();
        private static final String AGENT_KEY = "test-agent-key";

        private Dependencies deps;
        private HttpClient httpClient;
        private String baseUrl;

        @BeforeEach
        void setUp() {
                MonitoringConfig config = MonitoringConfig.defaults()
                                .withServerPort(0)
                                .withAgentKey(AGENT_KEY)
                                .withDatabaseUrl("jdbc:h2:mem:test-http-" + System.nanoTime()
                                                + ";DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE");
                deps = Dependencies.create(config);
                assertTrue(deps.start(), "server should bind");

                baseUrl = "http://localhost:" + deps.server().boundPort();
                httpClient = HttpClient.newBuilder()
                                .connectTimeout(Duration.ofSeconds(5))
                                .build();
        }

        @AfterEach
        void tearDown() {
                if (deps != null) {
                        deps.close();
                }
        }

        @Test
        @DisplayName("Full HTTP flow: post samples, read SoC, board and summary")
        void telemetryFlowsToAggregates() throws Exception {
                assertEquals(202, postNodeInfo("n1", "10.0.0.201", 20.0).statusCode());
                assertEquals(202, postNodeInfo("n2", "10.0.0.205", 50.0).statusCode());
                assertEquals(202, postNodeInfo("n3", "10.0.0.215", 60.0).statusCode());

                JsonNode board = awaitJson("/api/v1/boards/10.0.0.200",
                                b -> b.has("nodeCount") && b.get("nodeCount").asInt() == 3);
                assertEquals(43.333, board.get("totals").get("avgCpuUsage").asDouble(), 0.001);
                assertEquals(2, board.get("socs").size());

                JsonNode soc = getJson("/api/v1/socs/10.0.0.200");
                assertEquals(2, soc.get("nodeCount").asInt());
                assertEquals(35.0, soc.get("totals").get("avgCpuUsage").asDouble(), 0.001);

                JsonNode socs = getJson("/api/v1/socs");
                assertEquals(2, socs.get("socs").size());

                JsonNode node = getJson("/api/v1/nodes/n3");
                assertEquals("10.0.0.210", node.get("socId").asText());

                JsonNode summary = getJson("/api/v1/summary");
                assertEquals(3, summary.get("totalNodes").asInt());
                assertEquals(1, summary.get("totalBoards").asInt());

                JsonNode health = getJson("/api/v1/health");
                assertEquals("healthy", health.get("status").asText());
                assertEquals("ok", health.get("storage").asText());
                assertEquals(3, health.get("nodes").asInt());

                // persisted through the record store
                assertTrue(deps.recordStore().findBoard("10.0.0.200").isPresent());
        }

        @Test
        void malformedAddressIsDroppedByTheLoop() throws Exception {
                assertEquals(202, postNodeInfo("bad", "10.0.0", 20.0).statusCode());
                assertEquals(202, postNodeInfo("good", "10.0.0.7", 20.0).statusCode());

                awaitJson("/api/v1/summary", s -> s.get("totalNodes").asInt() == 1);
                assertEquals(404, get("/api/v1/nodes/bad").statusCode());
                assertEquals(1, deps.dispatcher().nodesRejected());
        }

        @Test
        void deleteRemovesNodeAndEmptyGroups() throws Exception {
                postNodeInfo("n1", "10.0.0.201", 20.0);
                awaitJson("/api/v1/summary", s -> s.get("totalNodes").asInt() == 1);

                HttpResponse<String> deleted = httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(baseUrl + "/api/v1/nodes/n1"))
                                                .DELETE()
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
                assertEquals(200, deleted.statusCode());

                assertEquals(404, get("/api/v1/nodes/n1").statusCode());
                assertEquals(404, get("/api/v1/socs/10.0.0.200").statusCode());
                assertEquals(404, get("/api/v1/boards/10.0.0.200").statusCode());
        }

        @Test
        void unknownResourcesReturn404() throws Exception {
                assertEquals(404, get("/api/v1/nodes/ghost").statusCode());
                assertEquals(404, get("/api/v1/socs/10.9.9.0").statusCode());
                assertEquals(404, get("/api/v1/boards/10.9.9.0").statusCode());
                assertEquals(404, get("/not/an/endpoint").statusCode());
        }

        @Test
        void itemPathsWithExtraSegmentsReturn404() throws Exception {
                postNodeInfo("n1", "10.0.0.201", 10.0);
                awaitJson("/api/v1/socs/10.0.0.200", json -> json.has("socId"));

                assertEquals(404, get("/api/v1/socs/10.0.0.200/extra").statusCode());
                assertEquals(404, get("/api/v1/boards/10.0.0.200/x").statusCode());
                assertEquals(404, get("/api/v1/nodes/n1/more").statusCode());
                assertEquals(404, get("/api/v1/socs/").statusCode());
        }

        @Test
        void invalidBodiesReturn400() throws Exception {
                assertEquals(400, postInternal("/internal/v1/nodeinfo", "{\"nodeName\":\"\",\"ip\":\"10.0.0.1\"}")
                                .statusCode());
                assertEquals(400, postInternal("/internal/v1/nodeinfo", "{oops").statusCode());
                assertEquals(400, postInternal("/internal/v1/containers", "{\"containers\":[]}").statusCode());
                assertEquals(400, postInternal("/internal/v1/containers",
                                "{\"nodeName\":\"n1\",\"containers\":[null]}").statusCode());
                assertEquals(400, postInternal("/internal/v1/containers",
                                "{\"nodeName\":\"n1\",\"containers\":[{\"id\":\"c1\",\"names\":[null]}]}")
                                .statusCode());
        }

        @Test
        void containerInventoryIsAccepted() throws Exception {
                String body = """
                                {"nodeName": "n1", "containers": [{"id": "c1", "names": ["/web"], "image": "nginx"}]}
                                """;
                assertEquals(202, postInternal("/internal/v1/containers", body).statusCode());

                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
                while (deps.dispatcher().containerListsProcessed() < 1 && System.nanoTime() < deadline) {
                        TimeUnit.MILLISECONDS.sleep(20);
                }
                assertEquals(1, deps.monitoringService().containerCounts().get("n1").intValue());

                JsonNode health = getJson("/api/v1/health");
                assertEquals(1, health.get("containers").asInt());
        }

        @Test
        void internalApiRequiresAgentKey() throws Exception {
                HttpResponse<String> response = httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(baseUrl + "/internal/v1/nodeinfo"))
                                                .header("Content-Type", "application/json")
                                                .POST(HttpRequest.BodyPublishers.ofString(
                                                                nodeInfoJson("n1", "10.0.0.1", 1.0)))
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
                assertEquals(403, response.statusCode());

                // public API stays open
                assertEquals(200, get("/api/v1/health").statusCode());
        }

        // ---- helpers ----

        private static String nodeInfoJson(String name, String ip, double cpu) {
                return """
                                {"nodeName": "%s", "ip": "%s", "cpuUsage": %s, "cpuCount": 4, "memUsage": 10.0,
                                 "totalMemory": 8192, "usedMemory": 1024, "os": "linux", "arch": "aarch64"}
                                """.formatted(name, ip, cpu);
        }

        private HttpResponse<String> postNodeInfo(String name, String ip, double cpu) throws Exception {
                return postInternal("/internal/v1/nodeinfo", nodeInfoJson(name, ip, cpu));
        }

        private HttpResponse<String> postInternal(String path, String body) throws Exception {
                return httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(baseUrl + path))
                                                .header("Content-Type", "application/json")
                                                .header("X-Monitor-Key", AGENT_KEY)
                                                .POST(HttpRequest.BodyPublishers.ofString(body))
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        private HttpResponse<String> get(String path) throws Exception {
                return httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(baseUrl + path))
                                                .GET()
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        private JsonNode getJson(String path) throws Exception {
                HttpResponse<String> response = get(path);
                assertEquals(200, response.statusCode(), "GET " + path + " body: " + response.body());
                return MAPPER.readTree(response.body());
        }

        /** Samples are applied asynchronously by the node loop */
        private JsonNode awaitJson(String path, Predicate<JsonNode> condition) throws Exception {
                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
                while (true) {
                        HttpResponse<String> response = get(path);
                        if (response.statusCode() == 200) {
                                JsonNode json = MAPPER.readTree(response.body());
                                if (condition.test(json)) {
                                        return json;
                                }
                        }
                        if (System.nanoTime() > deadline) {
                                fail("Timed out waiting for " + path + ", last: " + response.body());
                        }
                        TimeUnit.MILLISECONDS.sleep(20);
                }
        }
}
