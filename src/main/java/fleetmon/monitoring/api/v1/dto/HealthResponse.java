package fleetmon.monitoring.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("storage") String storage,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("nodes") Integer nodes,
        @JsonProperty("socs") Integer socs,
        @JsonProperty("boards") Integer boards,
        @JsonProperty("containers") Integer containers,
        @JsonProperty("nodeQueueDepth") Integer nodeQueueDepth,
        @JsonProperty("containerQueueDepth") Integer containerQueueDepth) {

    public static HealthResponse healthy(String storage, String uptime, String version, int nodes, int socs,
            int boards, int containers, int nodeQueueDepth, int containerQueueDepth) {
        return new HealthResponse("healthy", storage, uptime, version, nodes, socs, boards, containers,
                nodeQueueDepth, containerQueueDepth);
    }

    public static HealthResponse unhealthy(String storage) {
        return new HealthResponse("unhealthy", storage, null, null, null, null, null, null, null, null);
    }
}
