package fleetmon.monitoring.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import fleetmon.monitoring.model.AggregateTotals;
import fleetmon.monitoring.model.NodeInfo;
import fleetmon.monitoring.model.SocInfo;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a SoC aggregate.
 * GET /api/v1/socs, GET /api/v1/socs/{id}
 */
public record SocInfoResponse(
        @JsonProperty("socId") String socId,
        @JsonProperty("nodeCount") int nodeCount,
        @JsonProperty("nodes") List<String> nodes,
        @JsonProperty("totals") AggregateTotals totals,
        @JsonProperty("lastUpdated") Instant lastUpdated) {

    public static SocInfoResponse from(SocInfo soc) {
        return new SocInfoResponse(
                soc.socId(),
                soc.nodeCount(),
                soc.nodes().stream().map(NodeInfo::nodeName).toList(),
                soc.totals(),
                soc.lastUpdated());
    }
}
