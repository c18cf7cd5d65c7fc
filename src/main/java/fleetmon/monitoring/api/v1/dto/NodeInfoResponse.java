package fleetmon.monitoring.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fleetmon.monitoring.core.IdentityDeriver;
import fleetmon.monitoring.model.HierarchyId;
import fleetmon.monitoring.model.NodeInfo;

/**
 * Response DTO for one node.
 * GET /api/v1/nodes, GET /api/v1/nodes/{name}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeInfoResponse(
        @JsonProperty("nodeName") String nodeName,
        @JsonProperty("ip") String ip,
        @JsonProperty("socId") String socId,
        @JsonProperty("boardId") String boardId,
        @JsonProperty("cpuUsage") double cpuUsage,
        @JsonProperty("cpuCount") long cpuCount,
        @JsonProperty("gpuCount") long gpuCount,
        @JsonProperty("usedMemory") long usedMemory,
        @JsonProperty("totalMemory") long totalMemory,
        @JsonProperty("memUsage") double memUsage,
        @JsonProperty("rxBytes") long rxBytes,
        @JsonProperty("txBytes") long txBytes,
        @JsonProperty("readBytes") long readBytes,
        @JsonProperty("writeBytes") long writeBytes,
        @JsonProperty("os") String os,
        @JsonProperty("arch") String arch) {

    /** Create response from domain model; stored nodes always carry a valid address */
    public static NodeInfoResponse from(NodeInfo node) {
        HierarchyId ids = IdentityDeriver.derive(node.ip());
        return new NodeInfoResponse(
                node.nodeName(),
                node.ip(),
                ids.socId(),
                ids.boardId(),
                node.cpuUsage(),
                node.cpuCount(),
                node.gpuCount(),
                node.usedMemory(),
                node.totalMemory(),
                node.memUsage(),
                node.rxBytes(),
                node.txBytes(),
                node.readBytes(),
                node.writeBytes(),
                node.os(),
                node.arch());
    }
}
