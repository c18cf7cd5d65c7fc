package fleetmon.monitoring.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fleetmon.monitoring.model.NodeInfo;

/**
 * Request DTO for one utilization sample.
 * POST /internal/v1/nodeinfo
 *
 * The address is not checked here; malformed addresses are rejected by the
 * store when the sample is applied.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NodeInfoRequest(
        @JsonProperty("nodeName") String nodeName,
        @JsonProperty("ip") String ip,
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

    public void validate() {
        if (nodeName == null || nodeName.isBlank()) {
            throw new IllegalArgumentException("nodeName is required");
        }
        if (ip == null || ip.isBlank()) {
            throw new IllegalArgumentException("ip is required");
        }
        if (cpuCount < 0 || gpuCount < 0) {
            throw new IllegalArgumentException("cpuCount and gpuCount must be non-negative");
        }
        if (usedMemory < 0 || totalMemory < 0) {
            throw new IllegalArgumentException("memory figures must be non-negative");
        }
        if (rxBytes < 0 || txBytes < 0 || readBytes < 0 || writeBytes < 0) {
            throw new IllegalArgumentException("byte counters must be non-negative");
        }
    }

    public NodeInfo toDomain() {
        return NodeInfo.builder()
                .nodeName(nodeName)
                .ip(ip)
                .cpuUsage(cpuUsage)
                .cpuCount(cpuCount)
                .gpuCount(gpuCount)
                .usedMemory(usedMemory)
                .totalMemory(totalMemory)
                .memUsage(memUsage)
                .rxBytes(rxBytes)
                .txBytes(txBytes)
                .readBytes(readBytes)
                .writeBytes(writeBytes)
                .os(os == null ? "" : os)
                .arch(arch == null ? "" : arch)
                .build();
    }
}
