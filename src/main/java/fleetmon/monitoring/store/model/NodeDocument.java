package fleetmon.monitoring.store.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fleetmon.monitoring.model.NodeInfo;

/**
 * Stored JSON form of a node sample under {@code monitoring/nodes/<name>}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NodeDocument(
        @JsonProperty("node_name") String nodeName,
        @JsonProperty("ip") String ip,
        @JsonProperty("cpu_usage") double cpuUsage,
        @JsonProperty("cpu_count") long cpuCount,
        @JsonProperty("gpu_count") long gpuCount,
        @JsonProperty("used_memory") long usedMemory,
        @JsonProperty("total_memory") long totalMemory,
        @JsonProperty("mem_usage") double memUsage,
        @JsonProperty("rx_bytes") long rxBytes,
        @JsonProperty("tx_bytes") long txBytes,
        @JsonProperty("read_bytes") long readBytes,
        @JsonProperty("write_bytes") long writeBytes,
        @JsonProperty("os") String os,
        @JsonProperty("arch") String arch) {

    public static NodeDocument from(NodeInfo node) {
        return new NodeDocument(
                node.nodeName(),
                node.ip(),
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

    public NodeInfo toDomain() {
        if (nodeName == null || nodeName.isBlank()) {
            throw new IllegalArgumentException("node_name is missing");
        }
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
                .os(os)
                .arch(arch)
                .build();
    }
}
