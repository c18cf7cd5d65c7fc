package fleetmon.monitoring.store.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fleetmon.monitoring.model.AggregateTotals;
import fleetmon.monitoring.model.SocInfo;

import java.time.Instant;
import java.util.List;

/**
 * Stored JSON form of a SoC aggregate under {@code monitoring/socs/<id>}.
 * Totals are written for readers of the raw store; on load they are
 * recomputed from the nodes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SocDocument(
        @JsonProperty("soc_id") String socId,
        @JsonProperty("nodes") List<NodeDocument> nodes,
        @JsonProperty("total_cpu_usage") double totalCpuUsage,
        @JsonProperty("total_cpu_count") long totalCpuCount,
        @JsonProperty("total_gpu_count") long totalGpuCount,
        @JsonProperty("total_used_memory") long totalUsedMemory,
        @JsonProperty("total_memory") long totalMemory,
        @JsonProperty("total_mem_usage") double totalMemUsage,
        @JsonProperty("total_rx_bytes") long totalRxBytes,
        @JsonProperty("total_tx_bytes") long totalTxBytes,
        @JsonProperty("total_read_bytes") long totalReadBytes,
        @JsonProperty("total_write_bytes") long totalWriteBytes,
        @JsonProperty("last_updated") Instant lastUpdated) {

    public static SocDocument from(SocInfo soc) {
        AggregateTotals t = soc.totals();
        return new SocDocument(
                soc.socId(),
                soc.nodes().stream().map(NodeDocument::from).toList(),
                t.avgCpuUsage(),
                t.totalCpuCount(),
                t.totalGpuCount(),
                t.totalUsedMemory(),
                t.totalMemory(),
                t.avgMemUsage(),
                t.totalRxBytes(),
                t.totalTxBytes(),
                t.totalReadBytes(),
                t.totalWriteBytes(),
                soc.lastUpdated());
    }

    public SocInfo toDomain() {
        if (socId == null || socId.isBlank()) {
            throw new IllegalArgumentException("soc_id is missing");
        }
        List<NodeDocument> members = nodes == null ? List.of() : nodes;
        return new SocInfo(socId, members.stream().map(NodeDocument::toDomain).toList(), lastUpdated);
    }
}
