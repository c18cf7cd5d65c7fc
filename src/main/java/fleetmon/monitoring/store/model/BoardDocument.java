package fleetmon.monitoring.store.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fleetmon.monitoring.model.AggregateTotals;
import fleetmon.monitoring.model.BoardInfo;

import java.time.Instant;
import java.util.List;

/**
 * Stored JSON form of a board aggregate under {@code monitoring/boards/<id>}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BoardDocument(
        @JsonProperty("board_id") String boardId,
        @JsonProperty("nodes") List<NodeDocument> nodes,
        @JsonProperty("socs") List<SocDocument> socs,
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

    public static BoardDocument from(BoardInfo board) {
        AggregateTotals t = board.totals();
        return new BoardDocument(
                board.boardId(),
                board.nodes().stream().map(NodeDocument::from).toList(),
                board.socs().stream().map(SocDocument::from).toList(),
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
                board.lastUpdated());
    }

    public BoardInfo toDomain() {
        if (boardId == null || boardId.isBlank()) {
            throw new IllegalArgumentException("board_id is missing");
        }
        List<NodeDocument> members = nodes == null ? List.of() : nodes;
        List<SocDocument> boardSocs = socs == null ? List.of() : socs;
        return new BoardInfo(
                boardId,
                members.stream().map(NodeDocument::toDomain).toList(),
                boardSocs.stream().map(SocDocument::toDomain).toList(),
                lastUpdated);
    }
}
