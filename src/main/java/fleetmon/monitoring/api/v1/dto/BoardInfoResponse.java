package fleetmon.monitoring.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import fleetmon.monitoring.model.AggregateTotals;
import fleetmon.monitoring.model.BoardInfo;
import fleetmon.monitoring.model.NodeInfo;
import fleetmon.monitoring.model.SocInfo;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a board aggregate.
 * GET /api/v1/boards, GET /api/v1/boards/{id}
 */
public record BoardInfoResponse(
        @JsonProperty("boardId") String boardId,
        @JsonProperty("nodeCount") int nodeCount,
        @JsonProperty("nodes") List<String> nodes,
        @JsonProperty("socs") List<String> socs,
        @JsonProperty("totals") AggregateTotals totals,
        @JsonProperty("lastUpdated") Instant lastUpdated) {

    public static BoardInfoResponse from(BoardInfo board) {
        return new BoardInfoResponse(
                board.boardId(),
                board.nodeCount(),
                board.nodes().stream().map(NodeInfo::nodeName).toList(),
                board.socs().stream().map(SocInfo::socId).toList(),
                board.totals(),
                board.lastUpdated());
    }
}
