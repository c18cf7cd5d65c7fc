package fleetmon.monitoring.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of one board: member nodes, the SoC groups mapped to
 * this board, and totals derived from the member nodes.
 */
public final class BoardInfo {
    private final String boardId;
    private final List<NodeInfo> nodes;
    private final List<SocInfo> socs;
    private final AggregateTotals totals;
    private final Instant lastUpdated;

    public BoardInfo(String boardId, List<NodeInfo> nodes, List<SocInfo> socs, Instant lastUpdated) {
        this.boardId = Objects.requireNonNull(boardId, "boardId is required");
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.socs = Collections.unmodifiableList(new ArrayList<>(socs));
        this.totals = AggregateTotals.of(this.nodes);
        this.lastUpdated = lastUpdated;
    }

    /** First member creates the board; the SoC list is filled in by the store */
    public static BoardInfo create(String boardId, NodeInfo node, Instant now) {
        return new BoardInfo(boardId, List.of(node), List.of(), now);
    }

    public BoardInfo withNode(NodeInfo node, Instant now) {
        return new BoardInfo(boardId, Members.replaceOrAppend(nodes, node), socs, now);
    }

    public BoardInfo withoutNode(String nodeName, Instant now) {
        return new BoardInfo(boardId, Members.remove(nodes, nodeName), socs, now);
    }

    /** Replace the SoC list wholesale. Totals and timestamp are unchanged. */
    public BoardInfo withSocs(List<SocInfo> boardSocs) {
        return new BoardInfo(boardId, nodes, boardSocs, lastUpdated);
    }

    public String boardId() {
        return boardId;
    }

    public List<NodeInfo> nodes() {
        return nodes;
    }

    public List<SocInfo> socs() {
        return socs;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public AggregateTotals totals() {
        return totals;
    }

    public Instant lastUpdated() {
        return lastUpdated;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BoardInfo that))
            return false;
        return boardId.equals(that.boardId)
                && nodes.equals(that.nodes)
                && socs.equals(that.socs)
                && Objects.equals(lastUpdated, that.lastUpdated);
    }

    @Override
    public int hashCode() {
        return Objects.hash(boardId, nodes, socs, lastUpdated);
    }

    @Override
    public String toString() {
        return "BoardInfo{id='" + boardId + "', nodes=" + nodes.size() + ", socs=" + socs.size() + "}";
    }
}
