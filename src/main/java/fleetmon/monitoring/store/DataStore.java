package fleetmon.monitoring.store;

import fleetmon.monitoring.core.IdentityDeriver;
import fleetmon.monitoring.core.InvalidAddressException;
import fleetmon.monitoring.model.BoardInfo;
import fleetmon.monitoring.model.HierarchyId;
import fleetmon.monitoring.model.NodeInfo;
import fleetmon.monitoring.model.SocInfo;
import fleetmon.monitoring.model.SystemSummary;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory store of node samples and their SoC and board aggregates.
 *
 * Invariants after every public mutation:
 * - each stored node is a member of exactly one SoC and one board, the ones
 * derived from its address
 * - aggregate totals are recomputed from the full member list
 * - a board's SoC list is exactly the set of stored SoCs mapping to it
 *
 * Not thread-safe. {@link fleetmon.monitoring.service.MonitoringService} owns
 * the single instance and guards every call.
 */
public class DataStore {

    private final Map<String, NodeInfo> nodes = new HashMap<>();
    private final Map<String, SocInfo> socs = new HashMap<>();
    private final Map<String, BoardInfo> boards = new HashMap<>();
    private final Clock clock;

    public DataStore() {
        this(Clock.systemUTC());
    }

    public DataStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Store a node sample and update its SoC and board.
     *
     * A node that reappears under a different SoC or board is detached from
     * the old groups first.
     *
     * @param node the latest sample for the node
     * @return the SoC and board the node now belongs to
     * @throws InvalidAddressException if the address does not parse; nothing is changed
     */
    public HierarchyId upsertNode(NodeInfo node) {
        HierarchyId ids = IdentityDeriver.derive(node.ip());
        Instant now = clock.instant();
        String name = node.nodeName();

        NodeInfo previous = nodes.put(name, node);

        String previousBoardId = null;
        if (previous != null) {
            HierarchyId old = IdentityDeriver.derive(previous.ip());
            if (!old.socId().equals(ids.socId())) {
                detachFromSoc(old.socId(), name, now);
            }
            if (!old.boardId().equals(ids.boardId())) {
                detachFromBoard(old.boardId(), name, now);
                previousBoardId = old.boardId();
            }
        }

        SocInfo soc = socs.get(ids.socId());
        socs.put(ids.socId(), soc == null
                ? SocInfo.create(ids.socId(), node, now)
                : soc.withNode(node, now));

        BoardInfo board = boards.get(ids.boardId());
        boards.put(ids.boardId(), board == null
                ? BoardInfo.create(ids.boardId(), node, now)
                : board.withNode(node, now));

        rebuildBoardSocs(ids.boardId());
        if (previousBoardId != null) {
            rebuildBoardSocs(previousBoardId);
        }

        return ids;
    }

    /**
     * Remove a node and recompute the aggregates it belonged to.
     * Aggregates left without members are dropped.
     *
     * @return true if the node was present
     */
    public boolean removeNode(String nodeName) {
        NodeInfo previous = nodes.remove(nodeName);
        if (previous == null) {
            return false;
        }

        HierarchyId ids = IdentityDeriver.derive(previous.ip());
        Instant now = clock.instant();
        detachFromSoc(ids.socId(), nodeName, now);
        detachFromBoard(ids.boardId(), nodeName, now);
        return true;
    }

    public Optional<NodeInfo> getNode(String nodeName) {
        return Optional.ofNullable(nodes.get(nodeName));
    }

    public Optional<SocInfo> getSoc(String socId) {
        return Optional.ofNullable(socs.get(socId));
    }

    public Optional<BoardInfo> getBoard(String boardId) {
        return Optional.ofNullable(boards.get(boardId));
    }

    public List<NodeInfo> allNodes() {
        List<NodeInfo> list = new ArrayList<>(nodes.values());
        list.sort(Comparator.comparing(NodeInfo::nodeName));
        return list;
    }

    public List<SocInfo> allSocs() {
        List<SocInfo> list = new ArrayList<>(socs.values());
        list.sort(Comparator.comparing(SocInfo::socId));
        return list;
    }

    public List<BoardInfo> allBoards() {
        List<BoardInfo> list = new ArrayList<>(boards.values());
        list.sort(Comparator.comparing(BoardInfo::boardId));
        return list;
    }

    /**
     * Fleet-wide averages over all nodes, zero when empty.
     */
    public SystemSummary summary() {
        int count = nodes.size();
        if (count == 0) {
            return new SystemSummary(0, socs.size(), boards.size(), 0.0, 0.0, 0, 0);
        }

        double cpu = 0.0;
        double mem = 0.0;
        long cores = 0;
        long gpus = 0;
        for (NodeInfo node : nodes.values()) {
            cpu += node.cpuUsage();
            mem += node.memUsage();
            cores = Math.addExact(cores, node.cpuCount());
            gpus = Math.addExact(gpus, node.gpuCount());
        }
        return new SystemSummary(count, socs.size(), boards.size(), cpu / count, mem / count, cores, gpus);
    }

    private void detachFromSoc(String socId, String nodeName, Instant now) {
        SocInfo soc = socs.get(socId);
        if (soc == null) {
            return;
        }
        SocInfo updated = soc.withoutNode(nodeName, now);
        if (updated.isEmpty()) {
            socs.remove(socId);
        } else {
            socs.put(socId, updated);
        }
    }

    private void detachFromBoard(String boardId, String nodeName, Instant now) {
        BoardInfo board = boards.get(boardId);
        if (board == null) {
            return;
        }
        BoardInfo updated = board.withoutNode(nodeName, now);
        if (updated.isEmpty()) {
            boards.remove(boardId);
        } else {
            boards.put(boardId, updated);
            rebuildBoardSocs(boardId);
        }
    }

    /**
     * Rebuild a board's SoC list from the full SoC mapping.
     */
    private void rebuildBoardSocs(String boardId) {
        BoardInfo board = boards.get(boardId);
        if (board == null) {
            return;
        }

        List<SocInfo> boardSocs = new ArrayList<>();
        for (SocInfo soc : socs.values()) {
            if (boardId.equals(IdentityDeriver.boardId(soc.socId()))) {
                boardSocs.add(soc);
            }
        }
        boardSocs.sort(Comparator.comparing(SocInfo::socId));

        boards.put(boardId, board.withSocs(boardSocs));
    }
}
