package fleetmon.monitoring.service;

import fleetmon.monitoring.core.IdentityDeriver;
import fleetmon.monitoring.core.InvalidAddressException;
import fleetmon.monitoring.model.BoardInfo;
import fleetmon.monitoring.model.ContainerInfo;
import fleetmon.monitoring.model.ContainerList;
import fleetmon.monitoring.model.HierarchyId;
import fleetmon.monitoring.model.MonitoringSnapshot;
import fleetmon.monitoring.model.NodeInfo;
import fleetmon.monitoring.model.SocInfo;
import fleetmon.monitoring.model.SystemSummary;
import fleetmon.monitoring.store.DataStore;
import fleetmon.monitoring.store.MonitoringRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Service layer that owns the single {@link DataStore}.
 *
 * Every mutation runs under the write lock and every read under the read
 * lock, so readers only ever see the state left by a completed upsert.
 * Persistence runs inside the write lock after the in-memory update and is
 * best-effort: failures are logged and never undo the update.
 */
public class MonitoringService {

    private static final Logger log = LoggerFactory.getLogger(MonitoringService.class);

    private final DataStore store;
    private final MonitoringRecordStore recordStore;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Integer> containerCounts = new HashMap<>(); // guarded by lock

    public MonitoringService(DataStore store) {
        this(store, null);
    }

    /**
     * @param store       the in-memory store, owned exclusively by this service from now on
     * @param recordStore durable storage, or null to keep everything in memory
     */
    public MonitoringService(DataStore store, MonitoringRecordStore recordStore) {
        this.store = store;
        this.recordStore = recordStore;
    }

    /**
     * Apply one utilization sample.
     *
     * @return the SoC and board the node was filed under
     * @throws InvalidAddressException if the node address is malformed; nothing is stored
     */
    public HierarchyId ingest(NodeInfo node) {
        Lock write = lock.writeLock();
        write.lock();
        try {
            Optional<HierarchyId> previous = store.getNode(node.nodeName())
                    .map(existing -> IdentityDeriver.derive(existing.ip()));
            HierarchyId ids = store.upsertNode(node);
            log.info("Stored NodeInfo for {} ({}) -> soc {}, board {}",
                    node.nodeName(), node.ip(), ids.socId(), ids.boardId());
            persist(node, ids, previous.filter(old -> !old.equals(ids)).orElse(null));
            return ids;
        } finally {
            write.unlock();
        }
    }

    /**
     * Record a container inventory. The store is not touched; only the
     * latest container count per node is kept, for the health endpoint.
     */
    public void observeContainers(ContainerList containerList) {
        log.info("Received ContainerList from {}: containers count={}",
                containerList.nodeName(), containerList.containers().size());
        for (ContainerInfo container : containerList.containers()) {
            log.debug("  Container: id={}, names={}, image={}",
                    container.id(), container.names(), container.image());
        }
        if (containerList.nodeName() == null) {
            return;
        }
        Lock write = lock.writeLock();
        write.lock();
        try {
            containerCounts.put(containerList.nodeName(), containerList.containers().size());
        } finally {
            write.unlock();
        }
    }

    /**
     * Remove a node and recompute the groups it belonged to.
     *
     * @return true if the node existed
     */
    public boolean removeNode(String nodeName) {
        Lock write = lock.writeLock();
        write.lock();
        try {
            Optional<NodeInfo> existing = store.getNode(nodeName);
            if (existing.isEmpty()) {
                return false;
            }
            HierarchyId ids = IdentityDeriver.derive(existing.get().ip());
            store.removeNode(nodeName);
            containerCounts.remove(nodeName);
            log.info("Removed node {} from soc {}, board {}", nodeName, ids.socId(), ids.boardId());
            persistRemoval(nodeName, ids);
            return true;
        } finally {
            write.unlock();
        }
    }

    // ---- reads ----

    public Optional<NodeInfo> findNode(String nodeName) {
        return read(() -> store.getNode(nodeName));
    }

    public Optional<SocInfo> findSoc(String socId) {
        return read(() -> store.getSoc(socId));
    }

    public Optional<BoardInfo> findBoard(String boardId) {
        return read(() -> store.getBoard(boardId));
    }

    public List<NodeInfo> allNodes() {
        return read(store::allNodes);
    }

    public List<SocInfo> allSocs() {
        return read(store::allSocs);
    }

    public List<BoardInfo> allBoards() {
        return read(store::allBoards);
    }

    public SystemSummary summary() {
        return read(store::summary);
    }

    /**
     * Nodes, SoCs and boards taken under one lock acquisition.
     */
    public MonitoringSnapshot snapshot() {
        return read(() -> new MonitoringSnapshot(store.allNodes(), store.allSocs(), store.allBoards()));
    }

    /**
     * Latest container count per node, as reported on the inventory stream.
     */
    public Map<String, Integer> containerCounts() {
        return read(() -> Map.copyOf(containerCounts));
    }

    /**
     * Sum of the latest container counts over all reporting nodes.
     */
    public int totalContainers() {
        return read(() -> containerCounts.values().stream().mapToInt(Integer::intValue).sum());
    }

    public boolean persistenceEnabled() {
        return recordStore != null;
    }

    private <T> T read(Supplier<T> query) {
        Lock read = lock.readLock();
        read.lock();
        try {
            return query.get();
        } finally {
            read.unlock();
        }
    }

    private void persist(NodeInfo node, HierarchyId ids, HierarchyId moved) {
        if (recordStore == null) {
            return;
        }
        try {
            recordStore.storeNode(node);
            syncSoc(ids.socId());
            syncBoard(ids.boardId());
            if (moved != null) {
                syncSoc(moved.socId());
                syncBoard(moved.boardId());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to persist monitoring data for {}: {}", node.nodeName(), e.getMessage());
        }
    }

    private void persistRemoval(String nodeName, HierarchyId ids) {
        if (recordStore == null) {
            return;
        }
        try {
            recordStore.deleteNode(nodeName);
            syncSoc(ids.socId());
            syncBoard(ids.boardId());
        } catch (RuntimeException e) {
            log.warn("Failed to remove persisted data for {}: {}", nodeName, e.getMessage());
        }
    }

    /** Write the current SoC record, or delete it if the SoC no longer exists */
    private void syncSoc(String socId) {
        Optional<SocInfo> soc = store.getSoc(socId);
        if (soc.isPresent()) {
            recordStore.storeSoc(soc.get());
        } else {
            recordStore.deleteSoc(socId);
        }
    }

    private void syncBoard(String boardId) {
        Optional<BoardInfo> board = store.getBoard(boardId);
        if (board.isPresent()) {
            recordStore.storeBoard(board.get());
        } else {
            recordStore.deleteBoard(boardId);
        }
    }
}
