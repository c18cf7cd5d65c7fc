package fleetmon.monitoring.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of one SoC group: its member nodes and the totals
 * derived from them. Every mutation returns a new instance with freshly
 * recomputed totals.
 */
public final class SocInfo {
    private final String socId;
    private final List<NodeInfo> nodes;
    private final AggregateTotals totals;
    private final Instant lastUpdated;

    public SocInfo(String socId, List<NodeInfo> nodes, Instant lastUpdated) {
        this.socId = Objects.requireNonNull(socId, "socId is required");
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.totals = AggregateTotals.of(this.nodes);
        this.lastUpdated = lastUpdated;
    }

    /** First member creates the group */
    public static SocInfo create(String socId, NodeInfo node, Instant now) {
        return new SocInfo(socId, List.of(node), now);
    }

    /** Replace the member with the same name, or append it */
    public SocInfo withNode(NodeInfo node, Instant now) {
        return new SocInfo(socId, Members.replaceOrAppend(nodes, node), now);
    }

    public SocInfo withoutNode(String nodeName, Instant now) {
        return new SocInfo(socId, Members.remove(nodes, nodeName), now);
    }

    public String socId() {
        return socId;
    }

    public List<NodeInfo> nodes() {
        return nodes;
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
        if (!(o instanceof SocInfo that))
            return false;
        return socId.equals(that.socId)
                && nodes.equals(that.nodes)
                && Objects.equals(lastUpdated, that.lastUpdated);
    }

    @Override
    public int hashCode() {
        return Objects.hash(socId, nodes, lastUpdated);
    }

    @Override
    public String toString() {
        return "SocInfo{id='" + socId + "', nodes=" + nodes.size() + ", avgCpu=" + totals.avgCpuUsage() + "}";
    }
}
