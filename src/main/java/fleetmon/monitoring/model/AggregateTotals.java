package fleetmon.monitoring.model;

import java.util.List;

/**
 * Derived statistics shared by SoC and board aggregates.
 *
 * CPU and memory usage are arithmetic means over members, every other field
 * is an exact sum. Always computed from the full member list.
 *
 * Counters are unsigned but summed as {@code long}; a sum past
 * {@link Long#MAX_VALUE} throws {@link ArithmeticException} instead of wrapping.
 */
public record AggregateTotals(
        double avgCpuUsage,
        double avgMemUsage,
        long totalCpuCount,
        long totalGpuCount,
        long totalUsedMemory,
        long totalMemory,
        long totalRxBytes,
        long totalTxBytes,
        long totalReadBytes,
        long totalWriteBytes) {

    public static final AggregateTotals ZERO = new AggregateTotals(0.0, 0.0, 0, 0, 0, 0, 0, 0, 0, 0);

    /**
     * Recompute totals from the given members. An empty list yields {@link #ZERO}.
     */
    public static AggregateTotals of(List<NodeInfo> nodes) {
        if (nodes.isEmpty()) {
            return ZERO;
        }

        double cpuSum = 0.0;
        double memSum = 0.0;
        long cpuCount = 0;
        long gpuCount = 0;
        long usedMemory = 0;
        long totalMemory = 0;
        long rx = 0;
        long tx = 0;
        long read = 0;
        long write = 0;

        for (NodeInfo node : nodes) {
            cpuSum += node.cpuUsage();
            memSum += node.memUsage();
            cpuCount = Math.addExact(cpuCount, node.cpuCount());
            gpuCount = Math.addExact(gpuCount, node.gpuCount());
            usedMemory = Math.addExact(usedMemory, node.usedMemory());
            totalMemory = Math.addExact(totalMemory, node.totalMemory());
            rx = Math.addExact(rx, node.rxBytes());
            tx = Math.addExact(tx, node.txBytes());
            read = Math.addExact(read, node.readBytes());
            write = Math.addExact(write, node.writeBytes());
        }

        int n = nodes.size();
        return new AggregateTotals(cpuSum / n, memSum / n, cpuCount, gpuCount,
                usedMemory, totalMemory, rx, tx, read, write);
    }
}
