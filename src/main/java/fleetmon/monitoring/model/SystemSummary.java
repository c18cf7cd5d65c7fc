package fleetmon.monitoring.model;

/**
 * Fleet-wide figures: entity counts plus mean usage and summed capacity over all nodes.
 */
public record SystemSummary(
        int totalNodes,
        int totalSocs,
        int totalBoards,
        double avgCpuUsage,
        double avgMemUsage,
        long totalCpuCount,
        long totalGpuCount) {
}
