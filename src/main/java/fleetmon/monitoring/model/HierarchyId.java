package fleetmon.monitoring.model;

/**
 * SoC and board identifiers derived from one node address.
 */
public record HierarchyId(String socId, String boardId) {
}
