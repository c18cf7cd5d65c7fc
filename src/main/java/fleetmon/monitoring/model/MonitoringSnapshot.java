package fleetmon.monitoring.model;

import java.util.List;

/**
 * Nodes, SoCs and boards captured from one consistent store state.
 */
public record MonitoringSnapshot(List<NodeInfo> nodes, List<SocInfo> socs, List<BoardInfo> boards) {
}
