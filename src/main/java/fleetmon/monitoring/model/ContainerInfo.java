package fleetmon.monitoring.model;

import java.util.List;

/**
 * One container reported by a node agent.
 */
public record ContainerInfo(String id, List<String> names, String image) {

    public ContainerInfo {
        names = names == null ? List.of() : List.copyOf(names);
    }
}
