package fleetmon.monitoring.model;

import java.util.List;

/**
 * Container inventory of one node. Observed only, never aggregated.
 */
public record ContainerList(String nodeName, List<ContainerInfo> containers) {

    public ContainerList {
        containers = containers == null ? List.of() : List.copyOf(containers);
    }
}
