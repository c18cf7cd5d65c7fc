package fleetmon.monitoring.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fleetmon.monitoring.model.ContainerInfo;
import fleetmon.monitoring.model.ContainerList;

import java.util.List;
import java.util.Objects;

/**
 * Request DTO for a node's container inventory.
 * POST /internal/v1/containers
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContainerListRequest(
        @JsonProperty("nodeName") String nodeName,
        @JsonProperty("containers") List<Container> containers) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Container(
            @JsonProperty("id") String id,
            @JsonProperty("names") List<String> names,
            @JsonProperty("image") String image) {
    }

    public void validate() {
        if (nodeName == null || nodeName.isBlank()) {
            throw new IllegalArgumentException("nodeName is required");
        }
        if (containers == null) {
            return;
        }
        for (Container c : containers) {
            if (c == null) {
                throw new IllegalArgumentException("containers must not contain null entries");
            }
            if (c.names() != null && c.names().stream().anyMatch(Objects::isNull)) {
                throw new IllegalArgumentException("container names must not contain null: " + c.id());
            }
        }
    }

    public ContainerList toDomain() {
        List<Container> list = containers == null ? List.of() : containers;
        return new ContainerList(nodeName, list.stream()
                .map(c -> new ContainerInfo(c.id(), c.names(), c.image()))
                .toList());
    }
}
