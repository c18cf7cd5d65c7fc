package fleetmon.monitoring.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for internal API operations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("error") String error,
        @JsonProperty("queued") Integer queued) {

    /** Message accepted; queued = depth after enqueue */
    public static OperationResponse accepted(int queued) {
        return new OperationResponse(true, null, queued);
    }

    public static OperationResponse error(String error) {
        return new OperationResponse(false, error, null);
    }

    public static OperationResponse queueFull() {
        return error("queue_full");
    }

    public static OperationResponse shuttingDown() {
        return error("shutting_down");
    }
}
