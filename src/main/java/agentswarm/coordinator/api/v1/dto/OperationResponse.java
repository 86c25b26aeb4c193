package agentswarm.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response for session teardown.
 * DELETE /api/v1/sessions/{id}
 */
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("destroyed") boolean destroyed) {

    public static OperationResponse destroyed(boolean destroyed) {
        return new OperationResponse(true, destroyed);
    }
}
