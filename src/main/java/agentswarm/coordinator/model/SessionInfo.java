package agentswarm.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Read view of a session assembled from its registry keys.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionInfo(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("resource_id") String resourceId,
        @JsonProperty("status") SessionStatus status,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("message") String message) {
}
