package agentswarm.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Dedup record binding a session to its resource, stored under {@code agent:machine:{sessionId}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionMapping(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("resource_id") String resourceId,
        @JsonProperty("created_at") Instant createdAt) {

    public SessionMapping {
        Objects.requireNonNull(sessionId, "session_id is required");
        Objects.requireNonNull(resourceId, "resource_id is required");
    }
}
