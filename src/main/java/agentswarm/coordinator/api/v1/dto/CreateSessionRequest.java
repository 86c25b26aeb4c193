package agentswarm.coordinator.api.v1.dto;

import agentswarm.coordinator.model.SessionIds;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Request DTO for creating (or joining) a session.
 * POST /api/v1/sessions
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateSessionRequest(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("prompt") String prompt,
        @JsonProperty("env") Map<String, String> env) {

    /** The requested id, or a generated one when absent. */
    public String sessionIdOr(long epochMillis) {
        return sessionId == null || sessionId.isBlank() ? "session-" + epochMillis : sessionId;
    }

    /** Validate the request */
    public void validate() {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt is required");
        }
        if (sessionId != null && !sessionId.isBlank()) {
            SessionIds.requireValid(sessionId);
        }
        if (env != null) {
            env.forEach((name, value) -> {
                if (name == null || name.isBlank() || value == null) {
                    throw new IllegalArgumentException("env entries need a name and a value");
                }
            });
        }
    }
}
