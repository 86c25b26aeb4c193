package agentswarm.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("registry") String registry,
        @JsonProperty("reaper") String reaper,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version) {
    public static HealthResponse healthy(boolean reaperRunning, String uptime, String version) {
        return new HealthResponse("healthy", "ok", reaperRunning ? "running" : "stopped", uptime, version);
    }

    public static HealthResponse unhealthy(String registry) {
        return new HealthResponse("unhealthy", registry, null, null, null);
    }
}
