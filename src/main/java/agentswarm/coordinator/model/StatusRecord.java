package agentswarm.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Terminal outcome written once by a worker under {@code agent:status:{sessionId}}.
 * Its presence always wins over lease state.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record StatusRecord(
        @JsonProperty("status") SessionStatus status,
        @JsonProperty("message") String message) {

    public StatusRecord {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("status record must be done or error, got " + status);
        }
    }

    public static StatusRecord done() {
        return new StatusRecord(SessionStatus.DONE, null);
    }

    public static StatusRecord error(String message) {
        return new StatusRecord(SessionStatus.ERROR, message == null ? "unknown error" : message);
    }

    @JsonIgnore
    public boolean isDone() {
        return status == SessionStatus.DONE;
    }
}
