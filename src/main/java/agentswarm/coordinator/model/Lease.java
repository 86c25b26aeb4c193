package agentswarm.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Liveness record renewed by a worker under {@code agent:heartbeat:{sessionId}}.
 * {@code started_at} is the worker's start time in fractional epoch seconds and does not
 * change across renewals.
 *
 * {@code status} is kept as the raw wire value so that workers may report states this
 * coordinator does not know; only {@code started_at} matters for reclamation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Lease(
        @JsonProperty("resource_id") String resourceId,
        @JsonProperty("started_at") Double startedAt,
        @JsonProperty("status") String status) {

    public static Lease running(String resourceId, Instant startedAt) {
        return new Lease(resourceId, toEpochSeconds(startedAt), SessionStatus.RUNNING.wire());
    }

    /** Start time, or null when the worker did not report one. */
    public Instant startedAtInstant() {
        if (startedAt == null || startedAt.isNaN() || startedAt.isInfinite()) {
            return null;
        }
        long secs = (long) Math.floor(startedAt);
        long nanos = Math.round((startedAt - secs) * 1_000_000_000L);
        return Instant.ofEpochSecond(secs, Math.min(nanos, 999_999_999L));
    }

    /** Wall-clock time since the worker started, or null if the start time is unknown. */
    public Duration age(Instant now) {
        Instant started = startedAtInstant();
        return started == null ? null : Duration.between(started, now);
    }

    static double toEpochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }
}
