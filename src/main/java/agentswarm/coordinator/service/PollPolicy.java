package agentswarm.coordinator.service;

import java.time.Duration;

/**
 * Interval schedule for status polling: starts at {@code initial}, grows by {@code multiplier}
 * per attempt, never exceeds {@code max}.
 */
public record PollPolicy(Duration initial, double multiplier, Duration max) {

    public PollPolicy {
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("initial poll interval must be positive");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (max.compareTo(initial) < 0) {
            max = initial;
        }
    }

    /** Fixed interval. */
    public static PollPolicy fixed(Duration interval) {
        return new PollPolicy(interval, 1.0, interval);
    }

    /** Interval after {@code current}. */
    public Duration next(Duration current) {
        if (multiplier == 1.0) {
            return current.compareTo(max) > 0 ? max : current;
        }
        long nextMs = (long) Math.ceil(current.toMillis() * multiplier);
        Duration next = Duration.ofMillis(nextMs);
        return next.compareTo(max) > 0 ? max : next;
    }
}
