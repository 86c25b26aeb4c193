package agentswarm.agent;

import agentswarm.coordinator.model.Lease;
import agentswarm.coordinator.model.StatusRecord;
import agentswarm.coordinator.registry.RegistryClient;
import agentswarm.coordinator.registry.RegistryCodec;
import agentswarm.coordinator.registry.RegistryKeys;
import agentswarm.coordinator.registry.RegistryUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Worker-side liveness reporting for one session.
 *
 * Lifecycle:
 * 1. {@link #start()} writes the lease immediately, then renews it every heartbeat interval.
 * Each renewal resets the TTL, so only sustained silence lets the lease expire.
 * 2. {@link #markDone()} or {@link #markError(Throwable)} stops renewals, writes the terminal
 * status record and deletes the lease. Only the first terminal call does I/O.
 * 3. {@link #close()} stops the timer and releases the registry when this reporter owns it.
 *
 * All registry writes of one reporter happen under a single lock, so once renewals are stopped
 * no renewal can run, not even one that was already due.
 */
public class LeaseReporter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LeaseReporter.class);

    private final RegistryClient registry;
    private final String sessionId;
    private final String resourceId;
    private final Duration heartbeatInterval;
    private final Duration heartbeatTtl;
    private final Duration terminalStatusTtl;
    private final Instant startedAt;
    private final boolean ownsRegistry;

    private final Object lock = new Object();
    // guarded by lock
    private ScheduledExecutorService timer;
    private ScheduledFuture<?> renewal;
    private boolean stopped;
    private boolean closed;
    private StatusRecord terminal;

    private LeaseReporter(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "registry is required");
        this.sessionId = Objects.requireNonNull(builder.sessionId, "sessionId is required");
        this.resourceId = builder.resourceId == null ? "local" : builder.resourceId;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.heartbeatTtl = builder.heartbeatTtl;
        this.terminalStatusTtl = builder.terminalStatusTtl;
        this.ownsRegistry = builder.ownsRegistry;
        Clock clock = builder.clock == null ? Clock.systemUTC() : builder.clock;
        this.startedAt = builder.startedAt == null ? clock.instant() : builder.startedAt;

        if (heartbeatTtl.compareTo(heartbeatInterval) <= 0) {
            throw new IllegalArgumentException("heartbeatTtl must be greater than heartbeatInterval");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Write the first lease and schedule renewals. A failed first write is logged, not thrown;
     * the next tick retries it.
     */
    public void start() {
        synchronized (lock) {
            if (closed || stopped) {
                throw new IllegalStateException("Lease reporter for session " + sessionId + " already stopped");
            }
            if (timer != null) {
                log.warn("Lease reporter for session {} already started", sessionId);
                return;
            }
            timer = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "lease-reporter-" + sessionId);
                t.setDaemon(true);
                return t;
            });
        }

        renew();

        synchronized (lock) {
            if (stopped) {
                return;
            }
            long intervalMs = heartbeatInterval.toMillis();
            renewal = timer.scheduleAtFixedRate(this::renewTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        }
        log.info("Lease reporter started: session={} resource={} interval={}s ttl={}s",
                sessionId, resourceId, heartbeatInterval.toSeconds(), heartbeatTtl.toSeconds());
    }

    /**
     * Write one lease renewal now.
     *
     * @return true if the lease was written; false if renewals are stopped or the write failed
     */
    public boolean renew() {
        synchronized (lock) {
            if (stopped) {
                return false;
            }
            try {
                registry.setWithTtl(RegistryKeys.heartbeat(sessionId),
                        RegistryCodec.encode(Lease.running(resourceId, startedAt)), heartbeatTtl);
                log.debug("Lease renewed for session {}", sessionId);
                return true;
            } catch (RegistryUnavailableException e) {
                log.warn("Lease renewal failed for session {}, retrying next tick: {}", sessionId, e.getMessage());
                return false;
            }
        }
    }

    /**
     * Record successful completion.
     *
     * @throws RegistryUnavailableException if the status record could not be written; the call may be retried
     */
    public StatusRecord markDone() {
        return finish(StatusRecord.done());
    }

    /**
     * Record a failure with the error's message.
     *
     * @throws RegistryUnavailableException if the status record could not be written; the call may be retried
     */
    public StatusRecord markError(Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.toString();
        return finish(StatusRecord.error(message));
    }

    public StatusRecord markError(String message) {
        return finish(StatusRecord.error(message));
    }

    private StatusRecord finish(StatusRecord record) {
        synchronized (lock) {
            if (terminal != null) {
                log.debug("Session {} already terminal ({}), ignoring {}", sessionId,
                        terminal.status().wire(), record.status().wire());
                return terminal;
            }

            // Renewals first, so no renewal can recreate the lease after it is deleted
            stopRenewalsLocked();

            // Status before lease delete: a concurrent sweep sees the lease or the status, never neither
            registry.setWithTtl(RegistryKeys.status(sessionId), RegistryCodec.encode(record), terminalStatusTtl);
            terminal = record;

            try {
                registry.delete(RegistryKeys.heartbeat(sessionId));
            } catch (RegistryUnavailableException e) {
                log.warn("Could not delete lease for session {}, it will expire in {}s: {}",
                        sessionId, heartbeatTtl.toSeconds(), e.getMessage());
            }
        }
        log.info("Session {} marked {}{}", sessionId, record.status().wire(),
                record.message() != null ? ": " + record.message() : "");
        return record;
    }

    /**
     * Stop renewals and release resources. Idempotent; safe after markDone/markError.
     */
    @Override
    public void close() {
        ScheduledExecutorService toShutdown;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            stopRenewalsLocked();
            toShutdown = timer;
            timer = null;
        }
        if (toShutdown != null) {
            toShutdown.shutdownNow();
        }
        if (ownsRegistry) {
            registry.close();
        }
        log.debug("Lease reporter closed for session {}", sessionId);
    }

    public String sessionId() {
        return sessionId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public boolean isRenewing() {
        synchronized (lock) {
            return renewal != null && !stopped;
        }
    }

    public Optional<StatusRecord> terminalStatus() {
        synchronized (lock) {
            return Optional.ofNullable(terminal);
        }
    }

    private void renewTick() {
        try {
            renew();
        } catch (RuntimeException e) {
            // an escaping exception would cancel the periodic task
            log.error("Unexpected lease renewal error for session {}", sessionId, e);
        }
    }

    private void stopRenewalsLocked() {
        stopped = true;
        if (renewal != null) {
            renewal.cancel(false);
        }
    }

    public static final class Builder {
        private RegistryClient registry;
        private String sessionId;
        private String resourceId;
        private Duration heartbeatInterval = Duration.ofSeconds(10);
        private Duration heartbeatTtl = Duration.ofSeconds(30);
        private Duration terminalStatusTtl = Duration.ofHours(1);
        private Clock clock;
        private Instant startedAt;
        private boolean ownsRegistry;

        public Builder registry(RegistryClient registry) {
            this.registry = registry;
            return this;
        }

        /** Hand the registry over; {@link LeaseReporter#close()} will close it. */
        public Builder ownedRegistry(RegistryClient registry) {
            this.registry = registry;
            this.ownsRegistry = true;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder resourceId(String resourceId) {
            this.resourceId = resourceId;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder heartbeatTtl(Duration heartbeatTtl) {
            this.heartbeatTtl = heartbeatTtl;
            return this;
        }

        public Builder terminalStatusTtl(Duration terminalStatusTtl) {
            this.terminalStatusTtl = terminalStatusTtl;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public LeaseReporter build() {
            return new LeaseReporter(this);
        }
    }
}
