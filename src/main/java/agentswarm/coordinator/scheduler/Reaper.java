package agentswarm.coordinator.scheduler;

import agentswarm.cloud.ProvisionResult;
import agentswarm.cloud.ResourceFilter;
import agentswarm.cloud.ResourceProvisioner;
import agentswarm.coordinator.config.CoordinatorConfig;
import agentswarm.coordinator.model.KillReason;
import agentswarm.coordinator.model.Resource;
import agentswarm.coordinator.model.SessionIds;
import agentswarm.coordinator.model.StatusRecord;
import agentswarm.coordinator.registry.RegistryClient;
import agentswarm.coordinator.registry.RegistryCodec;
import agentswarm.coordinator.registry.RegistryKeys;
import agentswarm.coordinator.registry.RegistryUnavailableException;
import agentswarm.coordinator.scheduler.SweepReport.Reclamation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Control-plane sweep that reclaims worker resources which are done, dead or over budget.
 *
 * Each sweep:
 * 1. Lists resources in started/starting. If the list fails the sweep is skipped.
 * 2. Ignores resources whose name is not a session resource name.
 * 3. Reads each session's status and lease keys (in parallel, bounded) and decides:
 * - terminal status present: task_done
 * - no lease: heartbeat_lost
 * - lease older than maxTurnTimeout: timeout (start time from the lease, else from the mapping)
 * 4. Reclaims: stop (optionally destroy), then deletes all session keys even if stop failed.
 * A resource whose stop failed is still live and is picked up again next sweep.
 *
 * The next sweep is scheduled only after the current one returns, so sweeps never overlap.
 */
public class Reaper implements Runnable, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Reaper.class);

    static final String MDC_SESSION_ID = "sessionId";

    private final RegistryClient registry;
    private final ResourceProvisioner provisioner;
    private final CoordinatorConfig config;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService evaluators;

    private volatile boolean running = false;
    private volatile boolean stopped = false;

    public Reaper(RegistryClient registry, ResourceProvisioner provisioner, CoordinatorConfig config, Clock clock) {
        this.registry = registry;
        this.provisioner = provisioner;
        this.config = config;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agent-swarm-reaper");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger n = new AtomicInteger();
        this.evaluators = Executors.newFixedThreadPool(config.reaperParallelism(), r -> {
            Thread t = new Thread(r, "agent-swarm-reaper-eval-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start sweeping: first sweep now, then every reaper interval after the previous one finishes.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Reaper already running");
            return;
        }
        if (stopped) {
            log.warn("Reaper was stopped and cannot be restarted");
            return;
        }
        running = true;
        scheduleNext(Duration.ZERO);
        log.info("Reaper started: interval={}s maxTurnTimeout={}s parallelism={} explicitDestroy={}",
                config.reaperInterval().toSeconds(), config.maxTurnTimeout().toSeconds(),
                config.reaperParallelism(), config.explicitDestroy());
    }

    /**
     * Stop sweeping. An in-flight sweep is given a few seconds to finish.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        running = false;
        stopped = true;
        scheduler.shutdown();
        evaluators.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
                log.warn("Reaper forcefully stopped");
            }
            if (!evaluators.awaitTermination(5, TimeUnit.SECONDS)) {
                evaluators.shutdownNow();
            }
            log.info("Reaper stopped");
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            evaluators.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /** One scheduled cycle: sweep, log any failure, reschedule. */
    @Override
    public void run() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Reaper sweep error", e);
        } finally {
            if (running) {
                scheduleNext(config.reaperInterval());
            }
        }
    }

    private void scheduleNext(Duration delay) {
        try {
            scheduler.schedule(this, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Reaper shutting down, next sweep not scheduled");
        }
    }

    /**
     * Run one sweep now.
     */
    public SweepReport sweep() {
        Instant now = clock.instant();

        ProvisionResult<List<Resource>> listed = provisioner.list(ResourceFilter.live());
        if (!listed.isSuccess()) {
            log.warn("Sweep skipped, cannot list resources: {}", listed.failure());
            return SweepReport.listFailed(now);
        }

        List<Resource> resources = listed.value();
        if (resources == null || resources.isEmpty()) {
            log.debug("Sweep: no live resources");
            return SweepReport.empty(now);
        }

        List<String> ignored = new ArrayList<>();
        List<Callable<Outcome>> evaluations = new ArrayList<>();
        for (Resource resource : resources) {
            Optional<String> sessionId = SessionIds.fromResourceName(config.resourceNamePrefix(), resource.name());
            if (sessionId.isEmpty()) {
                ignored.add(resource.id());
                continue;
            }
            evaluations.add(() -> reconcile(resource, sessionId.get(), now));
        }

        int live = 0;
        List<String> skipped = new ArrayList<>();
        List<Reclamation> reclaimed = new ArrayList<>();
        for (Outcome outcome : runAll(evaluations)) {
            if (outcome.reclamation() != null) {
                reclaimed.add(outcome.reclamation());
            } else if (outcome.skipped()) {
                skipped.add(outcome.resourceId());
            } else {
                live++;
            }
        }

        SweepReport report = new SweepReport(now, false, live, ignored, skipped, reclaimed);
        if (!reclaimed.isEmpty() || !skipped.isEmpty()) {
            log.info("Sweep: {} live, {} reclaimed, {} skipped, {} ignored",
                    live, reclaimed.size(), skipped.size(), ignored.size());
        } else {
            log.debug("Sweep: {} live, {} ignored", live, ignored.size());
        }
        return report;
    }

    private List<Outcome> runAll(List<Callable<Outcome>> evaluations) {
        List<Outcome> outcomes = new ArrayList<>();
        if (evaluations.isEmpty()) {
            return outcomes;
        }
        List<Future<Outcome>> futures;
        try {
            futures = evaluators.invokeAll(evaluations);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Sweep interrupted");
            return outcomes;
        } catch (RejectedExecutionException e) {
            log.debug("Reaper shutting down, sweep abandoned");
            return outcomes;
        }
        for (Future<Outcome> future : futures) {
            try {
                outcomes.add(future.get());
            } catch (ExecutionException e) {
                log.error("Resource evaluation failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return outcomes;
            }
        }
        return outcomes;
    }

    private Outcome reconcile(Resource resource, String sessionId, Instant now) {
        MDC.put(MDC_SESSION_ID, sessionId);
        try {
            Optional<KillReason> reason;
            try {
                reason = decide(sessionId, now);
            } catch (RegistryUnavailableException e) {
                log.warn("Registry unavailable, skipping resource={} session={} this cycle: {}",
                        resource.id(), sessionId, e.getMessage());
                return Outcome.skipped(resource.id());
            }
            if (reason.isEmpty()) {
                return Outcome.live(resource.id());
            }
            return Outcome.reclaimed(reclaim(resource, sessionId, reason.get()));
        } finally {
            MDC.remove(MDC_SESSION_ID);
        }
    }

    private Optional<KillReason> decide(String sessionId, Instant now) {
        StatusRecord status = null;
        String rawStatus = registry.get(RegistryKeys.status(sessionId));
        if (rawStatus != null) {
            try {
                status = RegistryCodec.decodeStatus(rawStatus);
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring unreadable status record for session {}: {}", sessionId, e.getMessage());
            }
        }
        if (status != null) {
            return evaluate(status, false, null, now, config.maxTurnTimeout());
        }

        String rawLease = registry.get(RegistryKeys.heartbeat(sessionId));
        if (rawLease == null) {
            return evaluate(null, false, null, now, config.maxTurnTimeout());
        }
        Instant startedAt = null;
        try {
            startedAt = RegistryCodec.decodeLease(rawLease).startedAtInstant();
        } catch (IllegalArgumentException e) {
            log.warn("Unreadable lease for session {}: {}", sessionId, e.getMessage());
        }
        if (startedAt == null) {
            startedAt = mappingCreatedAt(sessionId);
        }
        return evaluate(null, true, startedAt, now, config.maxTurnTimeout());
    }

    /** Fallback start time for a lease without a usable started_at. */
    private Instant mappingCreatedAt(String sessionId) {
        String rawMapping = registry.get(RegistryKeys.mapping(sessionId));
        if (rawMapping == null) {
            log.warn("Lease for session {} has no start time and no mapping, timeout not checked", sessionId);
            return null;
        }
        try {
            return RegistryCodec.decodeMapping(rawMapping).createdAt();
        } catch (IllegalArgumentException e) {
            log.warn("Unreadable mapping for session {}, timeout not checked: {}", sessionId, e.getMessage());
            return null;
        }
    }

    /**
     * Reclamation decision for one session. First match wins: task_done, heartbeat_lost, timeout.
     *
     * @param status         terminal status record, or null
     * @param leasePresent   whether a lease key exists
     * @param leaseStartedAt the lease's start time, or null if unknown
     */
    static Optional<KillReason> evaluate(StatusRecord status, boolean leasePresent, Instant leaseStartedAt,
            Instant now, Duration maxTurnTimeout) {
        if (status != null) {
            return Optional.of(KillReason.TASK_DONE);
        }
        if (!leasePresent) {
            return Optional.of(KillReason.HEARTBEAT_LOST);
        }
        if (leaseStartedAt != null && Duration.between(leaseStartedAt, now).compareTo(maxTurnTimeout) > 0) {
            return Optional.of(KillReason.TIMEOUT);
        }
        return Optional.empty();
    }

    private Reclamation reclaim(Resource resource, String sessionId, KillReason reason) {
        ProvisionResult<Void> stop = provisioner.stop(resource.id());
        boolean stoppedOk = stop.isSuccessOrGone();
        if (!stoppedOk) {
            log.warn("Stop failed for resource={} session={} reason={}, retrying next sweep: {}",
                    resource.id(), sessionId, reason, stop.failure());
        }

        if (config.explicitDestroy()) {
            ProvisionResult<Void> destroy = provisioner.destroy(resource.id());
            if (!destroy.isSuccessOrGone()) {
                log.warn("Destroy failed for resource={} session={}: {}", resource.id(), sessionId,
                        destroy.failure());
            }
        }

        try {
            registry.delete(RegistryKeys.all(sessionId));
        } catch (RegistryUnavailableException e) {
            log.warn("Could not clean registry keys for session {}, they will expire: {}", sessionId,
                    e.getMessage());
        }

        log.info("Reclaimed resource={} session={} reason={} stopped={}", resource.id(), sessionId, reason,
                stoppedOk);
        return new Reclamation(resource.id(), sessionId, reason, stoppedOk);
    }

    private record Outcome(String resourceId, boolean skipped, Reclamation reclamation) {
        static Outcome live(String resourceId) {
            return new Outcome(resourceId, false, null);
        }

        static Outcome skipped(String resourceId) {
            return new Outcome(resourceId, true, null);
        }

        static Outcome reclaimed(Reclamation reclamation) {
            return new Outcome(reclamation.resourceId(), false, reclamation);
        }
    }
}
