package agentswarm.coordinator.scheduler;

import agentswarm.cloud.ProvisionResult;
import agentswarm.cloud.ResourceConfig;
import agentswarm.cloud.ResourceFilter;
import agentswarm.cloud.ResourceProvisioner;
import agentswarm.coordinator.config.CoordinatorConfig;
import agentswarm.coordinator.model.KillReason;
import agentswarm.coordinator.model.Lease;
import agentswarm.coordinator.model.Resource;
import agentswarm.coordinator.model.ResourceState;
import agentswarm.coordinator.model.SessionMapping;
import agentswarm.coordinator.model.StatusRecord;
import agentswarm.coordinator.registry.RegistryCodec;
import agentswarm.coordinator.registry.RegistryKeys;
import agentswarm.coordinator.scheduler.SweepReport.Reclamation;
import agentswarm.coordinator.store.H2Registries;
import agentswarm.support.CountingRegistry;
import agentswarm.support.FakeProvisioner;
import agentswarm.support.MutableClock;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Reaper sweeps.
 */
class ReaperTest {

    private static final Duration TTL = Duration.ofSeconds(30);

    private MutableClock clock;
    private CountingRegistry registry;
    private FakeProvisioner provisioner;
    private CoordinatorConfig config;
    private Reaper reaper;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-01T00:00:00Z");
        registry = new CountingRegistry(H2Registries.open("reaper", clock));
        provisioner = new FakeProvisioner();
        config = CoordinatorConfig.defaults()
                .withMaxTurnTimeout(Duration.ofSeconds(600))
                .withReaperParallelism(4);
        reaper = new Reaper(registry, provisioner, config, clock);
    }

    @AfterEach
    void tearDown() {
        reaper.close();
        registry.close();
    }

    private void writeLease(String sessionId, String resourceId, Instant startedAt) {
        registry.setWithTtl(RegistryKeys.heartbeat(sessionId),
                RegistryCodec.encode(Lease.running(resourceId, startedAt)), TTL);
    }

    private void writeMapping(String sessionId, String resourceId) {
        registry.setWithTtl(RegistryKeys.mapping(sessionId),
                RegistryCodec.encode(new SessionMapping(sessionId, resourceId, clock.instant())),
                Duration.ofSeconds(900));
    }

    @Test
    void healthyLeaseIsLeftAlone() {
        provisioner.add("m-1", "agent-session-s1", ResourceState.STARTED);
        writeLease("s1", "m-1", clock.instant());

        SweepReport report = reaper.sweep();

        assertEquals(1, report.live());
        assertTrue(report.reclaimed().isEmpty());
        assertTrue(provisioner.stopCalls().isEmpty());
    }

    @Test
    void lostHeartbeatIsReclaimedOnlyAfterTtl() {
        provisioner.add("m-1", "agent-session-s1", ResourceState.STARTED);
        writeLease("s1", "m-1", clock.instant());
        writeMapping("s1", "m-1");

        clock.advance(Duration.ofSeconds(29));
        assertTrue(reaper.sweep().reclaimed().isEmpty(), "Lease still within TTL");

        clock.advance(Duration.ofSeconds(1));
        SweepReport report = reaper.sweep();

        assertEquals(List.of(new Reclamation("m-1", "s1", KillReason.HEARTBEAT_LOST, true)), report.reclaimed());
        assertEquals(List.of("m-1"), provisioner.stopCalls());
        assertEquals(ResourceState.STOPPED, provisioner.get("m-1").state());
        assertNull(registry.get(RegistryKeys.mapping("s1")));
    }

    @Test
    void completedSessionIsReclaimedAsTaskDone() {
        provisioner.add("m-1", "agent-session-s1", ResourceState.STARTED);
        registry.setWithTtl(RegistryKeys.status("s1"), RegistryCodec.encode(StatusRecord.done()),
                Duration.ofHours(1));
        writeMapping("s1", "m-1");

        SweepReport report = reaper.sweep();

        assertEquals(1, report.reclaimed().size());
        assertEquals(KillReason.TASK_DONE, report.reclaimed().get(0).reason());
        for (String key : RegistryKeys.all("s1")) {
            assertNull(registry.get(key), key + " should be cleaned up");
        }
    }

    @Test
    void errorStatusIsAlsoTaskDone() {
        provisioner.add("m-1", "agent-session-s1", ResourceState.STARTED);
        registry.setWithTtl(RegistryKeys.status("s1"), RegistryCodec.encode(StatusRecord.error("boom")),
                Duration.ofHours(1));

        assertEquals(KillReason.TASK_DONE, reaper.sweep().reclaimed().get(0).reason());
    }

    @Test
    void statusWinsOverLiveLease() {
        provisioner.add("m-1", "agent-session-s1", ResourceState.STARTED);
        writeLease("s1", "m-1", clock.instant());
        registry.setWithTtl(RegistryKeys.status("s1"), "done", Duration.ofHours(1));

        assertEquals(KillReason.TASK_DONE, reaper.sweep().reclaimed().get(0).reason());
    }

    @Test
    void timeoutOverridesHealthyHeartbeat() {
        provisioner.add("m-1", "agent-session-s1", ResourceState.STARTED);
        Instant started = clock.instant();
        clock.advance(Duration.ofSeconds(601));
        writeLease("s1", "m-1", started);

        SweepReport report = reaper.sweep();

        assertEquals(KillReason.TIMEOUT, report.reclaimed().get(0).reason());
        assertNull(registry.get(RegistryKeys.heartbeat("s1")));
    }

    @Test
    void exactlyMaxTurnTimeoutIsNotYetTimedOut() {
        Instant now = Instant.parse("2026-01-01T00:10:00Z");
        Instant started = now.minus(Duration.ofSeconds(600));

        assertEquals(Optional.empty(), Reaper.evaluate(null, true, started, now, Duration.ofSeconds(600)));
        assertEquals(Optional.of(KillReason.TIMEOUT),
                Reaper.evaluate(null, true, started.minusMillis(1), now, Duration.ofSeconds(600)));
    }

    @Test
    void unreadableLeaseCountsAsPresent() {
        provisioner.add("m-1", "agent-session-s1", ResourceState.STARTED);
        registry.setWithTtl(RegistryKeys.heartbeat("s1"), "{garbage", TTL);

        SweepReport report = reaper.sweep();

        assertEquals(1, report.live());
        assertTrue(report.reclaimed().isEmpty());
    }

    @Test
    void leaseWithUnknownStatusStillTimesOut() {
        provisioner.add("m-1", "agent-session-s1", ResourceState.STARTED);
        long startedAt = clock.instant().minus(Duration.ofHours(1)).getEpochSecond();
        registry.setWithTtl(RegistryKeys.heartbeat("s1"),
                "{\"resource_id\":\"m-1\",\"started_at\":" + startedAt + ",\"status\":\"busy\",\"extra\":1}", TTL);

        SweepReport report = reaper.sweep();

        assertEquals(0, report.live());
        assertEquals(1, report.reclaimed().size());
        assertEquals(KillReason.TIMEOUT, report.reclaimed().get(0).reason());
    }

    @Test
    void leaseWithoutStartTimeFallsBackToMappingCreatedAt() {
        provisioner.add("m-1", "agent-session-s1", ResourceState.STARTED);
        writeMapping("s1", "m-1");

        registry.setWithTtl(RegistryKeys.heartbeat("s1"), "{garbage", TTL);
        assertTrue(reaper.sweep().reclaimed().isEmpty(), "Mapping is recent");

        clock.advance(Duration.ofSeconds(601));
        registry.setWithTtl(RegistryKeys.heartbeat("s1"), "{\"resource_id\":\"m-1\",\"status\":\"running\"}", TTL);
        SweepReport report = reaper.sweep();

        assertEquals(KillReason.TIMEOUT, report.reclaimed().get(0).reason());
    }

    @Test
    void emptySweepDoesNoRegistryIo() {
        int before = registry.calls();

        SweepReport report = reaper.sweep();

        assertEquals(before, registry.calls());
        assertEquals(0, report.evaluated());
        assertFalse(report.listFailed());
    }

    @Test
    void foreignResourcesAreIgnoredWithoutRegistryIo() {
        provisioner.add("x-1", "database-primary", ResourceState.STARTED);
        provisioner.add("x-2", "agent-session-", ResourceState.STARTED);
        int before = registry.calls();

        SweepReport report = reaper.sweep();

        assertEquals(List.of("x-1", "x-2"), report.ignored());
        assertEquals(before, registry.calls());
        assertTrue(provisioner.stopCalls().isEmpty());
    }

    @Test
    void stoppedResourcesAreNotListed() {
        provisioner.add("m-1", "agent-session-s1", ResourceState.STOPPED);

        SweepReport report = reaper.sweep();

        assertEquals(0, report.evaluated());
        assertTrue(provisioner.stopCalls().isEmpty());
    }

    @Test
    void reclamationSurvivesStopFailureAndRetriesNextSweep() {
        provisioner.add("m-1", "agent-session-s1", ResourceState.STARTED);
        registry.setWithTtl(RegistryKeys.status("s1"), RegistryCodec.encode(StatusRecord.done()),
                Duration.ofHours(1));
        writeMapping("s1", "m-1");
        provisioner.failStops(true);

        SweepReport first = reaper.sweep();

        assertFalse(first.reclaimed().get(0).stopped());
        for (String key : RegistryKeys.all("s1")) {
            assertNull(registry.get(key), "Registry cleanup must not depend on stop succeeding");
        }
        assertEquals(ResourceState.STARTED, provisioner.get("m-1").state());

        provisioner.failStops(false);
        SweepReport second = reaper.sweep();

        assertEquals(KillReason.HEARTBEAT_LOST, second.reclaimed().get(0).reason());
        assertTrue(second.reclaimed().get(0).stopped());
        assertEquals(List.of("m-1", "m-1"), provisioner.stopCalls());
        assertEquals(ResourceState.STOPPED, provisioner.get("m-1").state());
    }

    @Test
    void listFailureSkipsSweep() {
        provisioner.add("m-1", "agent-session-s1", ResourceState.STARTED);
        provisioner.failLists(true);
        int before = registry.calls();

        SweepReport report = reaper.sweep();

        assertTrue(report.listFailed());
        assertEquals(before, registry.calls());
        assertTrue(provisioner.stopCalls().isEmpty());
    }

    @Test
    void registryOutageSkipsResourceInsteadOfReclaiming() {
        provisioner.add("m-1", "agent-session-s1", ResourceState.STARTED);
        registry.setDown(true);

        SweepReport report = reaper.sweep();

        registry.setDown(false);
        assertEquals(List.of("m-1"), report.skipped());
        assertTrue(provisioner.stopCalls().isEmpty());
    }

    @Test
    void explicitDestroyFollowsStop() {
        reaper.close();
        reaper = new Reaper(registry, provisioner, config.withExplicitDestroy(true), clock);
        provisioner.add("m-1", "agent-session-s1", ResourceState.STARTED);

        reaper.sweep();

        assertEquals(List.of("m-1"), provisioner.destroyCalls());
        assertEquals(ResourceState.DESTROYED, provisioner.get("m-1").state());
    }

    @Test
    void manySessionsAreEvaluatedIndependently() {
        for (int i = 0; i < 20; i++) {
            provisioner.add("m-" + i, "agent-session-s" + i, ResourceState.STARTED);
            if (i % 2 == 0) {
                writeLease("s" + i, "m-" + i, clock.instant());
            }
        }

        SweepReport report = reaper.sweep();

        assertEquals(10, report.live());
        assertEquals(10, report.reclaimed().size());
        assertTrue(report.reclaimed().stream().allMatch(r -> r.reason() == KillReason.HEARTBEAT_LOST));
    }

    @Test
    void loopKeepsSweepingWithoutOverlap() throws Exception {
        reaper.close();
        SlowListProvisioner slow = new SlowListProvisioner(Duration.ofMillis(30));
        reaper = new Reaper(registry, slow, config.withReaperInterval(Duration.ofMillis(10)), clock);

        reaper.start();
        assertTrue(slow.sweeps.await(5, TimeUnit.SECONDS), "Expected repeated sweeps");
        reaper.stop();

        assertTrue(slow.calls.get() >= 3);
        assertEquals(1, slow.maxConcurrent.get(), "Sweeps must never overlap");
    }

    /** Provisioner whose list call takes a while and records how many run at once. */
    private static final class SlowListProvisioner implements ResourceProvisioner {
        private final Duration delay;
        private final CountDownLatch sweeps = new CountDownLatch(3);
        private final AtomicInteger calls = new AtomicInteger();
        private final AtomicInteger active = new AtomicInteger();
        private final AtomicInteger maxConcurrent = new AtomicInteger();

        SlowListProvisioner(Duration delay) {
            this.delay = delay;
        }

        @Override
        public ProvisionResult<List<Resource>> list(ResourceFilter filter) {
            int now = active.incrementAndGet();
            maxConcurrent.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                active.decrementAndGet();
            }
            calls.incrementAndGet();
            sweeps.countDown();
            return ProvisionResult.success(List.of());
        }

        @Override
        public ProvisionResult<Resource> create(String name, ResourceConfig config) {
            throw new UnsupportedOperationException();
        }

        @Override
        public ProvisionResult<Void> stop(String resourceId) {
            return ProvisionResult.done();
        }

        @Override
        public ProvisionResult<Void> destroy(String resourceId) {
            return ProvisionResult.done();
        }
    }

    @Test
    void startAndStopAreIdempotent() {
        reaper.start();
        reaper.start();
        assertTrue(reaper.isRunning());

        reaper.stop();
        reaper.stop();
        assertFalse(reaper.isRunning());
    }
}
