package agentswarm.agent;

import agentswarm.coordinator.model.SessionStatus;
import agentswarm.coordinator.model.StatusRecord;
import agentswarm.coordinator.registry.RegistryCodec;
import agentswarm.coordinator.registry.RegistryKeys;
import agentswarm.coordinator.store.H2Registries;
import agentswarm.support.CountingRegistry;
import agentswarm.support.MutableClock;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for running a task under a lease.
 */
class AgentRunnerTest {

    private MutableClock clock;
    private CountingRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-01T00:00:00Z");
        registry = new CountingRegistry(H2Registries.open("runner", clock));
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    private LeaseReporter reporter(String sessionId) {
        return LeaseReporter.builder()
                .registry(registry)
                .sessionId(sessionId)
                .heartbeatInterval(Duration.ofMinutes(10))
                .heartbeatTtl(Duration.ofMinutes(30))
                .clock(clock)
                .build();
    }

    @Test
    void successfulTaskMarksDone() {
        AtomicBoolean leaseSeenDuringTask = new AtomicBoolean();

        int exit = new AgentRunner(reporter("ok")).run(
                () -> leaseSeenDuringTask.set(registry.get(RegistryKeys.heartbeat("ok")) != null));

        assertEquals(AgentRunner.EXIT_DONE, exit);
        assertTrue(leaseSeenDuringTask.get());
        assertTrue(RegistryCodec.decodeStatus(registry.get(RegistryKeys.status("ok"))).isDone());
        assertNull(registry.get(RegistryKeys.heartbeat("ok")));
    }

    @Test
    void failingTaskMarksError() {
        int exit = new AgentRunner(reporter("bad")).run(() -> {
            throw new AgentTaskException("exit 3");
        });

        assertEquals(AgentRunner.EXIT_TASK_FAILED, exit);
        StatusRecord status = RegistryCodec.decodeStatus(registry.get(RegistryKeys.status("bad")));
        assertEquals(SessionStatus.ERROR, status.status());
        assertEquals("exit 3", status.message());
    }

    @Test
    void unwritableOutcomeReturnsDistinctExitCode() {
        int exit = new AgentRunner(reporter("down")).run(() -> registry.setDown(true));

        registry.setDown(false);
        assertEquals(AgentRunner.EXIT_STATUS_NOT_WRITTEN, exit);
        assertNull(registry.get(RegistryKeys.status("down")));
    }

    @Test
    void commandTaskReportsNonZeroExit() {
        CommandTask task = new CommandTask(List.of("sh", "-c", "exit 3"));

        AgentTaskException e = assertThrows(AgentTaskException.class, task::run);
        assertTrue(e.getMessage().contains("3"));
    }

    @Test
    void commandTaskSucceedsOnZeroExit() {
        assertDoesNotThrow(() -> new CommandTask("true").run());
    }
}
