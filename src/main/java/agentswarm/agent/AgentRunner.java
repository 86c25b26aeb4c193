package agentswarm.agent;

import agentswarm.coordinator.registry.RegistryUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds a {@link LeaseReporter} to one task run: lease up, run, terminal write, close.
 */
public class AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentRunner.class);

    public static final int EXIT_DONE = 0;
    public static final int EXIT_TASK_FAILED = 1;
    public static final int EXIT_STATUS_NOT_WRITTEN = 2;

    private final LeaseReporter reporter;

    public AgentRunner(LeaseReporter reporter) {
        this.reporter = reporter;
    }

    /**
     * Run the task and record its outcome. The reporter is closed on return.
     *
     * @return process exit code
     */
    public int run(AgentTask task) {
        try {
            reporter.start();

            Exception failure = null;
            try {
                task.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failure = e;
            } catch (Exception e) {
                failure = e;
            }

            try {
                if (failure == null) {
                    reporter.markDone();
                    return EXIT_DONE;
                }
                log.error("Task failed for session {}", reporter.sessionId(), failure);
                reporter.markError(failure);
                return EXIT_TASK_FAILED;
            } catch (RegistryUnavailableException e) {
                // Lease renewals are already stopped, so the reaper will see heartbeat_lost
                log.error("Could not record outcome for session {}: {}", reporter.sessionId(), e.getMessage());
                return EXIT_STATUS_NOT_WRITTEN;
            }
        } finally {
            reporter.close();
        }
    }
}
