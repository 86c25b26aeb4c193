package agentswarm.agent;

/**
 * The bounded unit of work a worker runs between lease start and its terminal write.
 */
@FunctionalInterface
public interface AgentTask {

    /**
     * Run to completion. Returning normally means {@code done}; throwing means {@code error}.
     */
    void run() throws Exception;
}
