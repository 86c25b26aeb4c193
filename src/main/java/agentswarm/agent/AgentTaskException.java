package agentswarm.agent;

/**
 * A task finished but reported failure.
 */
public class AgentTaskException extends Exception {

    public AgentTaskException(String message) {
        super(message);
    }
}
