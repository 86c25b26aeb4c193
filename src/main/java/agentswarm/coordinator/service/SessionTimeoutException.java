package agentswarm.coordinator.service;

import java.time.Duration;

/**
 * A session did not reach a terminal status within the wait deadline.
 */
public class SessionTimeoutException extends RuntimeException {

    private final String sessionId;
    private final Duration timeout;

    public SessionTimeoutException(String sessionId, Duration timeout) {
        super("Session " + sessionId + " did not finish within " + timeout.toSeconds() + "s");
        this.sessionId = sessionId;
        this.timeout = timeout;
    }

    public String sessionId() {
        return sessionId;
    }

    public Duration timeout() {
        return timeout;
    }
}
