package agentswarm.coordinator.service;

import java.util.Map;

/**
 * What a new session's worker should do. {@code env} is passed to the worker in addition to
 * the variables the orchestrator sets itself.
 */
public record SessionRequest(String prompt, Map<String, String> env) {

    public SessionRequest {
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    public static SessionRequest of(String prompt) {
        return new SessionRequest(prompt, Map.of());
    }
}
