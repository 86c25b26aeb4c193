package agentswarm.coordinator.registry;

/**
 * Registry key namespace. All keys of one session share the session id suffix,
 * so no key is ever contended across sessions.
 */
public final class RegistryKeys {

    public static final String PREFIX = "agent:";

    private RegistryKeys() {
    }

    /** Lease renewed by the worker. */
    public static String heartbeat(String sessionId) {
        return PREFIX + "heartbeat:" + sessionId;
    }

    /** Terminal status record written once by the worker. */
    public static String status(String sessionId) {
        return PREFIX + "status:" + sessionId;
    }

    /** Session to resource mapping written by the orchestrator. */
    public static String mapping(String sessionId) {
        return PREFIX + "machine:" + sessionId;
    }

    /** Every key that belongs to a session, for teardown. */
    public static String[] all(String sessionId) {
        return new String[] { heartbeat(sessionId), status(sessionId), mapping(sessionId) };
    }
}
