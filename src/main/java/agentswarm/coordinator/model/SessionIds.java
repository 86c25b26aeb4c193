package agentswarm.coordinator.model;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Session id format and the deterministic resource name derived from it.
 */
public final class SessionIds {

    public static final Pattern PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private SessionIds() {
    }

    public static boolean isValid(String sessionId) {
        return sessionId != null && PATTERN.matcher(sessionId).matches();
    }

    /**
     * @throws IllegalArgumentException if the id is not 1-64 characters of letters, digits, '-' or '_'
     */
    public static String requireValid(String sessionId) {
        if (!isValid(sessionId)) {
            throw new IllegalArgumentException(
                    "session_id must be 1-64 characters of [A-Za-z0-9_-], got '" + sessionId + "'");
        }
        return sessionId;
    }

    public static String resourceName(String prefix, String sessionId) {
        return prefix + sessionId;
    }

    /** The session a resource belongs to, or empty if the name is not a session resource name. */
    public static Optional<String> fromResourceName(String prefix, String resourceName) {
        if (resourceName == null || !resourceName.startsWith(prefix)) {
            return Optional.empty();
        }
        String candidate = resourceName.substring(prefix.length());
        return isValid(candidate) ? Optional.of(candidate) : Optional.empty();
    }
}
