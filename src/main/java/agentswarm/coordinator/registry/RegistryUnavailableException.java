package agentswarm.coordinator.registry;

/**
 * The registry store could not be reached or rejected the operation.
 */
public class RegistryUnavailableException extends RuntimeException {

    private final String operation;
    private final String key;

    public RegistryUnavailableException(String operation, String key, Throwable cause) {
        super("Registry " + operation + " failed" + (key != null ? " for key " + key : "")
                + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.operation = operation;
        this.key = key;
    }

    public String operation() {
        return operation;
    }

    public String key() {
        return key;
    }
}
