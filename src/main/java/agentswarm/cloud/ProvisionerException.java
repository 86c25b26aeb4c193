package agentswarm.cloud;

/**
 * A provisioner call failed and the caller chose to fail fast.
 */
public class ProvisionerException extends RuntimeException {

    private final ProvisionerFailure failure;

    public ProvisionerException(ProvisionerFailure failure) {
        super("Provisioner " + failure);
        this.failure = failure;
    }

    public ProvisionerFailure failure() {
        return failure;
    }
}
