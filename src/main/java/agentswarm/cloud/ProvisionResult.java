package agentswarm.cloud;

import java.util.Objects;

/**
 * Outcome of a provisioner call: either a value or a {@link ProvisionerFailure}.
 */
public final class ProvisionResult<T> {

    private final T value;
    private final ProvisionerFailure failure;

    private ProvisionResult(T value, ProvisionerFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> ProvisionResult<T> success(T value) {
        return new ProvisionResult<>(value, null);
    }

    public static ProvisionResult<Void> done() {
        return new ProvisionResult<>(null, null);
    }

    public static <T> ProvisionResult<T> failure(ProvisionerFailure failure) {
        return new ProvisionResult<>(null, Objects.requireNonNull(failure, "failure is required"));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /** Success, or a NOT_FOUND failure: the resource is already gone. */
    public boolean isSuccessOrGone() {
        return failure == null || failure.isNotFound();
    }

    public T value() {
        if (failure != null) {
            throw new IllegalStateException("No value: " + failure);
        }
        return value;
    }

    public ProvisionerFailure failure() {
        return failure;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ProvisionResult{success}" : "ProvisionResult{" + failure + "}";
    }
}
