package agentswarm.cloud;

/**
 * Why a provisioner call failed.
 *
 * @param kind       classification driving retry policy
 * @param operation  create, list, stop or destroy
 * @param resourceId resource id or name involved, may be null
 * @param status     platform status code, or 0 when the request never got a response
 * @param message    platform or transport message
 */
public record ProvisionerFailure(
        Kind kind,
        String operation,
        String resourceId,
        int status,
        String message) {

    public enum Kind {
        /** Network error, rate limit or platform 5xx; try again later */
        RETRYABLE,
        /** Invalid request or credentials; retrying will not help */
        FATAL,
        /** The resource does not exist */
        NOT_FOUND,
        /** A resource with the requested name already exists */
        CONFLICT
    }

    public boolean isRetryable() {
        return kind == Kind.RETRYABLE;
    }

    public boolean isNotFound() {
        return kind == Kind.NOT_FOUND;
    }

    /** Map an HTTP status code onto a failure kind. */
    public static Kind classify(int httpStatus) {
        if (httpStatus == 404) {
            return Kind.NOT_FOUND;
        }
        if (httpStatus == 409) {
            return Kind.CONFLICT;
        }
        if (httpStatus == 408 || httpStatus == 429 || httpStatus >= 500) {
            return Kind.RETRYABLE;
        }
        return Kind.FATAL;
    }

    public static ProvisionerFailure retryable(String operation, String resourceId, String message) {
        return new ProvisionerFailure(Kind.RETRYABLE, operation, resourceId, 0, message);
    }

    @Override
    public String toString() {
        return operation + " " + kind + (resourceId != null ? " resource=" + resourceId : "")
                + (status > 0 ? " status=" + status : "") + ": " + message;
    }
}
