package podpilot.controlplane.exception;

/**
 * Base exception for all control plane errors.
 * Every subclass maps to exactly one {@link ErrorCode}.
 */
public class ClusterException extends RuntimeException {

    private final ErrorCode code;

    public ClusterException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ClusterException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
