package podpilot.controlplane.exception;

/**
 * Exception thrown when the state store fails to read or write.
 */
public class StoreException extends ClusterException {

    public StoreException(String message, Throwable cause) {
        super(ErrorCode.STORE_FAILURE, message, cause);
    }
}
