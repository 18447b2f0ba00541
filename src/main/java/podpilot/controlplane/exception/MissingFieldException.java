package podpilot.controlplane.exception;

/**
 * Exception thrown when a required input field is absent or out of range
 */
public class MissingFieldException extends ClusterException {

    private final String field;

    public MissingFieldException(String field) {
        this(field, field + " is required");
    }

    public MissingFieldException(String field, String message) {
        super(ErrorCode.MISSING_FIELD, message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
