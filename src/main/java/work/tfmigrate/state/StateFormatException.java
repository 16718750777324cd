package work.tfmigrate.state;

/**
 * Raised when a state document is not the JSON object shape Terraform writes.
 */
public final class StateFormatException extends RuntimeException {
    public StateFormatException(String message) {
        super(message);
    }

    public StateFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
