package work.tfmigrate.runtime;

/**
 * Failure outside the merge core (unreadable input, malformed configuration or state), carrying a machine
 * code alongside the message.
 */
public final class MigrationException extends RuntimeException {
    public static final String CONFIG_PARSE_ERROR = "config_parse_error";
    public static final String STATE_PARSE_ERROR = "state_parse_error";
    public static final String IO_ERROR = "io_error";
    public static final String SETTINGS_ERROR = "settings_error";
    public static final String UNSUPPORTED_MIGRATION = "unsupported_migration";

    private final String code;
    private final Object data;

    public MigrationException(String code, String message, Object data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public MigrationException(String code, String message, Object data, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.data = data;
    }

    public String code() {
        return code;
    }

    public Object data() {
        return data;
    }
}
