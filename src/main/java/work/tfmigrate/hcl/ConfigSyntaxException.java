package work.tfmigrate.hcl;

/**
 * Raised when configuration text cannot be split into blocks and attributes.
 */
public final class ConfigSyntaxException extends RuntimeException {
    private final int line;

    public ConfigSyntaxException(int line, String message) {
        super("line " + line + ": " + message);
        this.line = line;
    }

    public int line() {
        return line;
    }
}
