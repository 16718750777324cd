package work.tfmigrate.merge;

import java.util.Objects;

/**
 * A satellite whose entries could not be merged. {@code source} holds its original declaration when the
 * representation has one (configuration) and is {@code null} otherwise.
 */
public record MergeDiagnostic(DiagnosticReason reason, String satelliteName, String message, String source) {
    public MergeDiagnostic {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(message, "message");
    }
}
