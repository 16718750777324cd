package work.tfmigrate.merge;

public enum DiagnosticReason {
    UNPARSEABLE_REFERENCE,
    TARGET_NOT_FOUND,
    UNSUPPORTED_MODE
}
