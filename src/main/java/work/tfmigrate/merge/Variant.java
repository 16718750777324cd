package work.tfmigrate.merge;

/**
 * Successor variants a legacy primary resource is split into.
 */
public enum Variant {
    DEFAULT,
    CUSTOM
}
