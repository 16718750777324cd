package work.tfmigrate.runtime;

/**
 * What the configuration pipeline should do with the block a migrator was given.
 */
public record ConfigTransformResult(Action action) {
    public enum Action {
        /** The block stays where it is, possibly edited in place. */
        KEEP,
        /** The block is dropped. */
        REMOVE
    }

    public static ConfigTransformResult keep() {
        return new ConfigTransformResult(Action.KEEP);
    }

    public static ConfigTransformResult remove() {
        return new ConfigTransformResult(Action.REMOVE);
    }
}
