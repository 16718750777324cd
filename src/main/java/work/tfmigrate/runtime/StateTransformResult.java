package work.tfmigrate.runtime;

/**
 * Outcome for one state instance. The instance itself is edited in place; the resulting resource type is
 * returned here rather than remembered by the migrator.
 */
public record StateTransformResult(String resourceType, boolean removed) {
    public static StateTransformResult migrated(String resourceType) {
        return new StateTransformResult(resourceType, false);
    }

    public static StateTransformResult remove() {
        return new StateTransformResult(null, true);
    }
}
