package work.tfmigrate.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import work.tfmigrate.hcl.Block;
import work.tfmigrate.state.StateDocument;

/**
 * Migrates the resources of one or more kinds between two provider schema versions.
 */
public interface ResourceMigrator {
    /**
     * Resource kinds this migrator is registered for.
     */
    List<String> handledKinds();

    ConfigTransformResult transformConfig(MigrationContext ctx, Block block);

    /**
     * @param resourceType current type of the resource owning {@code instance}
     * @param instance one element of the resource's {@code instances} array, edited in place
     */
    StateTransformResult transformState(MigrationContext ctx, String resourceType, ObjectNode instance);

    /**
     * Runs once per state document before any instance is transformed.
     */
    default void preprocessState(MigrationContext ctx, StateDocument document) {}
}
