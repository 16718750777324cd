package work.tfmigrate.resources.deviceprofile;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;
import work.tfmigrate.hcl.Block;
import work.tfmigrate.merge.ConfigCrossResourceMerger;
import work.tfmigrate.merge.MergeSchema;
import work.tfmigrate.merge.StateCrossResourceMerger;
import work.tfmigrate.runtime.ConfigTransformResult;
import work.tfmigrate.runtime.MigrationContext;
import work.tfmigrate.runtime.ResourceMigrator;
import work.tfmigrate.runtime.StateTransformResult;
import work.tfmigrate.state.StateDocument;

/**
 * {@code cloudflare_split_tunnel} has no v5 counterpart; its tunnels live on the device profiles instead.
 * The migrator only triggers the cross-resource merge, which moves the entries and removes the resource.
 */
public final class SplitTunnelMigrator implements ResourceMigrator {
    private final MergeSchema schema;
    private final ConfigCrossResourceMerger configMerger;
    private final StateCrossResourceMerger stateMerger;

    public SplitTunnelMigrator(MergeSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.configMerger = new ConfigCrossResourceMerger(schema);
        this.stateMerger = new StateCrossResourceMerger(schema);
    }

    @Override
    public List<String> handledKinds() {
        return List.of(schema.satelliteKind());
    }

    /**
     * Covers units with split tunnels but no device profile; the block is normally gone once the merge ran.
     */
    @Override
    public ConfigTransformResult transformConfig(MigrationContext ctx, Block block) {
        if (ctx.configFile() != null) {
            ctx.report(configMerger.process(ctx.configFile()).diagnostics());
        }
        return ConfigTransformResult.remove();
    }

    @Override
    public StateTransformResult transformState(MigrationContext ctx, String resourceType, ObjectNode instance) {
        return StateTransformResult.remove();
    }

    @Override
    public void preprocessState(MigrationContext ctx, StateDocument document) {
        ctx.report(stateMerger.process(document, ctx.label()).diagnostics());
    }
}
