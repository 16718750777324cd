package work.tfmigrate.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.tfmigrate.hcl.Block;
import work.tfmigrate.hcl.ConfigFile;
import work.tfmigrate.hcl.ConfigParser;
import work.tfmigrate.hcl.ConfigSyntaxException;

/**
 * Migrates one {@code .tf} unit: every top-level resource block is handed to the migrator registered for
 * its kind, then the unit is rendered again.
 */
public final class ConfigMigrationPipeline {
    private static final Logger log = LoggerFactory.getLogger(ConfigMigrationPipeline.class);

    private final MigratorRegistry registry;
    private final String sourceVersion;
    private final String targetVersion;
    private final Set<String> resourceFilter;

    /**
     * @param resourceFilter kinds to migrate; empty means every kind with a migrator
     */
    public ConfigMigrationPipeline(
        MigratorRegistry registry,
        String sourceVersion,
        String targetVersion,
        Set<String> resourceFilter
    ) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sourceVersion = Objects.requireNonNull(sourceVersion, "sourceVersion");
        this.targetVersion = Objects.requireNonNull(targetVersion, "targetVersion");
        this.resourceFilter = resourceFilter == null ? Set.of() : Set.copyOf(resourceFilter);
    }

    public MigrationReport migrate(String content, String filename) {
        ConfigFile file;
        try {
            file = ConfigParser.parse(content, filename);
        } catch (ConfigSyntaxException ex) {
            throw new MigrationException(MigrationException.CONFIG_PARSE_ERROR,
                filename + ": " + ex.getMessage(), Map.of("file", filename, "line", ex.line()), ex);
        }

        var ctx = MigrationContext.forConfig(file, sourceVersion, targetVersion);
        Map<String, Integer> migrated = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        for (var block : file.resources()) {
            // An earlier migrator may already have removed this block.
            if (!block.isAttached()) {
                continue;
            }
            String kind = block.resourceKind();
            if (!resourceFilter.isEmpty() && !resourceFilter.contains(kind)) {
                continue;
            }
            var migrator = registry.find(sourceVersion, targetVersion, kind);
            if (migrator.isEmpty()) {
                continue;
            }
            try {
                apply(block, migrator.get().transformConfig(ctx, block));
                migrated.merge(kind, 1, Integer::sum);
            } catch (RuntimeException ex) {
                String message = kind + "." + block.resourceName() + ": " + ex.getMessage();
                log.error("{}: failed to migrate {}", filename, message, ex);
                errors.add(message);
            }
        }

        String output = file.render();
        return new MigrationReport(filename, output, !output.equals(content), migrated, ctx.diagnostics(), errors);
    }

    private static void apply(Block block, ConfigTransformResult result) {
        if (!block.isAttached()) {
            return;
        }
        if (result.action() == ConfigTransformResult.Action.REMOVE) {
            block.parent().removeBlock(block);
        }
    }
}
