package work.tfmigrate.runtime;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.tfmigrate.state.StateDocument;
import work.tfmigrate.state.StateFormatException;
import work.tfmigrate.state.StateResource;

/**
 * Migrates a {@code terraform.tfstate} document. Each migrator's pre-processing hook runs once, then every
 * instance of a handled resource is transformed and the resource renamed to the type the migrator returned.
 */
public final class StateMigrationPipeline {
    private static final Logger log = LoggerFactory.getLogger(StateMigrationPipeline.class);

    private final MigratorRegistry registry;
    private final String sourceVersion;
    private final String targetVersion;
    private final Set<String> resourceFilter;

    public StateMigrationPipeline(
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

    public MigrationReport migrate(String json, String label) {
        StateDocument document;
        try {
            document = StateDocument.parse(json);
        } catch (StateFormatException ex) {
            throw new MigrationException(MigrationException.STATE_PARSE_ERROR,
                label + ": " + ex.getMessage(), Map.of("file", label), ex);
        }

        var ctx = MigrationContext.forState(document, label, sourceVersion, targetVersion);
        for (var migrator : activeMigrators()) {
            migrator.preprocessState(ctx, document);
        }

        Map<String, Integer> migrated = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        List<Integer> emptied = new ArrayList<>();
        for (var resource : document.resources()) {
            String type = resource.type();
            if (!resource.isManaged() || !selected(type)) {
                continue;
            }
            var migrator = registry.find(sourceVersion, targetVersion, type);
            if (migrator.isEmpty()) {
                log.debug("{}: no migrator for {}.{}", label, type, resource.name());
                continue;
            }
            try {
                if (migrateResource(migrator.get(), ctx, resource)) {
                    emptied.add(resource.index());
                }
                migrated.merge(type, 1, Integer::sum);
            } catch (RuntimeException ex) {
                String message = type + "." + resource.name() + ": " + ex.getMessage();
                log.error("{}: failed to migrate {}", label, message, ex);
                errors.add(message);
            }
        }
        document.removeResources(emptied);

        String output = document.render();
        return new MigrationReport(label, output, !output.equals(json), migrated, ctx.diagnostics(), errors);
    }

    /**
     * Transforms every instance of {@code resource}. Returns true when no instance is left.
     */
    private boolean migrateResource(ResourceMigrator migrator, MigrationContext ctx, StateResource resource) {
        Set<String> types = new LinkedHashSet<>();
        var instances = resource.node().get("instances") instanceof ArrayNode array ? array : null;
        if (instances == null) {
            return false;
        }
        int i = 0;
        while (i < instances.size()) {
            if (!(instances.get(i) instanceof ObjectNode instance)) {
                i++;
                continue;
            }
            var result = migrator.transformState(ctx, resource.type(), instance);
            if (result.removed()) {
                instances.remove(i);
                continue;
            }
            if (result.resourceType() != null) {
                types.add(result.resourceType());
            }
            i++;
        }
        if (instances.isEmpty()) {
            return true;
        }
        if (types.size() > 1) {
            log.warn("{}: instances of {}.{} migrate to different types {}; keeping {}",
                ctx.label(), resource.type(), resource.name(), types, types.iterator().next());
        }
        if (!types.isEmpty()) {
            ctx.stateDocument().setType(resource.index(), types.iterator().next());
        }
        return false;
    }

    private List<ResourceMigrator> activeMigrators() {
        List<ResourceMigrator> active = new ArrayList<>();
        for (var migrator : registry.migrators(sourceVersion, targetVersion)) {
            if (migrator.handledKinds().stream().anyMatch(this::selected)) {
                active.add(migrator);
            }
        }
        return active;
    }

    private boolean selected(String kind) {
        return resourceFilter.isEmpty() || resourceFilter.contains(kind);
    }
}
