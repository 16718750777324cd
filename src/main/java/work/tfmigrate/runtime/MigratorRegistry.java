package work.tfmigrate.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Maps resource kinds to migrators, per source/target version pair.
 */
public final class MigratorRegistry {
    private final Map<String, Entry> byKind = new ConcurrentHashMap<>();
    private final List<Entry> entries = new CopyOnWriteArrayList<>();

    public MigratorRegistry register(String sourceVersion, String targetVersion, ResourceMigrator migrator) {
        var entry = new Entry(sourceVersion, targetVersion, migrator);
        for (String kind : migrator.handledKinds()) {
            byKind.put(key(sourceVersion, targetVersion, kind), entry);
        }
        entries.add(entry);
        return this;
    }

    public Optional<ResourceMigrator> find(String sourceVersion, String targetVersion, String kind) {
        return Optional.ofNullable(byKind.get(key(sourceVersion, targetVersion, kind))).map(Entry::migrator);
    }

    /**
     * Migrators for a version pair, in registration order.
     */
    public List<ResourceMigrator> migrators(String sourceVersion, String targetVersion) {
        List<ResourceMigrator> result = new ArrayList<>();
        for (var entry : entries) {
            if (entry.sourceVersion().equals(sourceVersion) && entry.targetVersion().equals(targetVersion)) {
                result.add(entry.migrator());
            }
        }
        return result;
    }

    public boolean supports(String sourceVersion, String targetVersion) {
        return !migrators(sourceVersion, targetVersion).isEmpty();
    }

    private static String key(String sourceVersion, String targetVersion, String kind) {
        return sourceVersion + "->" + targetVersion + ":" + kind;
    }

    public record Entry(String sourceVersion, String targetVersion, ResourceMigrator migrator) {}
}
