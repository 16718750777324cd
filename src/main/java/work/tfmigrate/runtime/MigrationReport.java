package work.tfmigrate.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.tfmigrate.merge.MergeDiagnostic;

/**
 * Result of migrating one configuration unit or state document.
 *
 * @param migrated number of resources handled per original kind
 * @param errors per-resource migrator failures; the rest of the unit was still migrated
 */
public record MigrationReport(
    String label,
    String output,
    boolean changed,
    Map<String, Integer> migrated,
    List<MergeDiagnostic> diagnostics,
    List<String> errors
) {
    public MigrationReport {
        migrated = Collections.unmodifiableMap(new LinkedHashMap<>(migrated));
        diagnostics = List.copyOf(diagnostics);
        errors = List.copyOf(errors);
    }
}
