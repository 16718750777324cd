package work.tfmigrate.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import work.tfmigrate.hcl.ConfigFile;
import work.tfmigrate.merge.MergeDiagnostic;
import work.tfmigrate.state.StateDocument;

/**
 * Per-unit context handed to migrators. Holds the whole unit being migrated so that a migrator can work
 * across resources, and collects the diagnostics they report.
 */
public final class MigrationContext {
    private final String label;
    private final String sourceVersion;
    private final String targetVersion;
    private final ConfigFile configFile;
    private final StateDocument stateDocument;
    private final List<MergeDiagnostic> diagnostics = new ArrayList<>();

    private MigrationContext(
        String label,
        String sourceVersion,
        String targetVersion,
        ConfigFile configFile,
        StateDocument stateDocument
    ) {
        this.label = Objects.requireNonNull(label, "label");
        this.sourceVersion = Objects.requireNonNull(sourceVersion, "sourceVersion");
        this.targetVersion = Objects.requireNonNull(targetVersion, "targetVersion");
        this.configFile = configFile;
        this.stateDocument = stateDocument;
    }

    public static MigrationContext forConfig(ConfigFile file, String sourceVersion, String targetVersion) {
        return new MigrationContext(file.filename(), sourceVersion, targetVersion, file, null);
    }

    public static MigrationContext forState(StateDocument document, String label, String sourceVersion, String targetVersion) {
        return new MigrationContext(label, sourceVersion, targetVersion, null, document);
    }

    public String label() {
        return label;
    }

    public String sourceVersion() {
        return sourceVersion;
    }

    public String targetVersion() {
        return targetVersion;
    }

    /**
     * Unit being migrated, or {@code null} during a state pass.
     */
    public ConfigFile configFile() {
        return configFile;
    }

    /**
     * Document being migrated, or {@code null} during a configuration pass.
     */
    public StateDocument stateDocument() {
        return stateDocument;
    }

    public void report(List<MergeDiagnostic> found) {
        diagnostics.addAll(found);
    }

    public List<MergeDiagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
