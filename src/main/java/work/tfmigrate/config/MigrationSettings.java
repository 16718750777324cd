package work.tfmigrate.config;

import java.util.List;

/**
 * Values read from a {@code tf-migrate.toml} file. A {@code null} field was not set in the file.
 */
public record MigrationSettings(
    String sourceVersion,
    String targetVersion,
    List<String> resources,
    Boolean dryRun,
    Boolean recursive,
    String logLevel
) {
    public MigrationSettings {
        resources = resources == null ? null : List.copyOf(resources);
    }

    public static MigrationSettings empty() {
        return new MigrationSettings(null, null, null, null, null, null);
    }
}
