package work.tfmigrate.api;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable configuration for one migration run.
 */
public record MigrationConfiguration(
    Optional<Path> configDirectory,
    Optional<Path> stateFile,
    String sourceVersion,
    String targetVersion,
    Set<String> resources,
    boolean dryRun,
    boolean recursive,
    boolean backup,
    LogLevel logLevel
) {
    public MigrationConfiguration {
        Objects.requireNonNull(configDirectory, "configDirectory");
        Objects.requireNonNull(stateFile, "stateFile");
        Objects.requireNonNull(sourceVersion, "sourceVersion");
        Objects.requireNonNull(targetVersion, "targetVersion");
        resources = Set.copyOf(resources);
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path configDirectory;
        private Path stateFile;
        private String sourceVersion = "v4";
        private String targetVersion = "v5";
        private final Set<String> resources = new LinkedHashSet<>();
        private boolean dryRun;
        private boolean recursive;
        private boolean backup = true;
        private LogLevel logLevel = LogLevel.INFO;

        public Builder configDirectory(Path configDirectory) {
            this.configDirectory = configDirectory;
            return this;
        }

        public Builder stateFile(Path stateFile) {
            this.stateFile = stateFile;
            return this;
        }

        public Builder sourceVersion(String sourceVersion) {
            this.sourceVersion = sourceVersion;
            return this;
        }

        public Builder targetVersion(String targetVersion) {
            this.targetVersion = targetVersion;
            return this;
        }

        public Builder resources(Iterable<String> kinds) {
            resources.clear();
            kinds.forEach(resources::add);
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder recursive(boolean recursive) {
            this.recursive = recursive;
            return this;
        }

        public Builder backup(boolean backup) {
            this.backup = backup;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public MigrationConfiguration build() {
            return new MigrationConfiguration(
                Optional.ofNullable(configDirectory),
                Optional.ofNullable(stateFile),
                sourceVersion,
                targetVersion,
                resources,
                dryRun,
                recursive,
                backup,
                logLevel
            );
        }
    }
}
