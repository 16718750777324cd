package work.tfmigrate.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.tfmigrate.merge.MergeDiagnostic;
import work.tfmigrate.runtime.ConfigMigrationPipeline;
import work.tfmigrate.runtime.MigrationException;
import work.tfmigrate.runtime.MigrationReport;
import work.tfmigrate.runtime.MigratorCatalog;
import work.tfmigrate.runtime.MigratorRegistry;
import work.tfmigrate.runtime.StateMigrationPipeline;

/**
 * Public entry point: migrates the {@code .tf} files of a directory and/or a state file in place.
 */
public final class MigrationRunner {
    private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);
    private static final String BACKUP_SUFFIX = ".backup";

    private final MigratorRegistry registry;

    public MigrationRunner() {
        this(MigratorCatalog.create());
    }

    public MigrationRunner(MigratorRegistry registry) {
        this.registry = registry;
    }

    public RunResult run(MigrationConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("sourceVersion", configuration.sourceVersion());
        metadata.put("targetVersion", configuration.targetVersion());
        metadata.put("dryRun", configuration.dryRun());
        try {
            if (configuration.configDirectory().isEmpty() && configuration.stateFile().isEmpty()) {
                throw new IllegalArgumentException("Nothing to migrate: set a config directory or a state file");
            }
            if (!registry.supports(configuration.sourceVersion(), configuration.targetVersion())) {
                throw new MigrationException(MigrationException.UNSUPPORTED_MIGRATION,
                    "No migrators registered for " + configuration.sourceVersion() + " -> "
                        + configuration.targetVersion(), Map.of());
            }

            List<MigrationReport> reports = new ArrayList<>();
            if (configuration.configDirectory().isPresent()) {
                var pipeline = new ConfigMigrationPipeline(registry, configuration.sourceVersion(),
                    configuration.targetVersion(), configuration.resources());
                List<Map<String, Object>> files = new ArrayList<>();
                for (Path file : listConfigFiles(configuration.configDirectory().get(), configuration.recursive())) {
                    String content = read(file);
                    var report = pipeline.migrate(content, file.toString());
                    write(file, content, report, configuration);
                    reports.add(report);
                    files.add(summarize(report));
                }
                metadata.put("configFiles", files);
            }
            if (configuration.stateFile().isPresent()) {
                Path file = configuration.stateFile().get();
                var pipeline = new StateMigrationPipeline(registry, configuration.sourceVersion(),
                    configuration.targetVersion(), configuration.resources());
                String content = read(file);
                var report = pipeline.migrate(content, file.toString());
                write(file, content, report, configuration);
                reports.add(report);
                metadata.put("state", summarize(report));
            }

            int diagnostics = reports.stream().mapToInt(report -> report.diagnostics().size()).sum();
            int errors = reports.stream().mapToInt(report -> report.errors().size()).sum();
            metadata.put("diagnostics", diagnostics);
            metadata.put("errors", errors);
            metadata.put("logLevel", configuration.logLevel().name());
            if (errors > 0) {
                metadata.put("status", "partial");
                return RunResult.partial(metadata, started);
            }
            metadata.put("status", "ok");
            return RunResult.success(metadata, started);
        } catch (MigrationException ex) {
            metadata.put("code", ex.code());
            log.debug("Migration failed", ex);
            return RunResult.failure(ex.getMessage(), metadata, started);
        } catch (RuntimeException ex) {
            log.debug("Migration failed", ex);
            return RunResult.failure(ex.getMessage(), metadata, started);
        }
    }

    static List<Path> listConfigFiles(Path directory, boolean recursive) {
        if (!Files.isDirectory(directory)) {
            throw new MigrationException(MigrationException.IO_ERROR,
                "Config directory does not exist: " + directory, Map.of("path", directory.toString()));
        }
        try (Stream<Path> paths = recursive ? Files.walk(directory) : Files.list(directory)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(".tf"))
                .filter(path -> !isHidden(directory, path))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new MigrationException(MigrationException.IO_ERROR,
                "Unable to list " + directory + ": " + ex.getMessage(), Map.of("path", directory.toString()), ex);
        }
    }

    // Skips .terraform/ and other dot directories below the root.
    private static boolean isHidden(Path root, Path file) {
        for (Path part : root.relativize(file)) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new MigrationException(MigrationException.IO_ERROR,
                "Unable to read " + file + ": " + ex.getMessage(), Map.of("path", file.toString()), ex);
        }
    }

    private static void write(Path file, String original, MigrationReport report, MigrationConfiguration configuration) {
        if (!report.changed()) {
            log.debug("{}: no changes", file);
            return;
        }
        if (configuration.dryRun()) {
            log.info("{}: would be migrated (dry run)", file);
            return;
        }
        try {
            if (configuration.backup()) {
                Files.writeString(file.resolveSibling(file.getFileName() + BACKUP_SUFFIX), original, StandardCharsets.UTF_8);
            }
            Files.writeString(file, report.output(), StandardCharsets.UTF_8);
            log.info("{}: migrated", file);
        } catch (IOException ex) {
            throw new MigrationException(MigrationException.IO_ERROR,
                "Unable to write " + file + ": " + ex.getMessage(), Map.of("path", file.toString()), ex);
        }
    }

    private static Map<String, Object> summarize(MigrationReport report) {
        var summary = new LinkedHashMap<String, Object>();
        summary.put("file", report.label());
        summary.put("changed", report.changed());
        summary.put("migrated", report.migrated());
        summary.put("diagnostics", report.diagnostics().stream().map(MergeDiagnostic::message).collect(Collectors.toList()));
        if (!report.errors().isEmpty()) {
            summary.put("errors", report.errors());
        }
        return summary;
    }
}
