package work.tfmigrate.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.tfmigrate.api.LogLevel;
import work.tfmigrate.api.MigrationConfiguration;
import work.tfmigrate.api.MigrationRunner;
import work.tfmigrate.api.RunResult;
import work.tfmigrate.config.MigrationSettings;
import work.tfmigrate.config.SettingsLoader;

@CommandLine.Command(
    name = "tf-migrate",
    description = "Migrate Terraform configuration and state between Cloudflare provider versions.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class MigrateCommand implements Callable<Integer> {
    @CommandLine.Option(
        names = {"-d", "--config-dir"},
        paramLabel = "DIR",
        description = "Directory holding the .tf files to migrate in place."
    )
    private Path configDir;

    @CommandLine.Option(
        names = {"-s", "--state-file"},
        paramLabel = "FILE",
        description = "terraform.tfstate file to migrate in place."
    )
    private Path stateFile;

    @CommandLine.Option(
        names = "--settings",
        paramLabel = "FILE",
        description = "Settings file (default: tf-migrate.toml in the config directory, if present)."
    )
    private Path settingsFile;

    @CommandLine.Option(names = "--source-version", description = "Provider version to migrate from (default: v4).")
    private String sourceVersion;

    @CommandLine.Option(names = "--target-version", description = "Provider version to migrate to (default: v5).")
    private String targetVersion;

    @CommandLine.Option(
        names = {"-r", "--resource"},
        paramLabel = "KIND",
        description = "Only migrate these resource kinds (repeatable)."
    )
    private List<String> resources = new ArrayList<>();

    @CommandLine.Option(
        names = "--dry-run",
        arity = "0..1",
        description = "Report what would change without writing files."
    )
    private Boolean dryRun;

    @CommandLine.Option(names = "--recursive", arity = "0..1", description = "Also migrate .tf files in subdirectories.")
    private Boolean recursive;

    @CommandLine.Option(names = "--no-backup", description = "Do not keep a .backup copy of rewritten files.")
    private boolean noBackup;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        if (configDir == null && stateFile == null) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "At least one of --config-dir or --state-file is required.");
        }
        MigrationSettings settings = loadSettings();
        LogLevel logLevel = LogLevel.from(firstNonNull(logLevelRaw, settings.logLevel()));
        LoggingSetup.apply(logLevel);

        var configuration = MigrationConfiguration.builder()
            .configDirectory(configDir)
            .stateFile(stateFile)
            .sourceVersion(firstNonNull(sourceVersion, settings.sourceVersion(), "v4"))
            .targetVersion(firstNonNull(targetVersion, settings.targetVersion(), "v5"))
            .resources(!resources.isEmpty() || settings.resources() == null ? resources : settings.resources())
            .dryRun(firstNonNull(dryRun, settings.dryRun(), Boolean.FALSE))
            .recursive(firstNonNull(recursive, settings.recursive(), Boolean.FALSE))
            .backup(!noBackup)
            .logLevel(logLevel)
            .build();

        RunResult result = new MigrationRunner().run(configuration);
        spec.commandLine().getOut().println(result.toPrettyJson());
        return result.status().exitCode();
    }

    private MigrationSettings loadSettings() {
        if (settingsFile != null) {
            return SettingsLoader.load(settingsFile);
        }
        return SettingsLoader.find(configDir).map(SettingsLoader::load).orElse(MigrationSettings.empty());
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
