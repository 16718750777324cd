package work.tfmigrate.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import work.tfmigrate.runtime.MigrationException;

/**
 * Reads {@code tf-migrate.toml}:
 *
 * <pre>
 * [migration]
 * source_version = "v4"
 * target_version = "v5"
 * resources = ["cloudflare_split_tunnel"]
 *
 * [output]
 * dry_run = false
 * recursive = true
 * log_level = "info"
 * </pre>
 */
public final class SettingsLoader {
    public static final String DEFAULT_FILE_NAME = "tf-migrate.toml";

    private SettingsLoader() {}

    /**
     * Settings file in {@code directory}, if there is one.
     */
    public static Optional<Path> find(Path directory) {
        if (directory == null) {
            return Optional.empty();
        }
        Path candidate = directory.resolve(DEFAULT_FILE_NAME);
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    public static MigrationSettings load(Path file) {
        String raw;
        try {
            raw = Files.readString(file);
        } catch (IOException ex) {
            throw new MigrationException(MigrationException.IO_ERROR,
                "Unable to read settings file " + file + ": " + ex.getMessage(), Map.of("file", file.toString()), ex);
        }
        return parse(raw, file.toString());
    }

    public static MigrationSettings parse(String raw, String source) {
        TomlParseResult result = Toml.parse(raw);
        if (result.hasErrors()) {
            String details = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new MigrationException(MigrationException.SETTINGS_ERROR,
                "Invalid settings file " + source + ": " + details, Map.of("file", source));
        }
        try {
            return new MigrationSettings(
                result.getString("migration.source_version"),
                result.getString("migration.target_version"),
                strings(result.getArray("migration.resources")),
                result.getBoolean("output.dry_run"),
                result.getBoolean("output.recursive"),
                result.getString("output.log_level")
            );
        } catch (TomlInvalidTypeException ex) {
            throw new MigrationException(MigrationException.SETTINGS_ERROR,
                "Invalid settings file " + source + ": " + ex.getMessage(), Map.of("file", source), ex);
        }
    }

    private static List<String> strings(TomlArray array) {
        if (array == null) {
            return null;
        }
        List<String> values = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }
}
