package work.tfmigrate.support;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import work.tfmigrate.hcl.ConfigFile;
import work.tfmigrate.hcl.ConfigParser;
import work.tfmigrate.merge.MergeSchema;
import work.tfmigrate.resources.deviceprofile.DeviceProfileSchema;

/**
 * Shared helpers for the migration test suites.
 */
public final class MigrationTestSupport {
    private MigrationTestSupport() {}

    public static MergeSchema schema() {
        return DeviceProfileSchema.create();
    }

    public static ConfigFile parse(String text) {
        return ConfigParser.parse(text, "main.tf");
    }

    /**
     * Reads a file below {@code src/test/resources/fixtures}.
     */
    public static String fixture(String path) {
        try (InputStream in = MigrationTestSupport.class.getResourceAsStream("/fixtures/" + path)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static int occurrences(String text, String needle) {
        int count = 0;
        int from = text.indexOf(needle);
        while (from >= 0) {
            count++;
            from = text.indexOf(needle, from + needle.length());
        }
        return count;
    }
}
