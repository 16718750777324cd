package work.tfmigrate.runtime;

import work.tfmigrate.resources.deviceprofile.DeviceProfileMigrator;
import work.tfmigrate.resources.deviceprofile.DeviceProfileSchema;
import work.tfmigrate.resources.deviceprofile.SplitTunnelMigrator;

/**
 * Shared registry bootstrap so the CLI, the runner and tests see the same migrators.
 */
public final class MigratorCatalog {
    public static final String V4 = "v4";
    public static final String V5 = "v5";

    private MigratorCatalog() {}

    public static MigratorRegistry create() {
        var registry = new MigratorRegistry();
        var schema = DeviceProfileSchema.create();
        registry.register(V4, V5, new DeviceProfileMigrator(schema));
        registry.register(V4, V5, new SplitTunnelMigrator(schema));
        return registry;
    }
}
