package work.tfmigrate.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.tfmigrate.resources.deviceprofile.DeviceProfileMigrator;
import work.tfmigrate.resources.deviceprofile.DeviceProfileSchema;
import work.tfmigrate.resources.deviceprofile.SplitTunnelMigrator;

class MigratorRegistryTest {

    @Test
    void catalogRegistersDeviceProfileMigrators() {
        var registry = MigratorCatalog.create();

        assertTrue(registry.supports(MigratorCatalog.V4, MigratorCatalog.V5));
        assertFalse(registry.supports(MigratorCatalog.V5, MigratorCatalog.V4));
        for (String kind : new String[] {DeviceProfileSchema.PROFILES, DeviceProfileSchema.SETTINGS_POLICY,
            DeviceProfileSchema.DEFAULT_PROFILE, DeviceProfileSchema.CUSTOM_PROFILE}) {
            assertTrue(registry.find("v4", "v5", kind).orElseThrow() instanceof DeviceProfileMigrator, kind);
        }
        assertTrue(registry.find("v4", "v5", DeviceProfileSchema.SPLIT_TUNNEL).orElseThrow()
            instanceof SplitTunnelMigrator);
        assertTrue(registry.find("v4", "v5", "cloudflare_record").isEmpty());
    }

    @Test
    void migratorsKeepRegistrationOrder() {
        var registry = MigratorCatalog.create();

        var migrators = registry.migrators("v4", "v5");

        assertEquals(2, migrators.size());
        assertTrue(migrators.get(0) instanceof DeviceProfileMigrator);
        assertTrue(migrators.get(1) instanceof SplitTunnelMigrator);
    }
}
