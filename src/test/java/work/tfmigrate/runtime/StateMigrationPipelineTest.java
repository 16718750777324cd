package work.tfmigrate.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.tfmigrate.hcl.Block;
import work.tfmigrate.state.StateDocument;
import work.tfmigrate.state.StateResource;
import work.tfmigrate.support.MigrationTestSupport;

class StateMigrationPipelineTest {

    @Test
    void migratesDeviceProfileState() {
        var pipeline = new StateMigrationPipeline(MigratorCatalog.create(), "v4", "v5", Set.of());

        var report = pipeline.migrate(MigrationTestSupport.fixture("state/device_profiles.tfstate"), "terraform.tfstate");

        var document = StateDocument.parse(report.output());
        assertEquals(List.of("cloudflare_zero_trust_device_default_profile",
                "cloudflare_zero_trust_device_custom_profile", "cloudflare_zero_trust_device_profiles"),
            document.resources().stream().map(StateResource::type).toList());
        assertEquals(Map.of("cloudflare_zero_trust_device_profiles", 2), report.migrated());
        assertEquals(1, report.diagnostics().size());
        assertTrue(report.changed());
        assertEquals("3f1c2d5e-8a7b-4c1d-9e2f-0a1b2c3d4e5f", document.root().get("lineage").asText());

        var fallback = document.resources().get(0).attributes().orElseThrow();
        assertEquals("10.0.0.0/8", fallback.get("include").get(0).get("address").asText());
        assertFalse(fallback.has("exclude"));
        var custom = document.resources().get(1).attributes().orElseThrow();
        assertEquals("docs.example.com", custom.get("exclude").get(0).get("host").asText());
        assertEquals("pol-123", custom.get("policy_id").asText());
    }

    @Test
    void migratedStateIsStable() {
        var pipeline = new StateMigrationPipeline(MigratorCatalog.create(), "v4", "v5", Set.of());
        String once = pipeline.migrate(MigrationTestSupport.fixture("state/device_profiles.tfstate"), "s").output();

        var again = pipeline.migrate(once, "s");

        assertFalse(again.changed());
        assertTrue(again.diagnostics().isEmpty());
    }

    @Test
    void invalidJsonBecomesParseFailure() {
        var pipeline = new StateMigrationPipeline(MigratorCatalog.create(), "v4", "v5", Set.of());

        var error = assertThrows(MigrationException.class, () -> pipeline.migrate("{\"resources\": [", "bad.tfstate"));

        assertEquals(MigrationException.STATE_PARSE_ERROR, error.code());
    }

    @Test
    void filterLimitsMigratedKinds() {
        var pipeline = new StateMigrationPipeline(MigratorCatalog.create(), "v4", "v5",
            Set.of("cloudflare_record"));
        String json = MigrationTestSupport.fixture("state/device_profiles.tfstate");

        var report = pipeline.migrate(json, "terraform.tfstate");

        assertTrue(report.migrated().isEmpty());
        assertEquals(6, StateDocument.parse(report.output()).resources().size());
    }

    @Test
    void removesResourcesLeftWithoutInstances() {
        var registry = new MigratorRegistry().register("v4", "v5", new DroppingMigrator("cloudflare_gone"));
        var pipeline = new StateMigrationPipeline(registry, "v4", "v5", Set.of());

        var report = pipeline.migrate("""
            {
              "version": 4,
              "resources": [
                {"mode": "managed", "type": "cloudflare_gone", "name": "a", "instances": [{"attributes": {}}]},
                {"mode": "managed", "type": "cloudflare_kept", "name": "b", "instances": [{"attributes": {}}]}
              ]
            }
            """, "terraform.tfstate");

        assertEquals(List.of("cloudflare_kept"),
            StateDocument.parse(report.output()).resources().stream().map(StateResource::type).toList());
    }

    private record DroppingMigrator(String kind) implements ResourceMigrator {
        @Override
        public List<String> handledKinds() {
            return List.of(kind);
        }

        @Override
        public ConfigTransformResult transformConfig(MigrationContext ctx, Block block) {
            return ConfigTransformResult.remove();
        }

        @Override
        public StateTransformResult transformState(MigrationContext ctx, String resourceType, ObjectNode instance) {
            return StateTransformResult.remove();
        }
    }
}
