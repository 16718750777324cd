package work.tfmigrate.resources.deviceprofile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import work.tfmigrate.hcl.Block;
import work.tfmigrate.hcl.ConfigFile;
import work.tfmigrate.runtime.ConfigTransformResult;
import work.tfmigrate.runtime.MigrationContext;
import work.tfmigrate.state.StateDocument;
import work.tfmigrate.state.StateJson;
import work.tfmigrate.support.MigrationTestSupport;

class DeviceProfileMigratorTest {
    private final DeviceProfileMigrator migrator = new DeviceProfileMigrator(MigrationTestSupport.schema());

    @Test
    void customProfileMovesPrecedenceAndDropsLegacyFlags() {
        var file = MigrationTestSupport.parse("""
            resource "cloudflare_zero_trust_device_profiles" "eng" {
              account_id = "abc"
              name       = "Engineering"
              match      = "os.name == linux"
              precedence = 20
              default    = false
              enabled    = true
            }
            """);

        var result = transform(file);

        assertEquals(ConfigTransformResult.Action.KEEP, result.action());
        assertEquals("""
            resource "cloudflare_zero_trust_device_custom_profile" "eng" {
              account_id = "abc"
              name       = "Engineering"
              match      = "os.name == linux"
              precedence = 920
            }
            """, file.render());
    }

    @Test
    void defaultProfileDropsRoutingFieldsAndGainsNewDefaults() {
        var file = MigrationTestSupport.parse("""
            resource "cloudflare_zero_trust_device_profiles" "default" {
              account_id = "abc"
              name       = "Default"
              default    = true
              precedence = 100
              match      = "true"
            }
            """);

        transform(file);

        assertEquals("""
            resource "cloudflare_zero_trust_device_default_profile" "default" {
              account_id                     = "abc"
              register_interface_ip_with_dns = true
              sccm_vpn_boundary_support      = false
            }
            """, file.render());
    }

    @Test
    void keepsDeclaredNewDefaults() {
        var file = MigrationTestSupport.parse("""
            resource "cloudflare_device_settings_policy" "default" {
              account_id                = "abc"
              sccm_vpn_boundary_support = true
            }
            """);

        transform(file);

        var block = file.resources().get(0);
        assertEquals(DeviceProfileSchema.DEFAULT_PROFILE, block.resourceKind());
        assertEquals("true", block.body().getAttribute("sccm_vpn_boundary_support").expression());
        assertEquals("true", block.body().getAttribute("register_interface_ip_with_dns").expression());
    }

    @Test
    void nonLiteralPrecedenceIsLeftAlone() {
        var file = MigrationTestSupport.parse("""
            resource "cloudflare_zero_trust_device_profiles" "eng" {
              match      = var.match
              precedence = var.precedence
            }
            """);

        transform(file);

        var block = file.resources().get(0);
        assertEquals(DeviceProfileSchema.CUSTOM_PROFILE, block.resourceKind());
        assertEquals("var.precedence", block.body().getAttribute("precedence").expression());
    }

    @Test
    void nestsServiceModeFields() {
        var file = MigrationTestSupport.parse("""
            resource "cloudflare_zero_trust_device_profiles" "eng" {
              match                = "true"
              precedence           = 1
              service_mode_v2_port = 8080
            }
            """);

        transform(file);

        var body = file.resources().get(0).body();
        assertFalse(body.hasAttribute("service_mode_v2_port"));
        assertEquals("{\n    port = 8080\n  }", body.getAttribute("service_mode_v2").expression());
    }

    @Test
    void defaultWarpModeWithoutPortIsDropped() {
        var file = MigrationTestSupport.parse("""
            resource "cloudflare_zero_trust_device_profiles" "default" {
              service_mode_v2_mode = "warp"
            }
            """);

        transform(file);

        var body = file.resources().get(0).body();
        assertFalse(body.hasAttribute("service_mode_v2_mode"));
        assertFalse(body.hasAttribute("service_mode_v2"));
    }

    @Test
    void alreadyMigratedKindsAreKeptAsIs() {
        String text = """
            resource "cloudflare_zero_trust_device_custom_profile" "eng" {
              match      = "true"
              precedence = 920
            }
            """;
        var file = MigrationTestSupport.parse(text);

        var result = transform(file);

        assertEquals(ConfigTransformResult.Action.KEEP, result.action());
        assertEquals(text, file.render());
    }

    @Test
    void runsSplitTunnelMergeBeforeRenaming() {
        var file = MigrationTestSupport.parse("""
            resource "cloudflare_zero_trust_device_profiles" "default" {
              account_id = "abc"
            }

            resource "cloudflare_split_tunnel" "office" {
              account_id = "abc"
              tunnels {
                address = "10.0.0.0/8"
              }
            }
            """);
        var ctx = MigrationContext.forConfig(file, "v4", "v5");

        migrator.transformConfig(ctx, file.resources().get(0));

        assertEquals(1, file.resources().size());
        var body = file.resources().get(0).body();
        assertTrue(body.hasAttribute("exclude"));
        assertTrue(ctx.diagnostics().isEmpty());
    }

    @Test
    void migratesDefaultProfileState() {
        var document = StateDocument.parse(MigrationTestSupport.fixture("state/device_profiles.tfstate"));
        ObjectNode instance = instance(document, 0);

        var result = migrator.transformState(ctx(document), DeviceProfileSchema.PROFILES, instance);

        assertEquals(DeviceProfileSchema.DEFAULT_PROFILE, result.resourceType());
        assertFalse(result.removed());
        var attributes = (ObjectNode) instance.get("attributes");
        for (String gone : new String[] {"default", "name", "description", "enabled", "fallback_domains", "exclude",
            "service_mode_v2_mode", "service_mode_v2_port", "service_mode_v2"}) {
            assertFalse(attributes.has(gone), gone);
        }
        assertTrue(attributes.get("auto_connect").isDouble());
        assertEquals(180.0, attributes.get("captive_portal").doubleValue());
        assertEquals(0, instance.get("schema_version").asInt());
    }

    @Test
    void migratesCustomProfileState() {
        var document = StateDocument.parse(MigrationTestSupport.fixture("state/device_profiles.tfstate"));
        ObjectNode instance = instance(document, 1);

        var result = migrator.transformState(ctx(document), DeviceProfileSchema.PROFILES, instance);

        assertEquals(DeviceProfileSchema.CUSTOM_PROFILE, result.resourceType());
        var attributes = (ObjectNode) instance.get("attributes");
        assertEquals("pol-123", attributes.get("policy_id").asText());
        assertEquals(10.0, attributes.get("precedence").doubleValue());
        assertTrue(attributes.get("precedence").isDouble());
        assertFalse(attributes.has("default"));
        assertFalse(attributes.has("enabled"));
        assertEquals("Engineering", attributes.get("name").asText());
        assertEquals("proxy", attributes.get("service_mode_v2").get("mode").asText());
        assertEquals(3128.0, attributes.get("service_mode_v2").get("port").doubleValue());
    }

    @Test
    void instanceWithoutAttributesStillMovesToDefaultKind() {
        var instance = (ObjectNode) StateJson.readObject("{\"schema_version\": 3}");

        var result = migrator.transformState(null, DeviceProfileSchema.SETTINGS_POLICY, instance);

        assertEquals(DeviceProfileSchema.DEFAULT_PROFILE, result.resourceType());
        assertEquals(0, instance.get("schema_version").asInt());
    }

    @Test
    void preprocessRunsStateMergeOnce() {
        var document = StateDocument.parse(MigrationTestSupport.fixture("state/device_profiles.tfstate"));
        var ctx = ctx(document);

        migrator.preprocessState(ctx, document);
        new SplitTunnelMigrator(MigrationTestSupport.schema()).preprocessState(ctx, document);

        assertEquals(1, ctx.diagnostics().size());
        assertEquals(3, document.resources().size());
    }

    private ConfigTransformResult transform(ConfigFile file) {
        Block block = file.resources().get(0);
        return migrator.transformConfig(MigrationContext.forConfig(file, "v4", "v5"), block);
    }

    private static MigrationContext ctx(StateDocument document) {
        return MigrationContext.forState(document, "terraform.tfstate", "v4", "v5");
    }

    private static ObjectNode instance(StateDocument document, int index) {
        return document.resource(index).orElseThrow().instances().get(0);
    }
}
