package work.tfmigrate.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.tfmigrate.state.StateDocument;
import work.tfmigrate.state.StateResource;
import work.tfmigrate.support.MigrationTestSupport;

class StateCrossResourceMergerTest {
    private final StateCrossResourceMerger merger = new StateCrossResourceMerger(MigrationTestSupport.schema());

    @Test
    void foldsTunnelsIntoProfilesAndDropsSatellites() {
        var document = StateDocument.parse(MigrationTestSupport.fixture("state/device_profiles.tfstate"));

        var outcome = merger.process(document, "terraform.tfstate");

        assertEquals(2, outcome.primariesUpdated());
        assertEquals(3, outcome.satellitesRemoved());
        assertEquals(List.of("default", "engineering", "lookup"),
            document.resources().stream().map(StateResource::name).toList());

        var fallback = attributes(document, "default");
        assertEquals(1, fallback.get("include").size());
        assertEquals("10.0.0.0/8", fallback.get("include").get(0).get("address").asText());
        assertEquals("office", fallback.get("include").get(0).get("description").asText());
        assertFalse(fallback.get("include").get(0).has("host"));

        var engineering = attributes(document, "engineering");
        assertEquals("docs.example.com", engineering.get("exclude").get(0).get("host").asText());
        assertFalse(engineering.get("exclude").get(0).has("address"));
        assertFalse(engineering.has("include"));
    }

    @Test
    void reportsSatelliteWhosePolicyIsGone() {
        var document = StateDocument.parse(MigrationTestSupport.fixture("state/device_profiles.tfstate"));

        var outcome = merger.process(document, "terraform.tfstate");

        assertEquals(1, outcome.diagnostics().size());
        var diagnostic = outcome.diagnostics().get(0);
        assertEquals(DiagnosticReason.TARGET_NOT_FOUND, diagnostic.reason());
        assertEquals("Split tunnel \"stale\" references \"pol-missing\" which was not found - manual migration required",
            diagnostic.message());
        assertNull(diagnostic.source());
    }

    @Test
    void keepsDocumentEnvelope() {
        var document = StateDocument.parse(MigrationTestSupport.fixture("state/device_profiles.tfstate"));

        merger.process(document, "terraform.tfstate");

        var root = document.root();
        assertEquals("3f1c2d5e-8a7b-4c1d-9e2f-0a1b2c3d4e5f", root.get("lineage").asText());
        assertEquals(12, root.get("serial").asInt());
        assertEquals(4, root.get("version").asInt());
        assertTrue(root.get("outputs").isObject());
    }

    @Test
    void implicitSatelliteOnlyJoinsDefaultOfSameAccount() {
        var document = StateDocument.parse("""
            {
              "version": 4,
              "resources": [
                {"mode": "managed", "type": "cloudflare_zero_trust_device_profiles", "name": "main",
                 "instances": [{"attributes": {"account_id": "acc1", "default": true}}]},
                {"mode": "managed", "type": "cloudflare_split_tunnel", "name": "other",
                 "instances": [{"attributes": {"account_id": "acc2", "mode": "exclude",
                   "tunnels": [{"address": "10.0.0.0/8"}]}}]}
              ]
            }
            """);

        var outcome = merger.process(document, "terraform.tfstate");

        assertEquals(0, outcome.primariesUpdated());
        assertEquals(1, outcome.diagnostics().size());
        assertFalse(attributes(document, "main").has("exclude"));
        assertEquals(1, document.resources().size());
    }

    @Test
    void appendsAfterExistingCollection() {
        var document = StateDocument.parse("""
            {
              "version": 4,
              "resources": [
                {"mode": "managed", "type": "cloudflare_zero_trust_device_default_profile", "name": "main",
                 "instances": [{"attributes": {"account_id": "acc1", "exclude": [{"address": "1.1.1.1/32"}]}}]},
                {"mode": "managed", "type": "cloudflare_split_tunnel", "name": "tunnels",
                 "instances": [{"attributes": {"account_id": "acc1",
                   "tunnels": [{"address": "10.0.0.0/8"}]}}]}
              ]
            }
            """);

        merger.process(document, "terraform.tfstate");

        var exclude = attributes(document, "main").get("exclude");
        assertEquals(2, exclude.size());
        assertEquals("1.1.1.1/32", exclude.get(0).get("address").asText());
        assertEquals("10.0.0.0/8", exclude.get(1).get("address").asText());
    }

    @Test
    void nullValuesAreSkippedLikeEmptyOnes() {
        var document = StateDocument.parse("""
            {
              "version": 4,
              "resources": [
                {"mode": "managed", "type": "cloudflare_zero_trust_device_profiles", "name": "main",
                 "instances": [{"attributes": {"account_id": "acc1", "default": true}}]},
                {"mode": "managed", "type": "cloudflare_split_tunnel", "name": "office",
                 "instances": [{"attributes": {"account_id": "acc1", "mode": null, "policy_id": null,
                   "tunnels": [{"address": null, "description": "no key"},
                               {"address": "10.0.0.0/8", "description": null}]}}]}
              ]
            }
            """);

        var outcome = merger.process(document, "terraform.tfstate");

        assertTrue(outcome.diagnostics().isEmpty());
        var exclude = attributes(document, "main").get("exclude");
        assertEquals(1, exclude.size());
        assertEquals("10.0.0.0/8", exclude.get(0).get("address").asText());
        assertFalse(exclude.get(0).has("description"));
    }

    @Test
    void customProfileMatchedByPolicyIdAttribute() {
        var document = StateDocument.parse("""
            {
              "version": 4,
              "resources": [
                {"mode": "managed", "type": "cloudflare_zero_trust_device_custom_profile", "name": "eng",
                 "instances": [{"attributes": {"account_id": "acc1", "policy_id": "pol-9", "match": "x",
                   "precedence": 910}}]},
                {"mode": "managed", "type": "cloudflare_split_tunnel", "name": "eng",
                 "instances": [{"attributes": {"account_id": "acc1", "policy_id": "pol-9", "mode": "include",
                   "tunnels": [{"host": "vpn.example.com"}]}}]}
              ]
            }
            """);

        var outcome = merger.process(document, "terraform.tfstate");

        assertTrue(outcome.diagnostics().isEmpty());
        assertEquals("vpn.example.com", attributes(document, "eng").get("include").get(0).get("host").asText());
    }

    @Test
    void runsOncePerDocument() {
        var document = StateDocument.parse(MigrationTestSupport.fixture("state/device_profiles.tfstate"));

        merger.process(document, "terraform.tfstate");
        String once = document.render();
        var again = merger.process(document, "terraform.tfstate");

        assertTrue(again.skipped());
        assertEquals(once, document.render());
    }

    @Test
    void documentWithoutSatellitesIsUntouched() {
        String json = """
            {
              "version": 4,
              "resources": [
                {"mode": "managed", "type": "cloudflare_zero_trust_device_profiles", "name": "main",
                 "instances": [{"attributes": {"account_id": "acc1"}}]}
              ]
            }
            """;
        var document = StateDocument.parse(json);
        var before = document.root().deepCopy();

        var outcome = merger.process(document, "terraform.tfstate");

        assertEquals(0, outcome.satellitesRemoved());
        assertEquals(before, document.root());
    }

    @Test
    void compositeIdSuffix() {
        assertEquals("pol-123", StateCrossResourceMerger.compositeIdSuffix("acc1/pol-123"));
        assertNull(StateCrossResourceMerger.compositeIdSuffix("acc1"));
        assertNull(StateCrossResourceMerger.compositeIdSuffix("acc1/"));
        assertNull(StateCrossResourceMerger.compositeIdSuffix(null));
    }

    private static ObjectNode attributes(StateDocument document, String name) {
        return document.resources().stream()
            .filter(resource -> resource.name().equals(name))
            .findFirst()
            .flatMap(StateResource::attributes)
            .orElseThrow();
    }
}
