package work.tfmigrate.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SatelliteMatcherTest {
    private static final String PROFILES = "cloudflare_zero_trust_device_profiles";
    private static final String CUSTOM = "cloudflare_zero_trust_device_custom_profile";

    @Test
    void implicitReferenceGoesToDefaultPrimary() {
        var custom = primary("eng", PROFILES, Variant.CUSTOM);
        var fallback = primary("default", PROFILES, Variant.DEFAULT);
        var satellite = satellite("office", new TargetReference.ImplicitDefault(null));

        var result = SatelliteMatcher.match(List.of(custom, fallback), List.of(satellite));

        assertEquals(1, result.assignments().size());
        assertEquals(fallback, result.assignments().get(0).primary());
        assertEquals(List.of(satellite), result.assignments().get(0).satellites());
        assertTrue(result.orphans().isEmpty());
        assertTrue(result.unmatched().isEmpty());
    }

    @Test
    void namedReferencePrefersExactKind() {
        var renamed = primary("eng", CUSTOM, Variant.CUSTOM);
        var legacy = primary("eng", PROFILES, Variant.CUSTOM);
        var satellite = satellite("vpn", new TargetReference.Named(PROFILES, "eng"));

        var result = SatelliteMatcher.match(List.of(renamed, legacy), List.of(satellite));

        assertEquals(legacy, result.assignments().get(0).primary());
    }

    @Test
    void namedReferenceFallsBackToAnyKindWithThatName() {
        var renamed = primary("eng", CUSTOM, Variant.CUSTOM);
        var satellite = satellite("vpn", new TargetReference.Named(PROFILES, "eng"));

        var result = SatelliteMatcher.match(List.of(renamed), List.of(satellite));

        assertEquals(renamed, result.assignments().get(0).primary());
    }

    @Test
    void separatesOrphansFromMissingTargets() {
        var orphan = satellite("dynamic", new TargetReference.Unparseable("var.policy_id"));
        var missing = satellite("lost", new TargetReference.Named(PROFILES, "gone"));
        var noDefault = satellite("office", new TargetReference.ImplicitDefault(null));

        var result = SatelliteMatcher.match(List.of(primary("eng", PROFILES, Variant.CUSTOM)),
            List.of(orphan, missing, noDefault));

        assertTrue(result.assignments().isEmpty());
        assertEquals(List.of(orphan), result.orphans());
        assertEquals(List.of(missing, noDefault), result.unmatched());
    }

    @Test
    void firstDefaultPrimaryWins() {
        var first = primary("one", PROFILES, Variant.DEFAULT);
        var second = primary("two", PROFILES, Variant.DEFAULT);

        var result = SatelliteMatcher.match(List.of(first, second),
            List.of(satellite("office", new TargetReference.ImplicitDefault(null))));

        assertEquals(first, result.assignments().get(0).primary());
    }

    @Test
    void implicitReferenceRespectsScope() {
        var accountA = new PrimaryResource<>("a", PROFILES, "a", Variant.DEFAULT, null, "acc-a");
        var accountB = new PrimaryResource<>("b", PROFILES, "b", Variant.DEFAULT, null, "acc-b");
        var satellite = satellite("office", new TargetReference.ImplicitDefault("acc-b"));

        var result = SatelliteMatcher.match(List.of(accountA, accountB), List.of(satellite));

        assertEquals(accountB, result.assignments().get(0).primary());
    }

    @Test
    void keepsSatelliteOrderAndLeavesInputsUntouched() {
        var target = primary("default", PROFILES, Variant.DEFAULT);
        var first = satellite("first", new TargetReference.ImplicitDefault(null));
        var second = satellite("second", new TargetReference.ImplicitDefault(null));
        var satellites = new ArrayList<>(List.of(first, second));

        var result = SatelliteMatcher.match(List.of(target), satellites);

        assertEquals(List.of(first, second), result.assignments().get(0).satellites());
        assertEquals(List.of(first, second), satellites);
    }

    private static PrimaryResource<String> primary(String name, String kind, Variant variant) {
        return new PrimaryResource<>(kind + "." + name, kind, name, variant, name, null);
    }

    private static SatelliteResource<String> satellite(String name, TargetReference target) {
        return new SatelliteResource<>(name, name, target, "exclude", List.of(), null);
    }
}
