package work.tfmigrate.resources.deviceprofile;

import java.util.List;
import work.tfmigrate.merge.MergeSchema;
import work.tfmigrate.merge.VariantClassifier;

/**
 * Zero Trust device profiles: the v4 unified profile splits into default and custom profiles, and the
 * separate split tunnel resource folds into the profiles' {@code include} / {@code exclude} lists.
 */
public final class DeviceProfileSchema {
    public static final String PROFILES = "cloudflare_zero_trust_device_profiles";
    public static final String SETTINGS_POLICY = "cloudflare_device_settings_policy";
    public static final String DEFAULT_PROFILE = "cloudflare_zero_trust_device_default_profile";
    public static final String CUSTOM_PROFILE = "cloudflare_zero_trust_device_custom_profile";
    public static final String SPLIT_TUNNEL = "cloudflare_split_tunnel";

    private DeviceProfileSchema() {}

    public static MergeSchema create() {
        return MergeSchema.builder()
            .legacyPrimaryKinds(PROFILES, SETTINGS_POLICY)
            .defaultKind(DEFAULT_PROFILE)
            .customKind(CUSTOM_PROFILE)
            .satelliteKind(SPLIT_TUNNEL)
            .satelliteLabel("Split tunnel")
            .classifier(new VariantClassifier("default", "match", "precedence"))
            .reference("policy_id", CUSTOM_PROFILE, PROFILES, SETTINGS_POLICY)
            .mode("mode", "exclude")
            .entries("tunnels", List.of("address", "description", "host"), List.of("address", "host"))
            .collection("include", "include")
            .collection("exclude", "exclude")
            .scopeAttribute("account_id")
            .primaryKeyAttribute("policy_id")
            .compositeIdAttribute("id")
            .build();
    }
}
