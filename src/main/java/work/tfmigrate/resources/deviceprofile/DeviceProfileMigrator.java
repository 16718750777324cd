package work.tfmigrate.resources.deviceprofile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.tfmigrate.hcl.Block;
import work.tfmigrate.hcl.Body;
import work.tfmigrate.merge.ConfigCrossResourceMerger;
import work.tfmigrate.merge.MergeSchema;
import work.tfmigrate.merge.StateCrossResourceMerger;
import work.tfmigrate.merge.Variant;
import work.tfmigrate.runtime.ConfigTransformResult;
import work.tfmigrate.runtime.MigrationContext;
import work.tfmigrate.runtime.ResourceMigrator;
import work.tfmigrate.runtime.StateTransformResult;
import work.tfmigrate.state.StateDocument;
import work.tfmigrate.state.StateValues;
import work.tfmigrate.value.AttrValue;

/**
 * Splits the v4 device profile ({@code cloudflare_zero_trust_device_profiles} and its deprecated alias) into
 * the v5 default or custom profile. Also registered for the v5 kinds so that the split tunnel merge runs on
 * units that were partly migrated already; those blocks are otherwise left alone.
 */
public final class DeviceProfileMigrator implements ResourceMigrator {
    private static final Logger log = LoggerFactory.getLogger(DeviceProfileMigrator.class);

    static final BigDecimal PRECEDENCE_OFFSET = BigDecimal.valueOf(900);
    private static final String[] CUSTOM_REMOVED = {"default", "enabled"};
    private static final String[] DEFAULT_REMOVED = {"name", "description", "match", "precedence", "enabled", "default"};
    private static final String SERVICE_MODE = "service_mode_v2";
    private static final String SERVICE_MODE_MODE = "service_mode_v2_mode";
    private static final String SERVICE_MODE_PORT = "service_mode_v2_port";
    private static final String DEFAULT_SERVICE_MODE = "warp";

    private final MergeSchema schema;
    private final ConfigCrossResourceMerger configMerger;
    private final StateCrossResourceMerger stateMerger;

    public DeviceProfileMigrator(MergeSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.configMerger = new ConfigCrossResourceMerger(schema);
        this.stateMerger = new StateCrossResourceMerger(schema);
    }

    @Override
    public List<String> handledKinds() {
        return List.of(DeviceProfileSchema.PROFILES, DeviceProfileSchema.SETTINGS_POLICY,
            schema.defaultKind(), schema.customKind());
    }

    @Override
    public ConfigTransformResult transformConfig(MigrationContext ctx, Block block) {
        if (ctx.configFile() != null) {
            ctx.report(configMerger.process(ctx.configFile()).diagnostics());
        }
        if (!schema.isLegacyKind(block.resourceKind())) {
            return ConfigTransformResult.keep();
        }

        var body = block.body();
        var variant = schema.classifier().classify(body.attributeView());
        String newKind = schema.kindFor(variant);
        log.debug("{}.{} -> {}", block.resourceKind(), block.resourceName(), newKind);
        block.setLabel(0, newKind);

        if (variant == Variant.CUSTOM) {
            shiftPrecedence(block);
            body.removeAttributes(CUSTOM_REMOVED);
        } else {
            body.removeAttributes(DEFAULT_REMOVED);
        }
        nestServiceMode(body);
        if (variant == Variant.DEFAULT) {
            body.ensureAttribute("register_interface_ip_with_dns", AttrValue.bool(true));
            body.ensureAttribute("sccm_vpn_boundary_support", AttrValue.bool(false));
        }
        return ConfigTransformResult.keep();
    }

    @Override
    public StateTransformResult transformState(MigrationContext ctx, String resourceType, ObjectNode instance) {
        if (!schema.isLegacyKind(resourceType)) {
            return StateTransformResult.migrated(resourceType);
        }
        if (!(instance.get("attributes") instanceof ObjectNode attributes)) {
            instance.put("schema_version", 0);
            return StateTransformResult.migrated(schema.defaultKind());
        }

        var variant = schema.classifier().classify(StateValues.view(attributes));
        attributes.remove(List.of(variant == Variant.CUSTOM ? CUSTOM_REMOVED : DEFAULT_REMOVED));
        attributes.remove("fallback_domains");
        JsonNode exclude = attributes.get("exclude");
        if (exclude != null && exclude.isArray() && exclude.isEmpty()) {
            attributes.remove("exclude");
        }

        toFloat(attributes, "auto_connect");
        toFloat(attributes, "captive_portal");
        if (variant == Variant.CUSTOM) {
            toFloat(attributes, "precedence");
            String profileId = StateCrossResourceMerger.compositeIdSuffix(
                attributes.path(schema.compositeIdAttribute()).asText(""));
            if (profileId != null) {
                attributes.put(schema.primaryKeyAttribute(), profileId);
            }
        }
        nestServiceMode(attributes);
        instance.put("schema_version", 0);
        return StateTransformResult.migrated(schema.kindFor(variant));
    }

    @Override
    public void preprocessState(MigrationContext ctx, StateDocument document) {
        ctx.report(stateMerger.process(document, ctx.label()).diagnostics());
    }

    // v5 custom profiles must not collide with existing policies, so their precedence moves up by 900.
    private static void shiftPrecedence(Block block) {
        var attribute = block.body().getAttribute("precedence");
        if (attribute == null) {
            return;
        }
        if (attribute.value() instanceof AttrValue.NumberValue number) {
            block.body().setAttributeValue("precedence", AttrValue.number(number.value().add(PRECEDENCE_OFFSET)));
        } else {
            log.debug("{}.{}: precedence is not a literal number, leaving it unchanged",
                block.resourceKind(), block.resourceName());
        }
    }

    private static void nestServiceMode(Body body) {
        var mode = body.getAttribute(SERVICE_MODE_MODE);
        var port = body.getAttribute(SERVICE_MODE_PORT);
        if (mode != null && port == null
            && mode.value().literalString().filter(DEFAULT_SERVICE_MODE::equals).isPresent()) {
            body.removeAttribute(SERVICE_MODE_MODE);
            return;
        }
        if (mode == null && port == null) {
            return;
        }
        Map<String, AttrValue> nested = new LinkedHashMap<>();
        if (mode != null) {
            nested.put("mode", mode.value());
        }
        if (port != null) {
            nested.put("port", port.value());
        }
        body.removeAttributes(SERVICE_MODE_MODE, SERVICE_MODE_PORT);
        body.setAttributeValue(SERVICE_MODE, new AttrValue.ObjectValue(nested));
    }

    private static void nestServiceMode(ObjectNode attributes) {
        JsonNode mode = attributes.get(SERVICE_MODE_MODE);
        JsonNode port = attributes.get(SERVICE_MODE_PORT);
        boolean hasPort = port != null && port.isNumber() && port.asLong() != 0;
        if (mode != null && DEFAULT_SERVICE_MODE.equals(mode.asText()) && !hasPort) {
            attributes.remove(List.of(SERVICE_MODE_MODE, SERVICE_MODE_PORT));
            return;
        }
        ObjectNode nested = attributes.objectNode();
        if (mode != null && mode.isTextual() && !mode.asText().isEmpty()) {
            nested.put("mode", mode.asText());
        }
        if (hasPort) {
            nested.put("port", port.asDouble());
        }
        if (!nested.isEmpty()) {
            attributes.set(SERVICE_MODE, nested);
            attributes.remove(List.of(SERVICE_MODE_MODE, SERVICE_MODE_PORT));
        }
    }

    private static void toFloat(ObjectNode attributes, String name) {
        JsonNode value = attributes.get(name);
        if (value != null && value.isNumber()) {
            attributes.put(name, value.asDouble());
        }
    }
}
