package work.tfmigrate.merge;

import com.fasterxml.jackson.databind.node.ArrayNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.tfmigrate.state.StateDocument;
import work.tfmigrate.state.StateResource;
import work.tfmigrate.state.StateValues;
import work.tfmigrate.value.AttrValue;
import work.tfmigrate.value.AttributeView;

/**
 * State-document counterpart of {@link ConfigCrossResourceMerger}. References are concrete identifiers here:
 * satellites without one join the default-variant primary of the same scope, the others join the primary
 * whose identifier equals theirs. Merged entries follow any the primary already holds.
 *
 * <p>Diagnostics cannot be written into JSON; they are logged and returned.
 */
public final class StateCrossResourceMerger {
    private static final Logger log = LoggerFactory.getLogger(StateCrossResourceMerger.class);

    private final MergeSchema schema;

    public StateCrossResourceMerger(MergeSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    public MergeOutcome process(StateDocument document, String label) {
        if (!document.markProcessed(schema.passId())) {
            return MergeOutcome.alreadyProcessed();
        }

        List<PrimaryResource<Integer>> primaries = new ArrayList<>();
        List<SatelliteResource<Integer>> satellites = new ArrayList<>();
        List<Integer> removals = new ArrayList<>();
        for (var resource : document.resources()) {
            if (!resource.isManaged()) {
                continue;
            }
            if (schema.isPrimaryKind(resource.type())) {
                if (resource.attributes().isPresent()) {
                    primaries.add(readPrimary(resource));
                }
            } else if (schema.satelliteKind().equals(resource.type())) {
                removals.add(resource.index());
                if (resource.attributes().isPresent()) {
                    satellites.add(readSatellite(resource));
                }
            }
        }
        if (removals.isEmpty()) {
            return new MergeOutcome(false, 0, 0, List.of());
        }

        var match = SatelliteMatcher.match(primaries, satellites);
        List<SatelliteResource<Integer>> unsupported = new ArrayList<>();
        int updated = 0;
        for (var assignment : match.assignments()) {
            var merged = MergeEngine.merge(schema, assignment.satellites());
            unsupported.addAll(merged.unsupported());
            int index = assignment.primary().handle();
            merged.collections().forEach((attribute, entries) ->
                document.appendToAttribute(index, attribute,
                    (ArrayNode) StateValues.toJson(new AttrValue.ListValue(new ArrayList<AttrValue>(entries)))));
            if (!merged.isEmpty()) {
                updated++;
            }
        }

        int removed = document.removeResources(removals);
        var diagnostics = DiagnosticsReporter.collect(schema, match, unsupported);
        DiagnosticsReporter.log(label, diagnostics);
        log.debug("{}: removed {} {} resource(s), updated {} primary resource(s)",
            label, removed, schema.satelliteKind(), updated);
        return new MergeOutcome(false, updated, removed, diagnostics);
    }

    private PrimaryResource<Integer> readPrimary(StateResource resource) {
        AttributeView attributes = resource.attributeView();
        var variant = schema.variantOf(resource.type(), attributes);
        String scope = nonEmpty(attributes, schema.scopeAttribute());
        String key = null;
        if (variant == Variant.CUSTOM) {
            key = nonEmpty(attributes, schema.primaryKeyAttribute());
            if (key == null) {
                key = compositeIdSuffix(nonEmpty(attributes, schema.compositeIdAttribute()));
            }
        }
        return new PrimaryResource<>(resource.index(), resource.type(), resource.name(), variant, key, scope);
    }

    private SatelliteResource<Integer> readSatellite(StateResource resource) {
        AttributeView attributes = resource.attributeView();
        String reference = nonEmpty(attributes, schema.referenceAttribute());
        TargetReference target = reference == null
            ? new TargetReference.ImplicitDefault(nonEmpty(attributes, schema.scopeAttribute()))
            : new TargetReference.Named(null, reference);
        String mode = attributes.string(schema.modeAttribute()).filter(s -> !s.isEmpty()).orElse(schema.defaultMode());

        List<AttrValue.ObjectValue> entries = new ArrayList<>();
        if (attributes.get(schema.entryBlock()).orElse(null) instanceof AttrValue.ListValue list) {
            for (var item : list.items()) {
                if (item instanceof AttrValue.ObjectValue object) {
                    entries.add(object);
                }
            }
        }
        return new SatelliteResource<>(resource.index(), resource.name(), target, mode, entries, null);
    }

    private static String nonEmpty(AttributeView attributes, String name) {
        return attributes.string(name).filter(s -> !s.isEmpty()).orElse(null);
    }

    /**
     * {@code "account/profile"} gives {@code "profile"}; anything without a non-empty suffix gives {@code null}.
     */
    public static String compositeIdSuffix(String id) {
        if (id == null) {
            return null;
        }
        int slash = id.indexOf('/');
        return slash >= 0 && slash < id.length() - 1 ? id.substring(slash + 1) : null;
    }
}
