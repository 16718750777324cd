package work.tfmigrate.merge;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.tfmigrate.hcl.Attribute;
import work.tfmigrate.hcl.Block;
import work.tfmigrate.hcl.ConfigFile;
import work.tfmigrate.value.AttrValue;

/**
 * Runs the cross-resource merge over one configuration unit: satellites are matched to primaries, their
 * entries written onto the primaries, every satellite block removed, and unresolved satellites annotated at
 * the end of the unit.
 *
 * <p>At most one pass runs per unit per invocation; a unit that already carries annotations from an earlier
 * invocation gets no new ones.
 */
public final class ConfigCrossResourceMerger {
    private static final Logger log = LoggerFactory.getLogger(ConfigCrossResourceMerger.class);

    private final MergeSchema schema;

    public ConfigCrossResourceMerger(MergeSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    public MergeSchema schema() {
        return schema;
    }

    public MergeOutcome process(ConfigFile file) {
        if (!file.markProcessed(schema.passId())) {
            return MergeOutcome.alreadyProcessed();
        }

        List<PrimaryResource<Block>> primaries = new ArrayList<>();
        List<SatelliteResource<Block>> satellites = new ArrayList<>();
        for (var block : file.resources()) {
            String kind = block.resourceKind();
            if (schema.isPrimaryKind(kind)) {
                var variant = schema.variantOf(kind, block.body().attributeView());
                primaries.add(new PrimaryResource<>(block, kind, block.resourceName(), variant, block.resourceName(), null));
            } else if (schema.satelliteKind().equals(kind)) {
                satellites.add(readSatellite(block));
            }
        }
        if (satellites.isEmpty()) {
            return new MergeOutcome(false, 0, 0, List.of());
        }

        var match = SatelliteMatcher.match(primaries, satellites);
        List<SatelliteResource<Block>> unsupported = new ArrayList<>();
        int updated = 0;
        for (var assignment : match.assignments()) {
            var merged = MergeEngine.merge(schema, assignment.satellites());
            unsupported.addAll(merged.unsupported());
            var body = assignment.primary().handle().body();
            merged.collections().forEach((attribute, entries) ->
                body.setAttributeValue(attribute, new AttrValue.ListValue(new ArrayList<AttrValue>(entries))));
            if (!merged.isEmpty()) {
                updated++;
                log.debug("Merged {} into {}.{}", merged.collections().keySet(),
                    assignment.primary().kind(), assignment.primary().name());
            }
        }

        for (var satellite : satellites) {
            file.body().removeBlock(satellite.handle());
        }

        var diagnostics = DiagnosticsReporter.collect(schema, match, unsupported);
        DiagnosticsReporter.log(file.filename(), diagnostics);
        DiagnosticsReporter.appendTo(file.body(), diagnostics);
        log.debug("{}: removed {} {} block(s), updated {} primary resource(s)",
            file.filename(), satellites.size(), schema.satelliteKind(), updated);
        return new MergeOutcome(false, updated, satellites.size(), diagnostics);
    }

    private SatelliteResource<Block> readSatellite(Block block) {
        var body = block.body();
        TargetReference target;
        Attribute reference = body.getAttribute(schema.referenceAttribute());
        if (reference == null) {
            target = new TargetReference.ImplicitDefault(null);
        } else {
            target = ReferenceResolver.resolve(reference.expression(), schema.referenceKinds())
                .<TargetReference>map(identity -> new TargetReference.Named(identity.kind(), identity.name()))
                .orElseGet(() -> new TargetReference.Unparseable(reference.expression()));
        }
        return new SatelliteResource<>(block, block.resourceName(), target, readMode(block), readEntries(block),
            block.toSource(0));
    }

    private String readMode(Block block) {
        Attribute attribute = block.body().getAttribute(schema.modeAttribute());
        if (attribute == null || attribute.value() instanceof AttrValue.NullValue) {
            return schema.defaultMode();
        }
        var value = attribute.value();
        return value.literalString().orElse(attribute.expression());
    }

    // Entries come from nested blocks; a list-of-objects attribute with the same name is accepted too.
    private List<AttrValue.ObjectValue> readEntries(Block block) {
        List<AttrValue.ObjectValue> entries = new ArrayList<>();
        for (var item : block.body().items()) {
            if (item instanceof Block nested && nested.type().equals(schema.entryBlock())) {
                entries.add(new AttrValue.ObjectValue(nested.body().attributeView().values()));
            } else if (item instanceof Attribute attribute && attribute.name().equals(schema.entryBlock())
                && attribute.value() instanceof AttrValue.ListValue list) {
                for (var element : list.items()) {
                    if (element instanceof AttrValue.ObjectValue object) {
                        entries.add(object);
                    }
                }
            }
        }
        return entries;
    }
}
