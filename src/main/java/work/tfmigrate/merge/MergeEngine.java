package work.tfmigrate.merge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.tfmigrate.value.AttrValue;

/**
 * Folds the entries of the satellites assigned to one primary into per-mode collections.
 *
 * <p>Entries keep satellite order, then entry order within a satellite. Only the schema's entry fields are
 * carried, empty values are dropped, and an entry without any key field is skipped.
 */
public final class MergeEngine {
    private MergeEngine() {}

    public static <H> MergeResult<H> merge(MergeSchema schema, List<SatelliteResource<H>> satellites) {
        Map<String, List<AttrValue.ObjectValue>> byMode = new LinkedHashMap<>();
        List<SatelliteResource<H>> unsupported = new ArrayList<>();
        for (var satellite : satellites) {
            if (schema.collectionFor(satellite.mode()).isEmpty()) {
                unsupported.add(satellite);
                continue;
            }
            for (var entry : satellite.entries()) {
                normalize(schema, entry).ifPresent(normalized ->
                    byMode.computeIfAbsent(satellite.mode(), mode -> new ArrayList<>()).add(normalized));
            }
        }

        Map<String, List<AttrValue.ObjectValue>> collections = new LinkedHashMap<>();
        schema.collections().forEach((mode, attribute) -> {
            var entries = byMode.get(mode);
            if (entries != null && !entries.isEmpty()) {
                collections.put(attribute, entries);
            }
        });
        return new MergeResult<>(collections, unsupported);
    }

    static Optional<AttrValue.ObjectValue> normalize(MergeSchema schema, AttrValue.ObjectValue entry) {
        Map<String, AttrValue> fields = new LinkedHashMap<>();
        for (String field : schema.entryFields()) {
            entry.get(field).filter(value -> !value.isEmpty()).ifPresent(value -> fields.put(field, value));
        }
        boolean keyed = schema.keyFields().stream().anyMatch(fields::containsKey);
        return keyed ? Optional.of(new AttrValue.ObjectValue(fields)) : Optional.empty();
    }
}
