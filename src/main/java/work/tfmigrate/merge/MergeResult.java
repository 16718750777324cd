package work.tfmigrate.merge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.tfmigrate.value.AttrValue;

/**
 * Entries to write on one primary, keyed by collection attribute in write order. Only non-empty
 * collections are present.
 *
 * @param unsupported satellites whose mode has no collection; their entries were not merged
 */
public record MergeResult<H>(
    Map<String, List<AttrValue.ObjectValue>> collections,
    List<SatelliteResource<H>> unsupported
) {
    public MergeResult {
        var copy = new LinkedHashMap<String, List<AttrValue.ObjectValue>>();
        collections.forEach((name, entries) -> copy.put(name, List.copyOf(entries)));
        collections = Collections.unmodifiableMap(copy);
        unsupported = List.copyOf(unsupported);
    }

    public boolean isEmpty() {
        return collections.isEmpty();
    }
}
