package work.tfmigrate.merge;

import java.util.List;
import java.util.Objects;
import work.tfmigrate.value.AttrValue;

/**
 * A satellite with its target, mode and raw entries extracted.
 *
 * @param source original declaration text for diagnostics, {@code null} when unavailable
 */
public record SatelliteResource<H>(
    H handle,
    String name,
    TargetReference target,
    String mode,
    List<AttrValue.ObjectValue> entries,
    String source
) {
    public SatelliteResource {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(mode, "mode");
        entries = List.copyOf(entries);
    }
}
