package work.tfmigrate.merge;

import java.util.Objects;

/**
 * A classified primary as seen by the matcher. {@code handle} points back into the representation
 * (a configuration block or a state resource index).
 *
 * @param key value named references are matched against: the local name in configuration, the concrete
 *     primary identifier in state
 * @param scope value implicit-default references are matched against, {@code null} in configuration
 */
public record PrimaryResource<H>(H handle, String kind, String name, Variant variant, String key, String scope) {
    public PrimaryResource {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(variant, "variant");
    }
}
