package work.tfmigrate.merge;

import java.util.Objects;

/**
 * Kind and local name of a resource declaration, e.g. {@code cloudflare_split_tunnel.office}.
 */
public record ResourceIdentity(String kind, String name) {
    public ResourceIdentity {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
        return kind + "." + name;
    }
}
