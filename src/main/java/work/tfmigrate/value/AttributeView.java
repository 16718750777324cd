package work.tfmigrate.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Flat, read-only view over a resource's top-level attributes, independent of where they came from.
 */
public record AttributeView(Map<String, AttrValue> values) {
    public AttributeView {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static AttributeView of(Map<String, AttrValue> values) {
        return new AttributeView(values);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Optional<AttrValue> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean isTrue(String name) {
        return values.get(name) instanceof AttrValue.BoolValue b && b.value();
    }

    public Optional<String> string(String name) {
        return get(name).flatMap(AttrValue::literalString);
    }
}
