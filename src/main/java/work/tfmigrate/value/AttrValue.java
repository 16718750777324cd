package work.tfmigrate.value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Closed value model shared by the configuration tree and the state tree.
 *
 * <p>Literal values decode into the concrete variants; anything the migrator cannot evaluate
 * statically (references, function calls, templates) stays an {@link ExpressionValue} holding its raw
 * source text. HCL {@code null} and JSON {@code null} both decode to {@link NullValue}: the attribute is
 * present but carries no data.
 */
public sealed interface AttrValue
    permits AttrValue.StringValue,
        AttrValue.NumberValue,
        AttrValue.BoolValue,
        AttrValue.ListValue,
        AttrValue.ObjectValue,
        AttrValue.NullValue,
        AttrValue.ExpressionValue {

    static StringValue string(String value) {
        return new StringValue(value);
    }

    static NumberValue number(BigDecimal value) {
        return new NumberValue(value);
    }

    static NumberValue number(long value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    static BoolValue bool(boolean value) {
        return new BoolValue(value);
    }

    static NullValue nullValue() {
        return NullValue.INSTANCE;
    }

    static ExpressionValue expression(String raw) {
        return new ExpressionValue(raw);
    }

    /**
     * Literal string content, if this is a string literal.
     */
    default Optional<String> literalString() {
        return this instanceof StringValue s ? Optional.of(s.value()) : Optional.empty();
    }

    /**
     * True when the value carries no usable data: {@code null}, an empty string literal, an empty list or
     * object. Expressions are never empty because their runtime value is unknown.
     */
    default boolean isEmpty() {
        if (this instanceof NullValue) {
            return true;
        }
        if (this instanceof StringValue s) {
            return s.value().isEmpty();
        }
        if (this instanceof ListValue l) {
            return l.items().isEmpty();
        }
        if (this instanceof ObjectValue o) {
            return o.fields().isEmpty();
        }
        if (this instanceof ExpressionValue e) {
            return e.raw().isBlank();
        }
        return false;
    }

    record StringValue(String value) implements AttrValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record NumberValue(BigDecimal value) implements AttrValue {
        public NumberValue {
            Objects.requireNonNull(value, "value");
        }

        public boolean isIntegral() {
            return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
        }
    }

    record BoolValue(boolean value) implements AttrValue {}

    record ListValue(List<AttrValue> items) implements AttrValue {
        public ListValue {
            items = Collections.unmodifiableList(new ArrayList<>(items));
        }
    }

    record ObjectValue(Map<String, AttrValue> fields) implements AttrValue {
        public ObjectValue {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        public Optional<AttrValue> get(String key) {
            return Optional.ofNullable(fields.get(key));
        }
    }

    record NullValue() implements AttrValue {
        static final NullValue INSTANCE = new NullValue();
    }

    record ExpressionValue(String raw) implements AttrValue {
        public ExpressionValue {
            Objects.requireNonNull(raw, "raw");
        }
    }
}
