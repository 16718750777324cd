package work.tfmigrate.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.tfmigrate.value.AttrValue;
import work.tfmigrate.value.AttributeView;

/**
 * Converts between Jackson nodes and {@link AttrValue}. JSON {@code null} becomes {@link AttrValue.NullValue},
 * so a {@code null} attribute is present, as {@code null} is in configuration.
 */
public final class StateValues {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private StateValues() {}

    public static AttributeView view(ObjectNode attributes) {
        var values = new LinkedHashMap<String, AttrValue>();
        if (attributes != null) {
            var fields = attributes.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                if (!entry.getValue().isMissingNode()) {
                    values.put(entry.getKey(), fromJson(entry.getValue()));
                }
            }
        }
        return AttributeView.of(values);
    }

    public static AttrValue fromJson(JsonNode node) {
        if (node.isNull()) {
            return AttrValue.nullValue();
        }
        if (node.isTextual()) {
            return AttrValue.string(node.textValue());
        }
        if (node.isBoolean()) {
            return AttrValue.bool(node.booleanValue());
        }
        if (node.isNumber()) {
            return AttrValue.number(node.decimalValue());
        }
        if (node.isArray()) {
            List<AttrValue> items = new ArrayList<>();
            for (var item : node) {
                items.add(fromJson(item));
            }
            return new AttrValue.ListValue(items);
        }
        if (node.isObject()) {
            Map<String, AttrValue> fields = new LinkedHashMap<>();
            var iterator = node.fields();
            while (iterator.hasNext()) {
                var entry = iterator.next();
                fields.put(entry.getKey(), fromJson(entry.getValue()));
            }
            return new AttrValue.ObjectValue(fields);
        }
        return AttrValue.expression(node.toString());
    }

    public static JsonNode toJson(AttrValue value) {
        if (value instanceof AttrValue.StringValue s) {
            return NODES.textNode(s.value());
        }
        if (value instanceof AttrValue.NumberValue n) {
            if (n.isIntegral()) {
                BigInteger integral = n.value().toBigIntegerExact();
                return integral.bitLength() < Long.SIZE
                    ? NODES.numberNode(integral.longValue())
                    : NODES.numberNode(integral);
            }
            return NODES.numberNode(n.value().doubleValue());
        }
        if (value instanceof AttrValue.BoolValue b) {
            return NODES.booleanNode(b.value());
        }
        if (value instanceof AttrValue.NullValue) {
            return NODES.nullNode();
        }
        if (value instanceof AttrValue.ListValue list) {
            ArrayNode array = NODES.arrayNode();
            for (var item : list.items()) {
                array.add(toJson(item));
            }
            return array;
        }
        if (value instanceof AttrValue.ObjectValue object) {
            ObjectNode result = NODES.objectNode();
            object.fields().forEach((key, field) -> result.set(key, toJson(field)));
            return result;
        }
        return NODES.textNode(((AttrValue.ExpressionValue) value).raw());
    }
}
