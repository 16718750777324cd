package work.tfmigrate.hcl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.tfmigrate.value.AttrValue;

class LiteralsTest {

    @Test
    void decodesScalars() {
        assertEquals(AttrValue.string("10.0.0.0/8"), Literals.decode("\"10.0.0.0/8\""));
        assertEquals(AttrValue.number(10), Literals.decode("10"));
        assertEquals(new BigDecimal("1.5"), ((AttrValue.NumberValue) Literals.decode("1.5")).value());
        assertEquals(AttrValue.bool(true), Literals.decode("true"));
        assertEquals(AttrValue.string("line\n\"quoted\""), Literals.decode("\"line\\n\\\"quoted\\\"\""));
    }

    @Test
    void nullIsPresentButEmpty() {
        var value = Literals.decode(" null ");

        assertEquals(AttrValue.nullValue(), value);
        assertTrue(value.isEmpty());
        assertEquals("null", Literals.encode(value, 0));
    }

    @Test
    void escapedTemplateIsLiteral() {
        assertEquals(AttrValue.string("${not_interpolated}"), Literals.decode("\"$${not_interpolated}\""));
    }

    @Test
    void keepsNonLiteralsAsExpressions() {
        for (String raw : List.of("var.mode", "\"${var.prefix}-office\"", "nullable", "upper(\"x\")",
            "[for t in var.tunnels : t.address]", "local.enabled ? \"include\" : \"exclude\"")) {
            assertEquals(AttrValue.expression(raw), Literals.decode(raw), raw);
        }
    }

    @Test
    void decodesListOfObjects() {
        var value = Literals.decode("""
            [
              {
                address     = "10.0.0.0/8" # office
                description = "office"
              },
              { host = "example.com", description = var.note },
            ]""");

        var list = assertInstanceOf(AttrValue.ListValue.class, value);
        assertEquals(2, list.items().size());
        var first = (AttrValue.ObjectValue) list.items().get(0);
        assertEquals(AttrValue.string("10.0.0.0/8"), first.get("address").orElseThrow());
        var second = (AttrValue.ObjectValue) list.items().get(1);
        assertEquals(AttrValue.expression("var.note"), second.get("description").orElseThrow());
    }

    @Test
    void encodesObjectListAlignedAtDepth() {
        Map<String, AttrValue> fields = new LinkedHashMap<>();
        fields.put("address", AttrValue.string("10.0.0.0/8"));
        fields.put("description", AttrValue.string("office"));
        var value = new AttrValue.ListValue(List.of(new AttrValue.ObjectValue(fields),
            new AttrValue.ObjectValue(Map.of("host", AttrValue.string("example.com")))));

        assertEquals("""
            [{
                address     = "10.0.0.0/8"
                description = "office"
              }, {
                host = "example.com"
              }]""", Literals.encode(value, 1));
    }

    @Test
    void encodesScalarsAndEscapes() {
        assertEquals("\"a \\\"b\\\" $${c}\"", Literals.encode(AttrValue.string("a \"b\" ${c}"), 0));
        assertEquals("920", Literals.encode(AttrValue.number(new BigDecimal("920.0")), 0));
        assertEquals("0.5", Literals.encode(AttrValue.number(new BigDecimal("0.50")), 0));
        assertEquals("[\"a\", 1, false]",
            Literals.encode(new AttrValue.ListValue(List.of(AttrValue.string("a"), AttrValue.number(1),
                AttrValue.bool(false))), 0));
        assertEquals("var.x", Literals.encode(AttrValue.expression("var.x"), 0));
    }

    @Test
    void encodedValueDecodesToSameValue() {
        var value = new AttrValue.ObjectValue(Map.of("mode", AttrValue.string("proxy"), "port", AttrValue.number(8080)));

        assertEquals(value, Literals.decode(Literals.encode(value, 1)));
    }
}
