package work.tfmigrate.hcl;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import work.tfmigrate.value.AttrValue;

/**
 * Converts between raw HCL expression text and {@link AttrValue}.
 *
 * <p>Decoding is purely syntactic: only literal strings (without template sequences), numbers, booleans,
 * {@code null}, and list/object constructors are decoded; everything else becomes an
 * {@link AttrValue.ExpressionValue}.
 */
public final class Literals {
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

    private Literals() {}

    public static AttrValue decode(String expression) {
        String text = expression == null ? "" : expression.strip();
        if ("true".equals(text) || "false".equals(text)) {
            return AttrValue.bool(Boolean.parseBoolean(text));
        }
        if ("null".equals(text)) {
            return AttrValue.nullValue();
        }
        if (NUMBER.matcher(text).matches()) {
            return AttrValue.number(new BigDecimal(text));
        }
        try {
            if (text.startsWith("\"")) {
                int end = new ExpressionScanner(text).scanString(1);
                if (end == text.length() && !hasTemplateSequence(text)) {
                    return AttrValue.string(unquote(text));
                }
            } else if (text.startsWith("[") && closesAtEnd(text)) {
                return decodeList(text);
            } else if (text.startsWith("{") && closesAtEnd(text)) {
                return decodeObject(text);
            }
        } catch (ConfigSyntaxException ex) {
            // malformed literal: keep the text as an opaque expression
            return AttrValue.expression(text);
        }
        return AttrValue.expression(text);
    }

    public static String encode(AttrValue value, int level) {
        if (value instanceof AttrValue.StringValue s) {
            return quote(s.value());
        }
        if (value instanceof AttrValue.NumberValue n) {
            return formatNumber(n.value());
        }
        if (value instanceof AttrValue.BoolValue b) {
            return Boolean.toString(b.value());
        }
        if (value instanceof AttrValue.ExpressionValue e) {
            return e.raw();
        }
        if (value instanceof AttrValue.NullValue) {
            return "null";
        }
        if (value instanceof AttrValue.ListValue list) {
            return encodeList(list, level);
        }
        return encodeObject((AttrValue.ObjectValue) value, level);
    }

    public static String quote(String value) {
        var out = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '$', '%' -> {
                    out.append(c);
                    if (i + 1 < value.length() && value.charAt(i + 1) == '{') {
                        out.append(c);
                    }
                }
                default -> out.append(c);
            }
        }
        return out.append('"').toString();
    }

    public static String unquote(String raw) {
        String body = raw.length() >= 2 && raw.startsWith("\"") && raw.endsWith("\"")
            ? raw.substring(1, raw.length() - 1)
            : raw;
        var out = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(++i);
                switch (next) {
                    case 'n' -> out.append('\n');
                    case 'r' -> out.append('\r');
                    case 't' -> out.append('\t');
                    case 'u' -> {
                        if (i + 4 < body.length()) {
                            out.append((char) Integer.parseInt(body.substring(i + 1, i + 5), 16));
                            i += 4;
                        } else {
                            out.append("\\u");
                        }
                    }
                    default -> out.append(next);
                }
            } else if ((c == '$' || c == '%') && body.startsWith(c + "" + c + "{", i)) {
                out.append(c);
                i++;
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    static String formatNumber(BigDecimal value) {
        var stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            return stripped.toBigIntegerExact().toString();
        }
        return stripped.toPlainString();
    }

    private static boolean hasTemplateSequence(String quoted) {
        for (int i = 1; i < quoted.length() - 1; i++) {
            char c = quoted.charAt(i);
            if (c == '\\') {
                i++;
                continue;
            }
            if ((c == '$' || c == '%') && quoted.charAt(i + 1) == '{') {
                if (quoted.charAt(i - 1) == c) {
                    continue;
                }
                return true;
            }
        }
        return false;
    }

    private static boolean closesAtEnd(String text) {
        int end = new ExpressionScanner(text).scan(1, ExpressionScanner.Stop.TEMPLATE);
        return end == text.length() - 1;
    }

    private static AttrValue decodeList(String text) {
        String inner = text.substring(1, text.length() - 1);
        if (inner.strip().startsWith("for ")) {
            return AttrValue.expression(text);
        }
        var scanner = new ExpressionScanner(inner);
        List<AttrValue> items = new ArrayList<>();
        int i = skipSeparators(inner, 0, scanner);
        while (i < inner.length()) {
            int end = scanner.scan(i, ExpressionScanner.Stop.ELEMENT);
            if (end == i) {
                return AttrValue.expression(text);
            }
            items.add(decode(inner.substring(i, end)));
            i = skipSeparators(inner, end, scanner);
        }
        return new AttrValue.ListValue(items);
    }

    private static AttrValue decodeObject(String text) {
        String inner = text.substring(1, text.length() - 1);
        if (inner.strip().startsWith("for ")) {
            return AttrValue.expression(text);
        }
        var scanner = new ExpressionScanner(inner);
        Map<String, AttrValue> fields = new LinkedHashMap<>();
        int i = skipSeparators(inner, 0, scanner);
        while (i < inner.length()) {
            String key;
            char c = inner.charAt(i);
            if (c == '"') {
                int end = scanner.scanString(i + 1);
                key = unquote(inner.substring(i, end));
                i = end;
            } else if (ExpressionScanner.isIdentifierStart(c)) {
                int start = i;
                while (i < inner.length() && ExpressionScanner.isIdentifierPart(inner.charAt(i))) {
                    i++;
                }
                key = inner.substring(start, i);
            } else {
                return AttrValue.expression(text);
            }
            while (i < inner.length() && (inner.charAt(i) == ' ' || inner.charAt(i) == '\t')) {
                i++;
            }
            if (i >= inner.length() || (inner.charAt(i) != '=' && inner.charAt(i) != ':')) {
                return AttrValue.expression(text);
            }
            i++;
            int end = scanner.scan(i, ExpressionScanner.Stop.MEMBER);
            String member = inner.substring(i, end).strip();
            if (member.isEmpty()) {
                return AttrValue.expression(text);
            }
            fields.put(key, decode(member));
            i = skipSeparators(inner, end, scanner);
        }
        return new AttrValue.ObjectValue(fields);
    }

    private static int skipSeparators(String text, int from, ExpressionScanner scanner) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || c == ',') {
                i++;
            } else if (c == '#' || text.startsWith("//", i)) {
                i = scanner.lineEnd(i);
            } else if (text.startsWith("/*", i)) {
                int end = text.indexOf("*/", i + 2);
                i = end < 0 ? text.length() : end + 2;
            } else {
                break;
            }
        }
        return i;
    }

    private static String encodeList(AttrValue.ListValue list, int level) {
        if (list.items().isEmpty()) {
            return "[]";
        }
        boolean allObjects = list.items().stream().allMatch(AttrValue.ObjectValue.class::isInstance);
        var out = new StringBuilder("[");
        if (allObjects) {
            for (int i = 0; i < list.items().size(); i++) {
                if (i > 0) {
                    out.append(", ");
                }
                out.append(encodeObject((AttrValue.ObjectValue) list.items().get(i), level));
            }
            return out.append(']').toString();
        }
        boolean scalar = list.items().stream()
            .noneMatch(item -> item instanceof AttrValue.ListValue || item instanceof AttrValue.ObjectValue);
        if (scalar) {
            for (int i = 0; i < list.items().size(); i++) {
                if (i > 0) {
                    out.append(", ");
                }
                out.append(encode(list.items().get(i), level));
            }
            return out.append(']').toString();
        }
        out.append('\n');
        for (var item : list.items()) {
            out.append(ConfigWriter.indent(level + 1)).append(encode(item, level + 1)).append(",\n");
        }
        return out.append(ConfigWriter.indent(level)).append(']').toString();
    }

    private static String encodeObject(AttrValue.ObjectValue object, int level) {
        if (object.fields().isEmpty()) {
            return "{}";
        }
        int width = 0;
        for (var key : object.fields().keySet()) {
            width = Math.max(width, objectKey(key).length());
        }
        var out = new StringBuilder("{\n");
        for (var entry : object.fields().entrySet()) {
            String key = objectKey(entry.getKey());
            out.append(ConfigWriter.indent(level + 1))
                .append(key)
                .append(" ".repeat(width - key.length()))
                .append(" = ")
                .append(encode(entry.getValue(), level + 1))
                .append('\n');
        }
        return out.append(ConfigWriter.indent(level)).append('}').toString();
    }

    private static String objectKey(String key) {
        return ExpressionScanner.isIdentifier(key) ? key : quote(key);
    }
}
