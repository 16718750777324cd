package work.tfmigrate.hcl;

import java.util.List;

/**
 * Serialises a configuration tree. Unedited blocks are emitted from their original text; edited ones are
 * re-rendered with two-space indentation and aligned equals signs.
 */
final class ConfigWriter {
    private ConfigWriter() {}

    static String write(Body root) {
        var out = new StringBuilder();
        writeItems(out, root.items(), root.depth());
        return out.toString();
    }

    static void writeBlock(StringBuilder out, Block block, int level) {
        if (!block.isModified() && block.originalText() != null) {
            out.append(block.originalText());
        } else {
            out.append(block.type());
            for (var label : block.labels()) {
                out.append(' ').append(Literals.quote(label));
            }
            var items = block.body().items();
            if (items.isEmpty()) {
                out.append(" {}");
            } else {
                out.append(" {\n");
                writeItems(out, items, level + 1);
                out.append(indent(level)).append('}');
            }
        }
        if (block.trailingComment() != null) {
            out.append(' ').append(block.trailingComment());
        }
    }

    private static void writeItems(StringBuilder out, List<BodyItem> items, int level) {
        int index = 0;
        while (index < items.size()) {
            var item = items.get(index);
            if (item instanceof Unstructured unstructured) {
                out.append(unstructured.text());
                index++;
            } else if (item instanceof Block block) {
                out.append(indent(level));
                writeBlock(out, block, level);
                boolean last = index == items.size() - 1;
                String lineEnd = block.lineEnd();
                out.append(lineEnd.endsWith("\n") || (last && level == 0) ? lineEnd : "\n");
                index++;
            } else {
                int runEnd = index;
                int width = 0;
                while (runEnd < items.size() && items.get(runEnd) instanceof Attribute attribute) {
                    width = Math.max(width, attribute.name().length());
                    runEnd++;
                }
                for (int i = index; i < runEnd; i++) {
                    writeAttribute(out, (Attribute) items.get(i), level, width);
                }
                index = runEnd;
            }
        }
    }

    private static void writeAttribute(StringBuilder out, Attribute attribute, int level, int width) {
        out.append(indent(level)).append(attribute.name());
        out.append(" ".repeat(width - attribute.name().length()));
        out.append(" = ").append(attribute.expression());
        if (attribute.trailingComment() != null) {
            out.append(' ').append(attribute.trailingComment());
        }
        out.append('\n');
    }

    static String indent(int level) {
        return "  ".repeat(Math.max(0, level));
    }
}
