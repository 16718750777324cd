package work.tfmigrate.hcl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A labelled block such as {@code resource "kind" "name" { ... }}.
 *
 * <p>Blocks read from source remember their original text and are written back unchanged until
 * something in them is edited.
 */
public final class Block implements BodyItem {
    private String type;
    private final List<String> labels;
    private final Body body;
    private String originalText;
    private String trailingComment;
    private String lineEnd = "\n";
    private boolean modified;
    private Body parent;

    Block(String type, List<String> labels, int bodyDepth, String originalText, String trailingComment) {
        this.type = Objects.requireNonNull(type, "type");
        this.labels = new ArrayList<>(labels == null ? List.of() : labels);
        this.body = new Body(this, bodyDepth);
        this.originalText = originalText;
        this.trailingComment = trailingComment;
        this.modified = originalText == null;
    }

    public String type() {
        return type;
    }

    public List<String> labels() {
        return Collections.unmodifiableList(labels);
    }

    public String label(int index) {
        return index < labels.size() ? labels.get(index) : null;
    }

    public Body body() {
        return body;
    }

    public String trailingComment() {
        return trailingComment;
    }

    /**
     * True for {@code resource "<kind>" "<name>"} declarations.
     */
    public boolean isResource() {
        return "resource".equals(type) && labels.size() >= 2;
    }

    public String resourceKind() {
        return isResource() ? labels.get(0) : null;
    }

    public String resourceName() {
        return isResource() ? labels.get(1) : null;
    }

    public void setType(String newType) {
        if (!type.equals(newType)) {
            type = Objects.requireNonNull(newType, "newType");
            markModified();
        }
    }

    public void setLabel(int index, String value) {
        Objects.requireNonNull(value, "value");
        if (!value.equals(labels.get(index))) {
            labels.set(index, value);
            markModified();
        }
    }

    public boolean isModified() {
        return modified;
    }

    public boolean isAttached() {
        return parent != null;
    }

    public Body parent() {
        return parent;
    }

    void attach(Body newParent) {
        this.parent = newParent;
    }

    void captureSource(String text, String comment, String lineEnd) {
        this.originalText = text;
        this.trailingComment = comment;
        this.lineEnd = lineEnd;
        this.modified = false;
    }

    // Line break that followed the block in source: "\n", "\r\n", or empty at the end of input.
    String lineEnd() {
        return lineEnd;
    }

    String originalText() {
        return originalText;
    }

    void markModified() {
        modified = true;
        if (parent != null) {
            parent.markModified();
        }
    }

    /**
     * Source form of this block alone, as it would be written at the given indentation level.
     */
    public String toSource(int indentLevel) {
        var out = new StringBuilder();
        ConfigWriter.writeBlock(out, this, indentLevel);
        return out.toString();
    }
}
