package work.tfmigrate.hcl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import work.tfmigrate.value.AttrValue;
import work.tfmigrate.value.AttributeView;

/**
 * Ordered contents of a block (or of a whole file). Every edit marks the enclosing blocks as modified.
 */
public final class Body {
    private final Block owner;
    private final int depth;
    private final List<BodyItem> items = new ArrayList<>();

    Body(Block owner, int depth) {
        this.owner = owner;
        this.depth = depth;
    }

    public int depth() {
        return depth;
    }

    public List<BodyItem> items() {
        return Collections.unmodifiableList(items);
    }

    public List<Attribute> attributes() {
        return items.stream()
            .filter(Attribute.class::isInstance)
            .map(Attribute.class::cast)
            .collect(Collectors.toList());
    }

    public Attribute getAttribute(String name) {
        for (var item : items) {
            if (item instanceof Attribute attribute && attribute.name().equals(name)) {
                return attribute;
            }
        }
        return null;
    }

    public boolean hasAttribute(String name) {
        return getAttribute(name) != null;
    }

    public AttributeView attributeView() {
        var values = new LinkedHashMap<String, AttrValue>();
        for (var attribute : attributes()) {
            values.put(attribute.name(), attribute.value());
        }
        return AttributeView.of(values);
    }

    public List<Block> blocks() {
        return items.stream()
            .filter(Block.class::isInstance)
            .map(Block.class::cast)
            .collect(Collectors.toList());
    }

    public List<Block> blocks(String type) {
        return blocks().stream().filter(block -> block.type().equals(type)).collect(Collectors.toList());
    }

    /**
     * Sets {@code name} to the given raw expression, replacing an existing attribute in place or
     * appending a new one after the last non-blank item.
     */
    public void setAttributeRaw(String name, String expression) {
        Objects.requireNonNull(expression, "expression");
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) instanceof Attribute existing && existing.name().equals(name)) {
                if (existing.expression().equals(expression)) {
                    return;
                }
                items.set(i, new Attribute(name, expression, existing.trailingComment()));
                markModified();
                return;
            }
        }
        int insertAt = items.size();
        while (insertAt > 0 && items.get(insertAt - 1) instanceof Unstructured u && u.isBlankLine()) {
            insertAt--;
        }
        items.add(insertAt, new Attribute(name, expression, null));
        markModified();
    }

    public void setAttributeValue(String name, AttrValue value) {
        setAttributeRaw(name, Literals.encode(value, depth));
    }

    /**
     * Adds the attribute only when it is not declared yet.
     */
    public boolean ensureAttribute(String name, AttrValue value) {
        if (hasAttribute(name)) {
            return false;
        }
        setAttributeValue(name, value);
        return true;
    }

    public boolean removeAttribute(String name) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) instanceof Attribute attribute && attribute.name().equals(name)) {
                removeAt(i);
                markModified();
                return true;
            }
        }
        return false;
    }

    public int removeAttributes(String... names) {
        int removed = 0;
        for (var name : names) {
            if (removeAttribute(name)) {
                removed++;
            }
        }
        return removed;
    }

    public boolean removeBlock(Block block) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == block) {
                removeAt(i);
                block.attach(null);
                markModified();
                return true;
            }
        }
        return false;
    }

    public void appendUnstructured(String text) {
        items.add(new Unstructured(text));
        markModified();
    }

    /**
     * True when any verbatim text in this body contains {@code marker}.
     */
    public boolean containsUnstructured(String marker) {
        for (var item : items) {
            if (item instanceof Unstructured u && u.text().contains(marker)) {
                return true;
            }
            if (item instanceof Block block && block.body().containsUnstructured(marker)) {
                return true;
            }
        }
        return false;
    }

    void addParsed(BodyItem item) {
        if (item instanceof Block block) {
            block.attach(this);
        }
        items.add(item);
    }

    void markModified() {
        if (owner != null) {
            owner.markModified();
        }
    }

    // Drops one neighbouring blank line so removals do not leave double gaps.
    private void removeAt(int index) {
        items.remove(index);
        boolean blankBefore = index == 0 || isBlank(index - 1);
        if (index < items.size() && blankBefore && isBlank(index)) {
            items.remove(index);
        } else if (index == items.size() && index > 0 && isBlank(index - 1)) {
            items.remove(index - 1);
        }
    }

    private boolean isBlank(int index) {
        return items.get(index) instanceof Unstructured u && u.isBlankLine();
    }
}
