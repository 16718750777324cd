package work.tfmigrate.state;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Mutable Terraform state document. Edits go through resource indices and attribute names so that every
 * sibling field (version, lineage, outputs, dependencies) survives untouched.
 */
public final class StateDocument {
    private final ObjectNode root;
    private final Set<String> processedPasses = new HashSet<>();

    public StateDocument(ObjectNode root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public static StateDocument parse(String json) {
        return new StateDocument(StateJson.readObject(json));
    }

    public ObjectNode root() {
        return root;
    }

    public List<StateResource> resources() {
        List<StateResource> resources = new ArrayList<>();
        if (!(root.get("resources") instanceof ArrayNode array)) {
            return resources;
        }
        for (int i = 0; i < array.size(); i++) {
            if (array.get(i) instanceof ObjectNode node) {
                resources.add(new StateResource(i, node));
            }
        }
        return resources;
    }

    public Optional<StateResource> resource(int index) {
        if (root.get("resources") instanceof ArrayNode array && array.get(index) instanceof ObjectNode node) {
            return Optional.of(new StateResource(index, node));
        }
        return Optional.empty();
    }

    /**
     * Appends {@code items} after the elements already held by an array attribute, creating it when absent.
     */
    public void appendToAttribute(int resourceIndex, String name, ArrayNode items) {
        ObjectNode attributes = attributes(resourceIndex);
        ArrayNode merged = attributes.get(name) instanceof ArrayNode existing
            ? existing.deepCopy()
            : attributes.arrayNode();
        merged.addAll(items);
        attributes.set(name, merged);
    }

    private ObjectNode attributes(int resourceIndex) {
        return resource(resourceIndex)
            .flatMap(StateResource::attributes)
            .orElseThrow(() -> new StateFormatException("resource " + resourceIndex + " has no instance attributes"));
    }

    public void setType(int resourceIndex, String type) {
        resource(resourceIndex).ifPresent(resource -> resource.node().put("type", type));
    }

    /**
     * Removes resources by index; indices refer to positions before the removal.
     */
    public int removeResources(Collection<Integer> indices) {
        if (!(root.get("resources") instanceof ArrayNode array) || indices.isEmpty()) {
            return 0;
        }
        int removed = 0;
        for (int index : new TreeSet<>(indices).descendingSet()) {
            if (index >= 0 && index < array.size()) {
                array.remove(index);
                removed++;
            }
        }
        return removed;
    }

    public boolean markProcessed(String passId) {
        return processedPasses.add(passId);
    }

    public String render() {
        return StateJson.write(root);
    }
}
