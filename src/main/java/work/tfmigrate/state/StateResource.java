package work.tfmigrate.state;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.tfmigrate.value.AttributeView;

/**
 * One entry of the state's {@code resources} array, addressed by its position.
 */
public record StateResource(int index, ObjectNode node) {
    public String type() {
        return node.path("type").asText("");
    }

    public String name() {
        return node.path("name").asText("");
    }

    public String mode() {
        return node.path("mode").asText("managed");
    }

    public boolean isManaged() {
        return !"data".equals(mode());
    }

    public List<ObjectNode> instances() {
        List<ObjectNode> instances = new ArrayList<>();
        if (node.get("instances") instanceof ArrayNode array) {
            for (var instance : array) {
                if (instance instanceof ObjectNode object) {
                    instances.add(object);
                }
            }
        }
        return instances;
    }

    /**
     * Attributes of the first instance, the only one the migration engine reads or writes.
     */
    public Optional<ObjectNode> attributes() {
        var instances = instances();
        if (instances.isEmpty() || !(instances.get(0).get("attributes") instanceof ObjectNode attributes)) {
            return Optional.empty();
        }
        return Optional.of(attributes);
    }

    public AttributeView attributeView() {
        return StateValues.view(attributes().orElse(null));
    }
}
