package work.tfmigrate.state;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;

/**
 * Shared Jackson setup for reading and writing Terraform state documents.
 */
public final class StateJson {
    static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectWriter WRITER = MAPPER.writer(new StatePrettyPrinter());

    private StateJson() {}

    public static ObjectNode readObject(String json) {
        if (json == null || json.isBlank()) {
            throw new StateFormatException("state content is empty");
        }
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || !node.isObject()) {
                throw new StateFormatException("state document must be a JSON object");
            }
            return (ObjectNode) node;
        } catch (JsonProcessingException ex) {
            throw new StateFormatException("invalid JSON in state file: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * Writes with two-space indentation and {@code "key": value} separators, the layout Terraform itself uses.
     */
    public static String write(JsonNode node) {
        try {
            return WRITER.writeValueAsString(node) + "\n";
        } catch (JsonProcessingException ex) {
            throw new StateFormatException("unable to serialize state: " + ex.getOriginalMessage(), ex);
        }
    }

    // Empty arrays and objects stay "[]" and "{}" instead of Jackson's "[ ]" and "{ }".
    private static final class StatePrettyPrinter extends DefaultPrettyPrinter {
        StatePrettyPrinter() {
            super(Separators.createDefaultInstance().withObjectFieldValueSpacing(Separators.Spacing.AFTER));
            var indenter = new DefaultIndenter("  ", "\n");
            indentObjectsWith(indenter);
            indentArraysWith(indenter);
        }

        private StatePrettyPrinter(StatePrettyPrinter base) {
            super(base);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new StatePrettyPrinter(this);
        }

        @Override
        public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
            if (!_objectIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfEntries > 0) {
                _objectIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw('}');
        }

        @Override
        public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
            if (!_arrayIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfValues > 0) {
                _arrayIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw(']');
        }
    }
}
