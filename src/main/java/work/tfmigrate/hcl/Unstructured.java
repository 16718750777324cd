package work.tfmigrate.hcl;

import java.util.Objects;

/**
 * Source text written back exactly as it was read, including its line break.
 */
public record Unstructured(String text) implements BodyItem {
    public Unstructured {
        Objects.requireNonNull(text, "text");
    }

    public boolean isBlankLine() {
        return text.isBlank();
    }
}
