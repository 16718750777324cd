package work.tfmigrate.merge;

import java.util.Objects;
import work.tfmigrate.value.AttributeView;

/**
 * Decides which successor variant a legacy primary becomes.
 *
 * <p>An explicit {@code defaultFlag = true} always wins. Otherwise the resource is {@link Variant#CUSTOM}
 * only when both routing attributes are present; everything else falls back to {@link Variant#DEFAULT}.
 * The attribute values themselves are never inspected beyond presence.
 */
public record VariantClassifier(String defaultFlag, String matchAttribute, String precedenceAttribute) {
    public VariantClassifier {
        Objects.requireNonNull(defaultFlag, "defaultFlag");
        Objects.requireNonNull(matchAttribute, "matchAttribute");
        Objects.requireNonNull(precedenceAttribute, "precedenceAttribute");
    }

    public Variant classify(AttributeView attributes) {
        if (attributes.isTrue(defaultFlag)) {
            return Variant.DEFAULT;
        }
        if (attributes.has(matchAttribute) && attributes.has(precedenceAttribute)) {
            return Variant.CUSTOM;
        }
        return Variant.DEFAULT;
    }
}
