package work.tfmigrate.merge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.tfmigrate.value.AttributeView;

/**
 * Names the resource kinds and attributes one cross-resource merge works with. The merge components read
 * every kind and attribute name from here.
 *
 * @param legacyPrimaryKinds kinds of the unified primary before the split, preferred first
 * @param collections satellite mode to primary collection attribute, in the order collections are written
 */
public record MergeSchema(
    List<String> legacyPrimaryKinds,
    String defaultKind,
    String customKind,
    String satelliteKind,
    VariantClassifier classifier,
    String referenceAttribute,
    List<String> referenceKinds,
    String modeAttribute,
    String defaultMode,
    String entryBlock,
    List<String> entryFields,
    List<String> keyFields,
    Map<String, String> collections,
    String scopeAttribute,
    String primaryKeyAttribute,
    String compositeIdAttribute,
    String satelliteLabel
) {
    public MergeSchema {
        legacyPrimaryKinds = List.copyOf(legacyPrimaryKinds);
        Objects.requireNonNull(defaultKind, "defaultKind");
        Objects.requireNonNull(customKind, "customKind");
        Objects.requireNonNull(satelliteKind, "satelliteKind");
        Objects.requireNonNull(classifier, "classifier");
        Objects.requireNonNull(referenceAttribute, "referenceAttribute");
        referenceKinds = List.copyOf(referenceKinds);
        Objects.requireNonNull(modeAttribute, "modeAttribute");
        Objects.requireNonNull(defaultMode, "defaultMode");
        Objects.requireNonNull(entryBlock, "entryBlock");
        entryFields = List.copyOf(entryFields);
        keyFields = List.copyOf(keyFields);
        if (keyFields.isEmpty()) {
            throw new IllegalArgumentException("at least one key field is required");
        }
        collections = Collections.unmodifiableMap(new LinkedHashMap<>(collections));
        Objects.requireNonNull(scopeAttribute, "scopeAttribute");
        Objects.requireNonNull(primaryKeyAttribute, "primaryKeyAttribute");
        Objects.requireNonNull(compositeIdAttribute, "compositeIdAttribute");
        satelliteLabel = satelliteLabel == null ? satelliteKind : satelliteLabel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Identifier used for the per-unit processed flag.
     */
    public String passId() {
        return "merge:" + satelliteKind;
    }

    public boolean isLegacyKind(String kind) {
        return legacyPrimaryKinds.contains(kind);
    }

    public boolean isPrimaryKind(String kind) {
        return isLegacyKind(kind) || defaultKind.equals(kind) || customKind.equals(kind);
    }

    /**
     * Variant of a primary: successor kinds are already classified, legacy kinds go through the classifier.
     */
    public Variant variantOf(String kind, AttributeView attributes) {
        if (defaultKind.equals(kind)) {
            return Variant.DEFAULT;
        }
        if (customKind.equals(kind)) {
            return Variant.CUSTOM;
        }
        return classifier.classify(attributes);
    }

    public String kindFor(Variant variant) {
        return variant == Variant.CUSTOM ? customKind : defaultKind;
    }

    public Optional<String> collectionFor(String mode) {
        return Optional.ofNullable(collections.get(mode));
    }

    public static final class Builder {
        private final List<String> legacyPrimaryKinds = new ArrayList<>();
        private String defaultKind;
        private String customKind;
        private String satelliteKind;
        private VariantClassifier classifier;
        private String referenceAttribute;
        private final List<String> referenceKinds = new ArrayList<>();
        private String modeAttribute = "mode";
        private String defaultMode;
        private String entryBlock;
        private final List<String> entryFields = new ArrayList<>();
        private final List<String> keyFields = new ArrayList<>();
        private final Map<String, String> collections = new LinkedHashMap<>();
        private String scopeAttribute = "account_id";
        private String primaryKeyAttribute;
        private String compositeIdAttribute = "id";
        private String satelliteLabel;

        public Builder legacyPrimaryKinds(String... kinds) {
            legacyPrimaryKinds.addAll(List.of(kinds));
            return this;
        }

        public Builder defaultKind(String defaultKind) {
            this.defaultKind = defaultKind;
            return this;
        }

        public Builder customKind(String customKind) {
            this.customKind = customKind;
            return this;
        }

        public Builder satelliteKind(String satelliteKind) {
            this.satelliteKind = satelliteKind;
            return this;
        }

        public Builder classifier(VariantClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder reference(String attribute, String... kinds) {
            this.referenceAttribute = attribute;
            referenceKinds.addAll(List.of(kinds));
            return this;
        }

        public Builder mode(String attribute, String defaultMode) {
            this.modeAttribute = attribute;
            this.defaultMode = defaultMode;
            return this;
        }

        public Builder entries(String block, List<String> fields, List<String> keys) {
            this.entryBlock = block;
            entryFields.addAll(fields);
            keyFields.addAll(keys);
            return this;
        }

        public Builder collection(String mode, String attribute) {
            collections.put(mode, attribute);
            return this;
        }

        public Builder scopeAttribute(String scopeAttribute) {
            this.scopeAttribute = scopeAttribute;
            return this;
        }

        public Builder primaryKeyAttribute(String primaryKeyAttribute) {
            this.primaryKeyAttribute = primaryKeyAttribute;
            return this;
        }

        public Builder compositeIdAttribute(String compositeIdAttribute) {
            this.compositeIdAttribute = compositeIdAttribute;
            return this;
        }

        /**
         * Human-readable satellite name used in diagnostic messages; defaults to the satellite kind.
         */
        public Builder satelliteLabel(String satelliteLabel) {
            this.satelliteLabel = satelliteLabel;
            return this;
        }

        public MergeSchema build() {
            return new MergeSchema(
                legacyPrimaryKinds,
                defaultKind,
                customKind,
                satelliteKind,
                classifier,
                referenceAttribute,
                referenceKinds,
                modeAttribute,
                defaultMode,
                entryBlock,
                entryFields,
                keyFields,
                collections,
                scopeAttribute,
                primaryKeyAttribute,
                compositeIdAttribute,
                satelliteLabel
            );
        }
    }
}
