package work.tfmigrate.merge;

/**
 * Where a satellite says its entries belong.
 */
public sealed interface TargetReference
    permits TargetReference.ImplicitDefault, TargetReference.Named, TargetReference.Unparseable {

    /**
     * No reference: the default-variant primary within {@code scope} ({@code null} when the representation
     * has no scope, as in a configuration unit).
     */
    record ImplicitDefault(String scope) implements TargetReference {}

    /**
     * A resolved reference. {@code kind} is {@code null} when only a concrete key is known (state documents).
     */
    record Named(String kind, String key) implements TargetReference {}

    /**
     * A reference expression that could not be resolved statically.
     */
    record Unparseable(String raw) implements TargetReference {}
}
