package work.tfmigrate.hcl;

/**
 * One entry of a {@link Body}: an attribute, a nested block, or text kept verbatim (comments, blank lines).
 */
public sealed interface BodyItem permits Attribute, Block, Unstructured {}
