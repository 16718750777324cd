package work.tfmigrate.hcl;

import java.util.Objects;
import work.tfmigrate.value.AttrValue;

/**
 * {@code name = expression}, with the expression kept as raw source text.
 */
public final class Attribute implements BodyItem {
    private final String name;
    private final String expression;
    private final String trailingComment;

    public Attribute(String name, String expression, String trailingComment) {
        this.name = Objects.requireNonNull(name, "name");
        this.expression = Objects.requireNonNull(expression, "expression");
        this.trailingComment = trailingComment;
    }

    public String name() {
        return name;
    }

    public String expression() {
        return expression;
    }

    public String trailingComment() {
        return trailingComment;
    }

    public AttrValue value() {
        return Literals.decode(expression);
    }
}
