package work.tfmigrate.merge;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Statically resolves a reference expression such as {@code cloudflare_x.office.id} or
 * {@code cloudflare_x["office"].id} to the resource it points at.
 *
 * <p>Nothing is evaluated. The expression must be a plain traversal rooted at one of the candidate kinds;
 * variables, locals, module outputs, data sources, conditionals and function calls never resolve.
 */
public final class ReferenceResolver {
    private static final String IDENT = "[A-Za-z_][A-Za-z0-9_-]*";
    private static final Pattern DOT_FORM =
        Pattern.compile("^(" + IDENT + ")\\.(" + IDENT + ")((?:\\." + IDENT + "|\\[[^\\[\\]]*\\])*)$");
    private static final Pattern INDEXED_FORM =
        Pattern.compile("^(" + IDENT + ")\\[\\s*\"([^\"\\\\]+)\"\\s*\\]((?:\\." + IDENT + "|\\[[^\\[\\]]*\\])*)$");

    private ReferenceResolver() {}

    /**
     * @param rawExpression expression source text, possibly wrapped in a single {@code "${...}"} template
     * @param candidateKinds kinds accepted as the traversal root, in priority order
     */
    public static Optional<ResourceIdentity> resolve(String rawExpression, List<String> candidateKinds) {
        if (rawExpression == null || candidateKinds.isEmpty()) {
            return Optional.empty();
        }
        String expression = unwrapTemplate(rawExpression.strip());
        Matcher matcher = DOT_FORM.matcher(expression);
        if (!matcher.matches()) {
            matcher = INDEXED_FORM.matcher(expression);
            if (!matcher.matches()) {
                return Optional.empty();
            }
        }
        String root = matcher.group(1);
        for (String kind : candidateKinds) {
            if (kind.equals(root)) {
                return Optional.of(new ResourceIdentity(kind, matcher.group(2)));
            }
        }
        return Optional.empty();
    }

    // "${ref}" -> ref; anything else inside the quotes makes it an interpolated string.
    private static String unwrapTemplate(String expression) {
        if (expression.length() > 5 && expression.startsWith("\"${") && expression.endsWith("}\"")) {
            String inner = expression.substring(3, expression.length() - 2);
            if (!inner.contains("${") && !inner.contains("}")) {
                return inner.strip();
            }
        }
        return expression;
    }
}
