package work.tfmigrate.hcl;

/**
 * Finds the extent of HCL expressions without interpreting them.
 *
 * <p>Tracks bracket depth, quoted templates (including {@code ${...}} and {@code %{...}} sequences),
 * heredocs and comments so that an expression's end can be located on raw source text.
 */
final class ExpressionScanner {
    enum Stop {
        /** Attribute value in a body: ends at a newline, a comment or an unmatched closing bracket. */
        ATTRIBUTE,
        /** Interpolation inside a template: ends only at the unmatched closing brace. */
        TEMPLATE,
        /** List element: ends at a top-level comma or the unmatched closing bracket. */
        ELEMENT,
        /** Object member value: ends at a top-level comma, newline, comment or unmatched closing brace. */
        MEMBER
    }

    private final String src;

    ExpressionScanner(String src) {
        this.src = src;
    }

    int scan(int from, Stop stop) {
        int depth = 0;
        int i = from;
        boolean newlineStops = stop == Stop.ATTRIBUTE || stop == Stop.MEMBER;
        boolean commaStops = stop == Stop.ELEMENT || stop == Stop.MEMBER;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (c == '"') {
                i = scanString(i + 1);
                continue;
            }
            if (c == '<' && isHeredocStart(i)) {
                i = scanHeredoc(i);
                continue;
            }
            if (c == '#' || src.startsWith("//", i)) {
                if (depth == 0 && newlineStops) {
                    return i;
                }
                i = lineEnd(i);
                continue;
            }
            if (src.startsWith("/*", i)) {
                if (depth == 0 && newlineStops) {
                    return i;
                }
                int end = src.indexOf("*/", i + 2);
                if (end < 0) {
                    throw error(i, "unterminated comment");
                }
                i = end + 2;
                continue;
            }
            if (c == '\n' || c == '\r') {
                if (depth == 0 && newlineStops) {
                    return i;
                }
                i++;
                continue;
            }
            if (c == ',' && depth == 0 && commaStops) {
                return i;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
                i++;
                continue;
            }
            if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) {
                    return i;
                }
                depth--;
                i++;
                continue;
            }
            i++;
        }
        if (stop == Stop.TEMPLATE) {
            throw error(from, "unterminated template sequence");
        }
        return i;
    }

    /**
     * Scans a quoted template starting just after its opening quote; returns the index after the closing quote.
     */
    int scanString(int from) {
        int i = from;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '"') {
                return i + 1;
            }
            if (src.startsWith("$${", i) || src.startsWith("%%{", i)) {
                i += 3;
                continue;
            }
            if ((c == '$' || c == '%') && i + 1 < src.length() && src.charAt(i + 1) == '{') {
                int end = scan(i + 2, Stop.TEMPLATE);
                i = end + 1;
                continue;
            }
            if (c == '\n') {
                throw error(from, "unterminated string");
            }
            i++;
        }
        throw error(from, "unterminated string");
    }

    boolean isHeredocStart(int i) {
        if (!src.startsWith("<<", i)) {
            return false;
        }
        int j = i + 2;
        if (j < src.length() && src.charAt(j) == '-') {
            j++;
        }
        return j < src.length() && isIdentifierStart(src.charAt(j));
    }

    int scanHeredoc(int i) {
        int j = i + 2;
        if (src.charAt(j) == '-') {
            j++;
        }
        int markerStart = j;
        while (j < src.length() && isIdentifierPart(src.charAt(j))) {
            j++;
        }
        String marker = src.substring(markerStart, j);
        int line = lineEnd(j);
        while (line < src.length()) {
            int next = line + 1;
            int end = lineEnd(next);
            if (src.substring(next, end).strip().equals(marker)) {
                return end;
            }
            line = end;
        }
        throw error(i, "unterminated heredoc " + marker);
    }

    int lineEnd(int from) {
        int i = from;
        while (i < src.length() && src.charAt(i) != '\n') {
            i++;
        }
        return i;
    }

    ConfigSyntaxException error(int offset, String message) {
        int line = 1;
        for (int i = 0; i < offset && i < src.length(); i++) {
            if (src.charAt(i) == '\n') {
                line++;
            }
        }
        return new ConfigSyntaxException(line, message);
    }

    static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    static boolean isIdentifier(String text) {
        if (text == null || text.isEmpty() || !isIdentifierStart(text.charAt(0))) {
            return false;
        }
        for (int i = 1; i < text.length(); i++) {
            if (!isIdentifierPart(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
