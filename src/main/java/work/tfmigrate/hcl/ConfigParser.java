package work.tfmigrate.hcl;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads HCL native syntax into an editable {@link ConfigFile}.
 *
 * <p>Only the structure is parsed (blocks, labels, attributes, comments); expressions are kept as raw
 * text and decoded on demand by {@link Literals}.
 */
public final class ConfigParser {
    private final String src;
    private final ExpressionScanner scanner;
    private int pos;

    private ConfigParser(String src) {
        this.src = src;
        this.scanner = new ExpressionScanner(src);
    }

    public static ConfigFile parse(String text, String filename) {
        var parser = new ConfigParser(text == null ? "" : text);
        var file = new ConfigFile(filename);
        parser.parseBody(file.body(), true);
        return file;
    }

    private void parseBody(Body body, boolean root) {
        while (true) {
            int lineStart = pos;
            skipInlineSpace();
            if (pos >= src.length()) {
                if (!root) {
                    throw scanner.error(pos, "unexpected end of input, expected '}'");
                }
                if (pos > lineStart) {
                    body.addParsed(new Unstructured(src.substring(lineStart, pos)));
                }
                return;
            }
            char c = src.charAt(pos);
            if (c == '\n' || src.startsWith("\r\n", pos)) {
                pos += c == '\n' ? 1 : 2;
                body.addParsed(new Unstructured(src.substring(lineStart, pos)));
                continue;
            }
            if (c == '}') {
                if (root) {
                    throw scanner.error(pos, "unexpected '}'");
                }
                pos++;
                return;
            }
            if (c == '#' || src.startsWith("//", pos)) {
                pos = consumeNewline(scanner.lineEnd(pos));
                body.addParsed(new Unstructured(src.substring(lineStart, pos)));
                continue;
            }
            if (src.startsWith("/*", pos)) {
                int end = src.indexOf("*/", pos + 2);
                if (end < 0) {
                    throw scanner.error(pos, "unterminated comment");
                }
                pos = end + 2;
                skipInlineSpace();
                if (pos >= src.length() || src.charAt(pos) == '\n' || src.charAt(pos) == '\r') {
                    pos = consumeNewline(pos);
                }
                body.addParsed(new Unstructured(src.substring(lineStart, pos)));
                continue;
            }
            if (ExpressionScanner.isIdentifierStart(c)) {
                parseItem(body);
                continue;
            }
            throw scanner.error(pos, "unexpected character '" + c + "'");
        }
    }

    private void parseItem(Body body) {
        int start = pos;
        String name = readIdentifier();
        skipInlineSpace();
        if (pos < src.length() && src.charAt(pos) == '=' && !src.startsWith("==", pos)) {
            pos++;
            skipInlineSpace();
            int end = scanner.scan(pos, ExpressionScanner.Stop.ATTRIBUTE);
            String expression = src.substring(pos, end).strip();
            if (expression.isEmpty()) {
                throw scanner.error(pos, "missing value for attribute " + name);
            }
            pos = end;
            String comment = readTrailingComment();
            finishLine();
            body.addParsed(new Attribute(name, expression, comment));
            return;
        }

        List<String> labels = new ArrayList<>();
        while (true) {
            skipInlineSpace();
            if (pos >= src.length()) {
                throw scanner.error(pos, "unexpected end of input in block header " + name);
            }
            char c = src.charAt(pos);
            if (c == '{') {
                pos++;
                break;
            }
            if (c == '"') {
                labels.add(readQuotedLabel());
            } else if (ExpressionScanner.isIdentifierStart(c)) {
                labels.add(readIdentifier());
            } else {
                throw scanner.error(pos, "unexpected character '" + c + "' in block header " + name);
            }
        }

        skipInlineSpace();
        if (pos < src.length() && (src.charAt(pos) == '\n' || src.charAt(pos) == '\r')) {
            pos = consumeNewline(pos);
        }
        var block = new Block(name, labels, body.depth() + 1, "", null);
        parseBody(block.body(), false);
        String originalText = src.substring(start, pos);
        String comment = readTrailingComment();
        skipInlineSpace();
        int lineStart = pos;
        finishLine();
        block.captureSource(originalText, comment, src.substring(lineStart, pos));
        body.addParsed(block);
    }

    private String readIdentifier() {
        int start = pos;
        while (pos < src.length() && ExpressionScanner.isIdentifierPart(src.charAt(pos))) {
            pos++;
        }
        return src.substring(start, pos);
    }

    private String readQuotedLabel() {
        int end = scanner.scanString(pos + 1);
        String raw = src.substring(pos, end);
        pos = end;
        return Literals.unquote(raw);
    }

    private String readTrailingComment() {
        skipInlineSpace();
        if (pos >= src.length()) {
            return null;
        }
        if (src.charAt(pos) == '#' || src.startsWith("//", pos)) {
            int end = scanner.lineEnd(pos);
            String comment = src.substring(pos, end).stripTrailing();
            pos = end;
            return comment;
        }
        if (src.startsWith("/*", pos)) {
            int end = src.indexOf("*/", pos + 2);
            if (end < 0) {
                throw scanner.error(pos, "unterminated comment");
            }
            String comment = src.substring(pos, end + 2);
            pos = end + 2;
            return comment;
        }
        return null;
    }

    // An item ends at a line break, at the end of input, or right before the closing brace of a one-line block.
    private void finishLine() {
        skipInlineSpace();
        if (pos >= src.length() || src.charAt(pos) == '}') {
            return;
        }
        if (src.charAt(pos) == '\n' || src.charAt(pos) == '\r') {
            pos = consumeNewline(pos);
            return;
        }
        throw scanner.error(pos, "expected a line break but found '" + src.charAt(pos) + "'");
    }

    private int consumeNewline(int at) {
        if (src.startsWith("\r\n", at)) {
            return at + 2;
        }
        if (at < src.length() && src.charAt(at) == '\n') {
            return at + 1;
        }
        return at;
    }

    private void skipInlineSpace() {
        while (pos < src.length() && (src.charAt(pos) == ' ' || src.charAt(pos) == '\t')) {
            pos++;
        }
    }
}
