package adf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits ADF text into one {@link Token} per line. Every line is classified; only multiline
 * blocks carry state from one line to the next.
 */
public class Lexer {

    public List<Token> tokenize(String text) {
        List<String> lines = splitLines(text);
        LexContext ctx = new LexContext();
        List<Token> tokens = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            tokens.add(ctx.accept(lines.get(i), i + 1));
        }
        return tokens;
    }

    static List<String> splitLines(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        String[] arr = normalized.split("\n", -1);
        int len = arr.length;
        if (arr[len - 1].isEmpty()) {
            len--;
        }
        List<String> lines = new ArrayList<>(len);
        for (int i = 0; i < len; i++) {
            lines.add(arr[i]);
        }
        return lines;
    }

    private static final class LexContext {
        boolean inMultiline;
        int multilineQuotes;

        Token accept(String line, int lineNumber) {
            if (inMultiline) {
                return continueMultiline(line, lineNumber);
            }
            if (line.trim().isEmpty()) {
                return Token.builder()
                        .type(TokenType.BLANK)
                        .lineNumber(lineNumber)
                        .rawLine(line)
                        .build();
            }
            Token header = tryHeader(line, lineNumber);
            if (header != null) {
                return header;
            }
            if (line.indexOf('=') >= 0) {
                return keyValue(line, lineNumber);
            }
            return Token.builder()
                    .type(TokenType.SCALAR_VALUE)
                    .lineNumber(lineNumber)
                    .rawLine(line)
                    .value(line.trim())
                    .build();
        }

        private Token continueMultiline(String line, int lineNumber) {
            if (!endsWithQuotes(line, multilineQuotes)) {
                return Token.builder()
                        .type(TokenType.MULTILINE_CONTENT)
                        .lineNumber(lineNumber)
                        .rawLine(line)
                        .value(line)
                        .quoteCount(multilineQuotes)
                        .build();
            }
            int quotes = multilineQuotes;
            inMultiline = false;
            multilineQuotes = 0;
            String content = stripTrailing(line.substring(0, line.length() - quotes));
            return Token.builder()
                    .type(TokenType.MULTILINE_END)
                    .lineNumber(lineNumber)
                    .rawLine(line)
                    .value(content)
                    .quoteCount(quotes)
                    .build();
        }

        private Token keyValue(String line, int lineNumber) {
            int eq = line.indexOf('=');
            String key = line.substring(0, eq).trim();
            String rawValue = stripLeading(line.substring(eq + 1));

            int quotes = countLeadingQuotes(rawValue);
            if (quotes == 0) {
                ValueAndConstraint vc = splitConstraint(rawValue);
                return Token.builder()
                        .type(TokenType.KEY_VALUE)
                        .lineNumber(lineNumber)
                        .rawLine(line)
                        .key(key)
                        .value(vc.value)
                        .constraint(vc.constraint)
                        .build();
            }

            if (rawValue.length() > quotes * 2 && endsWithQuotes(rawValue, quotes)) {
                String inner = rawValue.substring(quotes, rawValue.length() - quotes);
                return Token.builder()
                        .type(TokenType.KEY_VALUE)
                        .lineNumber(lineNumber)
                        .rawLine(line)
                        .key(key)
                        .value(inner)
                        .quoteCount(quotes)
                        .build();
            }

            inMultiline = true;
            multilineQuotes = quotes;
            return Token.builder()
                    .type(TokenType.MULTILINE_START)
                    .lineNumber(lineNumber)
                    .rawLine(line)
                    .key(key)
                    .value(rawValue.substring(quotes))
                    .quoteCount(quotes)
                    .build();
        }
    }

    private static Token tryHeader(String line, int lineNumber) {
        String trimmed = line.trim();
        if (!trimmed.endsWith(":")) {
            return null;
        }
        String path = trimmed.substring(0, trimmed.length() - 1).trim();
        boolean absolute = false;
        if (path.startsWith("#")) {
            absolute = true;
            path = path.substring(1).trim();
        }

        if (path.isEmpty()) {
            // "#:" is the root section; a bare ":" is not a header at all
            if (!absolute) {
                return null;
            }
        } else if (!DocumentPath.isValidHeaderPath(path)) {
            return null;
        }

        return Token.builder()
                .type(absolute ? TokenType.ABSOLUTE_HEADER : TokenType.RELATIVE_HEADER)
                .lineNumber(lineNumber)
                .rawLine(line)
                .path(path)
                .absolute(absolute)
                .build();
    }

    static ValueAndConstraint splitConstraint(String s) {
        String trimmed = s.trim();
        int open = constraintStart(trimmed);
        if (open < 0) {
            return new ValueAndConstraint(trimmed, null);
        }
        String constraint = trimmed.substring(open + 1, trimmed.length() - 1).trim();
        if (constraint.isEmpty()) {
            return new ValueAndConstraint(trimmed, null);
        }
        return new ValueAndConstraint(stripTrailing(trimmed.substring(0, open)), constraint);
    }

    /**
     * Index of the '(' matching a ')' that ends the string, or -1.
     */
    private static int constraintStart(String s) {
        if (!s.endsWith(")")) {
            return -1;
        }
        int depth = 0;
        for (int i = s.length() - 1; i >= 0; i--) {
            char ch = s.charAt(i);
            if (ch == ')') {
                depth++;
            } else if (ch == '(') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    static int countLeadingQuotes(String s) {
        int i = 0;
        while (i < s.length() && s.charAt(i) == '"') {
            i++;
        }
        return i;
    }

    static boolean endsWithQuotes(String s, int count) {
        if (count <= 0 || s.length() < count) {
            return false;
        }
        for (int i = s.length() - count; i < s.length(); i++) {
            if (s.charAt(i) != '"') {
                return false;
            }
        }
        return true;
    }

    private static String stripLeading(String s) {
        int i = 0;
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
            i++;
        }
        return s.substring(i);
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end);
    }

    static final class ValueAndConstraint {
        final String value;
        final String constraint;

        ValueAndConstraint(String value, String constraint) {
            this.value = value;
            this.constraint = constraint;
        }
    }
}
