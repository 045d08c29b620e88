package adf;

import adf.Value.ArrayValue;
import adf.Value.ObjectValue;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Groups tokens into sections and writes each section into a {@link Document}.
 * <p>
 * A section body without key/value lines is a scalar array. One with key/value lines split
 * into groups by blank lines is an array of objects. Anything else is a plain object; for an
 * absolute section every top-level key of it is merged into the document on its own, which is
 * what lets repeated headers augment each other.
 */
public class Parser {

    private static final Logger LOG = Logger.getLogger(Parser.class.getName());

    private final ParseOptions options;
    private final Lexer lexer;

    public Parser() {
        this(ParseOptions.defaults());
    }

    public Parser(ParseOptions options) {
        this.options = options == null ? ParseOptions.defaults() : options;
        this.lexer = new Lexer();
    }

    public Document parse(String text) {
        if (options.isStrict()) {
            LOG.fine("Strict mode has no additional failure conditions; parsing leniently");
        }
        return parse(lexer.tokenize(text == null ? "" : text));
    }

    public Document parse(List<Token> tokens) {
        Document document = new Document();
        SectionState st = new SectionState();
        for (Token token : tokens) {
            if (token.getType().isHeader()) {
                processSection(st, document);
                st.start(token);
            } else {
                st.body.add(token);
            }
        }
        processSection(st, document);
        return document;
    }

    private void processSection(SectionState st, Document document) {
        List<Token> body = st.body;
        if (body.isEmpty() || !hasContent(body)) {
            return;
        }
        List<String> path = DocumentPath.split(st.path);

        if (!hasEntries(body)) {
            LOG.fine(() -> "Section '" + st.path + "' at line " + st.line + " is a scalar array");
            write(document, path, st.absolute, scalarArray(body));
        } else if (hasBlankLineSeparators(body)) {
            LOG.fine(() -> "Section '" + st.path + "' at line " + st.line + " is an object array");
            write(document, path, st.absolute, objectArray(body));
        } else {
            LOG.fine(() -> "Section '" + st.path + "' at line " + st.line + " is an object");
            ObjectValue obj = plainObject(body);
            if (st.absolute) {
                for (Map.Entry<String, Value> e : obj.entrySet()) {
                    document.mergeAtPath(DocumentPath.append(path, e.getKey()), e.getValue());
                }
            } else {
                document.addRelativeSection(path, obj);
            }
        }
    }

    private static void write(Document document, List<String> path, boolean absolute, Value value) {
        if (absolute) {
            document.set(path, value);
        } else {
            document.addRelativeSection(path, value);
        }
    }

    private ArrayValue scalarArray(List<Token> body) {
        ArrayValue values = Value.array();
        for (Token t : body) {
            if (t.getType() != TokenType.BLANK && t.getValue() != null) {
                values.add(inferType(t.getValue()));
            }
        }
        return values;
    }

    private ArrayValue objectArray(List<Token> body) {
        ArrayValue objects = Value.array();
        ObjectValue current = Value.object();
        int i = 0;
        while (i < body.size()) {
            Token t = body.get(i);
            if (t.getType() == TokenType.BLANK) {
                if (!current.isEmpty()) {
                    objects.add(current);
                    current = Value.object();
                }
            } else if (t.getType() == TokenType.KEY_VALUE) {
                String key = entryKey(t);
                if (!key.isEmpty()) {
                    current.put(key, inferType(t.getValue()));
                }
            } else if (t.getType() == TokenType.MULTILINE_START) {
                MultilineResult m = collectMultiline(body, i);
                String key = entryKey(t);
                if (!key.isEmpty()) {
                    current.put(key, Value.of(m.text));
                }
                i = m.lastIndex;
            }
            i++;
        }
        if (!current.isEmpty()) {
            objects.add(current);
        }
        return objects;
    }

    private ObjectValue plainObject(List<Token> body) {
        ObjectValue obj = Value.object();
        int i = 0;
        while (i < body.size()) {
            Token t = body.get(i);
            if (t.getType() == TokenType.KEY_VALUE) {
                setNested(obj, DocumentPath.split(t.getKey()), inferType(t.getValue()));
            } else if (t.getType() == TokenType.MULTILINE_START) {
                MultilineResult m = collectMultiline(body, i);
                setNested(obj, DocumentPath.split(t.getKey()), Value.of(m.text));
                i = m.lastIndex;
            }
            i++;
        }
        return obj;
    }

    /**
     * Joins the opening fragment, every content line and the closing line's own text with
     * newlines. Empty opening and closing fragments are left out.
     */
    static MultilineResult collectMultiline(List<Token> tokens, int startIndex) {
        List<String> parts = new ArrayList<>();
        String first = tokens.get(startIndex).getValue();
        if (first != null && !first.isEmpty()) {
            parts.add(first);
        }
        int i = startIndex + 1;
        while (i < tokens.size()) {
            Token t = tokens.get(i);
            if (t.getType() == TokenType.MULTILINE_CONTENT) {
                parts.add(t.getValue() == null ? "" : t.getValue());
            } else if (t.getType() == TokenType.MULTILINE_END) {
                if (t.getValue() != null && !t.getValue().isEmpty()) {
                    parts.add(t.getValue());
                }
                break;
            }
            i++;
        }
        return new MultilineResult(String.join("\n", parts), Math.min(i, tokens.size() - 1));
    }

    /**
     * True when a blank line follows some key/value content and more key/value content follows it.
     */
    static boolean hasBlankLineSeparators(List<Token> body) {
        boolean hasBlank = false;
        boolean contentAfterBlank = false;
        boolean foundContent = false;
        for (Token t : body) {
            if (t.getType() == TokenType.BLANK) {
                if (foundContent) {
                    hasBlank = true;
                    foundContent = false;
                }
            } else if (t.getType().opensEntry()) {
                if (hasBlank) {
                    contentAfterBlank = true;
                }
                foundContent = true;
            }
        }
        return hasBlank && contentAfterBlank;
    }

    private static boolean hasContent(List<Token> body) {
        for (Token t : body) {
            if (t.getType() != TokenType.BLANK) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasEntries(List<Token> body) {
        for (Token t : body) {
            if (t.getType().opensEntry()) {
                return true;
            }
        }
        return false;
    }

    private static String entryKey(Token t) {
        List<String> parts = DocumentPath.split(t.getKey());
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return StringUtils.defaultString(t.getKey());
    }

    private static void setNested(ObjectValue obj, List<String> parts, Value value) {
        if (parts.isEmpty()) {
            return;
        }
        ObjectValue current = obj;
        for (int i = 0; i < parts.size() - 1; i++) {
            Value next = current.get(parts.get(i));
            if (next == null || !next.isObject()) {
                next = Value.object();
                current.put(parts.get(i), next);
            }
            current = next.asObject();
        }
        current.put(parts.get(parts.size() - 1), value);
    }

    private Value inferType(String text) {
        if (text == null) {
            return Value.nullValue();
        }
        return options.isInferTypes() ? ScalarTypes.infer(text) : Value.of(text);
    }

    private static final class SectionState {
        final List<Token> body = new ArrayList<>();
        String path = "";
        boolean absolute = true;
        int line = 1;

        void start(Token header) {
            body.clear();
            path = header.getPath() == null ? "" : header.getPath();
            absolute = header.isAbsolute();
            line = header.getLineNumber();
        }
    }

    static final class MultilineResult {
        final String text;
        final int lastIndex;

        MultilineResult(String text, int lastIndex) {
            this.text = text;
            this.lastIndex = lastIndex;
        }
    }
}
