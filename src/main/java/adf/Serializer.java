package adf;

import adf.Value.ArrayValue;
import adf.Value.ObjectValue;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link Document} as ADF text.
 * <p>
 * Headers and grouping are rebuilt from the shape of the tree, so repeated sections come out
 * merged and constraints and source quoting are not reproduced.
 */
public class Serializer {

    private static final String LS = "\n";
    private static final String SPECIAL_CHARS = "=#:()";
    private static final int MIN_BLOCK_QUOTES = 3;

    public String serialize(Document document) {
        List<String> lines = new ArrayList<>();
        writeObject(document.toStructuredCopy(), new ArrayList<>(), lines, true);

        ObjectValue relative = document.relativeSectionsCopy();
        if (!relative.isEmpty()) {
            if (!lines.isEmpty()) {
                lines.add("");
            }
            writeObject(relative, new ArrayList<>(), lines, false);
        }
        return String.join(LS, lines);
    }

    private void writeObject(ObjectValue obj, List<String> parentPath, List<String> lines, boolean absolute) {
        for (Map.Entry<String, Value> e : obj.entrySet()) {
            List<String> path = DocumentPath.append(parentPath, e.getKey());
            Value value = e.getValue();
            switch (value.getKind()) {
                case OBJECT:
                    ObjectValue child = value.asObject();
                    if (child.isSimple()) {
                        writeHeader(path, lines, absolute);
                        for (Map.Entry<String, Value> member : child.entrySet()) {
                            writeEntry(member.getKey(), member.getValue(), lines);
                        }
                        lines.add("");
                    } else {
                        writeObject(child, path, lines, absolute);
                    }
                    break;
                case ARRAY:
                    writeHeader(path, lines, absolute);
                    writeArray(value.asArray(), lines);
                    lines.add("");
                    break;
                case NULL:
                case BOOLEAN:
                case INTEGER:
                case FLOAT:
                case STRING:
                    // a lone scalar goes under its parent's header so that it reads back in place;
                    // relative fragments have no root header and keep their own path instead
                    writeHeader(parentPath.isEmpty() && !absolute ? path : parentPath, lines, absolute);
                    writeEntry(e.getKey(), value, lines);
                    lines.add("");
                    break;
                default:
                    throw new IllegalStateException("Unexpected value kind: " + value.getKind());
            }
        }
    }

    private void writeHeader(List<String> path, List<String> lines, boolean absolute) {
        String prefix = absolute ? "# " : "";
        String joined = DocumentPath.join(path);
        if (joined.isEmpty()) {
            lines.add("#:");
        } else {
            lines.add(prefix + joined + ":");
        }
    }

    private void writeArray(ArrayValue arr, List<String> lines) {
        if (arr.isEmpty()) {
            return;
        }
        if (!arr.anyObject()) {
            for (Value item : arr) {
                lines.add(item.toText());
            }
            return;
        }
        for (int i = 0; i < arr.size(); i++) {
            if (i > 0) {
                lines.add("");
            }
            Value item = arr.get(i);
            if (item.isObject()) {
                for (Map.Entry<String, Value> member : item.asObject().entrySet()) {
                    writeEntry(member.getKey(), member.getValue(), lines);
                }
            } else {
                lines.add(item.toText());
            }
        }
    }

    private void writeEntry(String key, Value value, List<String> lines) {
        String k = DocumentPath.quoteSegment(key);
        if (value.isString() && needsBlock(value.asString())) {
            String text = value.asString();
            String quotes = StringUtils.repeat('"', blockQuoteCount(text));
            lines.add(k + " = " + quotes);
            if (!text.isEmpty()) {
                lines.add(text);
            }
            lines.add(quotes);
            return;
        }
        lines.add(k + " = " + formatValue(value));
    }

    static String formatValue(Value value) {
        switch (value.getKind()) {
            case BOOLEAN:
                return value.asBoolean() ? "true" : "false";
            case STRING:
                String s = value.asString();
                return needsQuoting(s) ? '"' + s + '"' : s;
            case NULL:
            case INTEGER:
            case FLOAT:
            case ARRAY:
            case OBJECT:
                return value.toText();
            default:
                throw new IllegalStateException("Unexpected value kind: " + value.getKind());
        }
    }

    static boolean needsQuoting(String s) {
        if (s.isEmpty()) {
            return true;
        }
        if (ScalarTypes.isBooleanLiteral(s) || ScalarTypes.looksNumeric(s)) {
            return true;
        }
        if (StringUtils.containsAny(s, SPECIAL_CHARS)) {
            return true;
        }
        return !s.equals(s.trim());
    }

    private static boolean needsBlock(String s) {
        return s.isEmpty() || s.indexOf('\n') >= 0 || s.indexOf('\r') >= 0 || s.startsWith("\"");
    }

    /**
     * A closing run must not be mistaken for the end of any content line.
     */
    private static int blockQuoteCount(String text) {
        int longest = 0;
        for (String line : text.split("\n", -1)) {
            int run = 0;
            for (int i = line.length() - 1; i >= 0 && line.charAt(i) == '"'; i--) {
                run++;
            }
            longest = Math.max(longest, run);
        }
        return Math.max(MIN_BLOCK_QUOTES, longest + 1);
    }
}
