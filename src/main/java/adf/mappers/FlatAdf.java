package adf.mappers;

import adf.Adf;
import adf.AdfValidationException;
import adf.Document;
import adf.DocumentPath;
import adf.ParseOptions;
import adf.Value;
import adf.Value.ArrayValue;
import adf.Value.ObjectValue;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Flattens an ADF document into one item per leaf, keyed like {@code server.host.primary}
 * or {@code users[1].name}. Relative fragments are keyed with a leading {@code ~}.
 */
public class FlatAdf implements FlatService {

    static final String RELATIVE_PREFIX = "~";
    private static final int MAX_INDEX_DIGITS = 9;

    private final ParseOptions options;

    public FlatAdf() {
        this(ParseOptions.defaults());
    }

    public FlatAdf(ParseOptions options) {
        this.options = options;
    }

    @Override
    public Map<String, FlatItem> flatToMap(String data) {
        Map<String, FlatItem> result = new LinkedHashMap<>();
        if (data == null || data.isBlank()) {
            return result;
        }
        Document document = Adf.parse(data, options);
        flatten(document.toStructuredCopy(), "", false, result);
        flatten(document.relativeSectionsCopy(), "", true, result);
        return result;
    }

    @Override
    public String flatToString(Map<String, FlatItem> data) {
        if (data == null || data.isEmpty()) {
            return "";
        }
        return Adf.serialize(toDocument(data));
    }

    @Override
    public void validate(Map<String, FlatItem> data) {
        if (data == null) {
            return;
        }
        Set<String> leaves = new HashSet<>();
        Map<String, Set<Integer>> indicesByArray = new HashMap<>();

        for (Map.Entry<String, FlatItem> entry : data.entrySet()) {
            String key = entry.getKey();
            FlatItem item = entry.getValue();
            if (key == null) {
                throw new AdfValidationException("Flat key must not be null");
            }
            if (item == null) {
                throw new AdfValidationException("Missing item", key);
            }
            if (item.getKey() != null && !key.equals(item.getKey())) {
                throw new AdfValidationException("Item key '" + item.getKey() + "' does not match its entry", key);
            }
            toValue(key, item.getValue());

            List<Step> steps = FlatKey.parse(key);
            String prefix = key.startsWith(RELATIVE_PREFIX) ? RELATIVE_PREFIX : "";
            StringBuilder sb = new StringBuilder(prefix);
            for (Step step : steps) {
                if (step.isIndex()) {
                    indicesByArray.computeIfAbsent(sb.toString(), x -> new TreeSet<>()).add(step.index);
                    sb.append('[').append(step.index).append(']');
                } else {
                    if (sb.length() > prefix.length()) {
                        sb.append('.');
                    }
                    sb.append(DocumentPath.quoteSegment(step.name));
                }
            }
            leaves.add(sb.toString());
        }

        checkLeafParentConflicts(leaves);
        checkContiguousIndices(indicesByArray);
    }

    Document toDocument(Map<String, FlatItem> data) {
        ObjectValue absolute = Value.object();
        ObjectValue relative = Value.object();
        for (Map.Entry<String, FlatItem> entry : data.entrySet()) {
            FlatItem item = entry.getValue();
            if (entry.getKey() != null && item != null) {
                boolean isRelative = item.isRelative() || entry.getKey().startsWith(RELATIVE_PREFIX);
                put(isRelative ? relative : absolute, FlatKey.parse(entry.getKey()), toValue(entry.getKey(), item.getValue()));
            }
        }

        Document document = new Document();
        document.set("", absolute);
        for (Map.Entry<String, Value> e : relative.entrySet()) {
            document.addRelativeSection(List.of(e.getKey()), e.getValue());
        }
        return document;
    }

    private static void flatten(Value value, String prefix, boolean relative, Map<String, FlatItem> out) {
        switch (value.getKind()) {
            case OBJECT:
                ObjectValue obj = value.asObject();
                if (obj.isEmpty() && !prefix.isEmpty()) {
                    addItem(prefix, new LinkedHashMap<>(), relative, out);
                }
                for (Map.Entry<String, Value> e : obj.entrySet()) {
                    String segment = DocumentPath.quoteSegment(e.getKey());
                    flatten(e.getValue(), prefix.isEmpty() ? segment : prefix + "." + segment, relative, out);
                }
                break;
            case ARRAY:
                ArrayValue arr = value.asArray();
                if (arr.isEmpty()) {
                    addItem(prefix, new ArrayList<>(), relative, out);
                }
                for (int i = 0; i < arr.size(); i++) {
                    flatten(arr.get(i), prefix + "[" + i + "]", relative, out);
                }
                break;
            default:
                addItem(prefix, value.toPlain(), relative, out);
                break;
        }
    }

    private static void addItem(String path, Object value, boolean relative, Map<String, FlatItem> out) {
        String key = relative ? RELATIVE_PREFIX + path : path;
        out.put(key, FlatItem.builder()
                .key(key)
                .value(value)
                .path(path)
                .relative(relative)
                .build());
    }

    private static Value toValue(String key, Object plain) {
        try {
            return Value.fromPlain(plain);
        } catch (IllegalArgumentException ex) {
            throw new AdfValidationException(ex.getMessage(), key);
        }
    }

    private static void put(ObjectValue root, List<Step> steps, Value value) {
        Value container = root;
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            boolean last = i == steps.size() - 1;
            Value fresh;
            if (last) {
                fresh = value;
            } else {
                fresh = steps.get(i + 1).isIndex() ? Value.array() : Value.object();
            }
            if (step.isIndex()) {
                container = putIndex(container.asArray(), step.index, fresh, last);
            } else {
                container = putName(container.asObject(), step.name, fresh, last);
            }
        }
    }

    private static Value putName(ObjectValue obj, String name, Value fresh, boolean last) {
        Value existing = obj.get(name);
        if (!last && existing != null && existing.getKind() == fresh.getKind()) {
            return existing;
        }
        obj.put(name, fresh);
        return fresh;
    }

    private static Value putIndex(ArrayValue arr, int index, Value fresh, boolean last) {
        while (arr.size() <= index) {
            arr.add(Value.nullValue());
        }
        Value existing = arr.get(index);
        if (!last && existing.getKind() == fresh.getKind()) {
            return existing;
        }
        arr.set(index, fresh);
        return fresh;
    }

    private static void checkLeafParentConflicts(Set<String> leaves) {
        for (String leaf : leaves) {
            for (String other : leaves) {
                boolean nested = other.length() > leaf.length()
                        && other.startsWith(leaf)
                        && (other.charAt(leaf.length()) == '.' || other.charAt(leaf.length()) == '[');
                if (nested) {
                    throw new AdfValidationException("Key is both a value and a parent of '" + other + "'", leaf);
                }
            }
        }
    }

    private static void checkContiguousIndices(Map<String, Set<Integer>> indicesByArray) {
        for (Map.Entry<String, Set<Integer>> e : indicesByArray.entrySet()) {
            int expected = 0;
            for (int idx : e.getValue()) {
                if (idx != expected) {
                    throw new AdfValidationException("Array index " + expected + " is missing", e.getKey());
                }
                expected++;
            }
        }
    }

    private static final class Step {
        final String name;
        final int index;

        private Step(String name, int index) {
            this.name = name;
            this.index = index;
        }

        static Step name(String name) {
            return new Step(name, -1);
        }

        static Step index(int index) {
            return new Step(null, index);
        }

        boolean isIndex() {
            return name == null;
        }
    }

    private static final class FlatKey {

        static List<Step> parse(String key) {
            String body = key.startsWith(RELATIVE_PREFIX) ? key.substring(RELATIVE_PREFIX.length()) : key;
            if (body.isEmpty()) {
                throw invalid(key, "empty key");
            }
            List<Step> steps = new ArrayList<>();
            int n = body.length();
            int i = 0;
            while (i < n) {
                i = readName(key, body, i, steps);
                i = readIndices(key, body, i, steps);
                if (i < n) {
                    if (body.charAt(i) != '.') {
                        throw invalid(key, "unexpected '" + body.charAt(i) + "'");
                    }
                    i++;
                    if (i == n) {
                        throw invalid(key, "trailing '.'");
                    }
                }
            }
            return steps;
        }

        private static int readName(String key, String body, int start, List<Step> steps) {
            if (body.charAt(start) == '"') {
                int close = body.indexOf('"', start + 1);
                if (close < 0) {
                    throw invalid(key, "unterminated quote");
                }
                if (close == start + 1) {
                    throw invalid(key, "empty quoted segment");
                }
                steps.add(Step.name(body.substring(start + 1, close)));
                return close + 1;
            }
            int i = start;
            while (i < body.length() && body.charAt(i) != '.' && body.charAt(i) != '[') {
                i++;
            }
            String name = body.substring(start, i);
            if (!DocumentPath.isPlainSegment(name)) {
                throw invalid(key, "invalid segment '" + name + "'");
            }
            steps.add(Step.name(name));
            return i;
        }

        private static int readIndices(String key, String body, int start, List<Step> steps) {
            int i = start;
            while (i < body.length() && body.charAt(i) == '[') {
                int close = body.indexOf(']', i);
                if (close < 0) {
                    throw invalid(key, "unterminated index");
                }
                String digits = body.substring(i + 1, close);
                if (!StringUtils.isNumeric(digits) || digits.length() > MAX_INDEX_DIGITS) {
                    throw invalid(key, "invalid index '" + digits + "'");
                }
                steps.add(Step.index(Integer.parseInt(digits)));
                i = close + 1;
            }
            return i;
        }

        private static AdfValidationException invalid(String key, String reason) {
            return new AdfValidationException("Invalid flat key: " + reason, key);
        }
    }
}
