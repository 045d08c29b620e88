package adf;

import adf.Value.ObjectValue;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * A parsed ADF document.
 * <p>
 * Holds two independent trees, both objects at the root: the absolute tree, addressed by
 * dot-paths from the document root, and the relative forest of fragments declared under
 * headers without {@code #}. Values handed in are copied on the way in and every accessor
 * returns a copy, so callers never alias internal state.
 * <p>
 * Not synchronized. Concurrent reads are safe only while nothing mutates the document.
 */
public class Document {

    private static final Logger LOG = Logger.getLogger(Document.class.getName());

    private ObjectValue root = Value.object();
    private ObjectValue relativeSections = Value.object();

    public Value get(String path) {
        return get(path, null);
    }

    /**
     * Value at {@code path}, or {@code defaultValue} as soon as a segment is missing or a
     * non-object is indexed. The empty path yields the whole absolute tree.
     */
    public Value get(String path, Value defaultValue) {
        return get(DocumentPath.split(path), defaultValue);
    }

    public Value get(List<String> segments, Value defaultValue) {
        Value found = resolve(root, segments);
        return found == null ? defaultValue : found.copy();
    }

    public boolean contains(String path) {
        return resolve(root, DocumentPath.split(path)) != null;
    }

    /**
     * Writes {@code value} at {@code path}, creating intermediate objects and replacing any
     * non-object in the way. At the empty path an object replaces the whole tree and anything
     * else is dropped.
     */
    public void set(String path, Value value) {
        set(DocumentPath.split(path), value);
    }

    public void set(List<String> segments, Value value) {
        Value v = value == null ? Value.nullValue() : value.copy();
        if (segments.isEmpty()) {
            if (v.isObject()) {
                root = v.asObject();
            } else {
                LOG.warning("Dropping " + v.getKind() + " value written at the document root");
            }
            return;
        }
        writeAt(root, segments, v);
    }

    public void merge(Document other) {
        if (other == null) {
            return;
        }
        root = deepMerge(root, other.root).asObject();
    }

    public void mergeAtPath(String path, Value value) {
        mergeAtPath(DocumentPath.split(path), value);
    }

    public void mergeAtPath(List<String> segments, Value value) {
        Value existing = resolve(root, segments);
        if (existing == null) {
            existing = Value.object();
        }
        if (existing.isObject() && value != null && value.isObject()) {
            set(segments, deepMerge(existing, value));
        } else {
            set(segments, value);
        }
    }

    /**
     * Stores a relocatable fragment, deep-merging with an object already stored at the same
     * path and overwriting anything else.
     */
    public void addRelativeSection(String path, Value value) {
        addRelativeSection(DocumentPath.split(path), value);
    }

    public void addRelativeSection(List<String> segments, Value value) {
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Relative section path must not be empty");
        }
        Value existing = resolve(relativeSections, segments);
        Value v = value == null ? Value.nullValue() : value;
        if (existing != null && existing.isObject() && v.isObject()) {
            writeAt(relativeSections, segments, deepMerge(existing, v));
        } else {
            writeAt(relativeSections, segments, v.copy());
        }
    }

    public ObjectValue toStructuredCopy() {
        return root.copy();
    }

    public ObjectValue relativeSectionsCopy() {
        return relativeSections.copy();
    }

    public ObjectValue getRelativeSections() {
        return relativeSectionsCopy();
    }

    public boolean isEmpty() {
        return root.isEmpty() && relativeSections.isEmpty();
    }

    public String serialize() {
        return new Serializer().serialize(this);
    }

    @Override
    public String toString() {
        return "Document(" + root.toText() + ")";
    }

    /**
     * Returns a new value; neither argument is modified and the result shares nothing with them.
     * Objects merge key by key, anything else is replaced by the overlay.
     */
    public static Value deepMerge(Value base, Value overlay) {
        if (base == null || overlay == null || !base.isObject() || !overlay.isObject()) {
            return overlay == null ? Value.nullValue() : overlay.copy();
        }
        ObjectValue result = base.asObject().copy();
        for (Map.Entry<String, Value> e : overlay.asObject().entrySet()) {
            Value current = result.get(e.getKey());
            if (current == null) {
                result.put(e.getKey(), e.getValue().copy());
            } else {
                result.put(e.getKey(), deepMerge(current, e.getValue()));
            }
        }
        return result;
    }

    private static Value resolve(ObjectValue tree, List<String> segments) {
        Value current = tree;
        for (String part : segments) {
            if (!current.isObject()) {
                return null;
            }
            current = current.asObject().get(part);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private static void writeAt(ObjectValue tree, List<String> segments, Value value) {
        ObjectValue current = tree;
        for (int i = 0; i < segments.size() - 1; i++) {
            String part = segments.get(i);
            Value next = current.get(part);
            if (next == null || !next.isObject()) {
                next = Value.object();
                current.put(part, next);
            }
            current = next.asObject();
        }
        current.put(segments.get(segments.size() - 1), value);
    }
}
