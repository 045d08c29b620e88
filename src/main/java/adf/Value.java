package adf;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public abstract class Value {

    public enum Kind {
        NULL, BOOLEAN, INTEGER, FLOAT, STRING, ARRAY, OBJECT
    }

    private static final NullValue NULL = new NullValue();

    Value() {
    }

    public abstract Kind getKind();

    public abstract Value copy();

    public abstract Object toPlain();

    public abstract String toText();

    public boolean isNull() {
        return getKind() == Kind.NULL;
    }

    public boolean isObject() {
        return getKind() == Kind.OBJECT;
    }

    public boolean isArray() {
        return getKind() == Kind.ARRAY;
    }

    public boolean isString() {
        return getKind() == Kind.STRING;
    }

    public boolean isContainer() {
        return isObject() || isArray();
    }

    public boolean asBoolean() {
        throw mismatch(Kind.BOOLEAN);
    }

    public long asLong() {
        throw mismatch(Kind.INTEGER);
    }

    public double asDouble() {
        throw mismatch(Kind.FLOAT);
    }

    public String asString() {
        throw mismatch(Kind.STRING);
    }

    public ArrayValue asArray() {
        throw mismatch(Kind.ARRAY);
    }

    public ObjectValue asObject() {
        throw mismatch(Kind.OBJECT);
    }

    @Override
    public String toString() {
        return toText();
    }

    private IllegalStateException mismatch(Kind expected) {
        return new IllegalStateException("Expected " + expected + " value but was " + getKind());
    }

    public static Value nullValue() {
        return NULL;
    }

    public static Value of(boolean b) {
        return new BooleanValue(b);
    }

    public static Value of(long l) {
        return new IntegerValue(l);
    }

    public static Value of(double d) {
        return new FloatValue(d);
    }

    public static Value of(String s) {
        return s == null ? NULL : new StringValue(s);
    }

    public static ArrayValue array() {
        return new ArrayValue(new ArrayList<>());
    }

    public static ArrayValue array(List<? extends Value> elements) {
        ArrayValue result = array();
        if (elements != null) {
            for (Value v : elements) {
                result.add(v);
            }
        }
        return result;
    }

    public static ObjectValue object() {
        return new ObjectValue(new LinkedHashMap<>());
    }

    public static ObjectValue object(Map<String, ? extends Value> entries) {
        ObjectValue result = object();
        if (entries != null) {
            for (Map.Entry<String, ? extends Value> e : entries.entrySet()) {
                result.put(e.getKey(), e.getValue());
            }
        }
        return result;
    }

    /**
     * Inverse of {@link #toPlain()}. Accepts any {@link Number}, {@link CharSequence},
     * {@link Iterable} and {@link Map} with string keys; values already of this type are copied.
     */
    public static Value fromPlain(Object o) {
        if (o == null) {
            return NULL;
        }
        if (o instanceof Value) {
            return ((Value) o).copy();
        }
        if (o instanceof Boolean) {
            return of((Boolean) o);
        }
        if (o instanceof Double || o instanceof Float) {
            return of(((Number) o).doubleValue());
        }
        if (o instanceof Number) {
            return of(((Number) o).longValue());
        }
        if (o instanceof CharSequence) {
            return of(o.toString());
        }
        if (o instanceof Map) {
            ObjectValue result = object();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) o).entrySet()) {
                result.put(String.valueOf(e.getKey()), fromPlain(e.getValue()));
            }
            return result;
        }
        if (o instanceof Iterable) {
            ArrayValue result = array();
            for (Object item : (Iterable<?>) o) {
                result.add(fromPlain(item));
            }
            return result;
        }
        throw new IllegalArgumentException("Unsupported value type: " + o.getClass().getName());
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class NullValue extends Value {

        private NullValue() {
        }

        @Override
        public Kind getKind() {
            return Kind.NULL;
        }

        @Override
        public Value copy() {
            return this;
        }

        @Override
        public Object toPlain() {
            return null;
        }

        @Override
        public String toText() {
            return "null";
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class BooleanValue extends Value {
        private final boolean value;

        BooleanValue(boolean value) {
            this.value = value;
        }

        @Override
        public Kind getKind() {
            return Kind.BOOLEAN;
        }

        @Override
        public boolean asBoolean() {
            return value;
        }

        @Override
        public Value copy() {
            return this;
        }

        @Override
        public Object toPlain() {
            return value;
        }

        @Override
        public String toText() {
            return value ? "true" : "false";
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class IntegerValue extends Value {
        private final long value;

        IntegerValue(long value) {
            this.value = value;
        }

        @Override
        public Kind getKind() {
            return Kind.INTEGER;
        }

        @Override
        public long asLong() {
            return value;
        }

        @Override
        public double asDouble() {
            return value;
        }

        @Override
        public Value copy() {
            return this;
        }

        @Override
        public Object toPlain() {
            return value;
        }

        @Override
        public String toText() {
            return Long.toString(value);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class FloatValue extends Value {
        private final double value;

        FloatValue(double value) {
            this.value = value;
        }

        @Override
        public Kind getKind() {
            return Kind.FLOAT;
        }

        @Override
        public double asDouble() {
            return value;
        }

        @Override
        public Value copy() {
            return this;
        }

        @Override
        public Object toPlain() {
            return value;
        }

        @Override
        public String toText() {
            return Double.toString(value);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class StringValue extends Value {
        private final String value;

        StringValue(String value) {
            this.value = value;
        }

        @Override
        public Kind getKind() {
            return Kind.STRING;
        }

        @Override
        public String asString() {
            return value;
        }

        @Override
        public Value copy() {
            return this;
        }

        @Override
        public Object toPlain() {
            return value;
        }

        @Override
        public String toText() {
            return value;
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class ArrayValue extends Value implements Iterable<Value> {
        private final List<Value> elements;

        ArrayValue(List<Value> elements) {
            this.elements = elements;
        }

        @Override
        public Kind getKind() {
            return Kind.ARRAY;
        }

        @Override
        public ArrayValue asArray() {
            return this;
        }

        public int size() {
            return elements.size();
        }

        public boolean isEmpty() {
            return elements.isEmpty();
        }

        public Value get(int index) {
            return elements.get(index);
        }

        public ArrayValue add(Value value) {
            elements.add(value == null ? NULL : value);
            return this;
        }

        public Value set(int index, Value value) {
            return elements.set(index, value == null ? NULL : value);
        }

        public boolean anyObject() {
            for (Value v : elements) {
                if (v.isObject()) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public Iterator<Value> iterator() {
            return elements.iterator();
        }

        @Override
        public ArrayValue copy() {
            List<Value> copied = new ArrayList<>(elements.size());
            for (Value v : elements) {
                copied.add(v.copy());
            }
            return new ArrayValue(copied);
        }

        @Override
        public Object toPlain() {
            List<Object> out = new ArrayList<>(elements.size());
            for (Value v : elements) {
                out.add(v.toPlain());
            }
            return out;
        }

        @Override
        public String toText() {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(elements.get(i).toText());
            }
            return sb.append(']').toString();
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class ObjectValue extends Value {
        private final LinkedHashMap<String, Value> entries;

        ObjectValue(LinkedHashMap<String, Value> entries) {
            this.entries = entries;
        }

        @Override
        public Kind getKind() {
            return Kind.OBJECT;
        }

        @Override
        public ObjectValue asObject() {
            return this;
        }

        public int size() {
            return entries.size();
        }

        public boolean isEmpty() {
            return entries.isEmpty();
        }

        public boolean containsKey(String key) {
            return entries.containsKey(key);
        }

        public Value get(String key) {
            return entries.get(key);
        }

        public ObjectValue put(String key, Value value) {
            Objects.requireNonNull(key, "key");
            entries.put(key, value == null ? NULL : value);
            return this;
        }

        public Value remove(String key) {
            return entries.remove(key);
        }

        public Set<String> keySet() {
            return entries.keySet();
        }

        public Set<Map.Entry<String, Value>> entrySet() {
            return entries.entrySet();
        }

        // no member is an object or an array
        public boolean isSimple() {
            for (Value v : entries.values()) {
                if (v.isContainer()) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public ObjectValue copy() {
            LinkedHashMap<String, Value> copied = new LinkedHashMap<>();
            for (Map.Entry<String, Value> e : entries.entrySet()) {
                copied.put(e.getKey(), e.getValue().copy());
            }
            return new ObjectValue(copied);
        }

        @Override
        public Object toPlain() {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<String, Value> e : entries.entrySet()) {
                out.put(e.getKey(), e.getValue().toPlain());
            }
            return out;
        }

        @Override
        public String toText() {
            StringBuilder sb = new StringBuilder("{");
            boolean first = true;
            for (Map.Entry<String, Value> e : entries.entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(e.getKey()).append(" = ").append(e.getValue().toText());
                first = false;
            }
            return sb.append('}').toString();
        }
    }
}
