package org.bytecodeflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stand-in for a runtime value during simulation: a concrete scalar when it
 * could be folded, a placeholder text when it could not, a composite of other
 * symbolic values, or the marker a call convention pushes for "no bound
 * receiver".
 */
public abstract class SymbolicValue {

    public enum Kind { CONCRETE, PLACEHOLDER, COMPOSITE, NULL_MARKER }

    public enum CompositeKind { LIST, TUPLE, SET, MAP }

    public static final Concrete NONE = new Concrete(null);
    public static final SymbolicValue NULL_MARKER = new NullMarker();

    private SymbolicValue() {}

    public abstract Kind kind();

    /** Text shown to renderers. */
    public abstract String display();

    @Override
    public String toString() {
        return display();
    }

    /* =========================
     *   factories
     * ========================= */

    public static Concrete of(long v) { return new Concrete(v); }
    public static Concrete of(double v) { return new Concrete(v); }
    public static Concrete of(boolean v) { return new Concrete(v); }
    public static Concrete of(String v) { return new Concrete(Objects.requireNonNull(v)); }

    public static Placeholder placeholder(String text) {
        return new Placeholder(text);
    }

    /** Placeholder rendered as {@code <name>}, for unbound locals and globals. */
    public static Placeholder tag(String name) {
        return new Placeholder("<" + name + ">");
    }

    public static Composite composite(CompositeKind kind, List<SymbolicValue> elements) {
        return new Composite(kind, elements);
    }

    /**
     * Converts a decoded operand (constant, default value, argument) into a
     * symbolic value. Lists become LIST composites, maps become MAP composites.
     */
    public static SymbolicValue fromObject(Object value) {
        if (value == null) return NONE;
        if (value instanceof SymbolicValue sv) return sv;
        if (value instanceof Boolean b) return of(b);
        if (value instanceof Double || value instanceof Float) return of(((Number) value).doubleValue());
        if (value instanceof Number n) return of(n.longValue());
        if (value instanceof CharSequence s) return of(s.toString());
        if (value instanceof List<?> list) {
            List<SymbolicValue> items = new ArrayList<>(list.size());
            for (Object o : list) items.add(fromObject(o));
            return composite(CompositeKind.LIST, items);
        }
        if (value instanceof Map<?, ?> map) {
            List<SymbolicValue> items = new ArrayList<>(map.size() * 2);
            for (Map.Entry<?, ?> e : map.entrySet()) {
                items.add(fromObject(e.getKey()));
                items.add(fromObject(e.getValue()));
            }
            return composite(CompositeKind.MAP, items);
        }
        return placeholder(String.valueOf(value));
    }

    /* =========================
     *   variants
     * ========================= */

    public static final class Concrete extends SymbolicValue {
        private final Object value; // Long, Double, Boolean, String, or null for None

        private Concrete(Object value) {
            this.value = value;
        }

        public Object value() { return value; }

        public boolean isNone() { return value == null; }

        public boolean isNumeric() {
            return value instanceof Long || value instanceof Double;
        }

        @Override public Kind kind() { return Kind.CONCRETE; }

        @Override
        public String display() {
            if (value == null) return "None";
            if (value instanceof Boolean b) return b ? "True" : "False";
            if (value instanceof String s) return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
            return value.toString();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Concrete c && Objects.equals(value, c.value);
        }

        @Override
        public int hashCode() { return Objects.hashCode(value); }
    }

    public static final class Placeholder extends SymbolicValue {
        private final String text;

        private Placeholder(String text) {
            this.text = Objects.requireNonNull(text);
        }

        public String text() { return text; }

        @Override public Kind kind() { return Kind.PLACEHOLDER; }
        @Override public String display() { return text; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Placeholder p && text.equals(p.text);
        }

        @Override
        public int hashCode() { return text.hashCode(); }
    }

    public static final class Composite extends SymbolicValue {
        private final CompositeKind compositeKind;
        private final List<SymbolicValue> elements;

        private Composite(CompositeKind compositeKind, List<SymbolicValue> elements) {
            this.compositeKind = Objects.requireNonNull(compositeKind);
            this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }

        public CompositeKind compositeKind() { return compositeKind; }

        /** Elements in order; for MAP, keys and values alternate. */
        public List<SymbolicValue> elements() { return elements; }

        @Override public Kind kind() { return Kind.COMPOSITE; }

        @Override
        public String display() {
            StringBuilder sb = new StringBuilder();
            switch (compositeKind) {
                case LIST:
                    sb.append('[');
                    join(sb, elements);
                    return sb.append(']').toString();
                case TUPLE:
                    sb.append('(');
                    join(sb, elements);
                    if (elements.size() == 1) sb.append(',');
                    return sb.append(')').toString();
                case SET:
                    if (elements.isEmpty()) return "set()";
                    sb.append('{');
                    join(sb, elements);
                    return sb.append('}').toString();
                case MAP:
                default:
                    sb.append('{');
                    for (int i = 0; i + 1 < elements.size(); i += 2) {
                        if (i > 0) sb.append(", ");
                        sb.append(elements.get(i).display()).append(": ").append(elements.get(i + 1).display());
                    }
                    return sb.append('}').toString();
            }
        }

        private static void join(StringBuilder sb, List<SymbolicValue> items) {
            for (int i = 0; i < items.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(items.get(i).display());
            }
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Composite c && compositeKind == c.compositeKind && elements.equals(c.elements);
        }

        @Override
        public int hashCode() { return Objects.hash(compositeKind, elements); }
    }

    private static final class NullMarker extends SymbolicValue {
        @Override public Kind kind() { return Kind.NULL_MARKER; }
        @Override public String display() { return "NULL"; }
    }
}
