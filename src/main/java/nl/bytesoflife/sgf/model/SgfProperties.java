package nl.bytesoflife.sgf.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The parsed properties of one SGF node, keyed by property code ({@code B}, {@code W}, {@code C}, ...).
 * Keys keep their insertion order so the node can be written back in the order it was read.
 * Instances are immutable; use {@link #builder()} to create one.
 */
public final class SgfProperties {

    private static final SgfProperties EMPTY = new SgfProperties(Map.of());

    private final Map<String, PropertyValue> values;

    private SgfProperties(Map<String, PropertyValue> values) {
        this.values = values;
    }

    public static SgfProperties empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public PropertyValue get(String key) {
        return values.get(key);
    }

    /**
     * First value of the property, or null when the key is absent.
     */
    public String getFirst(String key) {
        PropertyValue value = values.get(key);
        return value != null ? value.values().get(0) : null;
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Set<String> keySet() {
        return values.keySet();
    }

    public Map<String, PropertyValue> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Formats the properties as SGF node text, one {@code [value]} group per value:
     * {@code B[dd]AB[aa][bb]}.
     */
    public String toSgf() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, PropertyValue> entry : values.entrySet()) {
            sb.append(entry.getKey());
            for (String value : entry.getValue().values()) {
                sb.append('[').append(value).append(']');
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SgfProperties other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static final class Builder {

        private final Map<String, PropertyValue> values = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds a value to a key. The first value is stored as a single string, the second
         * turns it into a list, later values are appended to that list.
         */
        public Builder add(String key, String value) {
            PropertyValue existing = values.get(key);
            values.put(key, existing == null ? new PropertyValue.Single(value) : existing.append(value));
            return this;
        }

        public Builder put(String key, PropertyValue value) {
            values.put(key, value);
            return this;
        }

        public SgfProperties build() {
            if (values.isEmpty()) return EMPTY;
            return new SgfProperties(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
