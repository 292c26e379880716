package com.mainframe.jcl.model;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Open set of DCB sub-parameters that are not promoted to first-class allocation fields.
 *
 * Keys are upper-case attribute names; values are either {@link Long} (all-digit values)
 * or {@link String}. Equality ignores insertion order.
 */
public final class DcbAttributes {

    private static final DcbAttributes EMPTY = new DcbAttributes(new TreeMap<>());

    private final TreeMap<String, Object> attributes;

    private DcbAttributes(TreeMap<String, Object> attributes) {
        this.attributes = attributes;
    }

    public static DcbAttributes empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(attributes.get(name.toUpperCase(Locale.ROOT)));
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    public int size() {
        return attributes.size();
    }

    /**
     * Read-only view, sorted by attribute name.
     */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DcbAttributes other)) return false;
        return attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return attributes.toString();
    }

    public static final class Builder {
        private final TreeMap<String, Object> values = new TreeMap<>();

        private Builder() {
        }

        /**
         * Add a raw textual value, typing it as Long when it is all digits.
         * Later values for the same name replace earlier ones.
         */
        public Builder put(String name, String rawValue) {
            if (name == null || name.isBlank() || rawValue == null) {
                return this;
            }
            values.put(name.trim().toUpperCase(Locale.ROOT), typed(rawValue.trim()));
            return this;
        }

        public Builder putIfAbsent(String name, String rawValue) {
            if (name != null && !values.containsKey(name.trim().toUpperCase(Locale.ROOT))) {
                put(name, rawValue);
            }
            return this;
        }

        public DcbAttributes build() {
            return values.isEmpty() ? EMPTY : new DcbAttributes(new TreeMap<>(values));
        }

        private static Object typed(String raw) {
            if (!raw.isEmpty() && raw.length() <= 18 && raw.chars().allMatch(Character::isDigit)) {
                return Long.parseLong(raw);
            }
            return raw;
        }
    }
}
