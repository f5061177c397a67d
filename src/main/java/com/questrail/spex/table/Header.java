package com.questrail.spex.table;

import com.questrail.spex.api.FormatException;

import java.util.*;

/**
 * Header
 * -----------------------------------------------------------------------------
 * Ordered scalar keywords of a {@link Table} plus its free-text HISTORY and
 * COMMENT lines.
 *
 * <p>Keywords are case-insensitive and stored upper case. Values are one of
 * {@code String}, {@code Long}, {@code Double} or {@code Boolean}; the typed
 * getters coerce between the two numeric kinds.</p>
 *
 * <p>Instances are immutable; use {@link #toBuilder()} to derive a modified
 * copy.</p>
 */
public final class Header
{
    private static final Header EMPTY = new Builder().build();

    private final Map<String, Object> values;
    private final List<String> history;
    private final List<String> comments;

    private Header(Map<String, Object> values, List<String> history, List<String> comments) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.history = List.copyOf(history);
        this.comments = List.copyOf(comments);
    }

    public static Header empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.values.putAll(values);
        b.history.addAll(history);
        b.comments.addAll(comments);
        return b;
    }

    public boolean contains(String key) {
        return values.containsKey(normalize(key));
    }

    /**
     * Keywords in insertion order.
     */
    public Set<String> keys() {
        return values.keySet();
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(normalize(key)));
    }

    public Optional<String> getString(String key) {
        return get(key).map(v -> v instanceof String s ? s.trim() : String.valueOf(v));
    }

    public Optional<Double> getDouble(String key) {
        Object v = values.get(normalize(key));
        if (v == null) {
            return Optional.empty();
        }
        if (v instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        throw new FormatException("Header keyword " + key + " is not numeric: " + v);
    }

    public Optional<Long> getLong(String key) {
        Object v = values.get(normalize(key));
        if (v == null) {
            return Optional.empty();
        }
        if (v instanceof Long l) {
            return Optional.of(l);
        }
        if (v instanceof Double d && d == Math.rint(d)) {
            return Optional.of(d.longValue());
        }
        throw new FormatException("Header keyword " + key + " is not an integer: " + v);
    }

    public Optional<Integer> getInt(String key) {
        return getLong(key).map(Math::toIntExact);
    }

    public Optional<Boolean> getBoolean(String key) {
        Object v = values.get(normalize(key));
        if (v == null) {
            return Optional.empty();
        }
        if (v instanceof Boolean b) {
            return Optional.of(b);
        }
        throw new FormatException("Header keyword " + key + " is not logical: " + v);
    }

    /**
     * Numeric keyword that must be present.
     *
     * @throws FormatException when missing
     */
    public double requireDouble(String key) {
        return getDouble(key).orElseThrow(() -> new FormatException("Missing header keyword " + key));
    }

    public long requireLong(String key) {
        return getLong(key).orElseThrow(() -> new FormatException("Missing header keyword " + key));
    }

    public String requireString(String key) {
        return getString(key).orElseThrow(() -> new FormatException("Missing header keyword " + key));
    }

    public List<String> history() {
        return history;
    }

    public List<String> comments() {
        return comments;
    }

    static String normalize(String key) {
        Objects.requireNonNull(key, "key");
        return key.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "Header" + values;
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();
        private final List<String> history = new ArrayList<>();
        private final List<String> comments = new ArrayList<>();

        public Builder put(String key, String value) {
            return putValue(key, Objects.requireNonNull(value, "value"));
        }

        public Builder put(String key, long value) {
            return putValue(key, value);
        }

        public Builder put(String key, double value) {
            return putValue(key, value);
        }

        public Builder put(String key, boolean value) {
            return putValue(key, value);
        }

        /**
         * Generic put for values read back from a store.
         */
        public Builder putValue(String key, Object value) {
            Objects.requireNonNull(value, "value");
            if (value instanceof Integer i) {
                value = i.longValue();
            } else if (value instanceof Float f) {
                value = f.doubleValue();
            }
            if (!(value instanceof String || value instanceof Long
                    || value instanceof Double || value instanceof Boolean)) {
                throw new IllegalArgumentException("Unsupported header value type: " + value.getClass());
            }
            values.put(normalize(key), value);
            return this;
        }

        public Builder remove(String key) {
            values.remove(normalize(key));
            return this;
        }

        public Builder addHistory(String line) {
            history.add(Objects.requireNonNull(line, "line"));
            return this;
        }

        public Builder addComment(String line) {
            comments.add(Objects.requireNonNull(line, "line"));
            return this;
        }

        public Header build() {
            return new Header(values, history, comments);
        }
    }
}
