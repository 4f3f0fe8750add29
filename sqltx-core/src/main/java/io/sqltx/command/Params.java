package io.sqltx.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Named argument values for one command execution. Values may be {@code null}.
 */
public final class Params {
    private static final Params EMPTY = new Params(Map.of());

    private final Map<String, Object> values;

    private Params(Map<String, Object> values) {
        this.values = values;
    }

    public static Params empty() {
        return EMPTY;
    }

    public static Params of(String name, Object value) {
        return builder().set(name, value).build();
    }

    public static Params of(String name1, Object value1, String name2, Object value2) {
        return builder().set(name1, value1).set(name2, value2).build();
    }

    public static Params of(String name1, Object value1, String name2, Object value2,
                            String name3, Object value3) {
        return builder().set(name1, value1).set(name2, value2).set(name3, value3).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    @Override
    public String toString() {
        return "Params" + values.keySet();
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {}

        public Builder set(String name, Object value) {
            Objects.requireNonNull(name, "name");
            if (values.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate parameter: " + name);
            }
            values.put(name, value);
            return this;
        }

        public Params build() {
            return new Params(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
