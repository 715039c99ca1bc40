package strongbox.core.model.backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A dynamically typed configuration value.
 *
 * <p>Backend configuration is free-form, so values are carried as a tagged
 * variant rather than as raw objects. See {@link ConfigValueCodec} for the
 * serialized form and its treatment of numbers.
 */
public sealed interface ConfigValue {

    record Text(String value) implements ConfigValue {
        public Text {
            if (value == null) {
                throw new IllegalArgumentException("text value cannot be null");
            }
        }
    }

    record Int(long value) implements ConfigValue {}

    record Real(double value) implements ConfigValue {}

    record Bool(boolean value) implements ConfigValue {}

    record Nested(Map<String, ConfigValue> values) implements ConfigValue {
        public Nested {
            values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }
    }

    static ConfigValue of(String value) {
        return new Text(value);
    }

    static ConfigValue of(long value) {
        return new Int(value);
    }

    static ConfigValue of(double value) {
        return new Real(value);
    }

    static ConfigValue of(boolean value) {
        return new Bool(value);
    }

    /**
     * Wrap a plain Java value.
     *
     * @throws IllegalArgumentException for types with no config representation
     */
    static ConfigValue from(Object raw) {
        if (raw instanceof ConfigValue value) {
            return value;
        }
        if (raw instanceof String s) {
            return new Text(s);
        }
        if (raw instanceof Boolean b) {
            return new Bool(b);
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return new Int(((Number) raw).longValue());
        }
        if (raw instanceof Number n) {
            return new Real(n.doubleValue());
        }
        if (raw instanceof Map<?, ?> map) {
            final Map<String, ConfigValue> values = new LinkedHashMap<>();
            map.forEach((k, v) -> values.put(String.valueOf(k), from(v)));
            return new Nested(values);
        }
        throw new IllegalArgumentException(
                "unsupported config value type: " + (raw == null ? "null" : raw.getClass().getName()));
    }

    static Map<String, ConfigValue> fromMap(Map<String, ?> raw) {
        final Map<String, ConfigValue> values = new LinkedHashMap<>();
        if (raw != null) {
            raw.forEach((k, v) -> values.put(k, from(v)));
        }
        return values;
    }

    /**
     * Unwrap into a plain Java value.
     */
    default Object toRaw() {
        if (this instanceof Text t) {
            return t.value();
        }
        if (this instanceof Int i) {
            return i.value();
        }
        if (this instanceof Real r) {
            return r.value();
        }
        if (this instanceof Bool b) {
            return b.value();
        }
        final Map<String, Object> raw = new LinkedHashMap<>();
        ((Nested) this).values().forEach((k, v) -> raw.put(k, v.toRaw()));
        return raw;
    }

    /**
     * Whether the value carries nothing: an empty string or an empty mapping.
     */
    default boolean isEmpty() {
        if (this instanceof Text t) {
            return t.value().isEmpty();
        }
        if (this instanceof Nested n) {
            return n.values().isEmpty();
        }
        return false;
    }
}
