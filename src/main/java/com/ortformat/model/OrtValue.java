package com.ortformat.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * An ORT value: null, boolean, number, string, array or object.
 *
 * <p>Every instance is fully normalized. Whatever native data a value is built from is
 * converted recursively, and {@code OrtValue} payloads are deep-copied, so a tree never
 * shares a container with anything outside it. Object keys keep their insertion order,
 * which the generator relies on to lay out headers.
 *
 * <p>Equality compares arrays element by element in order and objects as sets of
 * key/value pairs, ignoring key order. Numbers compare as {@link Double#equals}.
 *
 * <p>Values are not thread-safe; callers sharing a tree across threads while mutating it
 * through {@code set} must synchronize externally.
 */
@EqualsAndHashCode
public final class OrtValue {

    private static final OrtValue NULL = new OrtValue(OrtType.NULL);

    @Getter
    private final OrtType type;

    // exactly one payload field is set, matching the type; NULL sets none
    private Boolean bool;
    private Double number;
    private String string;
    private List<OrtValue> items;
    private LinkedHashMap<String, OrtValue> entries;

    private OrtValue(OrtType type) {
        this.type = type;
    }

    private static OrtValue ofItems(List<OrtValue> items) {
        OrtValue value = new OrtValue(OrtType.ARRAY);
        value.items = items;
        return value;
    }

    private static OrtValue ofEntries(LinkedHashMap<String, OrtValue> entries) {
        OrtValue value = new OrtValue(OrtType.OBJECT);
        value.entries = entries;
        return value;
    }

    // ---- Construction ----

    public static OrtValue ofNull() {
        return NULL;
    }

    public static OrtValue of(boolean value) {
        OrtValue result = new OrtValue(OrtType.BOOL);
        result.bool = value;
        return result;
    }

    public static OrtValue of(double value) {
        OrtValue result = new OrtValue(OrtType.NUMBER);
        result.number = value;
        return result;
    }

    public static OrtValue of(String value) {
        if (value == null) {
            return NULL;
        }
        OrtValue result = new OrtValue(OrtType.STRING);
        result.string = value;
        return result;
    }

    public static OrtValue emptyArray() {
        return ofItems(new ArrayList<>());
    }

    public static OrtValue emptyObject() {
        return ofEntries(new LinkedHashMap<>());
    }

    public static OrtValue array(Object... items) {
        return of(Arrays.asList(items));
    }

    /**
     * Builds a value from native data.
     *
     * @throws IllegalArgumentException if some contained payload has no ORT representation
     */
    public static OrtValue of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof OrtValue ort) {
            return ort.deepCopy();
        }
        if (value instanceof Boolean b) {
            return of(b.booleanValue());
        }
        if (value instanceof Number n) {
            return of(n.doubleValue());
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return of(value.toString());
        }
        if (value instanceof Optional<?> optional) {
            return of(optional.orElse(null));
        }
        if (value instanceof Map<?, ?> map) {
            LinkedHashMap<String, OrtValue> converted = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                converted.put(String.valueOf(entry.getKey()), of(entry.getValue()));
            }
            return ofEntries(converted);
        }
        if (value instanceof Iterable<?> iterable) {
            List<OrtValue> converted = new ArrayList<>();
            for (Object item : iterable) {
                converted.add(of(item));
            }
            return ofItems(converted);
        }
        if (value instanceof Object[] array) {
            return of(Arrays.asList(array));
        }
        throw new IllegalArgumentException("Unsupported type for OrtValue: " + value.getClass().getName());
    }

    private OrtValue deepCopy() {
        return switch (type) {
            case NULL, BOOL, NUMBER, STRING -> this;
            case ARRAY -> {
                List<OrtValue> copy = new ArrayList<>(items.size());
                for (OrtValue item : items) {
                    copy.add(item.deepCopy());
                }
                yield ofItems(copy);
            }
            case OBJECT -> {
                LinkedHashMap<String, OrtValue> copy = new LinkedHashMap<>();
                entries.forEach((k, v) -> copy.put(k, v.deepCopy()));
                yield ofEntries(copy);
            }
        };
    }

    // ---- Type tests ----

    public boolean isNull() {
        return type == OrtType.NULL;
    }

    public boolean isBool() {
        return type == OrtType.BOOL;
    }

    public boolean isNumber() {
        return type == OrtType.NUMBER;
    }

    public boolean isString() {
        return type == OrtType.STRING;
    }

    public boolean isArray() {
        return type == OrtType.ARRAY;
    }

    public boolean isObject() {
        return type == OrtType.OBJECT;
    }

    // ---- Typed extraction (no coercion) ----

    public Optional<Boolean> asBool() {
        return Optional.ofNullable(bool);
    }

    public Optional<Double> asNumber() {
        return Optional.ofNullable(number);
    }

    public Optional<String> asString() {
        return Optional.ofNullable(string);
    }

    /**
     * Read-only view of the elements. Elements are live: mutating one through
     * {@link #set} is visible in this value.
     */
    public Optional<List<OrtValue>> asArray() {
        return isArray() ? Optional.of(Collections.unmodifiableList(items)) : Optional.empty();
    }

    /**
     * Read-only, insertion-ordered view of the entries.
     */
    public Optional<Map<String, OrtValue>> asObject() {
        return isObject() ? Optional.of(Collections.unmodifiableMap(entries)) : Optional.empty();
    }

    // ---- Indexed access ----

    public OrtValue get(String key) {
        if (!isObject()) {
            throw OrtAccessException.notAnObject(type, key);
        }
        OrtValue value = entries.get(key);
        if (value == null) {
            throw OrtAccessException.keyNotFound(key);
        }
        return value;
    }

    public OrtValue get(int index) {
        if (!isArray()) {
            throw OrtAccessException.notAnArray(type, index);
        }
        if (index < 0 || index >= items.size()) {
            throw OrtAccessException.indexOutOfBounds(index, items.size());
        }
        return items.get(index);
    }

    public boolean containsKey(String key) {
        return isObject() && entries.containsKey(key);
    }

    /**
     * Never fails: returns {@code defaultValue}, normalized, when this is not an object or
     * the key is absent.
     */
    public OrtValue getOrDefault(String key, Object defaultValue) {
        if (isObject()) {
            OrtValue value = entries.get(key);
            if (value != null) {
                return value;
            }
        }
        return of(defaultValue);
    }

    /**
     * Sets or adds an entry. The assigned payload is normalized and deep-copied.
     */
    public void set(String key, Object value) {
        if (!isObject()) {
            throw OrtAccessException.notAnObject(type, key);
        }
        entries.put(key, of(value));
    }

    /**
     * Replaces an existing element; arrays cannot grow through this method.
     */
    public void set(int index, Object value) {
        if (!isArray()) {
            throw OrtAccessException.notAnArray(type, index);
        }
        if (index < 0 || index >= items.size()) {
            throw OrtAccessException.indexOutOfBounds(index, items.size());
        }
        items.set(index, of(value));
    }

    /**
     * Element count of an array or entry count of an object.
     */
    public int size() {
        if (!type.isContainer()) {
            throw OrtAccessException.notAContainer(type);
        }
        return isArray() ? items.size() : entries.size();
    }

    // ---- Native conversion ----

    /**
     * Deep-converts to {@code null}, {@link Boolean}, {@link Double}, {@link String},
     * {@code List<Object>} or insertion-ordered {@code Map<String, Object>}.
     */
    public Object toNative() {
        return switch (type) {
            case NULL -> null;
            case BOOL -> bool;
            case NUMBER -> number;
            case STRING -> string;
            case ARRAY -> {
                List<Object> converted = new ArrayList<>(items.size());
                for (OrtValue item : items) {
                    converted.add(item.toNative());
                }
                yield converted;
            }
            case OBJECT -> {
                Map<String, Object> converted = new LinkedHashMap<>();
                entries.forEach((k, v) -> converted.put(k, v.toNative()));
                yield converted;
            }
        };
    }

    @Override
    public String toString() {
        return "OrtValue(" + type + ": " + toNative() + ")";
    }
}
