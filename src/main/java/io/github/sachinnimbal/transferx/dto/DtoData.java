package io.github.sachinnimbal.transferx.dto;

import io.github.sachinnimbal.transferx.dto.backend.DtoBackend;
import io.github.sachinnimbal.transferx.dto.engine.NestedBuiltins;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated inbound data that has not been turned into a domain instance yet.
 * Lets a handler fill in server-side values before creating an instance, or
 * apply a (partial) payload to an existing one.
 *
 * <p>Override keys use attribute names; {@code __} separates nested levels,
 * so {@code "address__city"} sets {@code city} of the nested {@code address}.
 */
public final class DtoData<T> {

    private static final String NESTED_SEPARATOR = "__";

    private final DtoBackend backend;
    private final Map<String, Object> builtins;

    public DtoData(DtoBackend backend, Map<String, Object> builtins) {
        this.backend = backend;
        this.builtins = builtins;
    }

    /**
     * A copy of the decoded values as plain maps, keyed by attribute name.
     */
    public Map<String, Object> asBuiltins() {
        return deepCopy(builtins);
    }

    public T createInstance() {
        return createInstance(Map.of());
    }

    @SuppressWarnings("unchecked")
    public T createInstance(Map<String, ?> overrides) {
        return (T) backend.transferDataFromBuiltins(withOverrides(overrides));
    }

    public T updateInstance(T target) {
        return updateInstance(target, Map.of());
    }

    /**
     * Applies the decoded values to {@code target}. Beans and entities are
     * updated in place and returned; records are immutable, so a new record is
     * returned and {@code target} is left untouched.
     */
    @SuppressWarnings("unchecked")
    public T updateInstance(T target, Map<String, ?> overrides) {
        Map<String, Object> values = backend.transferFieldValuesFromBuiltins(withOverrides(overrides));
        return (T) backend.getContext().getIntrospector()
                .accessorFor(target.getClass())
                .update(target, values);
    }

    private Map<String, Object> withOverrides(Map<String, ?> overrides) {
        Map<String, Object> data = deepCopy(builtins);
        overrides.forEach((key, value) -> setNested(data, key.split(NESTED_SEPARATOR), value));
        return data;
    }

    @SuppressWarnings("unchecked")
    private static void setNested(Map<String, Object> data, String[] keys, Object value) {
        Map<String, Object> current = data;
        for (int i = 0; i < keys.length - 1; i++) {
            Object next = current.get(keys[i]);
            if (!(next instanceof Map<?, ?>)) {
                next = new LinkedHashMap<String, Object>();
                current.put(keys[i], next);
            }
            current = (Map<String, Object>) next;
        }
        current.put(keys[keys.length - 1], value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>(source.size() * 2);
        source.forEach((key, value) -> copy.put(key, copyValue(value)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof NestedBuiltins nested) {
            return new NestedBuiltins(nested.getModelType(), deepCopy(nested));
        }
        if (value instanceof Map<?, ?> map) {
            return deepCopy((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(copyValue(item));
            }
            return copy;
        }
        return value;
    }

    @Override
    public String toString() {
        return "DtoData" + builtins;
    }
}
