package io.github.sachinnimbal.transferx.dto.engine;

import io.github.sachinnimbal.transferx.dto.field.FieldType;
import org.springframework.core.CollectionFactory;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Array;
import java.util.*;
import java.util.function.UnaryOperator;

/**
 * Rebuilds container values with the container type the domain model declares.
 * Abstract types map to a concrete default: {@code List}/{@code Collection} to
 * {@code ArrayList}, {@code Set} to {@code LinkedHashSet}, {@code Queue} to
 * {@code LinkedList}, {@code Map} to {@code LinkedHashMap}.
 */
public final class Containers {

    private Containers() {
    }

    public static Object rebuildCollection(FieldType type, Object source, UnaryOperator<Object> elementFn) {
        List<Object> results = new ArrayList<>();
        for (Object item : iterate(source, type)) {
            results.add(elementFn.apply(item));
        }
        if (type.isArray()) {
            return toArray(type.getInnerType(0).getRawClass(), results);
        }
        Collection<Object> target = newCollection(type.getRawClass(), results.size());
        target.addAll(results);
        return target;
    }

    public static Object rebuildMapping(FieldType type, Object source,
                                        UnaryOperator<Object> keyFn, UnaryOperator<Object> valueFn) {
        if (!(source instanceof Map<?, ?> map)) {
            throw new IllegalStateException("Expected a map for " + type.getDisplayName() + ", got "
                    + source.getClass().getName());
        }
        Map<Object, Object> target = CollectionFactory.createMap(type.getRawClass(), map.size());
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            target.put(keyFn.apply(entry.getKey()), valueFn.apply(entry.getValue()));
        }
        return target;
    }

    public static Object rebuildTuple(Object source, UnaryOperator<Object> keyFn, UnaryOperator<Object> valueFn) {
        if (source instanceof Map.Entry<?, ?> entry) {
            return new AbstractMap.SimpleImmutableEntry<>(keyFn.apply(entry.getKey()), valueFn.apply(entry.getValue()));
        }
        throw new IllegalStateException("Expected a Map.Entry, got " + source.getClass().getName());
    }

    public static Map.Entry<Object, Object> entry(Object key, Object value) {
        return new AbstractMap.SimpleImmutableEntry<>(key, value);
    }

    private static Iterable<?> iterate(Object source, FieldType type) {
        if (source instanceof Iterable<?> iterable) {
            return iterable;
        }
        if (source.getClass().isArray()) {
            int length = Array.getLength(source);
            List<Object> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(source, i));
            }
            return items;
        }
        throw new IllegalStateException("Expected a collection for " + type.getDisplayName() + ", got "
                + source.getClass().getName());
    }

    /**
     * Typed array when every element fits the component type, {@code Object[]} otherwise
     * (e.g. transfer models standing in for domain elements).
     */
    private static Object toArray(Class<?> componentType, List<Object> items) {
        Class<?> boxed = ClassUtils.resolvePrimitiveIfNecessary(componentType);
        boolean fits = items.stream().allMatch(item -> item == null ? !componentType.isPrimitive() : boxed.isInstance(item));
        Object array = Array.newInstance(fits ? componentType : Object.class, items.size());
        for (int i = 0; i < items.size(); i++) {
            Array.set(array, i, items.get(i));
        }
        return array;
    }

    @SuppressWarnings("unchecked")
    private static Collection<Object> newCollection(Class<?> type, int capacity) {
        if (type == Collection.class || type == Iterable.class || type == List.class) {
            return new ArrayList<>(capacity);
        }
        if (type == Queue.class || type == Deque.class) {
            return new LinkedList<>();
        }
        return (Collection<Object>) CollectionFactory.createCollection(type, capacity);
    }
}
