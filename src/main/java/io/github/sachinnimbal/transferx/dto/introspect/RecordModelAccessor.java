package io.github.sachinnimbal.transferx.dto.introspect;

import io.github.sachinnimbal.transferx.core.exception.DtoConfigurationException;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.*;
import java.util.function.Function;

/**
 * {@link ModelAccessor} for records: component accessors and the canonical
 * constructor, bound once as MethodHandles.
 */
public final class RecordModelAccessor implements ModelAccessor {

    private static final MethodHandles.Lookup LOOKUP = MethodHandles.lookup();

    private final Class<?> recordClass;
    private final List<String> fieldNames;
    private final Class<?>[] componentTypes;
    private final Map<String, Integer> positions;
    private final Map<String, Function<Object, Object>> getters;
    private final MethodHandle constructor;

    RecordModelAccessor(Class<?> recordClass) {
        if (!recordClass.isRecord()) {
            throw new DtoConfigurationException(recordClass.getName() + " is not a record");
        }
        this.recordClass = recordClass;
        RecordComponent[] components = recordClass.getRecordComponents();
        List<String> names = new ArrayList<>(components.length);
        Map<String, Integer> pos = new HashMap<>();
        Map<String, Function<Object, Object>> readers = new LinkedHashMap<>();
        this.componentTypes = new Class<?>[components.length];

        try {
            for (int i = 0; i < components.length; i++) {
                RecordComponent component = components[i];
                names.add(component.getName());
                pos.put(component.getName(), i);
                componentTypes[i] = component.getType();
                readers.put(component.getName(), bindGetter(component));
            }
            Constructor<?> canonical = recordClass.getDeclaredConstructor(componentTypes);
            canonical.setAccessible(true);
            this.constructor = LOOKUP.unreflectConstructor(canonical);
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new DtoConfigurationException("Cannot bind record accessors for " + recordClass.getName(), e);
        }

        this.fieldNames = List.copyOf(names);
        this.positions = Map.copyOf(pos);
        this.getters = Collections.unmodifiableMap(readers);
    }

    private static Function<Object, Object> bindGetter(RecordComponent component) throws IllegalAccessException {
        Method accessor = component.getAccessor();
        accessor.setAccessible(true);
        MethodHandle handle = LOOKUP.unreflect(accessor);
        return instance -> {
            try {
                return handle.invoke(instance);
            } catch (Throwable e) {
                throw new IllegalStateException("Cannot read record component '" + component.getName() + "'", e);
            }
        };
    }

    @Override
    public Class<?> getModelClass() {
        return recordClass;
    }

    @Override
    public List<String> getFieldNames() {
        return fieldNames;
    }

    @Override
    public boolean hasField(String fieldName) {
        return positions.containsKey(fieldName);
    }

    @Override
    public Function<Object, Object> getter(String fieldName) {
        Function<Object, Object> getter = getters.get(fieldName);
        if (getter == null) {
            throw new IllegalArgumentException(recordClass.getSimpleName() + " has no component '" + fieldName + "'");
        }
        return getter;
    }

    @Override
    public Object create(Map<String, Object> values) {
        Object[] args = new Object[componentTypes.length];
        for (int i = 0; i < args.length; i++) {
            args[i] = Primitives.defaultValue(componentTypes[i]);
        }
        fill(args, values);
        return construct(args);
    }

    @Override
    public Object update(Object target, Map<String, Object> values) {
        Object[] args = new Object[componentTypes.length];
        for (int i = 0; i < args.length; i++) {
            args[i] = getters.get(fieldNames.get(i)).apply(target);
        }
        fill(args, values);
        return construct(args);
    }

    private void fill(Object[] args, Map<String, Object> values) {
        values.forEach((name, value) -> {
            Integer index = positions.get(name);
            if (index != null) {
                args[index] = value == null ? Primitives.defaultValue(componentTypes[index]) : value;
            }
        });
    }

    private Object construct(Object[] args) {
        try {
            return constructor.invokeWithArguments(args);
        } catch (Throwable e) {
            throw new IllegalStateException("Cannot instantiate record " + recordClass.getName(), e);
        }
    }
}
