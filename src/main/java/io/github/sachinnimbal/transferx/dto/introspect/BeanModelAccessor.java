package io.github.sachinnimbal.transferx.dto.introspect;

import io.github.sachinnimbal.transferx.core.exception.DtoConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.*;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * {@link ModelAccessor} for mutable JavaBeans and JPA entities. Prefers
 * getters and setters, falls back to direct field access.
 */
@Slf4j
public final class BeanModelAccessor implements ModelAccessor {

    private static final MethodHandles.Lookup LOOKUP = MethodHandles.lookup();

    private final Class<?> beanClass;
    private final List<Field> fields;
    private final List<String> fieldNames;
    private final Map<String, Function<Object, Object>> getters = new LinkedHashMap<>();
    private final Map<String, BiConsumer<Object, Object>> setters = new HashMap<>();
    private final MethodHandle constructor;

    BeanModelAccessor(Class<?> beanClass) {
        this.beanClass = beanClass;
        this.fields = collectFields(beanClass);
        List<String> names = new ArrayList<>(fields.size());
        try {
            for (Field field : fields) {
                names.add(field.getName());
                getters.put(field.getName(), createFastGetter(field));
                BiConsumer<Object, Object> setter = createFastSetter(field);
                if (setter != null) {
                    setters.put(field.getName(), setter);
                }
            }
            this.constructor = findNoArgConstructor(beanClass);
        } catch (IllegalAccessException e) {
            throw new DtoConfigurationException("Cannot bind accessors for " + beanClass.getName(), e);
        }
        this.fieldNames = List.copyOf(names);
    }

    /**
     * Instance fields of the class hierarchy, superclass fields first.
     */
    static List<Field> collectFields(Class<?> type) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.push(c);
        }
        List<Field> result = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field field : c.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
                    continue;
                }
                result.add(field);
            }
        }
        return result;
    }

    List<Field> getFields() {
        return fields;
    }

    private Function<Object, Object> createFastGetter(Field field) throws IllegalAccessException {
        MethodHandle handle = findGetter(field);
        String name = field.getName();
        return instance -> {
            try {
                return handle.invoke(instance);
            } catch (Throwable e) {
                throw new IllegalStateException("Cannot read '" + name + "' of " + beanClass.getSimpleName(), e);
            }
        };
    }

    private MethodHandle findGetter(Field field) throws IllegalAccessException {
        String suffix = capitalize(field.getName());
        List<String> candidates = new ArrayList<>(2);
        candidates.add("get" + suffix);
        if (field.getType() == boolean.class || field.getType() == Boolean.class) {
            candidates.add("is" + suffix);
        }
        for (String methodName : candidates) {
            try {
                return LOOKUP.findVirtual(field.getDeclaringClass(), methodName, MethodType.methodType(field.getType()));
            } catch (NoSuchMethodException | IllegalAccessException e) {
                log.trace("No accessible {}() on {}, trying next accessor", methodName, beanClass.getSimpleName());
            }
        }
        field.setAccessible(true);
        return LOOKUP.unreflectGetter(field);
    }

    private BiConsumer<Object, Object> createFastSetter(Field field) throws IllegalAccessException {
        MethodHandle handle;
        try {
            handle = LOOKUP.findVirtual(field.getDeclaringClass(), "set" + capitalize(field.getName()),
                    MethodType.methodType(void.class, field.getType()));
        } catch (NoSuchMethodException | IllegalAccessException e) {
            if (Modifier.isFinal(field.getModifiers())) {
                return null;
            }
            field.setAccessible(true);
            handle = LOOKUP.unreflectSetter(field);
        }
        MethodHandle setter = handle;
        String name = field.getName();
        Object primitiveDefault = Primitives.defaultValue(field.getType());
        return (instance, value) -> {
            try {
                setter.invoke(instance, value == null ? primitiveDefault : value);
            } catch (Throwable e) {
                throw new IllegalStateException("Cannot write '" + name + "' of " + beanClass.getSimpleName(), e);
            }
        };
    }

    private static MethodHandle findNoArgConstructor(Class<?> type) throws IllegalAccessException {
        if (Modifier.isAbstract(type.getModifiers()) || type.isInterface()) {
            return null;
        }
        try {
            Constructor<?> ctor = type.getDeclaredConstructor();
            ctor.setAccessible(true);
            return LOOKUP.unreflectConstructor(ctor);
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private static String capitalize(String str) {
        if (str == null || str.isEmpty()) return str;
        return Character.toUpperCase(str.charAt(0)) + str.substring(1);
    }

    public boolean isInstantiable() {
        return constructor != null;
    }

    public Object newInstance() {
        if (constructor == null) {
            throw new DtoConfigurationException(beanClass.getName() + " needs a no-argument constructor");
        }
        try {
            return constructor.invoke();
        } catch (Throwable e) {
            throw new IllegalStateException("Cannot instantiate " + beanClass.getName(), e);
        }
    }

    @Override
    public Class<?> getModelClass() {
        return beanClass;
    }

    @Override
    public List<String> getFieldNames() {
        return fieldNames;
    }

    @Override
    public boolean hasField(String fieldName) {
        return getters.containsKey(fieldName);
    }

    public boolean isWritable(String fieldName) {
        return setters.containsKey(fieldName);
    }

    @Override
    public Function<Object, Object> getter(String fieldName) {
        Function<Object, Object> getter = getters.get(fieldName);
        if (getter == null) {
            throw new IllegalArgumentException(beanClass.getSimpleName() + " has no field '" + fieldName + "'");
        }
        return getter;
    }

    @Override
    public Object create(Map<String, Object> values) {
        return update(newInstance(), values);
    }

    @Override
    public Object update(Object target, Map<String, Object> values) {
        values.forEach((name, value) -> {
            BiConsumer<Object, Object> setter = setters.get(name);
            if (setter == null) {
                if (hasField(name)) {
                    throw new IllegalStateException("Field '" + name + "' of " + beanClass.getSimpleName() + " is not writable");
                }
                return;
            }
            setter.accept(target, value);
        });
        return target;
    }
}
