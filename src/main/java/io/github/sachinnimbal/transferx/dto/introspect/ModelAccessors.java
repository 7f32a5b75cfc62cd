package io.github.sachinnimbal.transferx.dto.introspect;

import java.lang.reflect.Field;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide cache of {@link ModelAccessor}s, one per model class.
 */
public final class ModelAccessors {

    private static final Map<Class<?>, ModelAccessor> CACHE = new ConcurrentHashMap<>();

    private ModelAccessors() {
    }

    public static ModelAccessor forClass(Class<?> modelClass) {
        return CACHE.computeIfAbsent(modelClass, c -> c.isRecord()
                ? new RecordModelAccessor(c)
                : new BeanModelAccessor(c));
    }

    public static BeanModelAccessor forBean(Class<?> beanClass) {
        ModelAccessor accessor = forClass(beanClass);
        if (accessor instanceof BeanModelAccessor bean) {
            return bean;
        }
        throw new IllegalArgumentException(beanClass.getName() + " is a record, not a bean");
    }

    /**
     * Instance fields of a model class, superclass fields first. For records
     * these are exactly the components.
     */
    public static List<Field> declaredFields(Class<?> modelClass) {
        return BeanModelAccessor.collectFields(modelClass);
    }

    public static int size() {
        return CACHE.size();
    }
}
