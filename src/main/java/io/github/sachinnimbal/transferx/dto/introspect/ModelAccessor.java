package io.github.sachinnimbal.transferx.dto.introspect;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads, creates and updates instances of one model class by field name.
 */
public interface ModelAccessor {

    Class<?> getModelClass();

    List<String> getFieldNames();

    boolean hasField(String fieldName);

    /**
     * Pre-bound reader for one field.
     *
     * @throws IllegalArgumentException if the model has no such field
     */
    Function<Object, Object> getter(String fieldName);

    default Object read(Object instance, String fieldName) {
        return getter(fieldName).apply(instance);
    }

    /**
     * Builds a new instance from field values. Fields absent from {@code values}
     * keep the model's own default.
     */
    Object create(Map<String, Object> values);

    /**
     * Applies field values to {@code target}. Mutable models are updated in
     * place and returned; immutable models (records) yield a new instance.
     */
    Object update(Object target, Map<String, Object> values);
}
