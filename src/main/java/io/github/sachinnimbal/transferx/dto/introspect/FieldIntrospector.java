package io.github.sachinnimbal.transferx.dto.introspect;

import io.github.sachinnimbal.transferx.dto.field.FieldDefinition;
import io.github.sachinnimbal.transferx.dto.field.FieldType;

import java.util.List;

/**
 * Per model kind (records, beans, JPA entities): enumerates the fields of a
 * model and tells which types are themselves models.
 */
public interface FieldIntrospector {

    /**
     * Field definitions of {@code modelType}, in declaration order. Generic
     * fields are resolved against the type arguments of {@code modelType}.
     */
    List<FieldDefinition> generateFieldDefinitions(FieldType modelType);

    /**
     * Whether {@code fieldType} is a model of this kind, or directly contains one
     * as an immediate inner type.
     */
    boolean detectNestedField(FieldType fieldType);

    boolean isModelType(Class<?> type);

    ModelAccessor accessorFor(Class<?> modelClass);
}
