package io.github.sachinnimbal.transferx.dto.introspect;

import io.github.sachinnimbal.transferx.core.annotations.DtoField;
import io.github.sachinnimbal.transferx.dto.field.FieldDefinition;
import io.github.sachinnimbal.transferx.dto.field.FieldType;
import org.springframework.core.ResolvableType;

import java.lang.reflect.Field;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.List;

/**
 * Introspects records. Record components have no defaults, so every field is
 * required on the wire unless the DTO is partial.
 */
public class RecordFieldIntrospector extends AbstractFieldIntrospector {

    @Override
    protected List<FieldDefinition> introspect(FieldType modelType) {
        Class<?> recordClass = modelType.getRawClass();
        List<FieldDefinition> definitions = new ArrayList<>();
        for (RecordComponent component : recordClass.getRecordComponents()) {
            DtoField annotation = component.getAnnotation(DtoField.class);
            if (isIgnored(annotation)) {
                continue;
            }
            Field backingField = backingField(recordClass, component.getName());
            FieldType fieldType = FieldType.of(ResolvableType.forField(backingField, modelType.getResolvableType()));
            if (isUnresolvedTypeVariable(component.getGenericType(), fieldType)) {
                continue;
            }
            definitions.add(FieldDefinition.builder()
                    .name(component.getName())
                    .fieldType(fieldType)
                    .mark(markOf(annotation, component.getName()))
                    .dtoFor(dtoForOf(annotation, component.getName()))
                    .modelName(recordClass.getSimpleName())
                    .build());
        }
        return definitions;
    }

    private static Field backingField(Class<?> recordClass, String name) {
        try {
            return recordClass.getDeclaredField(name);
        } catch (NoSuchFieldException e) {
            throw new IllegalStateException("Record " + recordClass.getName() + " has no field for component " + name, e);
        }
    }

    @Override
    public boolean isModelType(Class<?> type) {
        return type != null && type.isRecord();
    }
}
