package io.github.sachinnimbal.transferx.dto.introspect;

import io.github.sachinnimbal.transferx.core.annotations.DtoField;
import io.github.sachinnimbal.transferx.core.enums.Mark;
import io.github.sachinnimbal.transferx.dto.field.FieldDefinition;
import io.github.sachinnimbal.transferx.dto.field.FieldType;
import org.springframework.core.ResolvableType;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;

/**
 * Introspects mutable JavaBeans. The value a field holds on a freshly
 * constructed instance is its default, so bean fields are never required on
 * the wire. Fields without a setter that are not marked otherwise are
 * read-only.
 */
public class BeanFieldIntrospector extends AbstractFieldIntrospector {

    private static final List<String> PLATFORM_PACKAGES = List.of("java.", "javax.", "jakarta.", "sun.", "jdk.");

    @Override
    protected List<FieldDefinition> introspect(FieldType modelType) {
        Class<?> beanClass = modelType.getRawClass();
        BeanModelAccessor accessor = ModelAccessors.forBean(beanClass);
        List<FieldDefinition> definitions = new ArrayList<>();
        for (Field field : accessor.getFields()) {
            DtoField annotation = field.getAnnotation(DtoField.class);
            if (isIgnored(annotation) || skipField(field)) {
                continue;
            }
            FieldType fieldType = FieldType.of(ResolvableType.forField(field, modelType.getResolvableType()));
            if (isUnresolvedTypeVariable(field.getGenericType(), fieldType)) {
                continue;
            }
            String name = field.getName();
            Mark mark = refineMark(field, markOf(annotation, name));
            // nothing can write it on the way in
            if (mark == Mark.NONE && !accessor.isWritable(name)) {
                mark = Mark.READ_ONLY;
            }
            FieldDefinition.FieldDefinitionBuilder builder = FieldDefinition.builder()
                    .name(name)
                    .fieldType(fieldType)
                    .mark(mark)
                    .dtoFor(dtoForOf(annotation, name))
                    .modelName(beanClass.getSimpleName());
            if (accessor.isInstantiable()) {
                builder.defaultFactory(() -> accessor.read(accessor.newInstance(), name));
            }
            definitions.add(builder.build());
        }
        return definitions;
    }

    /**
     * Hook for subclasses that skip framework-managed fields.
     */
    protected boolean skipField(Field field) {
        return false;
    }

    /**
     * Hook for subclasses that derive a mark from framework annotations.
     */
    protected Mark refineMark(Field field, Mark declared) {
        return declared;
    }

    @Override
    public boolean isModelType(Class<?> type) {
        if (type == null || type.isPrimitive() || type.isArray() || type.isEnum() || type.isInterface()
                || type.isRecord() || Modifier.isAbstract(type.getModifiers())) {
            return false;
        }
        String name = type.getName();
        for (String prefix : PLATFORM_PACKAGES) {
            if (name.startsWith(prefix)) {
                return false;
            }
        }
        try {
            type.getDeclaredConstructor();
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }
}
