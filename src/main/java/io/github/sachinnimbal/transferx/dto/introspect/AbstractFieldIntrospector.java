package io.github.sachinnimbal.transferx.dto.introspect;

import io.github.sachinnimbal.transferx.core.annotations.DtoField;
import io.github.sachinnimbal.transferx.core.enums.DtoDirection;
import io.github.sachinnimbal.transferx.core.enums.Mark;
import io.github.sachinnimbal.transferx.core.exception.DtoConfigurationException;
import io.github.sachinnimbal.transferx.dto.field.FieldDefinition;
import io.github.sachinnimbal.transferx.dto.field.FieldType;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public abstract class AbstractFieldIntrospector implements FieldIntrospector {

    private final Map<FieldType, List<FieldDefinition>> definitionCache = new ConcurrentHashMap<>();

    @Override
    public final List<FieldDefinition> generateFieldDefinitions(FieldType modelType) {
        return definitionCache.computeIfAbsent(modelType, type -> {
            List<FieldDefinition> definitions = List.copyOf(introspect(type));
            log.debug("Introspected {} field(s) of {}", definitions.size(), type.getDisplayName());
            return definitions;
        });
    }

    protected abstract List<FieldDefinition> introspect(FieldType modelType);

    @Override
    public boolean detectNestedField(FieldType fieldType) {
        if (isModelType(fieldType.getRawClass())) {
            return true;
        }
        if (fieldType.isCollection() || fieldType.isMapping() || fieldType.isTuple() || fieldType.isUnion()) {
            return fieldType.getInnerTypes().stream().anyMatch(inner -> isModelType(inner.getRawClass()));
        }
        return false;
    }

    @Override
    public ModelAccessor accessorFor(Class<?> modelClass) {
        return ModelAccessors.forClass(modelClass);
    }

    /**
     * A bare type variable that the owning model type leaves unbound carries
     * no usable type information.
     */
    protected static boolean isUnresolvedTypeVariable(Type declared, FieldType resolved) {
        return declared instanceof TypeVariable<?> && resolved.getRawClass() == Object.class;
    }

    protected static boolean isIgnored(DtoField annotation) {
        return annotation != null && annotation.ignore();
    }

    protected static Mark markOf(DtoField annotation, String fieldName) {
        return annotation == null ? Mark.NONE : Mark.fromValue(annotation.mark(), fieldName);
    }

    protected static DtoDirection dtoForOf(DtoField annotation, String fieldName) {
        if (annotation == null || annotation.dtoFor().isEmpty()) {
            return null;
        }
        for (DtoDirection direction : DtoDirection.values()) {
            if (direction.getValue().equals(annotation.dtoFor())) {
                return direction;
            }
        }
        throw new DtoConfigurationException(String.format(
                "Invalid dtoFor '%s' on field '%s'. Valid values are: data, return", annotation.dtoFor(), fieldName));
    }
}
