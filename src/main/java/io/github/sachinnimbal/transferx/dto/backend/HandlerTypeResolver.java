package io.github.sachinnimbal.transferx.dto.backend;

import io.github.sachinnimbal.transferx.core.enums.DtoDirection;
import io.github.sachinnimbal.transferx.core.exception.DtoConfigurationException;
import io.github.sachinnimbal.transferx.dto.DtoData;
import io.github.sachinnimbal.transferx.dto.field.FieldType;
import io.github.sachinnimbal.transferx.dto.introspect.ModelAccessors;
import org.springframework.core.ResolvableType;

import java.lang.reflect.Field;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;

/**
 * Works out which part of a handler's declared type the DTO applies to.
 *
 * <p>{@code Optional<T>} and {@code DtoData<T>} are unwrapped, collections
 * are kept as the root shape around the model. A return type that is not
 * the model itself may be a generic wrapper ({@code Page<Person>}) with one
 * field holding the model; that field becomes the transfer target.
 */
public final class HandlerTypeResolver {

    private HandlerTypeResolver() {
    }

    public static HandlerTypeResolution resolve(FieldType handlerType, Class<?> dtoModelClass, DtoDirection direction) {
        FieldType type = handlerType;
        boolean optional = false;
        boolean dtoData = false;
        if (type.isOptional()) {
            optional = true;
            type = type.getInnerType(0);
        }
        if (type.isSubclassOf(DtoData.class)) {
            dtoData = true;
            type = type.getInnerType(0);
        }

        FieldType model = innermost(type);
        if (model.isSubclassOf(dtoModelClass)) {
            if (dtoData && type.isCollection()) {
                throw new DtoConfigurationException(String.format(
                        "DtoData must wrap a single model, handler type is '%s'", handlerType.getDisplayName()));
            }
            return new HandlerTypeResolution(type, model, optional, dtoData, null);
        }

        if (!type.isCollection() && !dtoData) {
            for (Field field : ModelAccessors.declaredFields(type.getRawClass())) {
                if (!isGeneric(field.getGenericType())) {
                    continue;
                }
                FieldType fieldType = FieldType.of(ResolvableType.forField(field, type.getResolvableType()));
                FieldType wrapped = innermost(fieldType);
                if (wrapped.isSubclassOf(dtoModelClass)) {
                    if (direction.isData()) {
                        throw new DtoConfigurationException(String.format(
                                "Generic wrapper '%s' is only supported for return values",
                                handlerType.getDisplayName()));
                    }
                    return new HandlerTypeResolution(fieldType, wrapped, optional, false, field.getName());
                }
            }
        }

        throw new DtoConfigurationException(String.format(
                "DTO narrowed with '%s', handler type is '%s'",
                dtoModelClass.getName(), handlerType.getDisplayName()));
    }

    private static FieldType innermost(FieldType type) {
        FieldType current = type;
        while (current.isCollection()) {
            current = current.getInnerType(0);
        }
        return current;
    }

    private static boolean isGeneric(Type type) {
        if (type instanceof TypeVariable<?>) {
            return true;
        }
        if (type instanceof ParameterizedType parameterized) {
            for (Type argument : parameterized.getActualTypeArguments()) {
                if (isGeneric(argument)) {
                    return true;
                }
            }
        }
        return false;
    }
}
