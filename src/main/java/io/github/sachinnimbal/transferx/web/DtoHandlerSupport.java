package io.github.sachinnimbal.transferx.web;

import io.github.sachinnimbal.transferx.core.annotations.DtoBody;
import io.github.sachinnimbal.transferx.core.annotations.UseDto;
import io.github.sachinnimbal.transferx.core.enums.DtoDirection;
import io.github.sachinnimbal.transferx.core.exception.DtoConfigurationException;
import io.github.sachinnimbal.transferx.dto.HandlerContext;
import io.github.sachinnimbal.transferx.dto.field.FieldType;
import org.springframework.core.MethodParameter;
import org.springframework.core.ResolvableType;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpEntity;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Optional;

/**
 * Derives handler ids and {@link HandlerContext}s from controller methods.
 */
public final class DtoHandlerSupport {

    private DtoHandlerSupport() {
    }

    public static String handlerId(Class<?> handlerType, Method method) {
        return ClassUtils.getUserClass(handlerType).getName() + "." + method.getName();
    }

    public static Optional<UseDto> useDto(Method method) {
        return Optional.ofNullable(AnnotatedElementUtils.findMergedAnnotation(method, UseDto.class));
    }

    public static boolean declaresData(UseDto useDto) {
        return useDto.data() != void.class;
    }

    public static boolean declaresReturn(UseDto useDto) {
        return useDto.returns() != void.class;
    }

    public static Optional<MethodParameter> dtoBodyParameter(Method method) {
        return Arrays.stream(method.getParameters())
                .map(MethodParameter::forParameter)
                .filter(parameter -> parameter.hasParameterAnnotation(DtoBody.class))
                .findFirst();
    }

    public static HandlerContext dataContext(Class<?> handlerType, Method method) {
        MethodParameter parameter = dtoBodyParameter(method).orElseThrow(() -> new DtoConfigurationException(
                String.format("%s declares a data DTO but has no @DtoBody parameter", handlerId(handlerType, method))));
        return dataContext(handlerType, parameter);
    }

    public static HandlerContext dataContext(Class<?> handlerType, MethodParameter parameter) {
        return HandlerContext.builder()
                .handlerId(handlerId(handlerType, parameter.getMethod()))
                .direction(DtoDirection.DATA)
                .fieldType(FieldType.of(ResolvableType.forMethodParameter(parameter)))
                .build();
    }

    public static HandlerContext returnContext(Class<?> handlerType, Method method) {
        ResolvableType returnType = ResolvableType.forMethodReturnType(method, ClassUtils.getUserClass(handlerType));
        if (HttpEntity.class.isAssignableFrom(returnType.toClass())) {
            returnType = returnType.as(HttpEntity.class).getGeneric(0);
        }
        if (returnType.toClass() == void.class || returnType.toClass() == Void.class) {
            throw new DtoConfigurationException(String.format(
                    "%s declares a return DTO but returns nothing", handlerId(handlerType, method)));
        }
        return HandlerContext.builder()
                .handlerId(handlerId(handlerType, method))
                .direction(DtoDirection.RETURN)
                .fieldType(FieldType.of(returnType))
                .build();
    }
}
