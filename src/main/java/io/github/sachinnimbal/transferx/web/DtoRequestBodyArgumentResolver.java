package io.github.sachinnimbal.transferx.web;

import io.github.sachinnimbal.transferx.core.annotations.DtoBody;
import io.github.sachinnimbal.transferx.core.annotations.UseDto;
import io.github.sachinnimbal.transferx.core.exception.DtoConfigurationException;
import io.github.sachinnimbal.transferx.dto.AbstractDto;
import io.github.sachinnimbal.transferx.dto.HandlerContext;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.MethodParameter;
import org.springframework.util.StreamUtils;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Populates {@link DtoBody} parameters by decoding the request body with the
 * handler's {@code @UseDto(data = ...)} DTO.
 */
@Slf4j
public class DtoRequestBodyArgumentResolver implements HandlerMethodArgumentResolver {

    private final DtoRegistry registry;

    public DtoRequestBodyArgumentResolver(DtoRegistry registry) {
        this.registry = registry;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(DtoBody.class);
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) throws Exception {
        UseDto useDto = DtoHandlerSupport.useDto(parameter.getMethod())
                .filter(DtoHandlerSupport::declaresData)
                .orElseThrow(() -> new DtoConfigurationException(
                        "@DtoBody requires @UseDto(data = ...) on " + parameter.getMethod()));

        HandlerContext context = DtoHandlerSupport.dataContext(parameter.getContainingClass(), parameter);
        AbstractDto<?> dto = registry.bind(useDto.data(), context);

        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        if (request == null) {
            throw new IllegalStateException("@DtoBody is only supported for servlet requests");
        }
        byte[] body = StreamUtils.copyToByteArray(request.getInputStream());
        log.debug("Decoding {} byte(s) of {} for {}", body.length, request.getContentType(), context.getHandlerId());

        return dto.decodeBytes(context.getHandlerId(), body, request.getContentType());
    }
}
