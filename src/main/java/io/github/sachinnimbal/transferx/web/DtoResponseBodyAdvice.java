package io.github.sachinnimbal.transferx.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.sachinnimbal.transferx.core.annotations.UseDto;
import io.github.sachinnimbal.transferx.dto.AbstractDto;
import io.github.sachinnimbal.transferx.dto.HandlerContext;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Replaces the return value of {@code @UseDto(returns = ...)} handlers with
 * its transfer model before the message converter writes it.
 *
 * <p>The encoded value is handed over as a Jackson tree: the converter would
 * otherwise serialize it against the handler's declared (domain) type.
 */
@ControllerAdvice
public class DtoResponseBodyAdvice implements ResponseBodyAdvice<Object> {

    private final DtoRegistry registry;
    private final ObjectMapper objectMapper;

    public DtoResponseBodyAdvice(DtoRegistry registry, ObjectMapper objectMapper) {
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return returnType.getMethod() != null
                && DtoHandlerSupport.useDto(returnType.getMethod()).filter(DtoHandlerSupport::declaresReturn).isPresent();
    }

    @Override
    public Object beforeBodyWrite(Object body, MethodParameter returnType, MediaType selectedContentType,
                                  Class<? extends HttpMessageConverter<?>> selectedConverterType,
                                  ServerHttpRequest request, ServerHttpResponse response) {
        if (body == null) {
            return null;
        }
        UseDto useDto = DtoHandlerSupport.useDto(returnType.getMethod()).orElseThrow();
        HandlerContext context = DtoHandlerSupport.returnContext(returnType.getContainingClass(), returnType.getMethod());
        AbstractDto<?> dto = registry.bind(useDto.returns(), context);
        Object encoded = dto.encode(context.getHandlerId(), body);
        return encoded == null ? null : objectMapper.valueToTree(encoded);
    }
}
