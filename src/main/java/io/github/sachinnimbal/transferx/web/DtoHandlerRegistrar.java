package io.github.sachinnimbal.transferx.web;

import io.github.sachinnimbal.transferx.core.annotations.UseDto;
import io.github.sachinnimbal.transferx.core.exception.DtoConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.context.ApplicationContext;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

import java.lang.reflect.Method;
import java.util.Optional;

/**
 * Binds every {@code @UseDto} handler once all singletons exist, so a DTO
 * that does not fit its handler stops the application at startup.
 */
@Slf4j
public class DtoHandlerRegistrar implements SmartInitializingSingleton {

    private final ApplicationContext applicationContext;
    private final DtoRegistry registry;

    public DtoHandlerRegistrar(ApplicationContext applicationContext, DtoRegistry registry) {
        this.applicationContext = applicationContext;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        int bound = 0;
        for (RequestMappingHandlerMapping mapping
                : applicationContext.getBeansOfType(RequestMappingHandlerMapping.class).values()) {
            for (HandlerMethod handlerMethod : mapping.getHandlerMethods().values()) {
                bound += register(handlerMethod);
            }
        }
        if (bound > 0) {
            log.info("✓ TransferX bound {} handler DTO(s)", bound);
        }
    }

    int register(HandlerMethod handlerMethod) {
        Method method = handlerMethod.getMethod();
        Optional<UseDto> annotation = DtoHandlerSupport.useDto(method);
        if (annotation.isEmpty()) {
            return 0;
        }
        UseDto useDto = annotation.get();
        Class<?> handlerType = handlerMethod.getBeanType();
        int bound = 0;
        try {
            if (DtoHandlerSupport.declaresData(useDto)) {
                registry.bind(useDto.data(), DtoHandlerSupport.dataContext(handlerType, method));
                bound++;
            }
            if (DtoHandlerSupport.declaresReturn(useDto)) {
                registry.bind(useDto.returns(), DtoHandlerSupport.returnContext(handlerType, method));
                bound++;
            }
        } catch (DtoConfigurationException e) {
            log.error("❌ Invalid DTO binding on {}: {}", DtoHandlerSupport.handlerId(handlerType, method), e.getMessage());
            throw e;
        }
        return bound;
    }
}
