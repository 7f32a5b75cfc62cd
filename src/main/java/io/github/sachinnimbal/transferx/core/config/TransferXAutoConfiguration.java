/*
 * Copyright 2025 Sachin Nimbal
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.sachinnimbal.transferx.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.github.sachinnimbal.transferx.core.exception.TransferXGlobalExceptionHandler;
import io.github.sachinnimbal.transferx.dto.codec.CodecRegistry;
import io.github.sachinnimbal.transferx.web.*;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Slf4j
@AutoConfiguration(after = {ValidationAutoConfiguration.class, JacksonAutoConfiguration.class})
@EnableConfigurationProperties(TransferXProperties.class)
@ConditionalOnProperty(prefix = "transferx.dto", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TransferXAutoConfiguration {

    public TransferXAutoConfiguration() {
        log.info("✓ TransferX DTO Auto-Configuration activated");
    }

    @Bean
    @ConditionalOnMissingBean
    public CodecRegistry transferXCodecRegistry() {
        CodecRegistry registry = CodecRegistry.defaults();
        log.info("  - Wire codecs: {}", registry.getSupportedMediaTypes());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public DtoRegistry transferXDtoRegistry(TransferXProperties properties, CodecRegistry codecRegistry,
                                            ObjectProvider<Validator> validator) {
        log.info("  - Default transfer backend: {}", properties.getDto().getBackend());
        return new DtoRegistry(properties, codecRegistry, validator.getIfAvailable());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    static class ServletDtoIntegration implements WebMvcConfigurer {

        private final DtoRegistry registry;

        ServletDtoIntegration(DtoRegistry registry) {
            this.registry = registry;
        }

        @Override
        public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
            resolvers.add(new DtoRequestBodyArgumentResolver(registry));
        }

        @Bean
        public DtoResponseBodyAdvice transferXResponseBodyAdvice(ObjectProvider<ObjectMapper> objectMapper) {
            return new DtoResponseBodyAdvice(registry,
                    objectMapper.getIfAvailable(() -> JsonMapper.builder().findAndAddModules().build()));
        }

        @Bean
        @ConditionalOnMissingBean
        public TransferXGlobalExceptionHandler transferXGlobalExceptionHandler() {
            return new TransferXGlobalExceptionHandler();
        }

        @Bean
        @ConditionalOnProperty(prefix = "transferx.dto", name = "eager-registration", havingValue = "true", matchIfMissing = true)
        public DtoHandlerRegistrar transferXHandlerRegistrar(ApplicationContext applicationContext) {
            return new DtoHandlerRegistrar(applicationContext, registry);
        }
    }

    /**
     * Swagger integration for DTO support.
     * Only loaded if springdoc is on the classpath and swagger support is enabled.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "transferx.swagger", name = "enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnClass(name = "org.springdoc.core.customizers.OperationCustomizer")
    static class SwaggerDtoIntegration {

        @Bean
        public DtoOpenApiCustomizer transferXOpenApiCustomizer(DtoRegistry registry) {
            log.info("✓ Swagger DTO integration enabled");
            return new DtoOpenApiCustomizer(registry);
        }
    }
}
