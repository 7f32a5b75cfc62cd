package io.github.sachinnimbal.transferx.web;

import io.github.sachinnimbal.transferx.core.annotations.UseDto;
import io.github.sachinnimbal.transferx.dto.AbstractDto;
import io.github.sachinnimbal.transferx.dto.HandlerContext;
import io.github.sachinnimbal.transferx.dto.openapi.DtoSchemaCreator;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.RequestBody;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;
import lombok.extern.slf4j.Slf4j;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springdoc.core.customizers.OperationCustomizer;
import org.springframework.core.MethodParameter;
import org.springframework.web.method.HandlerMethod;

import java.lang.reflect.Method;
import java.util.Optional;

/**
 * Documents {@code @UseDto} handlers with their transfer models instead of the
 * domain models springdoc would infer.
 */
@Slf4j
public class DtoOpenApiCustomizer implements OperationCustomizer, OpenApiCustomizer {

    private static final String JSON = "application/json";

    private final DtoRegistry registry;
    private final DtoSchemaCreator schemaCreator = new DtoSchemaCreator();

    public DtoOpenApiCustomizer(DtoRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Operation customize(Operation operation, HandlerMethod handlerMethod) {
        Method method = handlerMethod.getMethod();
        Optional<UseDto> annotation = DtoHandlerSupport.useDto(method);
        if (annotation.isEmpty()) {
            return operation;
        }
        UseDto useDto = annotation.get();
        Class<?> handlerType = handlerMethod.getBeanType();

        if (DtoHandlerSupport.declaresData(useDto)) {
            HandlerContext context = DtoHandlerSupport.dataContext(handlerType, method);
            Schema<?> schema = schemaFor(useDto.data(), context);
            RequestBody requestBody = operation.getRequestBody() != null ? operation.getRequestBody() : new RequestBody();
            requestBody.setContent(new Content().addMediaType(JSON, new MediaType().schema(schema)));
            requestBody.setRequired(true);
            operation.setRequestBody(requestBody);
            DtoHandlerSupport.dtoBodyParameter(method)
                    .map(MethodParameter::getParameter)
                    .ifPresent(parameter -> {
                        if (operation.getParameters() != null) {
                            operation.getParameters().removeIf(p -> parameter.getName().equals(p.getName()));
                        }
                    });
        }

        if (DtoHandlerSupport.declaresReturn(useDto)) {
            HandlerContext context = DtoHandlerSupport.returnContext(handlerType, method);
            Schema<?> schema = schemaFor(useDto.returns(), context);
            ApiResponses responses = operation.getResponses() != null ? operation.getResponses() : new ApiResponses();
            ApiResponse ok = responses.get("200") != null ? responses.get("200") : new ApiResponse().description("OK");
            ok.setContent(new Content().addMediaType(JSON, new MediaType().schema(schema)));
            responses.addApiResponse("200", ok);
            operation.setResponses(responses);
        }
        return operation;
    }

    private Schema<?> schemaFor(Class<?> dtoClass, HandlerContext context) {
        AbstractDto<?> dto = registry.bind(dtoClass, context);
        return dto.createOpenApiSchema(context.getDirection(), context.getHandlerId(), schemaCreator);
    }

    @Override
    public void customise(OpenAPI openApi) {
        Components components = openApi.getComponents() != null ? openApi.getComponents() : new Components();
        schemaCreator.getComponents().forEach(components::addSchemas);
        openApi.setComponents(components);
        log.debug("Published {} transfer model schema(s)", schemaCreator.getComponents().size());
    }

    DtoSchemaCreator getSchemaCreator() {
        return schemaCreator;
    }
}
