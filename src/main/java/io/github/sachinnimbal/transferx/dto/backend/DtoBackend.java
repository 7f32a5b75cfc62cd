package io.github.sachinnimbal.transferx.dto.backend;

import io.github.sachinnimbal.transferx.core.enums.TransferBackendMode;
import io.github.sachinnimbal.transferx.core.exception.DtoValidationException;
import io.github.sachinnimbal.transferx.core.exception.ValidationError;
import io.github.sachinnimbal.transferx.dto.DtoData;
import io.github.sachinnimbal.transferx.dto.codec.WireCodec;
import io.github.sachinnimbal.transferx.dto.engine.CompiledTransferEngine;
import io.github.sachinnimbal.transferx.dto.engine.InterpretedTransferEngine;
import io.github.sachinnimbal.transferx.dto.engine.TransferEngine;
import io.github.sachinnimbal.transferx.dto.engine.TransferEngineContext;
import io.github.sachinnimbal.transferx.dto.introspect.ModelAccessor;
import io.github.sachinnimbal.transferx.dto.introspect.ModelAccessors;
import io.github.sachinnimbal.transferx.dto.model.TransferAnnotation;
import io.github.sachinnimbal.transferx.dto.model.TransferModelSynthesizer;
import io.github.sachinnimbal.transferx.dto.model.TransferModelType;
import io.github.sachinnimbal.transferx.dto.schema.SchemaBuilder;
import io.github.sachinnimbal.transferx.dto.schema.TransferFieldDefinition;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One DTO binding: the field schema, transfer model and engine built for a
 * (direction, handler type) pair. Immutable once constructed.
 */
@Slf4j
@Getter
public class DtoBackend {

    private final BackendContext context;
    private final List<TransferFieldDefinition> parsedFieldDefinitions;
    private final TransferModelType transferModelType;
    private final TransferAnnotation annotation;
    private final TransferEngine engine;

    public DtoBackend(BackendContext context) {
        this.context = context;
        HandlerTypeResolution resolution = context.getResolution();

        TransferModelSynthesizer synthesizer = new TransferModelSynthesizer(context.getHandlerId(),
                context.getDirection(), context.getConfig().isForbidUnknownFields(), context.getNameRegistry());
        SchemaBuilder schemaBuilder = new SchemaBuilder(context.getConfig(), context.getIntrospector(),
                context.getDirection(), synthesizer);

        this.parsedFieldDefinitions = schemaBuilder.parseModel(resolution.modelType());
        this.transferModelType = synthesizer.createTransferModelType(
                resolution.modelType().getRawClass().getSimpleName(), parsedFieldDefinitions);
        this.annotation = TransferModelSynthesizer.wrapHandlerAnnotation(resolution.rootType(), transferModelType);

        TransferEngineContext engineContext = TransferEngineContext.builder()
                .fieldDefinitions(parsedFieldDefinitions)
                .rootType(resolution.rootType())
                .modelClass(resolution.modelType().getRawClass())
                .transferModelType(transferModelType)
                .introspector(context.getIntrospector())
                .direction(context.getDirection())
                .dtoData(resolution.dtoData())
                .build();
        this.engine = context.getBackendMode() == TransferBackendMode.CODEGEN
                ? new CompiledTransferEngine(engineContext)
                : new InterpretedTransferEngine(engineContext);
    }

    public boolean isDtoDataField() {
        return context.getResolution().dtoData();
    }

    /**
     * Decodes raw wire bytes. Returns domain instance(s), or a {@link DtoData}
     * when the handler asked for one, wrapped in an {@code Optional} when the
     * handler declared it.
     */
    public Object populateDataFromRaw(byte[] raw, String contentType) {
        WireCodec codec = context.getCodecRegistry().forMediaType(contentType);
        return populate(codec.decode(raw, annotation));
    }

    /**
     * Same as {@link #populateDataFromRaw} for payloads already parsed into maps and lists.
     */
    public Object populateDataFromBuiltins(Object builtins) {
        return populate(context.getCodecRegistry().json().convert(builtins, annotation));
    }

    @SuppressWarnings("unchecked")
    private Object populate(Object transferData) {
        Object data;
        if (isDtoDataField()) {
            data = transferData == null
                    ? null
                    : new DtoData<>(this, (Map<String, Object>) engine.decodeToBuiltins(transferData));
        } else {
            data = engine.decode(transferData);
            if (!context.getConfig().isPartial()) {
                validate(data);
            }
        }
        return context.getResolution().optional() ? Optional.ofNullable(data) : data;
    }

    public Object transferDataFromBuiltins(Map<String, Object> builtins) {
        return engine.decodeFromBuiltins(builtins);
    }

    public Map<String, Object> transferFieldValuesFromBuiltins(Map<String, Object> builtins) {
        return engine.decodeFieldValues(builtins);
    }

    /**
     * Domain data to transfer model(s), ready for any Jackson-based writer.
     * A generic wrapper is kept and only its wrapped field is transferred.
     * An empty {@code Optional} encodes to {@code null}.
     */
    public Object encodeData(Object data) {
        if (data instanceof Optional<?> optional && context.getResolution().optional()) {
            data = optional.orElse(null);
        }
        if (data == null) {
            return null;
        }
        String wrapperAttribute = context.getResolution().wrapperAttributeName();
        if (wrapperAttribute == null) {
            return engine.encode(data);
        }
        ModelAccessor wrapper = ModelAccessors.forClass(data.getClass());
        Object encoded = engine.encode(wrapper.read(data, wrapperAttribute));
        return wrapper.update(data, Collections.singletonMap(wrapperAttribute, encoded));
    }

    public byte[] encodeToBytes(Object data, String contentType) {
        return context.getCodecRegistry().forMediaType(contentType).encode(encodeData(data));
    }

    private void validate(Object data) {
        if (data == null || context.getDomainValidator() == null) {
            return;
        }
        List<ValidationError> errors;
        if (data instanceof Iterable<?> items) {
            errors = new ArrayList<>();
            int index = 0;
            for (Object item : items) {
                String prefix = "$[" + index++ + "]";
                for (ValidationError error : context.getDomainValidator().apply(item)) {
                    errors.add(new ValidationError(prefix + error.getPath().substring(1), error.getMessage()));
                }
            }
        } else {
            errors = context.getDomainValidator().apply(data);
        }
        if (!errors.isEmpty()) {
            throw new DtoValidationException(errors);
        }
    }
}
