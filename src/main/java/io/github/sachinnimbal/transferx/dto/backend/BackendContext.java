package io.github.sachinnimbal.transferx.dto.backend;

import io.github.sachinnimbal.transferx.core.enums.DtoDirection;
import io.github.sachinnimbal.transferx.core.enums.TransferBackendMode;
import io.github.sachinnimbal.transferx.core.exception.ValidationError;
import io.github.sachinnimbal.transferx.dto.codec.CodecRegistry;
import io.github.sachinnimbal.transferx.dto.config.DtoConfig;
import io.github.sachinnimbal.transferx.dto.introspect.FieldIntrospector;
import io.github.sachinnimbal.transferx.dto.model.TransferModelNameRegistry;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;
import java.util.function.Function;

@Value
@Builder
public class BackendContext {
    @NonNull
    String handlerId;
    @NonNull
    DtoDirection direction;
    @NonNull
    HandlerTypeResolution resolution;
    @NonNull
    DtoConfig config;
    @NonNull
    FieldIntrospector introspector;
    @NonNull
    TransferBackendMode backendMode;
    @NonNull
    CodecRegistry codecRegistry;
    @NonNull
    TransferModelNameRegistry nameRegistry;
    /** Validates a decoded domain instance; empty list when valid. */
    Function<Object, List<ValidationError>> domainValidator;
}
