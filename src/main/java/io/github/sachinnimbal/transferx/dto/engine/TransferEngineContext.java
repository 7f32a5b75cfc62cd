package io.github.sachinnimbal.transferx.dto.engine;

import io.github.sachinnimbal.transferx.core.enums.DtoDirection;
import io.github.sachinnimbal.transferx.dto.field.FieldType;
import io.github.sachinnimbal.transferx.dto.introspect.FieldIntrospector;
import io.github.sachinnimbal.transferx.dto.model.TransferModelType;
import io.github.sachinnimbal.transferx.dto.schema.TransferFieldDefinition;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TransferEngineContext {
    @NonNull
    List<TransferFieldDefinition> fieldDefinitions;
    /** Handler-level type: the model, or collections of it. */
    @NonNull
    FieldType rootType;
    @NonNull
    Class<?> modelClass;
    @NonNull
    TransferModelType transferModelType;
    @NonNull
    FieldIntrospector introspector;
    /** Direction of the binding, or {@code null} when the engine serves both. */
    DtoDirection direction;
    /** Inbound data is kept as builtins for a {@code DtoData} handler. */
    boolean dtoData;
}
