package io.github.sachinnimbal.transferx.dto;

import io.github.sachinnimbal.transferx.core.enums.DtoDirection;
import io.github.sachinnimbal.transferx.dto.field.FieldType;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * What a DTO needs to know about the handler it is bound to.
 */
@Value
@Builder
public class HandlerContext {
    /** Stable handler id, e.g. {@code com.example.PersonController.getPerson}. */
    @NonNull
    String handlerId;
    @NonNull
    DtoDirection direction;
    /** Declared parameter type (data) or return type (return). */
    @NonNull
    FieldType fieldType;
}
