package io.github.sachinnimbal.transferx.dto.backend;

import io.github.sachinnimbal.transferx.dto.field.FieldType;

/**
 * @param rootType              the type the engines transfer: the model or collections of it
 * @param modelType             the model type, generics bound from the handler
 * @param optional              the handler declared {@code Optional<...>}
 * @param dtoData               the handler declared {@code DtoData<...>}
 * @param wrapperAttributeName  field of a generic wrapper that holds {@code rootType}, or {@code null}
 */
public record HandlerTypeResolution(FieldType rootType, FieldType modelType, boolean optional, boolean dtoData,
                                    String wrapperAttributeName) {

    public boolean isWrapped() {
        return wrapperAttributeName != null;
    }
}
