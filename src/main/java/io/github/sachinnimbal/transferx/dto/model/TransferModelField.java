package io.github.sachinnimbal.transferx.dto.model;

import io.github.sachinnimbal.transferx.dto.field.FieldDefinition;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TransferModelField {
    /** Key on the wire and in {@link TransferModel}. */
    String serializationName;
    /** Attribute name on the domain model. */
    String name;
    TransferAnnotation annotation;
    boolean partial;
    FieldDefinition fieldDefinition;

    public boolean isRequired() {
        return !partial && !fieldDefinition.hasDefault();
    }

    public Object resolveDefault() {
        return fieldDefinition.resolveDefault();
    }
}
