package io.github.sachinnimbal.transferx.dto.schema;

import io.github.sachinnimbal.transferx.core.enums.Mark;
import io.github.sachinnimbal.transferx.dto.field.FieldDefinition;
import io.github.sachinnimbal.transferx.dto.field.FieldType;
import lombok.Builder;
import lombok.Value;

/**
 * A {@link FieldDefinition} enriched with everything a transfer needs: the
 * wire name, the partial and excluded flags, and the structural type.
 */
@Value
@Builder
public class TransferFieldDefinition {

    FieldDefinition fieldDefinition;
    String serializationName;
    boolean partial;
    boolean excluded;
    TransferType transferType;

    public String getName() {
        return fieldDefinition.getName();
    }

    public FieldType getFieldType() {
        return fieldDefinition.getFieldType();
    }

    public Mark getMark() {
        return fieldDefinition.getMark();
    }

    public boolean hasDefault() {
        return fieldDefinition.hasDefault();
    }
}
