package io.github.sachinnimbal.transferx.dto.schema;

import io.github.sachinnimbal.transferx.dto.model.TransferModelType;

import java.util.List;

/**
 * A nested model level: its synthesized transfer model and its own field schema.
 */
public record NestedFieldInfo(TransferModelType model, List<TransferFieldDefinition> fieldDefinitions) {

    public NestedFieldInfo {
        fieldDefinitions = List.copyOf(fieldDefinitions);
    }
}
