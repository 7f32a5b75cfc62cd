package io.github.sachinnimbal.transferx.dto.engine;

import io.github.sachinnimbal.transferx.dto.model.TransferModelType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builtins of a nested level, tagged with the transfer model they were read
 * from. The tag picks the same union alternative when the builtins are turned
 * back into domain instances.
 */
public final class NestedBuiltins extends LinkedHashMap<String, Object> {

    private static final long serialVersionUID = 1L;

    private final transient TransferModelType modelType;

    public NestedBuiltins(TransferModelType modelType, Map<String, ?> values) {
        super(values);
        this.modelType = modelType;
    }

    public TransferModelType getModelType() {
        return modelType;
    }
}
