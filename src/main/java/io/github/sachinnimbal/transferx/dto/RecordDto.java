package io.github.sachinnimbal.transferx.dto;

import io.github.sachinnimbal.transferx.dto.config.DtoConfig;
import io.github.sachinnimbal.transferx.dto.introspect.RecordFieldIntrospector;

/**
 * DTO for record models. Every component without a value on the wire is
 * required unless the DTO is partial.
 */
public class RecordDto<T> extends AbstractDto<T> {

    private static final RecordFieldIntrospector INTROSPECTOR = new RecordFieldIntrospector();

    protected RecordDto() {
        this(DtoConfig.defaults());
    }

    protected RecordDto(DtoConfig config) {
        super(config, INTROSPECTOR);
    }

    protected RecordDto(Class<T> modelClass, DtoConfig config) {
        super(modelClass, config, INTROSPECTOR);
    }

    public static <T> RecordDto<T> of(Class<T> modelClass, DtoConfig config) {
        return new RecordDto<>(modelClass, config);
    }
}
