package io.github.sachinnimbal.transferx.dto;

import io.github.sachinnimbal.transferx.dto.config.DtoConfig;
import io.github.sachinnimbal.transferx.dto.introspect.BeanFieldIntrospector;

/**
 * DTO for mutable JavaBeans with a no-argument constructor.
 */
public class BeanDto<T> extends AbstractDto<T> {

    private static final BeanFieldIntrospector INTROSPECTOR = new BeanFieldIntrospector();

    protected BeanDto() {
        this(DtoConfig.defaults());
    }

    protected BeanDto(DtoConfig config) {
        super(config, INTROSPECTOR);
    }

    protected BeanDto(Class<T> modelClass, DtoConfig config) {
        super(modelClass, config, INTROSPECTOR);
    }

    public static <T> BeanDto<T> of(Class<T> modelClass, DtoConfig config) {
        return new BeanDto<>(modelClass, config);
    }
}
