package io.github.sachinnimbal.transferx.dto;

import io.github.sachinnimbal.transferx.dto.config.DtoConfig;
import io.github.sachinnimbal.transferx.dto.introspect.JpaFieldIntrospector;

/**
 * DTO for JPA entities and embeddables. Transient fields are skipped; generated
 * ids and version columns are read-only.
 */
public class JpaDto<T> extends AbstractDto<T> {

    private static final JpaFieldIntrospector INTROSPECTOR = new JpaFieldIntrospector();

    protected JpaDto() {
        this(DtoConfig.defaults());
    }

    protected JpaDto(DtoConfig config) {
        super(config, INTROSPECTOR);
    }

    protected JpaDto(Class<T> modelClass, DtoConfig config) {
        super(modelClass, config, INTROSPECTOR);
    }

    public static <T> JpaDto<T> of(Class<T> modelClass, DtoConfig config) {
        return new JpaDto<>(modelClass, config);
    }
}
