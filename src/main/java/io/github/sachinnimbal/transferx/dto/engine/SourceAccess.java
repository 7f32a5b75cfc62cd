package io.github.sachinnimbal.transferx.dto.engine;

/**
 * How the engines read field values from a source instance.
 */
public enum SourceAccess {
    /** Source is a {@link io.github.sachinnimbal.transferx.dto.model.TransferModel} or a {@code Map}. */
    FIELD_MAP,
    /** Source is a domain object read through its {@link io.github.sachinnimbal.transferx.dto.introspect.ModelAccessor}. */
    DOMAIN_OBJECT
}
