package io.github.sachinnimbal.transferx.dto.codec;

import io.github.sachinnimbal.transferx.dto.model.TransferAnnotation;

import java.util.List;

/**
 * Translates between wire bytes and transfer models for one media type family.
 */
public interface WireCodec {

    List<String> getMediaTypes();

    /**
     * @throws io.github.sachinnimbal.transferx.core.exception.DtoValidationException
     *         when the payload is malformed or does not match {@code target}
     */
    Object decode(byte[] raw, TransferAnnotation target);

    /**
     * Validates already-parsed builtins (maps, lists, scalars) against {@code target}.
     */
    Object convert(Object builtins, TransferAnnotation target);

    byte[] encode(Object value);
}
