package io.github.sachinnimbal.transferx.dto.engine;

import java.util.function.UnaryOperator;

/**
 * A compiled transfer step. Returns {@code null} for {@code null} input.
 */
@FunctionalInterface
public interface TransferFunction extends UnaryOperator<Object> {

    TransferFunction IDENTITY = value -> value;

    static TransferFunction nullSafe(TransferFunction fn) {
        return value -> value == null ? null : fn.apply(value);
    }
}
