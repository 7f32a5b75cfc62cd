package io.github.sachinnimbal.transferx.core.enums;

public enum TransferBackendMode {
    /**
     * Walks the field schema on every transfer call.
     */
    INTERPRETED,

    /**
     * Compiles the field schema once into a tree of transfer functions
     * built on MethodHandles and reuses them for every call.
     */
    CODEGEN
}
