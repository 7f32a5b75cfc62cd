package io.github.sachinnimbal.transferx.dto.model;

/**
 * Marks a field of a partial transfer model that was absent from the payload.
 * Distinct from {@code null}, which is an explicit value.
 */
public enum Unset {
    UNSET;

    @Override
    public String toString() {
        return "UNSET";
    }
}
