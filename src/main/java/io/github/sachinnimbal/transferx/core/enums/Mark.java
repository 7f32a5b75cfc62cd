package io.github.sachinnimbal.transferx.core.enums;

import io.github.sachinnimbal.transferx.core.exception.DtoConfigurationException;
import lombok.Getter;

/**
 * Visibility mark carried by a model field.
 *
 * <ul>
 *   <li>{@link #READ_ONLY} - only appears in return (outbound) transfers</li>
 *   <li>{@link #WRITE_ONLY} - only appears in data (inbound) transfers</li>
 *   <li>{@link #PRIVATE} - never appears on the wire</li>
 * </ul>
 */
@Getter
public enum Mark {
    NONE(""),
    READ_ONLY("read-only"),
    WRITE_ONLY("write-only"),
    PRIVATE("private");

    private final String value;

    Mark(String value) {
        this.value = value;
    }

    public static Mark fromValue(String value, String fieldName) {
        if (value == null || value.isEmpty()) {
            return NONE;
        }
        for (Mark mark : values()) {
            if (mark.value.equals(value)) {
                return mark;
            }
        }
        throw new DtoConfigurationException(String.format(
                "Invalid mark '%s' on field '%s'. Valid marks are: read-only, write-only, private",
                value, fieldName));
    }
}
