package io.github.sachinnimbal.transferx.core.enums;

import lombok.Getter;

@Getter
public enum DtoDirection {
    /** Inbound: wire payload to domain instance. */
    DATA("data"),
    /** Outbound: domain instance to wire payload. */
    RETURN("return");

    private final String value;

    DtoDirection(String value) {
        this.value = value;
    }

    public boolean isData() {
        return this == DATA;
    }
}
