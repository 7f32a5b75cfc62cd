package io.github.sachinnimbal.transferx.core.exception;

import lombok.Getter;

@Getter
public class UnsupportedMediaTypeException extends RuntimeException {

    private final String mediaType;

    public UnsupportedMediaTypeException(String mediaType) {
        super(String.format("Unsupported media type: '%s'", mediaType));
        this.mediaType = mediaType;
    }
}
