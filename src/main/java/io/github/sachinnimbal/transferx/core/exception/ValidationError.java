package io.github.sachinnimbal.transferx.core.exception;

import lombok.Value;

@Value
public class ValidationError {
    /** Location inside the payload, e.g. {@code $.address.city} or {@code $[0].name}. */
    String path;
    String message;
}
