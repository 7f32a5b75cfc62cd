package io.github.sachinnimbal.transferx.core.exception;

/**
 * Raised when a DTO definition or a handler binding is invalid.
 * Surfaces at definition or registration time, never while serving a request.
 */
public class DtoConfigurationException extends RuntimeException {

    public DtoConfigurationException(String message) {
        super(message);
    }

    public DtoConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
