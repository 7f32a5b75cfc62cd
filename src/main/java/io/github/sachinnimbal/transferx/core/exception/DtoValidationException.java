package io.github.sachinnimbal.transferx.core.exception;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when an inbound payload does not conform to the transfer model.
 * Carries every problem found, not just the first.
 */
@Getter
public class DtoValidationException extends RuntimeException {

    private final transient List<ValidationError> errors;

    public DtoValidationException(List<ValidationError> errors) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
    }

    public DtoValidationException(String path, String message) {
        this(List.of(new ValidationError(path, message)));
    }

    private static String describe(List<ValidationError> errors) {
        return errors.stream()
                .map(e -> e.getMessage() + " - at `" + e.getPath() + "`")
                .collect(Collectors.joining("; "));
    }
}
