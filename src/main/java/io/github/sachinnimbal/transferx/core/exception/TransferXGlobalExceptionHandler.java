package io.github.sachinnimbal.transferx.core.exception;

import io.github.sachinnimbal.transferx.core.response.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Maps DTO failures raised while decoding or encoding a handler payload to HTTP responses.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TransferXGlobalExceptionHandler {

    @ExceptionHandler(DtoValidationException.class)
    public ResponseEntity<ApiResponse<List<ValidationError>>> handleValidation(DtoValidationException ex) {
        log.warn("DTO validation failed: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(
                        ex.getErrors(),
                        "Validation failed",
                        HttpStatus.BAD_REQUEST,
                        "VALIDATION_ERROR",
                        ex.getMessage()
                ));
    }

    @ExceptionHandler(UnsupportedMediaTypeException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnsupportedMediaType(UnsupportedMediaTypeException ex) {
        log.warn("Rejected payload: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(ApiResponse.error(
                        ex.getMessage(),
                        HttpStatus.UNSUPPORTED_MEDIA_TYPE,
                        "UNSUPPORTED_MEDIA_TYPE",
                        ex.getMediaType()
                ));
    }

    @ExceptionHandler(DtoConfigurationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConfiguration(DtoConfigurationException ex) {
        log.error("DTO configuration error: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(
                        "DTO configuration error",
                        HttpStatus.INTERNAL_SERVER_ERROR,
                        "DTO_CONFIGURATION_ERROR",
                        ex.getMessage()
                ));
    }
}
