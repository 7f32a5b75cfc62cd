package io.github.sachinnimbal.transferx.core.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Error envelope returned by {@link io.github.sachinnimbal.transferx.core.exception.TransferXGlobalExceptionHandler}.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    private boolean success;
    private String message;
    private Integer statusCode;
    private String status;
    private T data;
    private ErrorDetails error;
    private String timestamp;

    public static <T> ApiResponse<T> error(String message, HttpStatus status, String errorCode, String details) {
        return ApiResponse.<T>builder()
                .success(false)
                .message(message)
                .statusCode(status.value())
                .status(status.name())
                .error(ErrorDetails.builder()
                        .code(errorCode)
                        .details(details)
                        .build())
                .timestamp(now())
                .build();
    }

    public static <T> ApiResponse<T> error(T data, String message, HttpStatus status, String errorCode, String details) {
        ApiResponse<T> response = error(message, status, errorCode, details);
        response.setData(data);
        return response;
    }

    private static String now() {
        return LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetails {
        private String code;
        private String details;
    }
}
