package com.spendings.backend.dto;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error envelope returned by {@link com.spendings.backend.handlers.GlobalExceptionHandler}.
 * Successful calls return their bare response records instead.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private boolean success;
    private T data;
    private String message;
    private Instant timestamp;
    private List<String> errors;

    public static <T> ApiResponse<T> error(String message, List<String> errors) {
        return error(message, errors, null);
    }

    // erro com payload (ex: relatório de diagnóstico)
    public static <T> ApiResponse<T> error(String message, List<String> errors, T data) {
        return ApiResponse.<T>builder()
                .success(false)
                .data(data)
                .message(message)
                .timestamp(Instant.now())
                .errors(errors)
                .build();
    }
}
