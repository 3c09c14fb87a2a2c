package com.spendings.backend.handlers;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.spendings.backend.dto.ApiResponse;
import com.spendings.backend.dto.StatusReportDTO;
import com.spendings.backend.exceptions.BadRequestException;
import com.spendings.backend.exceptions.ResourceNotFoundException;
import com.spendings.backend.exceptions.StoreUnavailableException;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String VALIDATION_ERROR = "Validation error";

    private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE =
            new PropertyNamingStrategies.SnakeCaseStrategy();

    private <T> ResponseEntity<ApiResponse<T>> buildResponse(HttpStatus status, String message, List<String> errors) {
        return ResponseEntity.status(status).body(ApiResponse.error(message, errors));
    }

    // 404 - token de compartilhamento inexistente
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(ResourceNotFoundException ex) {
        return buildResponse(HttpStatus.NOT_FOUND, ex.getMessage(), List.of(ex.getMessage()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResource(NoResourceFoundException ex) {
        return buildResponse(HttpStatus.NOT_FOUND, "Not found", List.of(ex.getResourcePath()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return buildResponse(HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage(), null);
    }

    // 400 - corpo com campos inválidos (@Valid), todos os campos de uma vez
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
        List<String> errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(err -> SNAKE_CASE.translate(err.getField()) + ": " + err.getDefaultMessage())
                .sorted()
                .toList();

        return buildResponse(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, errors);
    }

    // 400 - query params (@Validated)
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConstraintViolation(ConstraintViolationException ex) {
        List<String> errors = ex.getConstraintViolations()
                .stream()
                .map(v -> SNAKE_CASE.translate(lastNode(v.getPropertyPath().toString())) + ": " + v.getMessage())
                .sorted()
                .toList();

        return buildResponse(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, errors);
    }

    // 400 - JSON malformado ou tipo errado (ex: amount = "abc", type = "gift")
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException ex) {
        String detail = "malformed request body";
        if (ex.getCause() instanceof JsonMappingException mapping && !mapping.getPath().isEmpty()) {
            String field = mapping.getPath().get(mapping.getPath().size() - 1).getFieldName();
            detail = field + ": " + describe(mapping);
        }
        return buildResponse(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, List.of(detail));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingParameter(MissingServletRequestParameterException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, VALIDATION_ERROR,
                List.of(ex.getParameterName() + ": is required"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, VALIDATION_ERROR,
                List.of(ex.getName() + ": invalid value '" + ex.getValue() + "'"));
    }

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(BadRequestException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, List.of(ex.getMessage()));
    }

    // 503 - só o diagnóstico chega aqui
    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ApiResponse<StatusReportDTO>> handleStoreUnavailable(StoreUnavailableException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.error(ex.getMessage(), List.of(ex.getMessage()), ex.getReport()));
    }

    // 500 - erro inesperado, inclusive falha do banco nos endpoints de negócio
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex) {
        log.error("[GlobalExceptionHandler] unexpected error", ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null);
    }

    private static String describe(JsonMappingException mapping) {
        if (mapping.getCause() instanceof IllegalArgumentException invalid && invalid.getMessage() != null) {
            return invalid.getMessage();
        }
        if (mapping instanceof InvalidFormatException format) {
            return "invalid value '" + format.getValue() + "'";
        }
        return "invalid value";
    }

    private static String lastNode(String propertyPath) {
        int dot = propertyPath.lastIndexOf('.');
        return dot < 0 ? propertyPath : propertyPath.substring(dot + 1);
    }
}
