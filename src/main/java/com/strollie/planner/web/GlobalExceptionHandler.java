package com.strollie.planner.web;

import com.strollie.planner.exception.ExternalServiceUnavailableException;
import com.strollie.planner.exception.RoutePlanningException;
import com.strollie.planner.web.error.ErrorResponse;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ApiResponses({
            @ApiResponse(responseCode = "400", description = "Ошибка валидации запроса",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex,
                                                          WebRequest request) {
        log.warn("Validation failed at {}: {}", request.getDescription(false), ex.getMessage());

        List<ErrorResponse.Violation> violations = ex.getBindingResult().getFieldErrors().stream()
                .map(this::toViolation)
                .collect(Collectors.toList());
        ex.getBindingResult().getGlobalErrors().forEach(e ->
                violations.add(new ErrorResponse.Violation(e.getObjectName(), e.getDefaultMessage())));

        ErrorResponse body = ErrorResponse.builder()
                .timestamp(OffsetDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error(HttpStatus.BAD_REQUEST.getReasonPhrase())
                .message("Validation failed")
                .path(request.getDescription(false))
                .violations(violations)
                .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(RoutePlanningException.class)
    @ApiResponses({
            @ApiResponse(responseCode = "404", description = "Не найдено подходящих мест",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "422", description = "Маршрут невыполним",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "503", description = "Внешний сервис недоступен",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<ErrorResponse> handlePlanning(RoutePlanningException ex, WebRequest request) {
        HttpStatus status = ex.getStatus();
        if (status.is5xxServerError()) {
            log.error("Route planning failed at {}: {}", request.getDescription(false), ex.getMessage(), ex.getCause());
        } else {
            log.warn("Route planning rejected at {}: {}", request.getDescription(false), ex.getMessage());
        }
        ErrorResponse body = body(status, ex.getMessage(), request);
        if (ex instanceof ExternalServiceUnavailableException unavailable) {
            body.setService(unavailable.getService());
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, WebRequest request) {
        log.warn("Unreadable request at {}: {}", request.getDescription(false), ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "Malformed request body", request));
    }

    @ExceptionHandler(Exception.class)
    @ApiResponses({
            @ApiResponse(responseCode = "500", description = "Внутренняя ошибка сервера",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex,
                                                       WebRequest request) {
        log.error("Unhandled exception occurred at path: {}", request.getDescription(false), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), request));
    }

    private ErrorResponse body(HttpStatus status, String message, WebRequest request) {
        return ErrorResponse.builder()
                .timestamp(OffsetDateTime.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .path(request.getDescription(false))
                .build();
    }

    private ErrorResponse.Violation toViolation(FieldError e) {
        return new ErrorResponse.Violation(e.getField(), e.getDefaultMessage());
    }
}