package com.heronix.beacon.controller.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.heronix.beacon.exception.AgentAuthenticationException;
import com.heronix.beacon.exception.BindingStateException;
import com.heronix.beacon.exception.DeviceValidationException;
import com.heronix.beacon.exception.ResourceNotFoundException;
import com.heronix.beacon.model.dto.ErrorResponseDTO;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps exceptions to the {message, errors?} error body.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    private static final String VALIDATION_ERROR = "Validation error";

    static final String STORE_FAILURE = "Internal Server Error, please retry";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDTO> handleInvalidBody(MethodArgumentNotValidException e) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            errors.computeIfAbsent(fieldError.getField(), k -> new ArrayList<>())
                    .add(fieldError.getDefaultMessage());
        }
        e.getBindingResult().getGlobalErrors().forEach(error ->
                errors.computeIfAbsent(error.getObjectName(), k -> new ArrayList<>())
                        .add(error.getDefaultMessage()));
        return ResponseEntity.badRequest().body(new ErrorResponseDTO(VALIDATION_ERROR, errors));
    }

    @ExceptionHandler(DeviceValidationException.class)
    public ResponseEntity<ErrorResponseDTO> handleDeviceValidation(DeviceValidationException e) {
        return ResponseEntity.badRequest().body(new ErrorResponseDTO(VALIDATION_ERROR, e.getFieldErrors()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDTO> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponseDTO.of("Malformed request body"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponseDTO> handleBadPathVariable(MethodArgumentTypeMismatchException e) {
        return ResponseEntity.badRequest().body(new ErrorResponseDTO("Invalid " + e.getName(),
                Map.of(e.getName(), List.of("must be a number"))));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponseDTO> handleNotFound(ResourceNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponseDTO.of(e.getMessage()));
    }

    @ExceptionHandler(BindingStateException.class)
    public ResponseEntity<ErrorResponseDTO> handleBindingState(BindingStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponseDTO.of(e.getMessage()));
    }

    @ExceptionHandler(AgentAuthenticationException.class)
    public ResponseEntity<ErrorResponseDTO> handleAgentAuthentication(AgentAuthenticationException e) {
        log.warn("Agent credential rejected during request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ErrorResponseDTO.of(AgentAuthenticationException.PUBLIC_MESSAGE));
    }

    @ExceptionHandler({
            TransactionTimedOutException.class,
            QueryTimeoutException.class,
            PessimisticLockingFailureException.class,
            CannotAcquireLockException.class
    })
    public ResponseEntity<ErrorResponseDTO> handleStoreTimeout(RuntimeException e) {
        log.error("Store operation did not complete: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponseDTO.of(STORE_FAILURE));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDTO> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse errorResponse) {
            // framework errors (unsupported method, unknown path, ...) keep their status
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .body(ErrorResponseDTO.of(errorResponse.getBody().getTitle()));
        }
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponseDTO.of("Internal Server Error"));
    }
}
