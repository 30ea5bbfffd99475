package com.riansoft.delivery_dispatch.controller;

import com.riansoft.delivery_dispatch.dto.ErrorResponseDto;
import com.riansoft.delivery_dispatch.exception.CustomerDataException;
import com.riansoft.delivery_dispatch.exception.DistanceMatrixException;
import com.riansoft.delivery_dispatch.exception.EmptyInstanceException;
import com.riansoft.delivery_dispatch.exception.NoSolutionFromOptimizerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(EmptyInstanceException.class)
    public ResponseEntity<ErrorResponseDto> handleEmptyInstance(EmptyInstanceException e) {
        log.warn("[API] {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(new ErrorResponseDto("EMPTY_INSTANCE", e.getMessage()));
    }

    @ExceptionHandler(CustomerDataException.class)
    public ResponseEntity<ErrorResponseDto> handleCustomerData(CustomerDataException e) {
        log.warn("[API] {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponseDto("INVALID_CUSTOMER_DATA", e.getMessage()));
    }

    @ExceptionHandler(DistanceMatrixException.class)
    public ResponseEntity<ErrorResponseDto> handleDistanceMatrix(DistanceMatrixException e) {
        log.error("[API] Distance provider failure: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new ErrorResponseDto("DISTANCE_PROVIDER_ERROR", e.getMessage()));
    }

    @ExceptionHandler(NoSolutionFromOptimizerException.class)
    public ResponseEntity<ErrorResponseDto> handleNoSolution(NoSolutionFromOptimizerException e) {
        log.error("[API] {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(new ErrorResponseDto("NO_SOLUTION", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidRequest(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("[API] Rejected request: {}", message);
        return ResponseEntity.badRequest().body(new ErrorResponseDto("INVALID_REQUEST", message));
    }
}
