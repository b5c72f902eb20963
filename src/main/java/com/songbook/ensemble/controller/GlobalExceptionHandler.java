package com.songbook.ensemble.controller;

import com.songbook.ensemble.exception.AggregationEmptyException;
import com.songbook.ensemble.exception.EnsembleConfigurationException;
import com.songbook.ensemble.exception.ExplanationUnavailableException;
import com.songbook.ensemble.exception.SourceException;
import com.songbook.ensemble.exception.SourceTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EnsembleConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(EnsembleConfigurationException ex) {
        return error(ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> String.format("'%s' %s", fieldError.getField(), fieldError.getDefaultMessage()))
            .collect(Collectors.joining("; "));
        return error(message.isEmpty() ? "Invalid request" : message, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return error("Malformed request body", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(SourceException.class)
    public ResponseEntity<ErrorResponse> handleSource(SourceException ex) {
        HttpStatus status = ex instanceof SourceTimeoutException ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY;
        return error(ex.getMessage(), status);
    }

    @ExceptionHandler(AggregationEmptyException.class)
    public ResponseEntity<ErrorResponse> handleEmpty(AggregationEmptyException ex) {
        return error(ex.getMessage(), HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(ExplanationUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleExplanation(ExplanationUnavailableException ex) {
        return error(ex.getMessage(), HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled exception", ex);
        return error("An unexpected error occurred", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> error(String message, HttpStatus status) {
        ErrorResponse error = new ErrorResponse(
            message,
            status.value(),
            Instant.now().toEpochMilli()
        );
        return new ResponseEntity<>(error, status);
    }
}
