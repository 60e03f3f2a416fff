package com.portsyncro.api.controller;

import com.portsyncro.api.dto.ErrorBody;
import com.portsyncro.pricing.InvalidPriceRequestException;
import com.portsyncro.snapshot.PortfolioNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps request problems to ErrorBody: validation, unreadable bodies and rejected price requests to 400,
 * a missing portfolio to 404.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String message = Optional.ofNullable(ex.getFieldError())
                .map(ApiExceptionHandler::describe)
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of("VALIDATION_ERROR", message));
    }

    /** Wrong JSON shape, e.g. a string where an array of symbols is expected. */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleUnreadable(ServerWebInputException ex) {
        return ResponseEntity.badRequest()
                .body(ErrorBody.of("INVALID_REQUEST", "Malformed request body: stocks and crypto must be arrays of symbols"));
    }

    @ExceptionHandler(InvalidPriceRequestException.class)
    public ResponseEntity<ErrorBody> handleInvalidPriceRequest(InvalidPriceRequestException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(PortfolioNotFoundException.class)
    public ResponseEntity<ErrorBody> handleNotFound(PortfolioNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("PORTFOLIO_NOT_FOUND", ex.getMessage()));
    }

    private static String describe(FieldError e) {
        return e.getField() + ": " + e.getDefaultMessage();
    }
}
