package com.swisspairing.web;

import com.swisspairing.service.ResultStoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ResultStoreExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ResultStoreExceptionHandler.class);

    @ExceptionHandler(ResultStoreUnavailableException.class)
    public ResponseEntity<ResultStoreErrorResponse> handleUnavailable(ResultStoreUnavailableException ex) {
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ResultStoreErrorResponse("store_unavailable", ex.getMessage()));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ResultStoreErrorResponse> handleIntegrityViolation(DataIntegrityViolationException ex) {
        log.warn("Rejected write violating store constraints: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ResultStoreErrorResponse(
                        "integrity_violation",
                        "Write rejected by result store constraints (unknown player id?)"
                ));
    }

    public record ResultStoreErrorResponse(
            String code,
            String message
    ) {
    }
}
