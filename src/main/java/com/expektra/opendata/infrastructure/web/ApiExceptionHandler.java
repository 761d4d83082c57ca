package com.expektra.opendata.infrastructure.web;

import com.expektra.opendata.domain.exception.EnergyDataException;
import com.expektra.opendata.domain.exception.ErrorKind;
import com.expektra.opendata.infrastructure.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps failures to {@code {error, message}} bodies; the HTTP status follows the error kind.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(EnergyDataException.class)
    public ResponseEntity<ErrorResponse> handleEnergyData(EnergyDataException e) {
        HttpStatus status = statusOf(e.kind());
        if (status.is5xxServerError()) {
            logger.error("Request failed with {}: {}", e.kind(), e.getMessage());
        } else {
            logger.warn("Rejected request: {}", e.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(e.kind().name(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        logger.warn("Bad parameter {}: {}", e.getName(), e.getValue());
        return ResponseEntity.badRequest().body(new ErrorResponse(ErrorKind.INVALID_RANGE.name(),
                "Invalid value for '" + e.getName() + "': " + e.getValue()));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case INVALID_RANGE -> HttpStatus.BAD_REQUEST;
            case UPSTREAM_REJECTED, DECODE_ERROR -> HttpStatus.BAD_GATEWAY;
            case UPSTREAM_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case STORE_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
