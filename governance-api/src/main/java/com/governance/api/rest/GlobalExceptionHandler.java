package com.governance.api.rest;

import com.governance.core.exception.DuplicateRecordException;
import com.governance.core.exception.GovernanceException;
import com.governance.core.exception.InvalidStateTransitionException;
import com.governance.core.exception.NotFoundException;
import com.governance.core.exception.OptimisticLockException;
import com.governance.core.exception.PersistenceException;
import com.governance.core.exception.SpecificationLoadException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps control plane exceptions to HTTP responses carrying the error code.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String BAD_REQUEST = "BAD_REQUEST";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private static final int MAX_MESSAGE_LENGTH = 300;

    @ExceptionHandler(GovernanceException.class)
    public ResponseEntity<ErrorResponse> handleGovernanceException(GovernanceException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("HTTP_ERROR path={}, method={}, errorCode={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            log.warn("HTTP_ERROR path={}, method={}, errorCode={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity.status(status)
            .body(new ErrorResponse(ex.getErrorCode(), ex.getMessage(), ex.isRetryable()));
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        String message = truncate(ex.getMessage());
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
            request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), message);
        return ResponseEntity.badRequest().body(new ErrorResponse(BAD_REQUEST, message, false));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
            request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), truncate(ex.getMessage()), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse(INTERNAL_ERROR, "Internal error", false));
    }

    static HttpStatus statusFor(GovernanceException ex) {
        if (ex instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof InvalidStateTransitionException
            || ex instanceof OptimisticLockException
            || ex instanceof DuplicateRecordException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof PersistenceException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (ex instanceof SpecificationLoadException) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_MESSAGE_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_MESSAGE_LENGTH);
    }

    // ========== DTOs ==========

    public record ErrorResponse(String errorCode, String message, boolean retryable) {}
}
