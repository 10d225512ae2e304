package com.cred.freestyle.enrollment.api.exception;

import com.cred.freestyle.enrollment.api.dto.ErrorResponse;
import com.cred.freestyle.enrollment.exception.EnrollmentException;
import com.cred.freestyle.enrollment.exception.ErrorCode;
import com.cred.freestyle.enrollment.exception.SeatInvariantViolationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.transaction.TransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the enrollment API.
 * Converts business errors to their ErrorCode status and everything else to
 * a standardized error response.
 *
 * @author Enrollment Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle EnrollmentException.
     * Status, title and code come from the exception's ErrorCode.
     */
    @ExceptionHandler(EnrollmentException.class)
    public ResponseEntity<ErrorResponse> handleEnrollmentException(
            EnrollmentException ex,
            HttpServletRequest request
    ) {
        ErrorCode errorCode = ex.getErrorCode();
        logger.warn("Enrollment operation rejected: {} - {}", errorCode.getCode(), ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                errorCode.getHttpStatus().value(),
                errorCode.getTitle(),
                ex.getCode(),
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetails(ex.getDetails());

        return ResponseEntity.status(errorCode.getHttpStatus()).body(error);
    }

    /**
     * Handle AccessDeniedException from method security.
     * Returns 403 FORBIDDEN.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDeniedException(
            AccessDeniedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Access denied on {}: {}", request.getRequestURI(), ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.FORBIDDEN.value(),
                ErrorCode.NOT_AUTHORIZED.getTitle(),
                ErrorCode.NOT_AUTHORIZED.getCode(),
                "You are not allowed to perform this operation.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    /**
     * Handle validation errors from @Valid annotation.
     * Returns 400 BAD REQUEST with field-level validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> fieldErrors = new HashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Validation Failed",
                ErrorCode.INVALID_REQUEST.getCode(),
                "Request validation failed. Please check the field errors.",
                request.getRequestURI()
        );
        error.addDetail("fieldErrors", fieldErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            HttpServletRequest request
    ) {
        logger.warn("Unreadable request body on {}", request.getRequestURI());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                ErrorCode.INVALID_REQUEST.getTitle(),
                ErrorCode.INVALID_REQUEST.getCode(),
                ErrorCode.INVALID_REQUEST.getMessage(),
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle store failures (connection loss, lock timeout, deadlock, commit failure).
     * Returns 503 SERVICE UNAVAILABLE; the operation had no effect and may be retried.
     */
    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    public ResponseEntity<ErrorResponse> handleStoreException(
            RuntimeException ex,
            HttpServletRequest request
    ) {
        logger.error("Enrollment store failure on {}", request.getRequestURI(), ex);

        return fromErrorCode(ErrorCode.STORE_UNAVAILABLE, request);
    }

    /**
     * Handle SeatInvariantViolationException.
     * A seat count outside [0, capacity] is a defect; the transaction has been rolled back.
     */
    @ExceptionHandler(SeatInvariantViolationException.class)
    public ResponseEntity<ErrorResponse> handleSeatInvariantViolation(
            SeatInvariantViolationException ex,
            HttpServletRequest request
    ) {
        logger.error("Seat invariant violated on offering {}: {}", ex.getOfferingId(), ex.getMessage(), ex);
        return fromErrorCode(ErrorCode.INTERNAL_ERROR, request);
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);
        return fromErrorCode(ErrorCode.INTERNAL_ERROR, request);
    }

    private ResponseEntity<ErrorResponse> fromErrorCode(ErrorCode errorCode, HttpServletRequest request) {
        ErrorResponse error = new ErrorResponse(
                errorCode.getHttpStatus().value(),
                errorCode.getTitle(),
                errorCode.getCode(),
                errorCode.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(errorCode.getHttpStatus()).body(error);
    }
}
