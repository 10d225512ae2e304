package com.cred.freestyle.enrollment.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Business rule violation raised by the registration and waitlist operations.
 * The {@link ErrorCode} identifies the failure; details carry the identifiers involved.
 *
 * @author Enrollment Team
 */
public class EnrollmentException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    public EnrollmentException(ErrorCode errorCode) {
        this(errorCode, errorCode.getMessage());
    }

    public EnrollmentException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.details = new LinkedHashMap<>();
    }

    public EnrollmentException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = new LinkedHashMap<>();
    }

    /**
     * Attach a detail for the error response.
     *
     * @return this exception for chaining
     */
    public EnrollmentException withDetail(String key, Object value) {
        this.details.put(key, value);
        return this;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getCode() {
        return errorCode.getCode();
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }
}
