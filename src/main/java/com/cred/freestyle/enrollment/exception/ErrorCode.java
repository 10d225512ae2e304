package com.cred.freestyle.enrollment.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Business error codes surfaced by the enrollment operations.
 * Each code carries the HTTP status and title used by the API layer.
 *
 * @author Enrollment Team
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ========================================
    // Offering (OFF)
    // ========================================
    OFFERING_NOT_FOUND("OFF001", HttpStatus.NOT_FOUND, "Offering Not Found", "Offering not found"),
    OFFERING_NOT_OPEN("OFF002", HttpStatus.CONFLICT, "Offering Not Open", "Offering is not open for registration"),
    DEADLINE_PASSED("OFF003", HttpStatus.CONFLICT, "Registration Closed", "Registration deadline has passed"),

    // ========================================
    // Registration (REG)
    // ========================================
    ALREADY_REGISTERED("REG001", HttpStatus.CONFLICT, "Already Registered", "Subject already holds a live registration"),
    REGISTRATION_NOT_FOUND("REG002", HttpStatus.NOT_FOUND, "Registration Not Found", "Registration not found"),
    REGISTRATION_NOT_PENDING("REG003", HttpStatus.CONFLICT, "Registration Not Pending", "Registration is not awaiting payment"),
    CANCELLATION_NOT_ALLOWED("REG004", HttpStatus.CONFLICT, "Cancellation Not Allowed", "Registration can no longer be cancelled"),
    NO_CAPACITY("REG005", HttpStatus.CONFLICT, "No Capacity", "No seat is available"),

    // ========================================
    // Waitlist (WL)
    // ========================================
    ALREADY_WAITLISTED("WL001", HttpStatus.CONFLICT, "Already Waitlisted", "Subject already holds a live waitlist entry"),
    WAITLIST_ENTRY_NOT_FOUND("WL002", HttpStatus.NOT_FOUND, "Waitlist Entry Not Found", "Waitlist entry not found"),
    OFFER_NOT_ACTIVE("WL003", HttpStatus.CONFLICT, "Offer Not Active", "Waitlist entry has no active offer"),
    OFFER_EXPIRED("WL004", HttpStatus.GONE, "Offer Expired", "Waitlist offer has expired"),

    // ========================================
    // Common
    // ========================================
    NOT_AUTHORIZED("SEC001", HttpStatus.FORBIDDEN, "Not Authorized", "Not authorized to act on this resource"),
    CHECKOUT_CREATION_FAILED("PAY001", HttpStatus.BAD_GATEWAY, "Checkout Creation Failed", "Payment provider could not create a checkout session"),
    INVALID_REQUEST("COM001", HttpStatus.BAD_REQUEST, "Invalid Request", "Request is missing or malformed"),
    STORE_UNAVAILABLE("COM002", HttpStatus.SERVICE_UNAVAILABLE, "Enrollment Store Unavailable", "The enrollment store is temporarily unavailable. Please retry."),
    INTERNAL_ERROR("COM999", HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred. Please try again later.");

    private final String code;
    private final HttpStatus httpStatus;
    private final String title;
    private final String message;
}
