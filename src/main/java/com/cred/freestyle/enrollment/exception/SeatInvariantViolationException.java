package com.cred.freestyle.enrollment.exception;

/**
 * Thrown when a transition would push an offering's confirmed seat count
 * outside [0, capacity]. Indicates a bug or corrupted data, never a user error.
 *
 * @author Enrollment Team
 */
public class SeatInvariantViolationException extends RuntimeException {

    private final String offeringId;

    public SeatInvariantViolationException(String offeringId, String message) {
        super(String.format("Seat invariant violated for offering %s: %s", offeringId, message));
        this.offeringId = offeringId;
    }

    public String getOfferingId() {
        return offeringId;
    }
}
