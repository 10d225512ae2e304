package com.cred.freestyle.enrollment.api.dto;

import jakarta.validation.constraints.Size;

/**
 * Optional body for cancelling a registration.
 *
 * @author Enrollment Team
 */
public class CancelRegistrationRequest {

    @Size(max = 500, message = "Reason must be at most 500 characters")
    private String reason;

    public CancelRegistrationRequest() {
    }

    public CancelRegistrationRequest(String reason) {
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
