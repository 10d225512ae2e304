package com.cred.freestyle.enrollment.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for cancelling an offering.
 *
 * @author Enrollment Team
 */
public class CancelOfferingRequest {

    @NotBlank(message = "Cancellation reason is required")
    @Size(max = 500, message = "Reason must be at most 500 characters")
    private String reason;

    public CancelOfferingRequest() {
    }

    public CancelOfferingRequest(String reason) {
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
