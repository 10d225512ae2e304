package com.cred.freestyle.enrollment.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Payment provider callback payload.
 * The registration ID is the client reference passed to the provider at checkout.
 *
 * @author Enrollment Team
 */
public class PaymentCallbackRequest {

    @NotBlank(message = "Registration ID is required")
    private String registrationId;

    @Size(max = 255, message = "Payment reference must be at most 255 characters")
    private String paymentReference;

    public PaymentCallbackRequest() {
    }

    public PaymentCallbackRequest(String registrationId, String paymentReference) {
        this.registrationId = registrationId;
        this.paymentReference = paymentReference;
    }

    // Getters and setters
    public String getRegistrationId() {
        return registrationId;
    }

    public void setRegistrationId(String registrationId) {
        this.registrationId = registrationId;
    }

    public String getPaymentReference() {
        return paymentReference;
    }

    public void setPaymentReference(String paymentReference) {
        this.paymentReference = paymentReference;
    }
}
