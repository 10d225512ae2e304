package com.cred.freestyle.enrollment.api.dto;

import com.cred.freestyle.enrollment.domain.model.Registration;

import java.time.Instant;

/**
 * Response DTO for a registration.
 *
 * @author Enrollment Team
 */
public class RegistrationResponse {

    private String registrationId;
    private String offeringId;
    private String subjectId;
    private String status;
    private String paymentStatus;
    private String checkoutUrl;
    private Instant registeredAt;
    private Instant confirmedAt;
    private Instant cancelledAt;
    private String cancelReason;

    public RegistrationResponse() {
    }

    /**
     * Create response from Registration entity.
     *
     * @param registration Registration entity
     * @return RegistrationResponse
     */
    public static RegistrationResponse fromEntity(Registration registration) {
        RegistrationResponse response = new RegistrationResponse();
        response.setRegistrationId(registration.getRegistrationId());
        response.setOfferingId(registration.getOfferingId());
        response.setSubjectId(registration.getSubjectId());
        response.setStatus(registration.getStatus().name());
        if (registration.getPaymentStatus() != null) {
            response.setPaymentStatus(registration.getPaymentStatus().name());
        }
        response.setCheckoutUrl(registration.getCheckoutUrl());
        response.setRegisteredAt(registration.getRegisteredAt());
        response.setConfirmedAt(registration.getConfirmedAt());
        response.setCancelledAt(registration.getCancelledAt());
        response.setCancelReason(registration.getCancelReason());
        return response;
    }

    // Getters and setters
    public String getRegistrationId() {
        return registrationId;
    }

    public void setRegistrationId(String registrationId) {
        this.registrationId = registrationId;
    }

    public String getOfferingId() {
        return offeringId;
    }

    public void setOfferingId(String offeringId) {
        this.offeringId = offeringId;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public void setSubjectId(String subjectId) {
        this.subjectId = subjectId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getPaymentStatus() {
        return paymentStatus;
    }

    public void setPaymentStatus(String paymentStatus) {
        this.paymentStatus = paymentStatus;
    }

    public String getCheckoutUrl() {
        return checkoutUrl;
    }

    public void setCheckoutUrl(String checkoutUrl) {
        this.checkoutUrl = checkoutUrl;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public void setRegisteredAt(Instant registeredAt) {
        this.registeredAt = registeredAt;
    }

    public Instant getConfirmedAt() {
        return confirmedAt;
    }

    public void setConfirmedAt(Instant confirmedAt) {
        this.confirmedAt = confirmedAt;
    }

    public Instant getCancelledAt() {
        return cancelledAt;
    }

    public void setCancelledAt(Instant cancelledAt) {
        this.cancelledAt = cancelledAt;
    }

    public String getCancelReason() {
        return cancelReason;
    }

    public void setCancelReason(String cancelReason) {
        this.cancelReason = cancelReason;
    }
}
