package com.cred.freestyle.enrollment.api.dto;

import com.cred.freestyle.enrollment.service.RegistrationResult;

/**
 * Response DTO for register and accept-offer calls.
 * Exactly one of registration / waitlistEntry is set; checkout fields are set
 * when the outcome is CHECKOUT_REQUIRED.
 *
 * @author Enrollment Team
 */
public class RegistrationOutcomeResponse {

    private String outcome;
    private RegistrationResponse registration;
    private WaitlistEntryResponse waitlistEntry;
    private String checkoutSessionId;
    private String checkoutUrl;

    public RegistrationOutcomeResponse() {
    }

    public static RegistrationOutcomeResponse fromResult(RegistrationResult result) {
        RegistrationOutcomeResponse response = new RegistrationOutcomeResponse();
        response.setOutcome(result.getOutcome().name());
        if (result.getRegistration() != null) {
            response.setRegistration(RegistrationResponse.fromEntity(result.getRegistration()));
        }
        if (result.getWaitlistEntry() != null) {
            response.setWaitlistEntry(WaitlistEntryResponse.fromEntity(result.getWaitlistEntry()));
        }
        if (result.getCheckoutSession() != null) {
            response.setCheckoutSessionId(result.getCheckoutSession().getSessionId());
            response.setCheckoutUrl(result.getCheckoutSession().getRedirectUrl());
        }
        return response;
    }

    // Getters and setters
    public String getOutcome() {
        return outcome;
    }

    public void setOutcome(String outcome) {
        this.outcome = outcome;
    }

    public RegistrationResponse getRegistration() {
        return registration;
    }

    public void setRegistration(RegistrationResponse registration) {
        this.registration = registration;
    }

    public WaitlistEntryResponse getWaitlistEntry() {
        return waitlistEntry;
    }

    public void setWaitlistEntry(WaitlistEntryResponse waitlistEntry) {
        this.waitlistEntry = waitlistEntry;
    }

    public String getCheckoutSessionId() {
        return checkoutSessionId;
    }

    public void setCheckoutSessionId(String checkoutSessionId) {
        this.checkoutSessionId = checkoutSessionId;
    }

    public String getCheckoutUrl() {
        return checkoutUrl;
    }

    public void setCheckoutUrl(String checkoutUrl) {
        this.checkoutUrl = checkoutUrl;
    }
}
