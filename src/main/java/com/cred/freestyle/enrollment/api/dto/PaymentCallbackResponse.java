package com.cred.freestyle.enrollment.api.dto;

/**
 * Acknowledgement returned to the payment provider.
 *
 * @author Enrollment Team
 */
public class PaymentCallbackResponse {

    private String registrationId;
    private String result;
    private String registrationStatus;

    public PaymentCallbackResponse() {
    }

    public PaymentCallbackResponse(String registrationId, String result, String registrationStatus) {
        this.registrationId = registrationId;
        this.result = result;
        this.registrationStatus = registrationStatus;
    }

    public String getRegistrationId() {
        return registrationId;
    }

    public void setRegistrationId(String registrationId) {
        this.registrationId = registrationId;
    }

    /**
     * "processed" or "ignored" for duplicate and late deliveries.
     */
    public String getResult() {
        return result;
    }

    public void setResult(String result) {
        this.result = result;
    }

    public String getRegistrationStatus() {
        return registrationStatus;
    }

    public void setRegistrationStatus(String registrationStatus) {
        this.registrationStatus = registrationStatus;
    }
}
