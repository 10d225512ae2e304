package com.cred.freestyle.enrollment.infrastructure.payment;

/**
 * Checkout session created by the payment provider.
 *
 * @author Enrollment Team
 */
public class CheckoutSession {

    private final String sessionId;
    private final String redirectUrl;

    public CheckoutSession(String sessionId, String redirectUrl) {
        this.sessionId = sessionId;
        this.redirectUrl = redirectUrl;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getRedirectUrl() {
        return redirectUrl;
    }
}
