package com.cred.freestyle.enrollment.infrastructure.payment;

import java.math.BigDecimal;

/**
 * Request to create a checkout session for one pending registration.
 *
 * @author Enrollment Team
 */
public class CheckoutRequest {

    private final String registrationId;
    private final String offeringTitle;
    private final BigDecimal amount;
    private final String currency;
    private final String contactEmail;

    public CheckoutRequest(
            String registrationId,
            String offeringTitle,
            BigDecimal amount,
            String currency,
            String contactEmail
    ) {
        this.registrationId = registrationId;
        this.offeringTitle = offeringTitle;
        this.amount = amount;
        this.currency = currency;
        this.contactEmail = contactEmail;
    }

    /**
     * Reference echoed back by the provider in its payment callbacks.
     */
    public String getRegistrationId() {
        return registrationId;
    }

    public String getOfferingTitle() {
        return offeringTitle;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public String getCurrency() {
        return currency;
    }

    public String getContactEmail() {
        return contactEmail;
    }
}
