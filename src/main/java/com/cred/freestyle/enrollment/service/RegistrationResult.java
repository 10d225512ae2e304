package com.cred.freestyle.enrollment.service;

import com.cred.freestyle.enrollment.domain.model.Offering;
import com.cred.freestyle.enrollment.domain.model.Registration;
import com.cred.freestyle.enrollment.domain.model.WaitlistEntry;
import com.cred.freestyle.enrollment.infrastructure.payment.CheckoutSession;

/**
 * Outcome of a register or accept-offer call.
 *
 * - CONFIRMED: registration holds a seat
 * - CHECKOUT_REQUIRED: registration awaits payment, checkout session attached
 * - WAITLISTED: offering was full, subject joined the waitlist
 *
 * @author Enrollment Team
 */
public class RegistrationResult {

    public enum Outcome {
        CONFIRMED,
        CHECKOUT_REQUIRED,
        WAITLISTED
    }

    private final Outcome outcome;
    private final Offering offering;
    private final Registration registration;
    private final WaitlistEntry waitlistEntry;
    private final CheckoutSession checkoutSession;

    private RegistrationResult(
            Outcome outcome,
            Offering offering,
            Registration registration,
            WaitlistEntry waitlistEntry,
            CheckoutSession checkoutSession
    ) {
        this.outcome = outcome;
        this.offering = offering;
        this.registration = registration;
        this.waitlistEntry = waitlistEntry;
        this.checkoutSession = checkoutSession;
    }

    /**
     * Result for a freshly opened registration: CONFIRMED for free offerings,
     * CHECKOUT_REQUIRED (session not yet attached) for paid ones.
     */
    public static RegistrationResult registered(Offering offering, Registration registration) {
        Outcome outcome = registration.holdsSeat() ? Outcome.CONFIRMED : Outcome.CHECKOUT_REQUIRED;
        return new RegistrationResult(outcome, offering, registration, null, null);
    }

    public static RegistrationResult waitlisted(Offering offering, WaitlistEntry entry) {
        return new RegistrationResult(Outcome.WAITLISTED, offering, null, entry, null);
    }

    public static RegistrationResult checkoutRequired(Offering offering, Registration registration, CheckoutSession session) {
        return new RegistrationResult(Outcome.CHECKOUT_REQUIRED, offering, registration, null, session);
    }

    public boolean requiresCheckout() {
        return outcome == Outcome.CHECKOUT_REQUIRED && checkoutSession == null;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public Offering getOffering() {
        return offering;
    }

    public Registration getRegistration() {
        return registration;
    }

    public WaitlistEntry getWaitlistEntry() {
        return waitlistEntry;
    }

    public CheckoutSession getCheckoutSession() {
        return checkoutSession;
    }
}
